package com.openforge.tutor.teaching;

import com.openforge.tutor.agent.AgentResponse;
import com.openforge.tutor.mastery.MasteryResult;
import com.openforge.tutor.response.TeachingResponse;
import com.openforge.tutor.validation.ValidationResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The reply to one turn.
 *
 * @param audio        speech for {@code response.audioText()}, or null if synthesis failed
 * @param handoffChain responders in the order they answered; one element without handoffs
 * @param mastery      rules verdict, only when the responder reported the lesson complete
 * @param validation   completes with the validator's verdict, or immediately with
 *                     approval when the responder is not validated
 */
public record TurnResult(
        TeachingResponse response,
        String routingReason,
        AgentResponse.Tier tier,
        byte[] audio,
        List<String> handoffChain,
        MasteryResult mastery,
        CompletableFuture<ValidationResult> validation,
        long responseTimeMs
) {

    public String responder() {
        return response.agentName();
    }

    public boolean hasAudio() {
        return audio != null && audio.length > 0;
    }
}
