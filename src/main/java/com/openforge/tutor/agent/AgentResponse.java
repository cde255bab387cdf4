package com.openforge.tutor.agent;

import com.openforge.tutor.response.TeachingResponse;
import com.openforge.tutor.speech.SynthesisOutcome;

/**
 * One generated reply plus how it was produced.
 *
 * @param synthesis progressive audio, only for {@link Tier#PROGRESSIVE}; null otherwise
 */
public record AgentResponse(
        TeachingResponse response,
        Tier tier,
        SynthesisOutcome synthesis,
        long latencyMs
) {

    public enum Tier {
        PROGRESSIVE,
        STREAMING,
        SYNC,
        DIRECT
    }

    public String agentName() {
        return response.agentName();
    }

    /** Progressive audio ready to play, so no full-text synthesis is needed. */
    public boolean hasProgressiveAudio() {
        return synthesis != null && !synthesis.fallbackRequired() && synthesis.hasAudio();
    }

    public AgentResponse withResponse(TeachingResponse replaced) {
        return new AgentResponse(replaced, tier, synthesis, latencyMs);
    }
}
