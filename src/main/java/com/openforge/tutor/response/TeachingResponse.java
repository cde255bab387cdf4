package com.openforge.tutor.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Canonical structured reply from a teaching agent.
 *
 * audioText   what the agent says; fed to speech synthesis, never contains SVG.
 * displayText   board notes in markdown.
 * svg   one diagram or null.
 * teachingPhase   self-reported progression phase 1-5, may be null.
 * handoffRequest   name of the agent the specialist wants to hand over to.
 *
 * The model-facing JSON uses camelCase keys, so every component is pinned
 * with @JsonProperty against the snake_case ObjectMapper.
 */
@Builder(toBuilder = true)
public record TeachingResponse(
        @JsonProperty("audioText")      String audioText,
        @JsonProperty("displayText")    String displayText,
        @JsonProperty("svg")            String svg,
        @JsonProperty("lessonComplete") boolean lessonComplete,
        @JsonProperty("teachingPhase")  Integer teachingPhase,
        @JsonProperty("handoffRequest") String handoffRequest,
        @JsonProperty("handoffMessage") String handoffMessage,
        @JsonProperty("agentName")      String agentName
) {

    public boolean hasSvg() {
        return svg != null && !svg.isBlank();
    }

    public boolean wantsHandoff() {
        return handoffRequest != null && !handoffRequest.isBlank();
    }

    /** Plain reply with no diagram, used for coordinator answers and fallbacks. */
    public static TeachingResponse spoken(String text, String agentName) {
        return TeachingResponse.builder()
                .audioText(text)
                .displayText(text)
                .agentName(agentName)
                .build();
    }
}
