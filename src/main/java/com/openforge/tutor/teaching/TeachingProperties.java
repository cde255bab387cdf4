package com.openforge.tutor.teaching;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Binds tutor.teaching.* from application.yml.
 *
 * historySize   interactions loaded per turn (for struggle detection)
 * promptHistorySize   of those, how many are shown to the agent
 * historyResponsePreview   agent replies in the prompt are cut to this many chars
 * skipValidationAgents   responders whose replies are never validated
 */
@Validated
@ConfigurationProperties(prefix = "tutor.teaching")
public record TeachingProperties(
        @DefaultValue("5")    @Positive int historySize,
        @DefaultValue("3")    @Min(0) int promptHistorySize,
        @DefaultValue("200")  int historyResponsePreview,
        @DefaultValue("10")   @Positive long validationTimeoutSeconds,
        @DefaultValue("3")    @Min(0) int maxHandoffs,
        @DefaultValue("0.7")  @DecimalMin("0.0") @DecimalMax("1.0") double evidenceConfidenceThreshold,
        @DefaultValue({"coordinator", "motivator", "assessor"}) List<String> skipValidationAgents
) {

    public static TeachingProperties defaults() {
        return new TeachingProperties(5, 3, 200, 10, 3, 0.7,
                List.of("coordinator", "motivator", "assessor"));
    }

    public boolean shouldValidate(String agentName) {
        return skipValidationAgents == null || !skipValidationAgents.contains(agentName);
    }
}
