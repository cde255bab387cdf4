package com.openforge.tutor.validation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Validator verdict.  {@code requiredFixes} is null on approval.
 */
public record ValidationResult(
        @JsonProperty("approved")        boolean approved,
        @JsonProperty("confidenceScore") double confidenceScore,
        @JsonProperty("issues")          List<String> issues,
        @JsonProperty("requiredFixes")   List<String> requiredFixes
) {

    public static final String FAIL_OPEN_ISSUE = "Validation system error - auto-approved as fail-safe";

    public ValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        requiredFixes = requiredFixes == null ? null : List.copyOf(requiredFixes);
    }

    /** Approval issued when the validator times out or fails; marked by its low confidence. */
    public static ValidationResult failOpen() {
        return new ValidationResult(true, 0.5, List.of(FAIL_OPEN_ISSUE), null);
    }

    /** Stand-in verdict for responders that are never validated. */
    public static ValidationResult skipped() {
        return new ValidationResult(true, 1.0, List.of(), null);
    }

    public boolean isFailOpen() {
        return approved && issues.contains(FAIL_OPEN_ISSUE);
    }
}
