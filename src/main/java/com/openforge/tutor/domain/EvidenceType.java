package com.openforge.tutor.domain;

import java.util.Arrays;

/**
 * Kinds of learning evidence.  The wire form (snake_case) is what the
 * classifier model returns and what the logs print.
 */
public enum EvidenceType {

    CORRECT_ANSWER("correct_answer"),
    INCORRECT_ANSWER("incorrect_answer"),
    EXPLANATION("explanation"),
    APPLICATION("application"),
    STRUGGLE("struggle");

    private final String wire;

    EvidenceType(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static EvidenceType fromWire(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wire.equalsIgnoreCase(value == null ? "" : value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown evidence type: " + value));
    }
}
