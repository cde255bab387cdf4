package com.openforge.tutor.adaptive;

import java.util.Locale;

public enum EncouragementLevel {
    MINIMAL,
    STANDARD,
    HIGH;

    /** Lowercase form stored in adaptation_logs.scaffolding_level. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
