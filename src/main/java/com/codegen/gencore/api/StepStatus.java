package com.codegen.gencore.api;

import java.util.Locale;

/** Outcome of one generation step as reported by a generator driver. */
public enum StepStatus {
    DONE,
    CACHED,
    FAILED,
    SKIPPED;

    /** Lower-case name used in stored records and payloads. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static StepStatus fromString(String value) {
        if (value == null)
            throw new IllegalArgumentException("Step status is null");
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown step status: " + value, e);
        }
    }
}
