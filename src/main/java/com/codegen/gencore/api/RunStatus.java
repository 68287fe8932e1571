package com.codegen.gencore.api;

import java.util.Locale;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    /** Closed because another run began while it was still active. */
    SUPERSEDED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RunStatus fromString(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
