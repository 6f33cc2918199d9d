package com.aejis.core.model;

/**
 * What a job asks the sandbox to do with an artifact.
 */
public enum OperationKind {
    /** Render a human-viewable preview and collect passive signals. */
    PREVIEW,
    /** Preview plus the behavioral probe (entropy, strings, suspicious patterns). */
    BEHAVIORAL;

    public String wireName() {
        return name().toLowerCase();
    }

    public static OperationKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return PREVIEW;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
