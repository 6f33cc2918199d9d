package com.aejis.core.scoring;

import java.util.Locale;

/**
 * Categories a finding can be tagged with, and what each one costs the score.
 * A finding is tagged by prefixing it with the category name: {@code "MALWARE_KEYWORD: trojan"}.
 */
public enum SignalCategory {
    SENSITIVE_DATA(10),
    MALWARE_KEYWORD(25),
    NETWORK_EXPLOIT(20),
    HIGH_ENTROPY(10),
    EXECUTABLE_CONTENT(15),
    MACRO_CONTENT(20),
    SOCIAL_ENGINEERING(10),
    CRYPTO_ACTIVITY(10),
    ARCHIVE_RISK(15),
    SUSPICIOUS_STRUCTURE(5),
    /** Informational finding, never lowers the score. */
    INFO(0);

    private final int weight;

    SignalCategory(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /** Formats a finding tagged with this category. */
    public String tag(String detail) {
        return name() + ": " + detail;
    }

    /**
     * Category of a tagged finding; untagged or unknown prefixes are {@link #INFO}.
     */
    public static SignalCategory of(String finding) {
        if (finding == null) {
            return INFO;
        }
        int colon = finding.indexOf(':');
        if (colon <= 0) {
            return INFO;
        }
        String prefix = finding.substring(0, colon).trim().toUpperCase(Locale.ROOT);
        for (SignalCategory category : values()) {
            if (category.name().equals(prefix)) {
                return category;
            }
        }
        return INFO;
    }
}
