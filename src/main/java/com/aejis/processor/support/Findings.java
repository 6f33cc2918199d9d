package com.aejis.processor.support;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;

/**
 * Routes tagged findings into a result. Every finding is a behavior; findings of the
 * heavier categories are also threat indicators. The scorer counts a string once no
 * matter how many lists it appears in.
 */
public final class Findings {

    static final int INDICATOR_WEIGHT = 15;

    private Findings() {}

    public static void report(ProcessingResult.Builder result, String finding) {
        result.behavior(finding);
        if (SignalCategory.of(finding).weight() >= INDICATOR_WEIGHT) {
            result.indicator(finding);
        }
    }

    public static void reportAll(ProcessingResult.Builder result, Iterable<String> findings) {
        for (String finding : findings) {
            report(result, finding);
        }
    }

    public static void report(ProcessingResult.Builder result, SignalCategory category, String detail) {
        report(result, category.tag(detail));
    }
}
