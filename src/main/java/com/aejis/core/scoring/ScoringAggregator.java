package com.aejis.core.scoring;

import com.aejis.core.model.ProcessingResult;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Turns findings into a behavioral score in [0, 100]: 100 minus the summed weights of
 * all distinct findings, floored at 0. 100 means no suspicious signal; the direction is
 * the same everywhere a score appears.
 */
@Component
public class ScoringAggregator {

    public int score(Collection<String> behaviors, Collection<String> threatIndicators) {
        int penalty = 0;
        for (String finding : distinct(behaviors, threatIndicators)) {
            penalty += SignalCategory.of(finding).weight();
        }
        return Math.max(0, ProcessingResult.MAX_SCORE - penalty);
    }

    public ProcessingResult rescore(ProcessingResult result) {
        return result.withBehavioralScore(score(result.behaviors(), result.threatIndicators()));
    }

    /** Count of distinct findings per category, for display. */
    public Map<SignalCategory, Integer> breakdown(Collection<String> behaviors, Collection<String> threatIndicators) {
        var counts = new EnumMap<SignalCategory, Integer>(SignalCategory.class);
        for (String finding : distinct(behaviors, threatIndicators)) {
            counts.merge(SignalCategory.of(finding), 1, Integer::sum);
        }
        return counts;
    }

    private static Set<String> distinct(Collection<String> a, Collection<String> b) {
        var all = new LinkedHashSet<String>();
        if (a != null) all.addAll(a);
        if (b != null) all.addAll(b);
        all.remove(null);
        return all;
    }
}
