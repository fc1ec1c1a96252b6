package com.opsdiag.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

public record RootCauseHypothesis(
        String ruleId,
        String title,
        String explanation,
        double confidenceScore,
        int rulePriority,
        List<Signal> supportingSignals,
        String recommendedMitigation
) {
    /** Confidence descending, then rule priority, then the most recent supporting signal first. */
    public static final Comparator<RootCauseHypothesis> RANKING =
            Comparator.comparingDouble(RootCauseHypothesis::confidenceScore).reversed()
                    .thenComparingInt(RootCauseHypothesis::rulePriority)
                    .thenComparing(RootCauseHypothesis::latestSupport, Comparator.reverseOrder());

    public RootCauseHypothesis {
        supportingSignals = supportingSignals == null ? List.of() : List.copyOf(supportingSignals);
    }

    public Instant latestSupport() {
        return supportingSignals.stream()
                .map(Signal::timestamp)
                .max(Comparator.naturalOrder())
                .orElse(Instant.EPOCH);
    }
}
