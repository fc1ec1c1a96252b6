package com.opsdiag.diagnosis;

import com.opsdiag.model.Signal;
import java.time.Duration;
import java.util.List;

/**
 * What a rule found. {@code horizon} is the span over which supporting evidence loses
 * all of its recency weight.
 */
public record RuleMatch(
        String explanation,
        List<Signal> supportingSignals,
        String recommendedMitigation,
        Duration horizon
) {
    public RuleMatch {
        supportingSignals = List.copyOf(supportingSignals);
    }
}
