package com.opsdiag.diagnosis.impl;

import com.opsdiag.diagnosis.RuleBaseProvider;
import java.time.Clock;
import java.time.Duration;

public final class RankerFixtures {

    private RankerFixtures() {
    }

    public static RuleBasedDiagnosisRanker ruleBased(Clock clock, RuleBaseProvider rules) {
        RuleBasedDiagnosisRanker ranker = new RuleBasedDiagnosisRanker();
        ranker.rules = rules;
        ranker.clock = clock;
        ranker.window = Duration.ofMinutes(30);
        ranker.deploymentWindow = Duration.ofHours(1);
        ranker.hops = 2;
        return ranker;
    }
}
