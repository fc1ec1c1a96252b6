package com.opsdiag.diagnosis.rules;

import com.opsdiag.diagnosis.DiagnosisContext;
import com.opsdiag.diagnosis.DiagnosisRule;
import com.opsdiag.diagnosis.RuleMatch;
import com.opsdiag.model.Signal;
import java.util.List;
import java.util.Optional;

public class ThreadPoolExhaustionRule implements DiagnosisRule {

    @Override
    public String id() {
        return "thread-pool-exhaustion";
    }

    @Override
    public String title() {
        return "thread pool exhaustion";
    }

    @Override
    public int priority() {
        return 4;
    }

    @Override
    public double baseWeight() {
        return 0.7;
    }

    @Override
    public Optional<RuleMatch> evaluate(DiagnosisContext context) {
        List<Signal> rejected = context.matchingOn(context.service(), SignalPatterns.RE_POOL);
        if (rejected.isEmpty()) {
            return Optional.empty();
        }
        String explanation = String.format(
                "%s rejected work %d time(s): worker pool saturated",
                context.service(),
                rejected.size());
        return Optional.of(new RuleMatch(
                explanation,
                rejected,
                "Review the thread pool configuration of " + context.service() + " and adjust concurrency limits",
                context.window()));
    }
}
