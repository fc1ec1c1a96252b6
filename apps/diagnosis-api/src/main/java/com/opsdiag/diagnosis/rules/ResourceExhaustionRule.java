package com.opsdiag.diagnosis.rules;

import com.opsdiag.diagnosis.DiagnosisContext;
import com.opsdiag.diagnosis.DiagnosisRule;
import com.opsdiag.diagnosis.RuleMatch;
import com.opsdiag.model.Signal;
import java.util.List;
import java.util.Optional;

public class ResourceExhaustionRule implements DiagnosisRule {

    @Override
    public String id() {
        return "resource-exhaustion";
    }

    @Override
    public String title() {
        return "memory exhaustion";
    }

    @Override
    public int priority() {
        return 3;
    }

    @Override
    public double baseWeight() {
        return 0.8;
    }

    @Override
    public Optional<RuleMatch> evaluate(DiagnosisContext context) {
        List<Signal> oom = context.matchingOn(context.service(), SignalPatterns.RE_OOM);
        if (oom.isEmpty()) {
            return Optional.empty();
        }
        String explanation = String.format(
                "%s shows %d out-of-memory signal(s) inside the correlation window",
                context.service(),
                oom.size());
        String mitigation = "Raise memory limits for " + context.service()
                + " or investigate a memory leak; restart the affected instances";
        return Optional.of(new RuleMatch(explanation, oom, mitigation, context.window()));
    }
}
