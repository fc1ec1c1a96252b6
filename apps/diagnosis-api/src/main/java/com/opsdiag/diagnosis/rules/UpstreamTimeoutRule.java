package com.opsdiag.diagnosis.rules;

import com.opsdiag.diagnosis.DiagnosisContext;
import com.opsdiag.diagnosis.DiagnosisRule;
import com.opsdiag.diagnosis.RuleMatch;
import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

public class UpstreamTimeoutRule implements DiagnosisRule {

    @Override
    public String id() {
        return "upstream-timeout";
    }

    @Override
    public String title() {
        return "upstream timeout";
    }

    @Override
    public int priority() {
        return 5;
    }

    @Override
    public double baseWeight() {
        return 0.65;
    }

    @Override
    public Optional<RuleMatch> evaluate(DiagnosisContext context) {
        List<Signal> timeouts = context.matching(SignalPatterns.RE_TIMEOUT).stream()
                .filter(signal -> signal.kind() == SignalKind.LOG
                        || signal.kind() == SignalKind.TRACE
                        || signal.kind() == SignalKind.ALARM)
                .toList();
        if (timeouts.isEmpty()) {
            return Optional.empty();
        }
        Set<String> services = new TreeSet<>();
        timeouts.forEach(signal -> services.add(signal.service()));
        String explanation = String.format(
                "%d timeout signal(s) on %s",
                timeouts.size(),
                String.join(", ", services));
        return Optional.of(new RuleMatch(
                explanation,
                timeouts,
                "Check latency and errors of upstream dependencies and the configured timeouts",
                context.window()));
    }
}
