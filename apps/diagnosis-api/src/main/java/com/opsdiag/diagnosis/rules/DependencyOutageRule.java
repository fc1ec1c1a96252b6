package com.opsdiag.diagnosis.rules;

import com.opsdiag.diagnosis.DiagnosisContext;
import com.opsdiag.diagnosis.DiagnosisRule;
import com.opsdiag.diagnosis.RuleMatch;
import com.opsdiag.model.Signal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

public class DependencyOutageRule implements DiagnosisRule {

    @Override
    public String id() {
        return "dependency-outage";
    }

    @Override
    public String title() {
        return "dependency outage";
    }

    @Override
    public int priority() {
        return 2;
    }

    @Override
    public double baseWeight() {
        return 0.85;
    }

    @Override
    public Optional<RuleMatch> evaluate(DiagnosisContext context) {
        List<Signal> refused = context.matching(SignalPatterns.RE_CONNECTION).stream()
                .filter(signal -> !SignalPatterns.RE_CRASH.matcher(signal.text()).find())
                .toList();
        if (refused.isEmpty()) {
            return Optional.empty();
        }
        Set<String> dependencies = context.topology().dependenciesWithin(context.service(), context.hops());
        List<Signal> crashes = context.matching(SignalPatterns.RE_CRASH).stream()
                .filter(signal -> !signal.service().equals(context.service()))
                .filter(signal -> !context.knowsTriggerService() || dependencies.contains(signal.service()))
                .toList();
        if (crashes.isEmpty()) {
            return Optional.empty();
        }
        Set<String> crashed = new TreeSet<>();
        crashes.forEach(signal -> crashed.add(signal.service()));

        List<Signal> supporting = new ArrayList<>(refused);
        supporting.addAll(crashes);
        supporting.sort(Comparator.comparing(Signal::timestamp));

        String explanation = String.format(
                "%d connection failure(s) while dependency %s reported crash/OOM signals (%d)",
                refused.size(),
                String.join(", ", crashed),
                crashes.size());
        String mitigation = "Restore " + String.join(", ", crashed)
                + " (restart or roll back the crashed instances, check memory limits) and fail over callers of "
                + context.service();
        return Optional.of(new RuleMatch(explanation, supporting, mitigation, context.window()));
    }
}
