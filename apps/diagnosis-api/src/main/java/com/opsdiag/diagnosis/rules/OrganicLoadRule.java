package com.opsdiag.diagnosis.rules;

import com.opsdiag.diagnosis.DiagnosisContext;
import com.opsdiag.diagnosis.DiagnosisRule;
import com.opsdiag.diagnosis.RuleMatch;
import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeSet;

public class OrganicLoadRule implements DiagnosisRule {

    static final double FRACTION_THRESHOLD = 0.85;
    static final double PERCENT_THRESHOLD = 85.0;

    @Override
    public String id() {
        return "organic-load";
    }

    @Override
    public String title() {
        return "organic load / capacity";
    }

    @Override
    public int priority() {
        return 7;
    }

    @Override
    public double baseWeight() {
        return 0.6;
    }

    @Override
    public Optional<RuleMatch> evaluate(DiagnosisContext context) {
        if (!context.ofKind(SignalKind.DEPLOYMENT).isEmpty()) {
            return Optional.empty();
        }
        List<Signal> saturated = context.ofKind(SignalKind.METRIC).stream()
                .filter(OrganicLoadRule::exceedsThreshold)
                .toList();
        if (saturated.isEmpty()) {
            return Optional.empty();
        }
        Set<String> metrics = new TreeSet<>();
        saturated.forEach(signal -> metrics.add(signal.service() + ":" + metricName(signal)));
        String explanation = String.format(
                "%d resource metric sample(s) above threshold (%s) with no deployment in the window",
                saturated.size(),
                String.join(", ", metrics));
        return Optional.of(new RuleMatch(
                explanation,
                saturated,
                "Scale out " + context.service() + " (add replicas or raise autoscaling limits) and review capacity planning",
                context.window()));
    }

    static boolean exceedsThreshold(Signal signal) {
        if (signal.numericValue() == null) {
            return false;
        }
        OptionalDouble threshold = threshold(signal);
        return threshold.isPresent() && signal.numericValue() > threshold.getAsDouble();
    }

    private static OptionalDouble threshold(Signal signal) {
        String configured = signal.attribute("threshold");
        if (configured != null) {
            try {
                return OptionalDouble.of(Double.parseDouble(configured.trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        if (!SignalPatterns.RE_RESOURCE_METRIC.matcher(metricName(signal)).find()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(signal.numericValue() <= 1.0 ? FRACTION_THRESHOLD : PERCENT_THRESHOLD);
    }

    private static String metricName(Signal signal) {
        String name = signal.attribute("metricName");
        return name != null ? name : signal.attributeOrEmpty("name");
    }
}
