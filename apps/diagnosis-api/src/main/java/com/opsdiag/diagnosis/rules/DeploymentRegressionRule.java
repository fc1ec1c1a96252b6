package com.opsdiag.diagnosis.rules;

import com.opsdiag.diagnosis.DiagnosisContext;
import com.opsdiag.diagnosis.DiagnosisRule;
import com.opsdiag.diagnosis.RuleMatch;
import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class DeploymentRegressionRule implements DiagnosisRule {

    public static final String ID = "deployment-regression";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String title() {
        return "deployment regression";
    }

    @Override
    public int priority() {
        return 1;
    }

    @Override
    public double baseWeight() {
        return 0.9;
    }

    @Override
    public Optional<RuleMatch> evaluate(DiagnosisContext context) {
        Set<String> suspects = context.serviceAndDependencies();
        var triggerTime = context.trigger().timestamp();
        List<Signal> deployments = context.ofKind(SignalKind.DEPLOYMENT).stream()
                .filter(signal -> suspects.contains(signal.service()))
                .filter(signal -> !signal.timestamp().isAfter(triggerTime))
                .filter(signal -> Duration.between(signal.timestamp(), triggerTime).compareTo(context.deploymentWindow()) <= 0)
                .toList();
        if (deployments.isEmpty()) {
            return Optional.empty();
        }
        Signal latest = deployments.stream()
                .max(Comparator.comparing(Signal::timestamp))
                .orElseThrow();
        var firstDeployment = deployments.stream()
                .map(Signal::timestamp)
                .min(Comparator.naturalOrder())
                .orElseThrow();

        List<Signal> supporting = new ArrayList<>(deployments);
        context.symptomsOn(context.service()).stream()
                .filter(signal -> !signal.timestamp().isBefore(firstDeployment))
                .forEach(supporting::add);

        long minutesBefore = Duration.between(latest.timestamp(), triggerTime).toMinutes();
        String release = describeRelease(latest);
        String where = latest.service().equals(context.service())
                ? context.service()
                : "dependency " + latest.service() + " of " + context.service();
        String explanation = String.format(
                "Deployment of %s%s %d min before the alarm on %s; %d deployment(s) in the window",
                where,
                release.isEmpty() ? "" : " (" + release + ")",
                minutesBefore,
                context.service(),
                deployments.size());
        String mitigation = "Roll back " + latest.service() + " to the previous release"
                + (release.isEmpty() ? "" : " (currently " + release + ")")
                + " and review the change before redeploying";
        return Optional.of(new RuleMatch(explanation, supporting, mitigation, context.deploymentWindow()));
    }

    static String describeRelease(Signal deployment) {
        List<String> parts = new ArrayList<>();
        if (!deployment.attributeOrEmpty("commit").isBlank()) {
            parts.add("commit " + deployment.attribute("commit"));
        }
        if (!deployment.attributeOrEmpty("version").isBlank()) {
            parts.add("version " + deployment.attribute("version"));
        } else if (!deployment.attributeOrEmpty("revision").isBlank()) {
            parts.add("revision " + deployment.attribute("revision"));
        }
        return String.join(", ", parts);
    }
}
