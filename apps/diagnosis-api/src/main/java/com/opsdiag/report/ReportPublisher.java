package com.opsdiag.report;

import com.opsdiag.diagnosis.rules.DeploymentRegressionRule;
import com.opsdiag.model.DeploymentHint;
import com.opsdiag.model.Incident;
import com.opsdiag.model.RootCauseHypothesis;
import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

@ApplicationScoped
public class ReportPublisher {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.ReportPublisher");

    @Inject
    Instance<IncidentNotifier> notifiers;

    @Inject
    Instance<DeploymentHintPublisher> hintPublishers;

    public IncidentReport publish(Incident incident) {
        IncidentReport report = ReportAssembler.assemble(incident);
        for (IncidentNotifier notifier : notifiers) {
            try {
                notifier.notify(report);
            } catch (RuntimeException e) {
                LOGGER.errorf(
                        e,
                        "[NOTIFY-ERROR] incidentId=%s notifier=%s",
                        incident.id(),
                        notifier.getClass().getSimpleName());
            }
        }
        deploymentHint(report).ifPresent(hint -> {
            for (DeploymentHintPublisher publisher : hintPublishers) {
                try {
                    publisher.publish(hint);
                } catch (RuntimeException e) {
                    LOGGER.errorf(
                            e,
                            "[NOTIFY-ERROR] incidentId=%s hintPublisher=%s",
                            incident.id(),
                            publisher.getClass().getSimpleName());
                }
            }
        });
        return report;
    }

    /** A hint when the top hypothesis is a deployment regression whose deployment names a commit. */
    public static Optional<DeploymentHint> deploymentHint(IncidentReport report) {
        List<RootCauseHypothesis> causes = report.rankedCauses();
        if (causes.isEmpty() || !DeploymentRegressionRule.ID.equals(causes.get(0).ruleId())) {
            return Optional.empty();
        }
        return causes.get(0).supportingSignals().stream()
                .filter(signal -> signal.kind() == SignalKind.DEPLOYMENT)
                .filter(signal -> !signal.attributeOrEmpty("commit").isBlank())
                .max(Comparator.comparing(Signal::timestamp))
                .map(signal -> new DeploymentHint(
                        signal.attribute("commit"),
                        signal.attribute("repository"),
                        signal.service()));
    }
}
