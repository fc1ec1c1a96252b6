package com.opsdiag.k8s;

import com.opsdiag.model.DeploymentSummary;
import com.opsdiag.model.K8sEvent;
import com.opsdiag.model.Severity;
import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import com.opsdiag.signal.InvalidSignalException;
import com.opsdiag.signal.SignalStore;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Polls the cluster and feeds the signal store: Warning events become LOG signals and
 * deployment revision changes become DEPLOYMENT signals. The first poll only records
 * the current revisions.
 */
@ApplicationScoped
public class KubernetesSignalCollector {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.KubernetesSignalCollector");

    static final String COMMIT_ANNOTATION = "opsdiag.io/commit";
    static final String REPOSITORY_ANNOTATION = "opsdiag.io/repository";
    static final String VERSION_LABEL = "app.kubernetes.io/version";

    private static final Pattern RE_HARD_FAILURE =
            Pattern.compile("^(OOMKill|BackOff|Failed|CrashLoop|Evicted)", Pattern.CASE_INSENSITIVE);

    private final Map<String, String> lastRevisions = new ConcurrentHashMap<>();
    private volatile Instant lastPoll;

    @Inject
    K8sConnector k8s;

    @Inject
    SignalStore store;

    @Inject
    Clock clock;

    @ConfigProperty(name = "engine.collector.kubernetes.enabled", defaultValue = "false")
    boolean enabled;

    @ConfigProperty(name = "engine.collector.kubernetes.namespace", defaultValue = "default")
    String namespace;

    @ConfigProperty(name = "engine.collector.kubernetes.lookback", defaultValue = "PT15M")
    Duration lookback;

    @Scheduled(every = "{engine.collector.kubernetes.interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledPoll() {
        if (!enabled) {
            return;
        }
        try {
            poll();
        } catch (RuntimeException e) {
            LOGGER.errorf(e, "[COMM-ERROR] target=Kubernetes action=poll namespace=%s", namespace);
        }
    }

    public CollectResult poll() {
        Instant now = clock.instant();
        Instant from = lastPoll != null ? lastPoll : now.minus(lookback);
        Instant start = Instant.now();
        LOGGER.infov("[COMM-START] target=Kubernetes action=poll namespace={0} from={1} to={2}", namespace, from, now);

        List<DeploymentSummary> deployments = k8s.listDeployments(namespace);
        List<K8sEvent> events = k8s.getEvents(namespace, from, now);

        List<Signal> signals = new ArrayList<>();
        for (DeploymentSummary deployment : deployments) {
            rollout(deployment, now).ifPresent(signals::add);
        }
        List<String> deploymentNames = deployments.stream().map(DeploymentSummary::name).toList();
        for (K8sEvent event : events) {
            if (event.timestamp() == null || !"warning".equalsIgnoreCase(orEmpty(event.type()))) {
                continue;
            }
            signals.add(toSignal(event, deploymentNames));
        }

        int accepted = 0;
        int rejected = 0;
        for (Signal signal : signals) {
            try {
                store.ingest(signal);
                accepted++;
            } catch (InvalidSignalException e) {
                rejected++;
            }
        }
        lastPoll = now;
        LOGGER.infov(
                "[COMM-END] target=Kubernetes action=poll deployments={0} events={1} accepted={2} rejected={3} durationMs={4}",
                deployments.size(),
                events.size(),
                accepted,
                rejected,
                Duration.between(start, Instant.now()).toMillis());
        return new CollectResult(accepted, rejected);
    }

    private Optional<Signal> rollout(DeploymentSummary deployment, Instant now) {
        if (deployment.name() == null || deployment.revision() == null) {
            return Optional.empty();
        }
        String previous = lastRevisions.put(deployment.name(), deployment.revision());
        if (previous == null || previous.equals(deployment.revision())) {
            return Optional.empty();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("source", "kubernetes");
        attributes.put("namespace", orEmpty(deployment.namespace()));
        attributes.put("revision", deployment.revision());
        attributes.put("previousRevision", previous);
        attributes.put("image", String.join(",", Optional.ofNullable(deployment.images()).orElse(List.of())));
        attributes.put("message", "rolled out revision " + deployment.revision() + " (was " + previous + ")");
        Map<String, String> annotations = Optional.ofNullable(deployment.annotations()).orElse(Map.of());
        Map<String, String> labels = Optional.ofNullable(deployment.labels()).orElse(Map.of());
        if (annotations.containsKey(COMMIT_ANNOTATION)) {
            attributes.put("commit", annotations.get(COMMIT_ANNOTATION));
        }
        if (annotations.containsKey(REPOSITORY_ANNOTATION)) {
            attributes.put("repository", annotations.get(REPOSITORY_ANNOTATION));
        }
        if (labels.containsKey(VERSION_LABEL)) {
            attributes.put("version", labels.get(VERSION_LABEL));
        }
        return Optional.of(new Signal(
                "k8s-deploy-" + deployment.name() + "-" + deployment.revision(),
                deployment.name(),
                SignalKind.DEPLOYMENT,
                now,
                Severity.INFO,
                attributes,
                null));
    }

    private Signal toSignal(K8sEvent event, List<String> deploymentNames) {
        String service = serviceFor(event.involvedName(), deploymentNames);
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("source", "kubernetes");
        attributes.put("namespace", orEmpty(event.namespace()));
        attributes.put("reason", orEmpty(event.reason()));
        attributes.put("message", orEmpty(event.message()));
        attributes.put("involvedKind", orEmpty(event.involvedKind()));
        attributes.put("involvedName", orEmpty(event.involvedName()));
        Severity severity = RE_HARD_FAILURE.matcher(orEmpty(event.reason())).find() ? Severity.ERROR : Severity.WARNING;
        return new Signal(
                "k8s-event-" + orEmpty(event.involvedName()) + "-" + orEmpty(event.reason()) + "-"
                        + event.timestamp().toEpochMilli(),
                service,
                SignalKind.LOG,
                event.timestamp(),
                severity,
                attributes,
                null);
    }

    /** Longest deployment name owning the object (pods are named {@code <deployment>-<hash>}). */
    static String serviceFor(String involvedName, List<String> deploymentNames) {
        if (involvedName == null || involvedName.isBlank()) {
            return "unknown";
        }
        return deploymentNames.stream()
                .filter(name -> involvedName.equals(name) || involvedName.startsWith(name + "-"))
                .max(Comparator.comparingInt(String::length))
                .orElse(involvedName);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    public record CollectResult(int accepted, int rejected) {
    }
}
