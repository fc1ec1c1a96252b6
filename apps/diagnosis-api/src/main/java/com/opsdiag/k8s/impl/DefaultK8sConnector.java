package com.opsdiag.k8s.impl;

import com.opsdiag.k8s.K8sConnector;
import com.opsdiag.model.DeploymentSummary;
import com.opsdiag.model.K8sEvent;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.MicroTime;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.events.v1.Event;
import io.fabric8.kubernetes.api.model.events.v1.EventSeries;
import io.fabric8.kubernetes.client.KubernetesClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@ApplicationScoped
public class DefaultK8sConnector implements K8sConnector {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultK8sConnector.class);

    static final String REVISION_ANNOTATION = "deployment.kubernetes.io/revision";

    private final KubernetesClient client;

    @Inject
    public DefaultK8sConnector(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public List<DeploymentSummary> listDeployments(String namespace) {
        var deploymentList = (namespace == null || namespace.isBlank())
                ? client.apps().deployments().inAnyNamespace().list()
                : client.apps().deployments().inNamespace(namespace).list();
        return Optional.ofNullable(deploymentList)
                .map(list -> list.getItems())
                .orElse(List.of())
                .stream()
                .map(this::toSummary)
                .sorted(Comparator.comparing(DeploymentSummary::name, Comparator.nullsLast(String::compareTo)))
                .toList();
    }

    @Override
    public List<K8sEvent> getEvents(String namespace, Instant from, Instant to) {
        var eventsOperation = client.events().v1().events();
        var eventList = (namespace == null || namespace.isBlank())
                ? eventsOperation.inAnyNamespace().list()
                : eventsOperation.inNamespace(namespace).list();
        return Optional.ofNullable(eventList)
                .map(list -> list.getItems())
                .orElse(List.of())
                .stream()
                .map(this::toEvent)
                .flatMap(Optional::stream)
                .filter(event -> isWithin(event.timestamp(), from, to))
                .sorted(Comparator.comparing(K8sEvent::timestamp))
                .toList();
    }

    private DeploymentSummary toSummary(Deployment deployment) {
        Map<String, String> annotations = safeMap(deployment.getMetadata().getAnnotations());
        List<String> images = Optional.ofNullable(deployment.getSpec())
                .map(spec -> spec.getTemplate())
                .map(template -> template.getSpec())
                .map(podSpec -> podSpec.getContainers())
                .orElse(List.of())
                .stream()
                .map(Container::getImage)
                .filter(Objects::nonNull)
                .toList();
        return new DeploymentSummary(
                deployment.getMetadata().getName(),
                deployment.getMetadata().getNamespace(),
                annotations.get(REVISION_ANNOTATION),
                images,
                deployment.getSpec() != null ? deployment.getSpec().getReplicas() : null,
                deployment.getStatus() != null ? deployment.getStatus().getAvailableReplicas() : null,
                safeMap(deployment.getMetadata().getLabels()),
                annotations);
    }

    private Optional<K8sEvent> toEvent(Event event) {
        Instant timestamp = resolveTimestamp(event);
        if (timestamp == null) {
            return Optional.empty();
        }
        String kind = Optional.ofNullable(event.getRegarding()).map(ref -> ref.getKind()).orElse(null);
        String name = Optional.ofNullable(event.getRegarding()).map(ref -> ref.getName()).orElse(null);
        String message = event.getNote();
        if (message == null && event.getSeries() != null) {
            EventSeries series = event.getSeries();
            message = "Series count=" + series.getCount();
        }
        return Optional.of(new K8sEvent(
                timestamp,
                event.getMetadata() != null ? event.getMetadata().getNamespace() : null,
                event.getType(),
                event.getReason(),
                message,
                kind,
                name));
    }

    private Instant resolveTimestamp(Event event) {
        return Optional.ofNullable(event.getEventTime())
                .map(this::fromMicroTime)
                .or(() -> parseInstant(event.getDeprecatedLastTimestamp()))
                .or(() -> parseInstant(event.getDeprecatedFirstTimestamp()))
                .orElse(null);
    }

    private Optional<Instant> parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(value));
        } catch (Exception ex) {
            LOGGER.debug("Unable to parse timestamp {}: {}", value, ex.getMessage());
            return Optional.empty();
        }
    }

    private Instant fromMicroTime(MicroTime microTime) {
        if (microTime == null || microTime.getTime() == null) {
            return null;
        }
        try {
            return Instant.parse(microTime.getTime());
        } catch (Exception ex) {
            LOGGER.debug("Unable to parse microtime {}: {}", microTime.getTime(), ex.getMessage());
            return null;
        }
    }

    private boolean isWithin(Instant timestamp, Instant from, Instant to) {
        if (timestamp == null) {
            return false;
        }
        boolean afterFrom = from == null || !timestamp.isBefore(from);
        boolean beforeTo = to == null || !timestamp.isAfter(to);
        return afterFrom && beforeTo;
    }

    private Map<String, String> safeMap(Map<String, String> input) {
        return input == null ? Map.of() : Map.copyOf(input);
    }
}
