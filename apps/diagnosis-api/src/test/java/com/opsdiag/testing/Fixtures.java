package com.opsdiag.testing;

import com.opsdiag.model.Criticality;
import com.opsdiag.model.Incident;
import com.opsdiag.model.ServiceNode;
import com.opsdiag.model.Severity;
import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import com.opsdiag.model.Trigger;
import com.opsdiag.topology.TopologySnapshot;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/** Builders shared by the unit tests. */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private Fixtures() {
    }

    public static Signal log(String id, String service, Instant at, Severity severity, String message) {
        return new Signal(id, service, SignalKind.LOG, at, severity, Map.of("message", message), null);
    }

    public static Signal metric(String id, String service, Instant at, String metricName, double value) {
        return new Signal(id, service, SignalKind.METRIC, at, Severity.WARNING, Map.of("metricName", metricName), value);
    }

    public static Signal deployment(String id, String service, Instant at, String commit) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("message", "rolled out new release");
        if (commit != null) {
            attributes.put("commit", commit);
            attributes.put("repository", "git@example.com:shop/" + service + ".git");
        }
        return new Signal(id, service, SignalKind.DEPLOYMENT, at, Severity.INFO, attributes, null);
    }

    public static Signal signal(String id, String service, SignalKind kind, Instant at, Severity severity) {
        return new Signal(id, service, kind, at, severity, Map.of(), null);
    }

    public static ServiceNode node(String name, Criticality criticality, String... dependencies) {
        return new ServiceNode(name, criticality, name + "-team", "99.9", Set.of(dependencies), Set.of());
    }

    public static TopologySnapshot topology(long version, ServiceNode... nodes) {
        return new TopologySnapshot(version, Arrays.asList(nodes));
    }

    /** checkout -> payment, checkout -> cart -> redis, frontend -> checkout. */
    public static TopologySnapshot shopTopology(long version) {
        return topology(version,
                node("frontend", Criticality.HIGH, "checkoutservice"),
                node("checkoutservice", Criticality.CRITICAL, "paymentservice", "cartservice"),
                node("paymentservice", Criticality.CRITICAL),
                node("cartservice", Criticality.HIGH, "redis"),
                node("redis", Criticality.HIGH));
    }

    public static Trigger trigger(String service, Instant at, Severity severity) {
        return new Trigger(service, at, severity, "error_rate", 0.42, "ALRT-" + service);
    }

    public static Incident incident(Trigger trigger) {
        return new Incident(UUID.randomUUID().toString(), trigger, trigger.toSignal(), trigger.timestamp(), Criticality.HIGH);
    }

    public static List<String> ids(List<Signal> signals) {
        return signals.stream().map(Signal::id).toList();
    }
}
