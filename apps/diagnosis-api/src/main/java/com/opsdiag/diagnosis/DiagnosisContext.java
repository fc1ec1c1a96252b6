package com.opsdiag.diagnosis;

import com.opsdiag.model.Severity;
import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import com.opsdiag.topology.TopologySnapshot;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

public record DiagnosisContext(
        Signal trigger,
        List<Signal> candidates,
        TopologySnapshot topology,
        Duration window,
        Duration deploymentWindow,
        int hops
) {
    public DiagnosisContext {
        candidates = List.copyOf(candidates);
        topology = topology == null ? TopologySnapshot.empty() : topology;
    }

    public String service() {
        return trigger.service();
    }

    /** The trigger service plus what it depends on within the hop limit. */
    public Set<String> serviceAndDependencies() {
        Set<String> services = new LinkedHashSet<>();
        services.add(service());
        services.addAll(topology.dependenciesWithin(service(), hops));
        return services;
    }

    public boolean knowsTriggerService() {
        return topology.contains(service());
    }

    public List<Signal> ofKind(SignalKind kind) {
        return candidates.stream().filter(signal -> signal.kind() == kind).toList();
    }

    public List<Signal> matching(Pattern pattern) {
        return candidates.stream()
                .filter(signal -> pattern.matcher(signal.text()).find())
                .toList();
    }

    public List<Signal> matchingOn(String service, Pattern pattern) {
        return matching(pattern).stream()
                .filter(signal -> signal.service().equals(service))
                .toList();
    }

    public List<Signal> symptomsOn(String service) {
        return candidates.stream()
                .filter(signal -> signal.service().equals(service))
                .filter(signal -> signal.kind() != SignalKind.DEPLOYMENT)
                .filter(signal -> signal.severity().atLeast(Severity.WARNING))
                .toList();
    }
}
