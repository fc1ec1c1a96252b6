package com.opsdiag.correlator.impl;

import com.opsdiag.correlator.CorrelationOutcome;
import com.opsdiag.correlator.Correlator;
import com.opsdiag.correlator.UpstreamUnavailableException;
import com.opsdiag.model.Incident;
import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import com.opsdiag.model.TimeRange;
import com.opsdiag.signal.SignalStore;
import com.opsdiag.topology.TopologyModel;
import com.opsdiag.topology.TopologySnapshot;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class WindowedCorrelator implements Correlator {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.Correlator");

    private static final Comparator<Signal> TIME_ORDER =
            Comparator.comparing(Signal::timestamp).thenComparing(Signal::id);

    @Inject
    SignalStore store;

    @Inject
    TopologyModel topology;

    @ConfigProperty(name = "engine.correlation.window", defaultValue = "PT30M")
    Duration window;

    @ConfigProperty(name = "engine.correlation.hops", defaultValue = "2")
    int hops;

    @ConfigProperty(name = "engine.correlation.cap", defaultValue = "500")
    int cap;

    @ConfigProperty(name = "engine.correlation.deployment-window", defaultValue = "PT1H")
    Duration deploymentWindow;

    @PostConstruct
    void init() {
        LOGGER.infov(
                "[INIT] WindowedCorrelator ready. window={0} hops={1} cap={2} deploymentWindow={3}",
                window,
                hops,
                cap,
                deploymentWindow);
    }

    @Override
    public CorrelationOutcome correlate(Incident incident) {
        Signal trigger = incident.triggerSignal();
        String requestId = incident.id();
        Instant start = Instant.now();
        try {
            TopologySnapshot snapshot = callWithLogging(
                    requestId,
                    "TopologyModel",
                    "current",
                    topology::current,
                    "service=" + trigger.service());

            Set<String> scope = new LinkedHashSet<>();
            scope.add(trigger.service());
            scope.addAll(snapshot.neighbors(trigger.service(), hops));

            TimeRange signalRange = TimeRange.ending(trigger.timestamp(), window);
            TimeRange deploymentRange = TimeRange.ending(trigger.timestamp(), deploymentWindow);
            Map<String, Signal> windowed = new LinkedHashMap<>();
            Map<String, Signal> pinned = new LinkedHashMap<>();
            for (String service : scope) {
                checkInterrupted(requestId);
                callWithLogging(
                        requestId,
                        "SignalStore",
                        "query",
                        () -> store.query(service, Set.of(), signalRange).toList(),
                        "service=" + service)
                        .forEach(signal -> windowed.putIfAbsent(signal.id(), signal));
                callWithLogging(
                        requestId,
                        "SignalStore",
                        "queryDeployments",
                        () -> store.query(service, Set.of(SignalKind.DEPLOYMENT), deploymentRange).toList(),
                        "service=" + service)
                        .forEach(signal -> pinned.putIfAbsent(signal.id(), signal));
            }
            checkInterrupted(requestId);

            pinned.remove(trigger.id());
            List<Signal> others = windowed.values().stream()
                    .filter(signal -> !signal.id().equals(trigger.id()))
                    .filter(signal -> !pinned.containsKey(signal.id()))
                    .toList();
            List<Signal> kept = cap(others, Math.max(0, cap - pinned.size()), trigger.timestamp());
            int dropped = others.size() - kept.size();

            List<Signal> candidates = new ArrayList<>(pinned.size() + kept.size());
            candidates.addAll(pinned.values());
            candidates.addAll(kept);
            candidates.sort(TIME_ORDER);

            boolean attached = incident.appendCandidates(candidates, snapshot.version());
            if (!attached) {
                LOGGER.infov("[CORRELATE-LATE] requestId={0} incident sealed; candidates not attached", requestId);
            }
            if (attached && dropped > 0) {
                incident.addNote(String.format(
                        "candidate cap of %d reached: dropped %d lower-severity or older signals", cap, dropped));
            }
            LOGGER.infov(
                    "[CORRELATE] requestId={0} service={1} scope={2} candidates={3} pinnedDeployments={4} dropped={5} topologyVersion={6} durationMs={7}",
                    requestId,
                    trigger.service(),
                    scope,
                    candidates.size(),
                    pinned.size(),
                    dropped,
                    snapshot.version(),
                    Duration.between(start, Instant.now()).toMillis());
            return new CorrelationOutcome(List.copyOf(candidates), Set.copyOf(scope), snapshot, dropped, false);
        } catch (CancellationException e) {
            throw e;
        } catch (UpstreamUnavailableException e) {
            return degrade(incident, e);
        } catch (RuntimeException e) {
            return degrade(incident, new UpstreamUnavailableException(e.getMessage(), e));
        }
    }

    /**
     * Keeps at most {@code room} signals, preferring higher severity and then proximity to the
     * trigger time.
     */
    private List<Signal> cap(List<Signal> signals, int room, Instant triggerTime) {
        if (signals.size() <= room) {
            return signals;
        }
        Comparator<Signal> keepOrder = Comparator
                .comparingInt((Signal signal) -> signal.severity().rank()).reversed()
                .thenComparing(signal -> Duration.between(signal.timestamp(), triggerTime).abs())
                .thenComparing(Signal::id);
        return signals.stream()
                .sorted(keepOrder)
                .limit(room)
                .toList();
    }

    private CorrelationOutcome degrade(Incident incident, UpstreamUnavailableException e) {
        LOGGER.errorf(
                e,
                "[COMM-ERROR] requestId=%s service=%s correlation degraded to an empty candidate set",
                incident.id(),
                incident.triggerSignal().service());
        incident.markDegraded("UpstreamUnavailable: " + e.getMessage());
        return CorrelationOutcome.degradedOutcome();
    }

    private void checkInterrupted(String requestId) {
        if (Thread.currentThread().isInterrupted()) {
            LOGGER.infov("[CORRELATE-CANCELLED] requestId={0}", requestId);
            throw new CancellationException("correlation " + requestId + " cancelled");
        }
    }

    private <T> T callWithLogging(String requestId, String target, String action, Supplier<T> supplier, String context) {
        Instant start = Instant.now();
        LOGGER.debugv(
                "[COMM-START] requestId={0} target={1} action={2} context={3}",
                requestId,
                target,
                action,
                context);
        try {
            T result = supplier.get();
            LOGGER.debugv(
                    "[COMM-END] requestId={0} target={1} action={2} durationMs={3}",
                    requestId,
                    target,
                    action,
                    Duration.between(start, Instant.now()).toMillis());
            return result;
        } catch (RuntimeException e) {
            LOGGER.errorf(
                    e,
                    "[COMM-ERROR] requestId=%s target=%s action=%s context=%s",
                    requestId,
                    target,
                    action,
                    context);
            throw e;
        }
    }
}
