package com.opsdiag.correlator.impl;

import com.opsdiag.correlator.CorrelationOutcome;
import com.opsdiag.model.Criticality;
import com.opsdiag.model.Incident;
import com.opsdiag.model.Severity;
import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import com.opsdiag.model.TimeRange;
import com.opsdiag.model.Trigger;
import com.opsdiag.signal.SignalStore;
import com.opsdiag.signal.impl.InMemorySignalStore;
import com.opsdiag.signal.impl.SignalStoreFixtures;
import com.opsdiag.testing.StaticTopologyModel;
import com.opsdiag.topology.TopologySnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.opsdiag.testing.Fixtures.NOW;
import static com.opsdiag.testing.Fixtures.deployment;
import static com.opsdiag.testing.Fixtures.ids;
import static com.opsdiag.testing.Fixtures.incident;
import static com.opsdiag.testing.Fixtures.log;
import static com.opsdiag.testing.Fixtures.metric;
import static com.opsdiag.testing.Fixtures.node;
import static com.opsdiag.testing.Fixtures.shopTopology;
import static com.opsdiag.testing.Fixtures.topology;
import static com.opsdiag.testing.Fixtures.trigger;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WindowedCorrelatorTest {

    InMemorySignalStore store;
    StaticTopologyModel topology;
    WindowedCorrelator correlator;

    @BeforeEach
    void setUp() {
        store = SignalStoreFixtures.inMemory(Clock.fixed(NOW, ZoneOffset.UTC));
        topology = new StaticTopologyModel(shopTopology(7));
        correlator = CorrelatorFixtures.windowed(store, topology, 500);
    }

    @Test
    void collectsSignalsOfTheServiceAndItsNeighborsInsideTheWindow() {
        store.ingest(log("checkout-err", "checkoutservice", NOW.minusSeconds(120), Severity.ERROR, "HTTP 500"));
        store.ingest(log("payment-err", "paymentservice", NOW.minusSeconds(90), Severity.ERROR, "NullPointerException"));
        store.ingest(deployment("payment-deploy", "paymentservice", NOW.minus(Duration.ofMinutes(4)), "a1b2c3"));
        store.ingest(log("unrelated", "catalog", NOW.minusSeconds(30), Severity.ERROR, "not a neighbor"));
        Incident incident = incident(trigger("checkoutservice", NOW, Severity.ERROR));

        CorrelationOutcome outcome = correlator.correlate(incident);

        assertEquals(List.of("payment-deploy", "checkout-err", "payment-err"), ids(outcome.candidates()));
        assertEquals(ids(outcome.candidates()), ids(incident.candidateSignals()));
        assertTrue(outcome.services().containsAll(Set.of("checkoutservice", "paymentservice", "cartservice", "frontend", "redis")));
        assertEquals(7, outcome.topology().version());
        assertEquals(7, incident.topologyVersion());
        assertFalse(outcome.degraded());
    }

    @Test
    void respectsWindowBoundaries() {
        Instant edge = NOW.minus(Duration.ofMinutes(30));
        store.ingest(log("at-edge", "checkoutservice", edge, Severity.ERROR, "edge"));
        store.ingest(log("too-old", "checkoutservice", edge.minusMillis(1), Severity.ERROR, "old"));
        store.ingest(deployment("old-deploy", "paymentservice", NOW.minus(Duration.ofMinutes(59)), null));
        store.ingest(deployment("ancient-deploy", "paymentservice", NOW.minus(Duration.ofMinutes(61)), null));
        Incident incident = incident(trigger("checkoutservice", NOW, Severity.ERROR));

        List<Signal> candidates = correlator.correlate(incident).candidates();

        assertEquals(List.of("old-deploy", "at-edge"), ids(candidates));
        for (Signal signal : candidates) {
            Duration age = Duration.between(signal.timestamp(), NOW);
            Duration limit = signal.kind() == SignalKind.DEPLOYMENT ? Duration.ofHours(1) : Duration.ofMinutes(30);
            assertTrue(age.compareTo(limit) <= 0, signal.id());
        }
    }

    @Test
    void excludesTheTriggerSignalItself() {
        Trigger trigger = trigger("checkoutservice", NOW, Severity.CRITICAL);
        Incident incident = incident(trigger);
        store.ingest(incident.triggerSignal());
        store.ingest(log("other", "checkoutservice", NOW.minusSeconds(5), Severity.ERROR, "boom"));

        assertEquals(List.of("other"), ids(correlator.correlate(incident).candidates()));
    }

    @Test
    void servicesOutsideTheHopLimitAreIgnored() {
        topology.set(topology(2,
                node("a", Criticality.LOW, "b"),
                node("b", Criticality.LOW, "c"),
                node("c", Criticality.LOW, "d"),
                node("d", Criticality.LOW)));
        store.ingest(log("on-c", "c", NOW.minusSeconds(10), Severity.ERROR, "two hops"));
        store.ingest(log("on-d", "d", NOW.minusSeconds(10), Severity.ERROR, "three hops"));

        assertEquals(List.of("on-c"), ids(correlator.correlate(incident(trigger("a", NOW, Severity.ERROR))).candidates()));
    }

    @Test
    void floodIsCappedButKeepsEveryDeployment() {
        for (int i = 0; i < 10_000; i++) {
            store.ingest(metric("m-" + i, "cartservice", NOW.minusMillis(i * 100L), "latency_ms", i));
        }
        for (int i = 0; i < 5; i++) {
            store.ingest(log("crit-" + i, "cartservice", NOW.minusSeconds(600 + i), Severity.CRITICAL, "fatal"));
        }
        store.ingest(deployment("cart-deploy", "cartservice", NOW.minus(Duration.ofMinutes(45)), "ffee00"));
        store.ingest(deployment("redis-deploy", "redis", NOW.minus(Duration.ofMinutes(10)), null));
        correlator = CorrelatorFixtures.windowed(store, topology, 100);
        Incident incident = incident(trigger("cartservice", NOW, Severity.ERROR));

        CorrelationOutcome outcome = correlator.correlate(incident);

        assertEquals(100, outcome.candidates().size());
        assertTrue(ids(outcome.candidates()).containsAll(List.of("cart-deploy", "redis-deploy")));
        assertTrue(ids(outcome.candidates()).containsAll(List.of("crit-0", "crit-1", "crit-2", "crit-3", "crit-4")));
        assertTrue(outcome.dropped() > 0);
        assertTrue(incident.notes().stream().anyMatch(note -> note.contains("candidate cap of 100")));
        List<Instant> times = outcome.candidates().stream().map(Signal::timestamp).toList();
        assertEquals(times.stream().sorted().toList(), times);
    }

    @Test
    void sealedIncidentGetsNeitherCandidatesNorCapNote() {
        for (int i = 0; i < 20; i++) {
            store.ingest(log("err-" + i, "cartservice", NOW.minusSeconds(i + 1), Severity.ERROR, "boom"));
        }
        correlator = CorrelatorFixtures.windowed(store, topology, 5);
        Incident incident = incident(trigger("cartservice", NOW, Severity.ERROR));
        incident.seal("budget exceeded", NOW);

        CorrelationOutcome outcome = correlator.correlate(incident);

        assertTrue(outcome.dropped() > 0);
        assertTrue(incident.candidateSignals().isEmpty());
        assertEquals(List.of("budget exceeded"), incident.notes());
    }

    @Test
    void unavailableStoreDegradesToAnEmptyCandidateSet() {
        SignalStore broken = new SignalStore() {
            @Override
            public void ingest(Signal signal) {
            }

            @Override
            public Stream<Signal> query(String service, Set<SignalKind> kinds, TimeRange range) {
                if (service.equals("cartservice")) {
                    throw new IllegalStateException("cartservice signal backend unreachable");
                }
                return Stream.empty();
            }

            @Override
            public int evictOlderThan(Instant cutoff) {
                return 0;
            }

            @Override
            public int size() {
                return 0;
            }

            @Override
            public Map<String, Integer> countsByService() {
                return Map.of();
            }
        };
        correlator = CorrelatorFixtures.windowed(broken, topology, 500);
        Incident incident = incident(trigger("cartservice", NOW, Severity.ERROR));

        CorrelationOutcome outcome = correlator.correlate(incident);

        assertTrue(outcome.degraded());
        assertTrue(outcome.candidates().isEmpty());
        assertTrue(incident.degraded());
        assertTrue(incident.notes().stream().anyMatch(note -> note.startsWith("UpstreamUnavailable")));
    }

    @Test
    void correlationUsesTheSnapshotTakenAtStartEvenIfTopologyIsReplaced() {
        TopologySnapshot original = topology.current();
        SignalStore reloadingStore = new SignalStore() {
            @Override
            public void ingest(Signal signal) {
                store.ingest(signal);
            }

            @Override
            public Stream<Signal> query(String service, Set<SignalKind> kinds, TimeRange range) {
                topology.set(topology(99, node("checkoutservice", Criticality.LOW)));
                return store.query(service, kinds, range);
            }

            @Override
            public int evictOlderThan(Instant cutoff) {
                return store.evictOlderThan(cutoff);
            }

            @Override
            public int size() {
                return store.size();
            }

            @Override
            public Map<String, Integer> countsByService() {
                return store.countsByService();
            }
        };
        store.ingest(log("payment-err", "paymentservice", NOW.minusSeconds(30), Severity.ERROR, "boom"));
        correlator = CorrelatorFixtures.windowed(reloadingStore, topology, 500);

        CorrelationOutcome outcome = correlator.correlate(incident(trigger("checkoutservice", NOW, Severity.ERROR)));

        assertEquals(original.version(), outcome.topology().version());
        assertEquals(List.of("payment-err"), ids(outcome.candidates()));
        assertEquals(99, topology.current().version());
    }
}
