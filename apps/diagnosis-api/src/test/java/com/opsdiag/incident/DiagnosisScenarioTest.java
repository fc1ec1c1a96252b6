package com.opsdiag.incident;

import com.opsdiag.audit.AuditFixtures;
import com.opsdiag.correlator.impl.CorrelatorFixtures;
import com.opsdiag.diagnosis.RuleBaseProvider;
import com.opsdiag.diagnosis.impl.RankerFixtures;
import com.opsdiag.model.DeploymentHint;
import com.opsdiag.model.Incident;
import com.opsdiag.model.Severity;
import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import com.opsdiag.model.TimeRange;
import com.opsdiag.report.DiagnosisStatus;
import com.opsdiag.report.IncidentReport;
import com.opsdiag.report.ReportAssembler;
import com.opsdiag.report.ReportPublisher;
import com.opsdiag.signal.SignalStore;
import com.opsdiag.signal.impl.InMemorySignalStore;
import com.opsdiag.signal.impl.SignalStoreFixtures;
import com.opsdiag.testing.StaticTopologyModel;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.opsdiag.testing.Fixtures.NOW;
import static com.opsdiag.testing.Fixtures.deployment;
import static com.opsdiag.testing.Fixtures.log;
import static com.opsdiag.testing.Fixtures.shopTopology;
import static com.opsdiag.testing.Fixtures.trigger;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/** Store, correlator, ranker and pipeline wired together the way the application runs them. */
class DiagnosisScenarioTest {

    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    InMemorySignalStore store;
    StaticTopologyModel topology;
    IncidentPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = SignalStoreFixtures.inMemory(clock);
        topology = new StaticTopologyModel(shopTopology(4));
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    @Test
    void paymentDeploymentBeforeCheckoutErrorsIsTheTopCause() {
        pipeline = pipeline(store);
        store.ingest(deployment("payment-v2", "paymentservice", NOW.minus(Duration.ofMinutes(6)), "9f8e7d"));
        store.ingest(log("checkout-500-1", "checkoutservice", NOW.minus(Duration.ofMinutes(5)), Severity.ERROR,
                "charge failed: HTTP 500 from paymentservice"));
        store.ingest(log("checkout-500-2", "checkoutservice", NOW.minus(Duration.ofMinutes(1)), Severity.ERROR,
                "charge failed: HTTP 500 from paymentservice"));
        store.ingest(log("frontend-noise", "frontend", NOW.minus(Duration.ofMinutes(2)), Severity.WARNING, "slow render"));

        IncidentReport report = pipeline.handle(trigger("checkoutservice", NOW, Severity.CRITICAL));

        assertEquals(DiagnosisStatus.COMPLETE, report.diagnosisStatus());
        assertEquals("deployment-regression", report.rankedCauses().get(0).ruleId());
        assertTrue(report.recommendedMitigations().get(0).contains("Roll back paymentservice"));
        assertEquals(4, report.candidateSignalCount());
        assertEquals(4, report.topologyVersion());
        DeploymentHint hint = ReportPublisher.deploymentHint(report).orElseThrow();
        assertEquals("9f8e7d", hint.commit());
        assertEquals("paymentservice", hint.service());
    }

    @Test
    void unavailableStoreStillOpensADegradedIncident() {
        SignalStore unavailable = new SignalStore() {
            @Override
            public void ingest(Signal signal) {
                store.ingest(signal);
            }

            @Override
            public Stream<Signal> query(String service, Set<SignalKind> kinds, TimeRange range) {
                throw new IllegalStateException("signal backend for " + service + " is down");
            }

            @Override
            public int evictOlderThan(Instant cutoff) {
                return 0;
            }

            @Override
            public int size() {
                return store.size();
            }

            @Override
            public Map<String, Integer> countsByService() {
                return Map.of();
            }
        };
        pipeline = pipeline(unavailable);

        IncidentReport report = pipeline.handle(trigger("cartservice", NOW, Severity.ERROR));

        assertEquals(DiagnosisStatus.DEGRADED, report.diagnosisStatus());
        assertEquals(0, report.candidateSignalCount());
        assertTrue(report.rankedCauses().isEmpty());
        assertTrue(report.statusMessage().contains("manual investigation required"));
        Incident incident = pipeline.registry.get(report.incidentId());
        assertTrue(incident.degraded());
    }

    private IncidentPipeline pipeline(SignalStore signals) {
        IncidentRegistry registry = new IncidentRegistry();
        registry.audit = AuditFixtures.withClock(clock);
        registry.clock = clock;
        registry.maxRetained = 100;
        registry.autoEscalateAfter = Duration.ofHours(24);
        ReportPublisher publisher = mock(ReportPublisher.class);
        when(publisher.publish(any(Incident.class)))
                .thenAnswer(invocation -> ReportAssembler.assemble(invocation.getArgument(0)));

        IncidentPipeline created = new IncidentPipeline();
        created.store = signals;
        created.topology = topology;
        created.correlator = CorrelatorFixtures.windowed(signals, topology, 500);
        created.ranker = RankerFixtures.ruleBased(clock, new RuleBaseProvider());
        created.registry = registry;
        created.publisher = publisher;
        created.clock = clock;
        created.workerCount = 2;
        created.budget = Duration.ofSeconds(5);
        created.debounce = Duration.ofSeconds(60);
        created.init();
        return created;
    }
}
