package com.opsdiag.incident;

import com.opsdiag.correlator.CorrelationOutcome;
import com.opsdiag.correlator.Correlator;
import com.opsdiag.diagnosis.DiagnosisRanker;
import com.opsdiag.model.Criticality;
import com.opsdiag.model.Incident;
import com.opsdiag.model.Severity;
import com.opsdiag.model.Signal;
import com.opsdiag.model.Trigger;
import com.opsdiag.report.IncidentReport;
import com.opsdiag.report.ReportPublisher;
import com.opsdiag.signal.InvalidSignalException;
import com.opsdiag.signal.SignalStore;
import com.opsdiag.topology.TopologyModel;
import com.opsdiag.topology.UnknownServiceException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Entry point for triggers. Every accepted trigger yields a registered incident and a
 * published report, whatever happens to its correlation.
 */
@ApplicationScoped
public class IncidentPipeline {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.IncidentPipeline");

    @Inject
    SignalStore store;

    @Inject
    TopologyModel topology;

    @Inject
    Correlator correlator;

    @Inject
    DiagnosisRanker ranker;

    @Inject
    IncidentRegistry registry;

    @Inject
    ReportPublisher publisher;

    @Inject
    Clock clock;

    @ConfigProperty(name = "engine.pipeline.workers", defaultValue = "4")
    int workerCount;

    @ConfigProperty(name = "engine.pipeline.budget", defaultValue = "PT5S")
    Duration budget;

    @ConfigProperty(name = "engine.pipeline.debounce", defaultValue = "PT60S")
    Duration debounce;

    final ConcurrentHashMap<String, InFlight> inFlight = new ConcurrentHashMap<>();
    private ExecutorService workers;

    @PostConstruct
    void init() {
        workers = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
        LOGGER.infov(
                "[INIT] IncidentPipeline ready. workers={0} budget={1} debounce={2}",
                workerCount,
                budget,
                debounce);
    }

    @PreDestroy
    void close() {
        workers.shutdownNow();
    }

    public IncidentReport handle(Trigger request) {
        Instant receivedAt = clock.instant();
        Trigger trigger = normalize(request, receivedAt);
        Signal triggerSignal = trigger.toSignal();
        Incident incident = new Incident(
                UUID.randomUUID().toString(),
                trigger,
                triggerSignal,
                receivedAt,
                priorityOf(trigger.service()));
        registry.register(incident);
        LOGGER.infov(
                "[INCIDENT-OPEN] incidentId={0} service={1} severity={2} priority={3}",
                incident.id(),
                trigger.service(),
                trigger.severity(),
                incident.priority());

        ingestTrigger(incident);

        FutureTask<Void> task = new FutureTask<>(() -> {
            diagnose(incident);
            return null;
        });
        InFlight entry = new InFlight(incident, trigger.severity(), receivedAt, task);
        claim(trigger.service(), entry);
        try {
            workers.execute(task);
            long remaining = budget.minus(Duration.between(receivedAt, clock.instant())).toMillis();
            task.get(Math.max(0, remaining), TimeUnit.MILLISECONDS);
            incident.complete();
        } catch (TimeoutException e) {
            task.cancel(true);
            CorrelationTimeoutException timeout = new CorrelationTimeoutException(incident.id(), budget);
            LOGGER.warnv("[INCIDENT-TIMEOUT] incidentId={0} {1}", incident.id(), timeout.getMessage());
            incident.seal("CorrelationTimeout: " + timeout.getMessage(), clock.instant());
        } catch (CancellationException e) {
            LOGGER.infov(
                    "[INCIDENT-SUPERSEDED] incidentId={0} supersededBy={1}",
                    incident.id(),
                    incident.supersededBy().orElse("<unknown>"));
        } catch (ExecutionException e) {
            LOGGER.errorf(e.getCause(), "[INCIDENT-ERROR] incidentId=%s diagnosis failed", incident.id());
            incident.markDegraded("diagnosis failed: " + e.getCause().getMessage());
            incident.seal("diagnosis aborted after an internal error", clock.instant());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            incident.seal("diagnosis interrupted before completion", clock.instant());
        } finally {
            inFlight.remove(trigger.service(), entry);
        }

        registry.recordEvent(incident, "diagnosed", incident.rankedCauses().size() + " hypothesis(es)");
        return publisher.publish(incident);
    }

    private void diagnose(Incident incident) {
        CorrelationOutcome outcome = correlator.correlate(incident);
        ranker.diagnose(incident, outcome.topology());
    }

    /**
     * Registers {@code entry} as the in-flight work of its service, cancelling the current one when
     * the newcomer is strictly more severe and arrives inside the debounce window.
     */
    void claim(String service, InFlight entry) {
        inFlight.compute(service, (key, existing) -> {
            if (existing == null || existing.task().isDone()) {
                return entry;
            }
            boolean moreSevere = entry.severity().rank() > existing.severity().rank();
            boolean withinDebounce = Duration.between(existing.receivedAt(), entry.receivedAt()).compareTo(debounce) <= 0;
            if (!moreSevere || !withinDebounce) {
                return existing;
            }
            // a task that finished after the isDone check keeps its result
            if (existing.task().cancel(true)) {
                existing.incident().supersede(entry.incident().id(), clock.instant());
                registry.recordEvent(existing.incident(), "superseded", "by " + entry.incident().id());
                entry.incident().addNote("supersedes incident " + existing.incident().id());
            }
            return entry;
        });
    }

    private void ingestTrigger(Incident incident) {
        try {
            store.ingest(incident.triggerSignal());
        } catch (InvalidSignalException e) {
            incident.addNote("trigger not stored as a signal: " + e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.errorf(e, "[COMM-ERROR] incidentId=%s target=SignalStore action=ingest", incident.id());
            incident.addNote("trigger not stored as a signal: signal store unavailable");
        }
    }

    private Criticality priorityOf(String service) {
        try {
            return topology.criticality(service);
        } catch (UnknownServiceException e) {
            LOGGER.debugv("[PRIORITY] service={0} not in topology, using LOW", service);
            return Criticality.LOW;
        } catch (RuntimeException e) {
            LOGGER.warnv("[PRIORITY] service={0} topology unavailable ({1}), using LOW", service, e.getMessage());
            return Criticality.LOW;
        }
    }

    private Trigger normalize(Trigger trigger, Instant receivedAt) {
        if (trigger == null || trigger.service() == null || trigger.service().isBlank()) {
            throw new InvalidSignalException("trigger service is required");
        }
        return new Trigger(
                trigger.service().trim(),
                trigger.timestamp() != null ? trigger.timestamp() : receivedAt,
                trigger.severity() != null ? trigger.severity() : Severity.ERROR,
                trigger.metricName(),
                trigger.value(),
                trigger.alarmId());
    }

    record InFlight(Incident incident, Severity severity, Instant receivedAt, FutureTask<Void> task) {
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "incident-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
