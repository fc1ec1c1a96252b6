package com.opsdiag.incident;

import com.opsdiag.audit.AuditService;
import com.opsdiag.model.Incident;
import com.opsdiag.model.IncidentState;
import com.opsdiag.model.InvalidTransitionException;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class IncidentRegistry {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.IncidentRegistry");

    private final Map<String, Incident> incidents = new LinkedHashMap<>();

    @Inject
    AuditService audit;

    @Inject
    Clock clock;

    @ConfigProperty(name = "engine.incident.max-retained", defaultValue = "500")
    int maxRetained;

    @ConfigProperty(name = "engine.incident.auto-escalate-after", defaultValue = "PT24H")
    Duration autoEscalateAfter;

    public synchronized void register(Incident incident) {
        incidents.put(incident.id(), incident);
        trim();
        audit.record(incident.id(), incident.triggerSignal().service(), "opened", incident.state(),
                incident.trigger().summary());
    }

    public synchronized Optional<Incident> find(String id) {
        return Optional.ofNullable(incidents.get(id));
    }

    public Incident get(String id) {
        return find(id).orElseThrow(() -> new IncidentNotFoundException(id));
    }

    /** Most recent first. */
    public synchronized List<Incident> list(Optional<String> service, Optional<IncidentState> state) {
        List<Incident> result = new ArrayList<>();
        for (Incident incident : incidents.values()) {
            if (service.isPresent() && !service.get().equals(incident.triggerSignal().service())) {
                continue;
            }
            if (state.isPresent() && state.get() != incident.state()) {
                continue;
            }
            result.add(incident);
        }
        result.sort(Comparator.comparing(Incident::openedAt).reversed());
        return result;
    }

    /**
     * Responder-driven state change.
     *
     * @throws InvalidTransitionException when the move is not allowed
     */
    public Incident transition(String id, IncidentState target, String note) {
        Incident incident = get(id);
        IncidentState from = incident.state();
        incident.transitionTo(target, clock.instant());
        if (note != null && !note.isBlank()) {
            incident.addNote(target + ": " + note);
        }
        audit.record(id, incident.triggerSignal().service(), "transition " + from + " -> " + target, target, note);
        LOGGER.infov("[INCIDENT-TRANSITION] incidentId={0} from={1} to={2}", id, from, target);
        return incident;
    }

    public void recordEvent(Incident incident, String event, String detail) {
        audit.record(incident.id(), incident.triggerSignal().service(), event, incident.state(), detail);
    }

    @Scheduled(every = "{engine.incident.sweep-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void escalateStale() {
        Instant cutoff = clock.instant().minus(autoEscalateAfter);
        List<Incident> stale;
        synchronized (this) {
            stale = incidents.values().stream()
                    .filter(incident -> !incident.state().terminal())
                    .filter(incident -> incident.openedAt().isBefore(cutoff))
                    .toList();
        }
        for (Incident incident : stale) {
            try {
                incident.transitionTo(IncidentState.ESCALATED, clock.instant());
            } catch (InvalidTransitionException e) {
                LOGGER.debugv("[INCIDENT-ESCALATED] incidentId={0} skipped: {1}", incident.id(), e.getMessage());
                continue;
            }
            incident.addNote("escalated automatically: unresolved after " + autoEscalateAfter);
            recordEvent(incident, "auto-escalated", "unresolved after " + autoEscalateAfter);
            LOGGER.warnv("[INCIDENT-ESCALATED] incidentId={0} openedAt={1}", incident.id(), incident.openedAt());
        }
    }

    private void trim() {
        if (incidents.size() <= maxRetained) {
            return;
        }
        Iterator<Incident> terminalFirst = incidents.values().iterator();
        while (incidents.size() > maxRetained && terminalFirst.hasNext()) {
            if (terminalFirst.next().state().terminal()) {
                terminalFirst.remove();
            }
        }
        Iterator<Incident> oldest = incidents.values().iterator();
        while (incidents.size() > maxRetained && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }
}
