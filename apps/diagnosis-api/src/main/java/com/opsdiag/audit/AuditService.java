package com.opsdiag.audit;

import com.opsdiag.model.IncidentState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

@ApplicationScoped
public class AuditService {

    private static final int MAX_ENTRIES = 1000;
    private final Deque<AuditEntry> history = new ArrayDeque<>();

    @Inject
    Clock clock;

    public synchronized void record(String incidentId,
            String service,
            String event,
            IncidentState state,
            String detail) {
        if (history.size() >= MAX_ENTRIES) {
            history.removeFirst();
        }
        history.addLast(new AuditEntry(clock.instant(), incidentId, service, event, state, detail));
    }

    public synchronized List<AuditEntry> export() {
        return new ArrayList<>(history);
    }

    public synchronized List<AuditEntry> forIncident(String incidentId) {
        return history.stream()
                .filter(entry -> entry.incidentId().equals(incidentId))
                .toList();
    }

    public record AuditEntry(Instant timestamp,
            String incidentId,
            String service,
            String event,
            IncidentState state,
            String detail) {
    }
}
