package com.opsdiag.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Record of one trigger through diagnosis to resolution.
 *
 * <p>Candidates and hypotheses are written by the worker that owns the incident. Once the
 * incident is sealed (budget exceeded) or superseded, further writes from that worker are
 * ignored so a cancelled correlation can never leak into the record. State changes stay
 * available after sealing.
 */
public class Incident {

    private final String id;
    private final Trigger trigger;
    private final Signal triggerSignal;
    private final Instant openedAt;
    private final Criticality priority;

    private IncidentState state = IncidentState.OPEN;
    private final List<Signal> candidateSignals = new ArrayList<>();
    private final List<RootCauseHypothesis> rankedCauses = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();
    private boolean sealed;
    private boolean partial;
    private boolean degraded;
    private boolean diagnosisAttempted;
    private String supersededBy;
    private long topologyVersion = -1;
    private Instant updatedAt;

    public Incident(String id, Trigger trigger, Signal triggerSignal, Instant openedAt, Criticality priority) {
        this.id = id;
        this.trigger = trigger;
        this.triggerSignal = triggerSignal;
        this.openedAt = openedAt;
        this.priority = priority == null ? Criticality.LOW : priority;
        this.updatedAt = openedAt;
    }

    public String id() {
        return id;
    }

    public Trigger trigger() {
        return trigger;
    }

    public Signal triggerSignal() {
        return triggerSignal;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public Criticality priority() {
        return priority;
    }

    public synchronized IncidentState state() {
        return state;
    }

    public synchronized List<Signal> candidateSignals() {
        return List.copyOf(candidateSignals);
    }

    public synchronized List<RootCauseHypothesis> rankedCauses() {
        return List.copyOf(rankedCauses);
    }

    public synchronized List<String> notes() {
        return List.copyOf(notes);
    }

    public synchronized boolean partial() {
        return partial;
    }

    public synchronized boolean degraded() {
        return degraded;
    }

    public synchronized boolean diagnosisAttempted() {
        return diagnosisAttempted;
    }

    public synchronized boolean sealed() {
        return sealed;
    }

    public synchronized Optional<String> supersededBy() {
        return Optional.ofNullable(supersededBy);
    }

    public synchronized long topologyVersion() {
        return topologyVersion;
    }

    public synchronized Instant updatedAt() {
        return updatedAt;
    }

    public synchronized boolean appendCandidates(List<Signal> signals, long topologyVersion) {
        if (sealed) {
            return false;
        }
        candidateSignals.addAll(signals);
        candidateSignals.sort(Comparator.comparing(Signal::timestamp).thenComparing(Signal::id));
        this.topologyVersion = topologyVersion;
        return true;
    }

    /** Appends hypotheses keeping the ranking order and moves an open incident to DIAGNOSED. */
    public synchronized boolean attachDiagnosis(List<RootCauseHypothesis> hypotheses, Instant at) {
        if (sealed) {
            return false;
        }
        rankedCauses.addAll(hypotheses);
        rankedCauses.sort(RootCauseHypothesis.RANKING);
        diagnosisAttempted = true;
        if (state == IncidentState.OPEN) {
            state = IncidentState.DIAGNOSED;
        }
        updatedAt = at;
        return true;
    }

    public synchronized void addNote(String note) {
        notes.add(note);
    }

    public synchronized void markDegraded(String note) {
        degraded = true;
        notes.add(note);
    }

    /** Freezes whatever the worker produced so far. */
    public synchronized void seal(String note, Instant at) {
        if (sealed) {
            return;
        }
        sealed = true;
        partial = true;
        notes.add(note);
        if (state == IncidentState.OPEN) {
            state = IncidentState.DIAGNOSED;
        }
        updatedAt = at;
    }

    /** Completion without budget overrun. */
    public synchronized void complete() {
        sealed = true;
    }

    /** Discards partial work in favour of a newer incident for the same service. */
    public synchronized void supersede(String newerIncidentId, Instant at) {
        sealed = true;
        supersededBy = newerIncidentId;
        candidateSignals.clear();
        rankedCauses.clear();
        notes.add("superseded by incident " + newerIncidentId + "; partial correlation discarded");
        updatedAt = at;
    }

    public synchronized void transitionTo(IncidentState target, Instant at) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidTransitionException("Cannot move incident " + id + " from " + state + " to " + target);
        }
        state = target;
        updatedAt = at;
    }
}
