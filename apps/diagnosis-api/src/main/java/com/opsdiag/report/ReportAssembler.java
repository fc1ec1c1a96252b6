package com.opsdiag.report;

import com.opsdiag.model.Incident;
import com.opsdiag.model.RootCauseHypothesis;
import java.util.List;
import java.util.Locale;

public final class ReportAssembler {

    static final String NO_HYPOTHESIS = "no automatic hypothesis: manual investigation required";

    private ReportAssembler() {
    }

    public static IncidentReport assemble(Incident incident) {
        List<RootCauseHypothesis> causes = incident.rankedCauses();
        List<String> mitigations = causes.stream()
                .map(RootCauseHypothesis::recommendedMitigation)
                .distinct()
                .toList();
        DiagnosisStatus status = statusOf(incident, causes);
        return new IncidentReport(
                incident.id(),
                incident.trigger().summary(),
                incident.triggerSignal().service(),
                incident.priority(),
                incident.state(),
                incident.openedAt(),
                status,
                messageFor(status, incident, causes),
                causes,
                mitigations,
                incident.candidateSignals().size(),
                incident.topologyVersion(),
                incident.supersededBy().orElse(null),
                incident.notes());
    }

    static DiagnosisStatus statusOf(Incident incident, List<RootCauseHypothesis> causes) {
        if (incident.supersededBy().isPresent()) {
            return DiagnosisStatus.SUPERSEDED;
        }
        if (incident.degraded()) {
            return DiagnosisStatus.DEGRADED;
        }
        if (incident.partial()) {
            return DiagnosisStatus.PARTIAL;
        }
        if (!incident.diagnosisAttempted()) {
            return DiagnosisStatus.PENDING;
        }
        return causes.isEmpty() ? DiagnosisStatus.EMPTY : DiagnosisStatus.COMPLETE;
    }

    private static String messageFor(DiagnosisStatus status, Incident incident, List<RootCauseHypothesis> causes) {
        return switch (status) {
            case SUPERSEDED -> "correlation superseded by incident " + incident.supersededBy().orElse("?")
                    + "; see that incident for the diagnosis";
            case DEGRADED -> "signal store or topology unavailable; " + NO_HYPOTHESIS;
            case PARTIAL -> causes.isEmpty()
                    ? "diagnosis budget exceeded before any hypothesis; " + NO_HYPOTHESIS
                    : "diagnosis budget exceeded; partial result: " + describeTop(causes);
            case PENDING -> "diagnosis in progress";
            case EMPTY -> NO_HYPOTHESIS;
            case COMPLETE -> describeTop(causes);
        };
    }

    private static String describeTop(List<RootCauseHypothesis> causes) {
        RootCauseHypothesis top = causes.get(0);
        return String.format(Locale.ROOT,
                "%d hypothesis(es); most likely %s (confidence %.2f)",
                causes.size(),
                top.title(),
                top.confidenceScore());
    }
}
