package com.opsdiag.report;

import com.opsdiag.model.Criticality;
import com.opsdiag.model.IncidentState;
import com.opsdiag.model.RootCauseHypothesis;
import java.time.Instant;
import java.util.List;

/**
 * Structured outcome of an incident handed to notifiers. {@code statusMessage} is always
 * present so an empty or partial diagnosis is never mistaken for "no cause exists".
 */
public record IncidentReport(
        String incidentId,
        String triggerSummary,
        String service,
        Criticality criticality,
        IncidentState state,
        Instant openedAt,
        DiagnosisStatus diagnosisStatus,
        String statusMessage,
        List<RootCauseHypothesis> rankedCauses,
        List<String> recommendedMitigations,
        int candidateSignalCount,
        long topologyVersion,
        String supersededBy,
        List<String> notes
) {
}
