package com.opsdiag.report;

import com.opsdiag.model.Incident;
import com.opsdiag.model.RootCauseHypothesis;
import com.opsdiag.model.Severity;
import java.util.List;
import org.junit.jupiter.api.Test;

import static com.opsdiag.testing.Fixtures.NOW;
import static com.opsdiag.testing.Fixtures.incident;
import static com.opsdiag.testing.Fixtures.trigger;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportAssemblerTest {

    @Test
    void pendingUntilDiagnosisRuns() {
        Incident incident = incident(trigger("cartservice", NOW, Severity.ERROR));

        assertEquals(DiagnosisStatus.PENDING, ReportAssembler.assemble(incident).diagnosisStatus());
    }

    @Test
    void emptyDiagnosisSaysSoExplicitly() {
        Incident incident = incident(trigger("cartservice", NOW, Severity.ERROR));
        incident.attachDiagnosis(List.of(), NOW);

        IncidentReport report = ReportAssembler.assemble(incident);

        assertEquals(DiagnosisStatus.EMPTY, report.diagnosisStatus());
        assertEquals(ReportAssembler.NO_HYPOTHESIS, report.statusMessage());
        assertTrue(report.recommendedMitigations().isEmpty());
    }

    @Test
    void completeReportListsDistinctMitigationsInRankOrder() {
        Incident incident = incident(trigger("cartservice", NOW, Severity.ERROR));
        incident.attachDiagnosis(List.of(
                hypothesis("upstream-timeout", 0.5, "check timeouts"),
                hypothesis("resource-exhaustion", 0.8, "raise memory"),
                hypothesis("thread-pool-exhaustion", 0.6, "check timeouts")), NOW);

        IncidentReport report = ReportAssembler.assemble(incident);

        assertEquals(DiagnosisStatus.COMPLETE, report.diagnosisStatus());
        assertEquals("resource-exhaustion", report.rankedCauses().get(0).ruleId());
        assertEquals(List.of("raise memory", "check timeouts"), report.recommendedMitigations());
        assertTrue(report.statusMessage().contains("most likely resource-exhaustion"));
    }

    @Test
    void supersededWinsOverOtherStatuses() {
        Incident incident = incident(trigger("cartservice", NOW, Severity.ERROR));
        incident.markDegraded("store down");
        incident.supersede("other-incident", NOW);

        IncidentReport report = ReportAssembler.assemble(incident);

        assertEquals(DiagnosisStatus.SUPERSEDED, report.diagnosisStatus());
        assertEquals("other-incident", report.supersededBy());
        assertTrue(report.statusMessage().contains("other-incident"));
    }

    private static RootCauseHypothesis hypothesis(String ruleId, double confidence, String mitigation) {
        return new RootCauseHypothesis(ruleId, ruleId, "explanation", confidence, 3, List.of(), mitigation);
    }
}
