package com.opsdiag.diagnosis;

import com.opsdiag.model.Incident;
import com.opsdiag.model.RootCauseHypothesis;
import com.opsdiag.topology.TopologySnapshot;
import java.util.List;

/**
 * Turns the candidate signals of an incident into ranked root-cause hypotheses. The
 * rule-based implementation is the default; any other ranker (for example one backed by an
 * external inference service) must honour the same ordering and never fail on a
 * well-formed incident.
 */
public interface DiagnosisRanker {

    /**
     * Evaluates the incident's candidates, attaches the resulting hypotheses to the incident and
     * returns them in ranking order. An empty list means no automatic hypothesis was found.
     */
    List<RootCauseHypothesis> diagnose(Incident incident, TopologySnapshot topology);
}
