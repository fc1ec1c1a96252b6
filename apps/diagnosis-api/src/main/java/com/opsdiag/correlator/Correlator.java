package com.opsdiag.correlator;

import com.opsdiag.model.Incident;

public interface Correlator {

    /**
     * Collects the candidate signals of the incident's trigger and appends them to the incident.
     * Upstream failures are recorded on the incident as a degraded, empty correlation rather than
     * thrown. Interruption of the calling thread aborts with a
     * {@link java.util.concurrent.CancellationException} and appends nothing.
     */
    CorrelationOutcome correlate(Incident incident);
}
