package com.opsdiag.incident;

import java.time.Duration;

/**
 * Diagnosis did not finish inside its budget; the incident keeps what was computed so far.
 */
public class CorrelationTimeoutException extends RuntimeException {

    public CorrelationTimeoutException(String incidentId, Duration budget) {
        super("diagnosis of incident " + incidentId + " exceeded its budget of " + budget.toMillis() + " ms");
    }
}
