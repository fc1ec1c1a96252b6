package com.opsdiag.incident;

public class IncidentNotFoundException extends RuntimeException {

    public IncidentNotFoundException(String incidentId) {
        super("incident not found: " + incidentId);
    }
}
