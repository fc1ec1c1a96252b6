package com.opsdiag.model;

import java.util.EnumSet;
import java.util.Set;

public enum IncidentState {
    OPEN,
    DIAGNOSED,
    MITIGATING,
    RESOLVED,
    ESCALATED;

    public Set<IncidentState> successors() {
        return switch (this) {
            case OPEN -> EnumSet.of(DIAGNOSED, RESOLVED, ESCALATED);
            case DIAGNOSED -> EnumSet.of(MITIGATING, RESOLVED, ESCALATED);
            case MITIGATING -> EnumSet.of(RESOLVED, ESCALATED);
            case RESOLVED, ESCALATED -> EnumSet.noneOf(IncidentState.class);
        };
    }

    public boolean canTransitionTo(IncidentState target) {
        return target != null && successors().contains(target);
    }

    public boolean terminal() {
        return this == RESOLVED || this == ESCALATED;
    }
}
