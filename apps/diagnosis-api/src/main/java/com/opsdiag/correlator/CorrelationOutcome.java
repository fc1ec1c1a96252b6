package com.opsdiag.correlator;

import com.opsdiag.model.Signal;
import com.opsdiag.topology.TopologySnapshot;
import java.util.List;
import java.util.Set;

/**
 * Result of one correlation. {@code topology} is the snapshot the candidate scope was computed
 * from; it is empty when correlation degraded.
 */
public record CorrelationOutcome(
        List<Signal> candidates,
        Set<String> services,
        TopologySnapshot topology,
        int dropped,
        boolean degraded
) {
    public static CorrelationOutcome degradedOutcome() {
        return new CorrelationOutcome(List.of(), Set.of(), TopologySnapshot.empty(), 0, true);
    }
}
