package com.opsdiag.correlator.impl;

import com.opsdiag.signal.SignalStore;
import com.opsdiag.topology.TopologyModel;
import java.time.Duration;

public final class CorrelatorFixtures {

    private CorrelatorFixtures() {
    }

    public static WindowedCorrelator windowed(SignalStore store, TopologyModel topology, int cap) {
        WindowedCorrelator correlator = new WindowedCorrelator();
        correlator.store = store;
        correlator.topology = topology;
        correlator.window = Duration.ofMinutes(30);
        correlator.hops = 2;
        correlator.cap = cap;
        correlator.deploymentWindow = Duration.ofHours(1);
        return correlator;
    }
}
