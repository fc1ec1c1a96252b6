package com.opsdiag.topology;

import com.opsdiag.model.Criticality;
import java.util.Set;

/**
 * Process-wide service graph. {@link #current()} returns one consistent snapshot;
 * {@link #reload(TopologyDocument)} replaces it atomically.
 */
public interface TopologyModel {

    TopologySnapshot current();

    TopologySnapshot reload(TopologyDocument document);

    default Set<String> neighbors(String service, int hops) {
        return current().neighbors(service, hops);
    }

    /**
     * @throws UnknownServiceException when the service was never registered
     */
    default Criticality criticality(String service) {
        return current().criticality(service);
    }
}
