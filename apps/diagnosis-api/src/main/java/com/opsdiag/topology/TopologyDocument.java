package com.opsdiag.topology;

import java.util.List;

public record TopologyDocument(List<ServiceEntry> services) {

    public TopologyDocument {
        services = services == null ? List.of() : List.copyOf(services);
    }

    public static record ServiceEntry(
            String name,
            String criticality,
            String owner,
            String sla,
            List<String> dependencies,
            List<String> externalDependencies
    ) {
    }
}
