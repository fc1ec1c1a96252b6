package com.opsdiag.model;

import java.util.Set;

/**
 * A service of the topology. Dependencies are plain names resolved against the
 * snapshot that owns the node, never embedded nodes.
 */
public record ServiceNode(
        String name,
        Criticality criticality,
        String owner,
        String sla,
        Set<String> dependencies,
        Set<String> externalDependencies
) {
    public ServiceNode {
        criticality = criticality == null ? Criticality.LOW : criticality;
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
        externalDependencies = externalDependencies == null ? Set.of() : Set.copyOf(externalDependencies);
    }
}
