package com.opsdiag.model;

import java.util.List;
import java.util.Map;

public record DeploymentSummary(
        String name,
        String namespace,
        String revision,
        List<String> images,
        Integer desired,
        Integer available,
        Map<String, String> labels,
        Map<String, String> annotations
) {
}
