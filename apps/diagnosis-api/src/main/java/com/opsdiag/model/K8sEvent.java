package com.opsdiag.model;

import java.time.Instant;

public record K8sEvent(
        Instant timestamp,
        String namespace,
        String type,
        String reason,
        String message,
        String involvedKind,
        String involvedName
) {
}
