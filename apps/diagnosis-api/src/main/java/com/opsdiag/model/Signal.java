package com.opsdiag.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record Signal(
        String id,
        String service,
        SignalKind kind,
        Instant timestamp,
        Severity severity,
        Map<String, String> attributes,
        Double numericValue
) {
    public Signal {
        Map<String, String> copy = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        attributes = Map.copyOf(copy);
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public String attributeOrEmpty(String key) {
        return Objects.requireNonNullElse(attributes.get(key), "");
    }

    /** Free text matched by the diagnosis patterns. */
    public String text() {
        return String.join(" ",
                attributeOrEmpty("message"),
                attributeOrEmpty("reason"),
                attributeOrEmpty("error"),
                attributeOrEmpty("status"));
    }
}
