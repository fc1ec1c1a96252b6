package com.opsdiag.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public record Trigger(
        String service,
        Instant timestamp,
        Severity severity,
        String metricName,
        Double value,
        String alarmId
) {

    public Signal toSignal() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("source", "trigger");
        if (metricName != null) {
            attributes.put("metricName", metricName);
        }
        if (alarmId != null) {
            attributes.put("alarmId", alarmId);
        }
        String id = alarmId != null && !alarmId.isBlank()
                ? "alarm-" + alarmId + "-" + timestamp.toEpochMilli()
                : "trigger-" + UUID.randomUUID();
        return new Signal(id, service, SignalKind.ALARM, timestamp, severity, attributes, value);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(" alarm on ").append(service).append(" at ").append(timestamp);
        if (metricName != null) {
            sb.append(" (").append(metricName);
            if (value != null) {
                sb.append('=').append(value);
            }
            sb.append(')');
        }
        if (alarmId != null) {
            sb.append(" [").append(alarmId).append(']');
        }
        return sb.toString();
    }
}
