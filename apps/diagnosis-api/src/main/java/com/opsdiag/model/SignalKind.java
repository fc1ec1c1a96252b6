package com.opsdiag.model;

import com.opsdiag.signal.InvalidSignalException;
import java.util.Locale;

public enum SignalKind {
    METRIC,
    LOG,
    TRACE,
    DEPLOYMENT,
    ALARM;

    public static SignalKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidSignalException("signal kind is required");
        }
        try {
            return SignalKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidSignalException("unrecognized signal kind: " + value, e);
        }
    }
}
