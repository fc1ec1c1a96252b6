package com.opsdiag.model;

import java.util.Locale;

public enum Criticality {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static Criticality parse(String value) {
        if (value == null || value.isBlank()) {
            return LOW;
        }
        return Criticality.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
