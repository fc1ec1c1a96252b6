package com.opsdiag.model;

import java.util.Locale;

public enum Severity {
    INFO(0),
    WARNING(1),
    ERROR(2),
    CRITICAL(3);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean atLeast(Severity other) {
        return rank >= other.rank;
    }

    /**
     * Lenient parse for values coming from collectors and alerting backends.
     * Unknown or missing values map to {@link #INFO}.
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "warn", "warning", "minor" -> WARNING;
            case "error", "err", "major", "high" -> ERROR;
            case "critical", "crit", "fatal", "page" -> CRITICAL;
            default -> INFO;
        };
    }
}
