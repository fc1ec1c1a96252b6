package com.opsdiag.api;

import com.opsdiag.signal.InvalidSignalException;
import java.time.Instant;
import java.time.format.DateTimeParseException;

final class RequestValues {

    private RequestValues() {
    }

    /** ISO-8601 instant, or {@code fallback} when blank. */
    static Instant instantOr(String value, Instant fallback, String field) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidSignalException(field + " is not an ISO-8601 instant: " + value, e);
        }
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
