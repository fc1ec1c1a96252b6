package com.opsdiag.model;

import java.time.Duration;
import java.time.Instant;

public record TimeRange(Instant from, Instant to) {

    public static TimeRange ending(Instant to, Duration length) {
        return new TimeRange(to.minus(length), to);
    }

    public boolean contains(Instant timestamp) {
        if (timestamp == null) {
            return false;
        }
        boolean afterFrom = from == null || !timestamp.isBefore(from);
        boolean beforeTo = to == null || !timestamp.isAfter(to);
        return afterFrom && beforeTo;
    }
}
