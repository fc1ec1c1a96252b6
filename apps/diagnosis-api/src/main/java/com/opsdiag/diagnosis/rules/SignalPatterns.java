package com.opsdiag.diagnosis.rules;

import java.util.regex.Pattern;

final class SignalPatterns {

    static final Pattern RE_CONNECTION =
            Pattern.compile(
                    "connection refused|ECONNREFUSED|connect failed|connection reset|no healthy upstream|UNAVAILABLE|503 Service Unavailable",
                    Pattern.CASE_INSENSITIVE);
    static final Pattern RE_CRASH =
            Pattern.compile(
                    "OOMKilled|OutOfMemoryError|CrashLoopBackOff|Back-off restarting failed container|exit code 137|segmentation fault|panic:",
                    Pattern.CASE_INSENSITIVE);
    static final Pattern RE_OOM =
            Pattern.compile("OOMKilled|OutOfMemoryError|out of memory|exit code 137", Pattern.CASE_INSENSITIVE);
    static final Pattern RE_POOL =
            Pattern.compile("RejectedExecution|no idle threads|thread pool exhausted|TooManyRequests|pool exhausted",
                    Pattern.CASE_INSENSITIVE);
    static final Pattern RE_TIMEOUT =
            Pattern.compile("timeout|timed out|deadline exceeded|DEADLINE_EXCEEDED|socket timeout",
                    Pattern.CASE_INSENSITIVE);
    static final Pattern RE_CONFIG_MISSING =
            Pattern.compile(
                    "configmap \\S+ not found|secret \\S+ not found|missing required config|configuration property \\S+ (is )?(missing|not set)|FailedMount|CreateContainerConfigError",
                    Pattern.CASE_INSENSITIVE);
    static final Pattern RE_RESOURCE_METRIC =
            Pattern.compile("cpu|memory|mem_|utilization|saturation|disk", Pattern.CASE_INSENSITIVE);

    private SignalPatterns() {
    }
}
