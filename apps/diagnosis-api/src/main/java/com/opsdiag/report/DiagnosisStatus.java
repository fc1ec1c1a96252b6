package com.opsdiag.report;

public enum DiagnosisStatus {
    COMPLETE,
    EMPTY,
    PARTIAL,
    DEGRADED,
    SUPERSEDED,
    PENDING
}
