package com.opsdiag.llm;

import com.opsdiag.report.IncidentReport;

public interface LlmClient {

    /** Turns an assembled report into a short narrative for humans. */
    String narrate(IncidentReport report);
}
