package com.opsdiag.report;

/**
 * Outbound boundary towards chat, paging or ticketing collaborators. Implementations
 * receive the structured report only and own any vendor formatting.
 */
public interface IncidentNotifier {

    void notify(IncidentReport report);
}
