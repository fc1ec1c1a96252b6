package com.opsdiag.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

@ApplicationScoped
public class LoggingIncidentNotifier implements IncidentNotifier {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.IncidentNotifier");

    @Inject
    ObjectMapper mapper;

    @Override
    public void notify(IncidentReport report) {
        try {
            LOGGER.infov(
                    "[REPORT] incidentId={0} status={1} report={2}",
                    report.incidentId(),
                    report.diagnosisStatus(),
                    mapper.writeValueAsString(report));
        } catch (JsonProcessingException e) {
            LOGGER.errorf(e, "[REPORT-ERROR] incidentId=%s could not serialize report", report.incidentId());
            LOGGER.infov(
                    "[REPORT] incidentId={0} status={1} message={2}",
                    report.incidentId(),
                    report.diagnosisStatus(),
                    report.statusMessage());
        }
    }
}
