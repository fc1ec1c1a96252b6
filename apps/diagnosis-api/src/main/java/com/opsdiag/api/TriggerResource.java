package com.opsdiag.api;

import com.opsdiag.incident.IncidentPipeline;
import com.opsdiag.model.Severity;
import com.opsdiag.model.Trigger;
import com.opsdiag.report.IncidentReport;
import com.opsdiag.signal.InvalidSignalException;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.jboss.logging.Logger;

@Path("/v1/triggers")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class TriggerResource {

    private static final Logger LOGGER = Logger.getLogger("API.TriggerResource");

    /** Alarm as sent by the alerting backend. Missing timestamp means "now", missing severity means ERROR. */
    public static record TriggerRequest(
            String service,
            String timestamp,
            String severity,
            String metricName,
            Double value,
            String alarmId) {
    }

    @Inject
    IncidentPipeline pipeline;

    @PostConstruct
    void init() {
        LOGGER.infov(
                "[INIT] TriggerResource ready. pipeline={0}",
                pipeline != null ? pipeline.getClass().getSimpleName() : "<null>");
    }

    @POST
    public IncidentReport trigger(TriggerRequest req) {
        if (req == null) {
            throw new InvalidSignalException("trigger body is required");
        }
        String requestId = UUID.randomUUID().toString();
        Trigger trigger = new Trigger(
                req.service(),
                RequestValues.instantOr(req.timestamp(), null, "timestamp"),
                RequestValues.isBlank(req.severity()) ? null : Severity.parse(req.severity()),
                req.metricName(),
                req.value(),
                RequestValues.isBlank(req.alarmId()) ? null : req.alarmId().trim());

        Instant start = Instant.now();
        LOGGER.infov(
                "[COMM-START] requestId={0} target=IncidentPipeline service={1} severity={2} alarmId={3}",
                requestId,
                trigger.service(),
                trigger.severity(),
                trigger.alarmId());
        IncidentReport report = pipeline.handle(trigger);
        LOGGER.infov(
                "[COMM-END] requestId={0} target=IncidentPipeline incidentId={1} status={2} causes={3} durationMs={4}",
                requestId,
                report.incidentId(),
                report.diagnosisStatus(),
                report.rankedCauses().size(),
                Duration.between(start, Instant.now()).toMillis());
        return report;
    }
}
