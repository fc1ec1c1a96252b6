package com.opsdiag.api;

import com.opsdiag.audit.AuditService;
import com.opsdiag.incident.IncidentRegistry;
import com.opsdiag.llm.LlmClient;
import com.opsdiag.model.Incident;
import com.opsdiag.model.IncidentState;
import com.opsdiag.model.Signal;
import com.opsdiag.report.IncidentReport;
import com.opsdiag.report.ReportAssembler;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

@Path("/v1/incidents")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class IncidentResource {

    private static final Logger LOGGER = Logger.getLogger("API.IncidentResource");

    public static record TransitionRequest(String state, String note) {
    }

    public static record IncidentDetail(
            IncidentReport report,
            List<Signal> candidateSignals,
            Instant updatedAt,
            List<AuditService.AuditEntry> history) {
    }

    public static record NarrativeResponse(String incidentId, IncidentReport report, String narrative) {
    }

    @Inject
    IncidentRegistry registry;

    @Inject
    AuditService audit;

    @Inject
    LlmClient llm;

    @PostConstruct
    void init() {
        LOGGER.infov(
                "[INIT] IncidentResource ready. registry={0}, llm={1}",
                registry != null ? registry.getClass().getSimpleName() : "<null>",
                llm != null ? llm.getClass().getSimpleName() : "<null>");
    }

    @GET
    public List<IncidentReport> list(@QueryParam("service") String service, @QueryParam("state") String state) {
        Optional<String> byService = RequestValues.isBlank(service) ? Optional.empty() : Optional.of(service.trim());
        Optional<IncidentState> byState = RequestValues.isBlank(state) ? Optional.empty() : Optional.of(parseState(state));
        return registry.list(byService, byState).stream()
                .map(ReportAssembler::assemble)
                .toList();
    }

    @GET
    @Path("/{id}")
    public IncidentDetail detail(@PathParam("id") String id) {
        Incident incident = registry.get(id);
        return new IncidentDetail(
                ReportAssembler.assemble(incident),
                incident.candidateSignals(),
                incident.updatedAt(),
                audit.forIncident(id));
    }

    @GET
    @Path("/{id}/report")
    public IncidentReport report(@PathParam("id") String id) {
        return ReportAssembler.assemble(registry.get(id));
    }

    @POST
    @Path("/{id}/transitions")
    public IncidentReport transition(@PathParam("id") String id, TransitionRequest req) {
        if (req == null || RequestValues.isBlank(req.state())) {
            throw new IllegalArgumentException("target state is required");
        }
        Incident incident = registry.transition(id, parseState(req.state()), req.note());
        return ReportAssembler.assemble(incident);
    }

    @POST
    @Path("/{id}/narrative")
    public NarrativeResponse narrative(@PathParam("id") String id) {
        String requestId = UUID.randomUUID().toString();
        IncidentReport report = ReportAssembler.assemble(registry.get(id));
        Instant start = Instant.now();
        LOGGER.infov(
                "[COMM-START] requestId={0} target=LLM incidentId={1} causes={2}",
                requestId,
                id,
                report.rankedCauses().size());
        String narrative = llm.narrate(report);
        LOGGER.infov(
                "[COMM-END] requestId={0} target=LLM durationMs={1}",
                requestId,
                Duration.between(start, Instant.now()).toMillis());
        audit.record(id, report.service(), "narrated", report.state(), null);
        return new NarrativeResponse(id, report, narrative);
    }

    private static IncidentState parseState(String value) {
        try {
            return IncidentState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown incident state: " + value, e);
        }
    }
}
