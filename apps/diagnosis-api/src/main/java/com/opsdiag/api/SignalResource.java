package com.opsdiag.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdiag.model.Severity;
import com.opsdiag.model.Signal;
import com.opsdiag.model.SignalKind;
import com.opsdiag.model.TimeRange;
import com.opsdiag.signal.InvalidSignalException;
import com.opsdiag.signal.SignalStore;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@Path("/v1/signals")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class SignalResource {

    private static final Logger LOGGER = Logger.getLogger("API.SignalResource");

    public static record SignalPayload(
            String id,
            String service,
            String kind,
            String timestamp,
            String severity,
            Map<String, String> attributes,
            Double numericValue) {
    }

    public static record Rejection(int index, String id, String reason) {
    }

    public static record IngestResult(int accepted, List<Rejection> rejected) {
    }

    public static record StoreStats(int size, Map<String, Integer> byService) {
    }

    @Inject
    SignalStore store;

    @Inject
    ObjectMapper mapper;

    @Inject
    Clock clock;

    @ConfigProperty(name = "engine.correlation.window", defaultValue = "PT30M")
    Duration defaultWindow;

    /**
     * Accepts a single signal object or an array of them. A single invalid signal fails the
     * request; in a batch, invalid entries are reported and the rest are stored.
     */
    @POST
    public IngestResult ingest(JsonNode body) {
        if (body == null || body.isNull()) {
            throw new InvalidSignalException("signal body is required");
        }
        String requestId = UUID.randomUUID().toString();
        if (!body.isArray()) {
            store.ingest(toSignal(read(body)));
            return new IngestResult(1, List.of());
        }
        int accepted = 0;
        List<Rejection> rejected = new ArrayList<>();
        for (int i = 0; i < body.size(); i++) {
            SignalPayload payload = null;
            try {
                payload = read(body.get(i));
                store.ingest(toSignal(payload));
                accepted++;
            } catch (InvalidSignalException e) {
                rejected.add(new Rejection(i, payload != null ? payload.id() : null, e.getMessage()));
            }
        }
        LOGGER.infov(
                "[INGEST-BATCH] requestId={0} received={1} accepted={2} rejected={3}",
                requestId,
                body.size(),
                accepted,
                rejected.size());
        return new IngestResult(accepted, rejected);
    }

    @GET
    public List<Signal> query(@QueryParam("service") String service,
            @QueryParam("kinds") String kinds,
            @QueryParam("from") String from,
            @QueryParam("to") String to) {
        if (RequestValues.isBlank(service)) {
            throw new IllegalArgumentException("query parameter 'service' is required");
        }
        Instant toInstant = RequestValues.instantOr(to, clock.instant(), "to");
        Instant fromInstant = RequestValues.instantOr(from, toInstant.minus(defaultWindow), "from");
        if (fromInstant.isAfter(toInstant)) {
            throw new IllegalArgumentException("'from' must not be after 'to'");
        }
        return store.query(service.trim(), parseKinds(kinds), new TimeRange(fromInstant, toInstant)).toList();
    }

    @GET
    @Path("/stats")
    public StoreStats stats() {
        return new StoreStats(store.size(), store.countsByService());
    }

    private SignalPayload read(JsonNode node) {
        try {
            return mapper.treeToValue(node, SignalPayload.class);
        } catch (JsonProcessingException e) {
            throw new InvalidSignalException("malformed signal: " + e.getOriginalMessage(), e);
        }
    }

    private Signal toSignal(SignalPayload payload) {
        if (payload == null) {
            throw new InvalidSignalException("signal body is required");
        }
        if (RequestValues.isBlank(payload.timestamp())) {
            throw new InvalidSignalException("signal timestamp is required");
        }
        String id = RequestValues.isBlank(payload.id()) ? "signal-" + UUID.randomUUID() : payload.id().trim();
        return new Signal(
                id,
                payload.service(),
                SignalKind.parse(payload.kind()),
                RequestValues.instantOr(payload.timestamp(), null, "timestamp"),
                Severity.parse(payload.severity()),
                payload.attributes(),
                payload.numericValue());
    }

    private static Set<SignalKind> parseKinds(String kinds) {
        if (RequestValues.isBlank(kinds)) {
            return Set.of();
        }
        Set<SignalKind> parsed = EnumSet.noneOf(SignalKind.class);
        Arrays.stream(kinds.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(SignalKind::parse)
                .forEach(parsed::add);
        return parsed;
    }
}
