package com.opsdiag.api;

import com.opsdiag.incident.IncidentNotFoundException;
import com.opsdiag.llm.LlmException;
import com.opsdiag.model.InvalidTransitionException;
import com.opsdiag.signal.InvalidSignalException;
import com.opsdiag.topology.TopologyException;
import com.opsdiag.topology.UnknownServiceException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import java.util.UUID;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Maps engine exceptions to JSON error bodies carrying a request id that also appears in the log.
 */
public class ApiExceptionMappers {

    private static final Logger LOGGER = Logger.getLogger("API.Errors");

    @ServerExceptionMapper
    public Response invalidSignal(InvalidSignalException e) {
        return failure(Response.Status.BAD_REQUEST, e);
    }

    @ServerExceptionMapper
    public Response invalidTopology(TopologyException e) {
        return failure(Response.Status.BAD_REQUEST, e);
    }

    @ServerExceptionMapper
    public Response invalidArgument(IllegalArgumentException e) {
        return failure(Response.Status.BAD_REQUEST, e);
    }

    @ServerExceptionMapper
    public Response unknownService(UnknownServiceException e) {
        return failure(Response.Status.NOT_FOUND, e);
    }

    @ServerExceptionMapper
    public Response incidentNotFound(IncidentNotFoundException e) {
        return failure(Response.Status.NOT_FOUND, e);
    }

    @ServerExceptionMapper
    public Response invalidTransition(InvalidTransitionException e) {
        return failure(Response.Status.CONFLICT, e);
    }

    @ServerExceptionMapper
    public Response llmFailure(LlmException e) {
        return failure(Response.Status.BAD_GATEWAY, e);
    }

    static Response failure(Response.Status status, RuntimeException e) {
        String requestId = UUID.randomUUID().toString();
        if (status.getFamily() == Response.Status.Family.SERVER_ERROR) {
            LOGGER.errorf(e, "[API-ERROR] requestId=%s status=%d", requestId, status.getStatusCode());
        } else {
            LOGGER.warnv("[API-ERROR] requestId={0} status={1} message={2}",
                    requestId, status.getStatusCode(), e.getMessage());
        }
        return Response.status(status)
                .entity(Map.of(
                        "message", String.valueOf(e.getMessage()),
                        "requestId", requestId))
                .type(MediaType.APPLICATION_JSON)
                .build();
    }
}
