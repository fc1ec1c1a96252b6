package com.opsdiag.api;

import com.opsdiag.model.ServiceNode;
import com.opsdiag.topology.TopologyDocument;
import com.opsdiag.topology.TopologyModel;
import com.opsdiag.topology.TopologySnapshot;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.jboss.logging.Logger;

@Path("/v1/topology")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class TopologyResource {

    private static final Logger LOGGER = Logger.getLogger("API.TopologyResource");

    public static record TopologyView(long version, Collection<ServiceNode> services) {
    }

    public static record NeighborsView(String service, int hops, long topologyVersion, Set<String> neighbors) {
    }

    @Inject
    TopologyModel topology;

    @GET
    public TopologyView current() {
        TopologySnapshot snapshot = topology.current();
        return new TopologyView(snapshot.version(), List.copyOf(snapshot.services()));
    }

    @PUT
    public TopologyView replace(TopologyDocument document) {
        TopologySnapshot snapshot = topology.reload(document);
        LOGGER.infov("[TOPOLOGY-PUT] version={0} services={1}", snapshot.version(), snapshot.services().size());
        return new TopologyView(snapshot.version(), List.copyOf(snapshot.services()));
    }

    @GET
    @Path("/{service}/neighbors")
    public NeighborsView neighbors(@PathParam("service") String service,
            @QueryParam("hops") @DefaultValue("1") int hops) {
        if (hops < 0) {
            throw new IllegalArgumentException("hops must not be negative");
        }
        TopologySnapshot snapshot = topology.current();
        snapshot.node(service);
        return new NeighborsView(service, hops, snapshot.version(), new TreeSet<>(snapshot.neighbors(service, hops)));
    }
}
