package com.routeops.api;

import com.routeops.api.model.StatusResponse;
import com.routeops.api.services.RouteService;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * Root-level ping and reset endpoints.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class PingResource {

    private static final Logger LOG = Logger.getLogger(PingResource.class);

    @Inject
    RouteService routeService;

    @GET
    @Path("ping")
    @Tag(name = "Health")
    @Operation(summary = "Ping", description = "Fixed response, touches no dependencies")
    public StatusResponse ping() {
        return StatusResponse.of("pong");
    }

    @POST
    @Path("reset")
    @Tag(name = "Routes")
    @Operation(summary = "Delete all routes", description = "Development only")
    public Uni<StatusResponse> reset() {
        LOG.warn("Reset requested");

        return routeService.reset();
    }
}
