package com.routeops.api;

import com.routeops.api.model.RouteCreateRequest;
import com.routeops.api.model.RouteDto;
import com.routeops.api.model.RouteUpdateRequest;
import com.routeops.api.model.StatusResponse;
import com.routeops.api.services.RouteService;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriBuilder;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;

/**
 * REST API for route records stored in PostgreSQL.
 */
@Path("/routes")
@Tag(name = "Routes", description = "Create, query, update and delete routes")
@Produces(MediaType.APPLICATION_JSON)
public class RouteResource {

    private static final Logger LOG = Logger.getLogger(RouteResource.class);

    @Inject
    RouteService routeService;

    @GET
    @Path("/ping")
    @Operation(summary = "Routes ping", description = "Fixed response, touches no dependencies")
    public StatusResponse ping() {
        return StatusResponse.of("ok");
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Create a route")
    @APIResponse(responseCode = "201", description = "Route created")
    @APIResponse(responseCode = "422", description = "Missing or invalid fields")
    public Uni<Response> createRoute(RouteCreateRequest request) {
        LOG.info("Creating route");

        return routeService.create(request)
            .onItem().transform(route -> Response
                .created(UriBuilder.fromResource(RouteResource.class).path(route.id().toString()).build())
                .entity(route)
                .build());
    }

    @GET
    @Operation(summary = "List routes",
               description = "Returns a page of routes, newest first, optionally filtered by flight id")
    @APIResponse(responseCode = "422", description = "Offset or limit is not a non-negative integer")
    public Uni<List<RouteDto>> listRoutes(
            @QueryParam("offset") String offset,
            @QueryParam("limit") String limit,
            @QueryParam("flight") String flight) {
        LOG.infof("Listing routes with offset=%s, limit=%s, flight=%s", offset, limit, flight);

        return routeService.list(offset, limit, flight);
    }

    @GET
    @Path("/count")
    @Operation(summary = "Count routes")
    public Uni<Map<String, Object>> countRoutes() {
        return routeService.count()
            .onItem().transform(count -> Map.<String, Object>of("count", count));
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get route by ID")
    @APIResponse(responseCode = "404", description = "Route not found")
    public Uni<RouteDto> getRoute(@PathParam("id") String id) {
        LOG.infof("Querying route by ID: %s", id);

        return routeService.get(id);
    }

    @PATCH
    @Path("/{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Update route", description = "Applies only the fields present in the body")
    @APIResponse(responseCode = "404", description = "Route not found")
    @APIResponse(responseCode = "422", description = "Invalid fields or empty body")
    public Uni<RouteDto> patchRoute(@PathParam("id") String id, RouteUpdateRequest request) {
        LOG.infof("Updating route %s", id);

        return routeService.update(id, request);
    }

    @PUT
    @Path("/{id}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Update route", description = "Same partial-update semantics as PATCH")
    @APIResponse(responseCode = "404", description = "Route not found")
    @APIResponse(responseCode = "422", description = "Invalid fields or empty body")
    public Uni<RouteDto> putRoute(@PathParam("id") String id, RouteUpdateRequest request) {
        return patchRoute(id, request);
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete route")
    @APIResponse(responseCode = "204", description = "Route deleted")
    @APIResponse(responseCode = "404", description = "Route not found")
    public Uni<Response> deleteRoute(@PathParam("id") String id) {
        LOG.infof("Deleting route %s", id);

        return routeService.delete(id)
            .onItem().transform(ignored -> Response.noContent().build());
    }

    @POST
    @Path("/reset")
    @Operation(summary = "Delete all routes", description = "Development only")
    public Uni<StatusResponse> resetRoutes() {
        LOG.warn("Reset requested");

        return routeService.reset();
    }
}
