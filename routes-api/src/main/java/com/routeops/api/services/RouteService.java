package com.routeops.api.services;

import com.routeops.api.model.PageRequest;
import com.routeops.api.model.RouteCreateRequest;
import com.routeops.api.model.RouteDto;
import com.routeops.api.model.RouteUpdateRequest;
import com.routeops.api.model.StatusResponse;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.UUID;

/**
 * Route operations on top of {@link RouteRepository}: validation, id parsing,
 * partial-update merging and not-found handling.
 */
@ApplicationScoped
public class RouteService {

    private static final Logger LOG = Logger.getLogger(RouteService.class);

    private final RouteRepository repository;
    private final int defaultLimit;

    public RouteService(RouteRepository repository,
            @ConfigProperty(name = "routes.page.default-limit", defaultValue = "100") int defaultLimit) {
        this.repository = repository;
        this.defaultLimit = defaultLimit;
    }

    public Uni<RouteDto> create(RouteCreateRequest request) {
        RouteDto route;
        try {
            route = RouteValidator.validateNew(UUID.randomUUID(), request);
        } catch (RouteValidationException e) {
            LOG.warnf("Rejected route create: %s", e.getErrors());
            return Uni.createFrom().failure(e);
        }
        return repository.insert(route)
            .invoke(created -> LOG.infof("Created route %s (%s -> %s)",
                created.id(), created.origin(), created.destination()));
    }

    /**
     * @param offset rows to skip, 0 when absent
     * @param limit page size, the configured default when absent
     * @param flightId exact flight filter; null or blank means no filter
     */
    public Uni<List<RouteDto>> list(String offset, String limit, String flightId) {
        PageRequest page;
        try {
            page = RouteValidator.parsePage(offset, limit, defaultLimit);
        } catch (RouteValidationException e) {
            LOG.warnf("Rejected route list: %s", e.getErrors());
            return Uni.createFrom().failure(e);
        }
        String flight = flightId == null || flightId.isBlank() ? null : flightId;
        return repository.findPage(page.offset(), page.limit(), flight);
    }

    public Uni<Long> count() {
        return repository.count();
    }

    public Uni<RouteDto> get(String id) {
        UUID routeId = parseId(id);
        if (routeId == null) {
            return Uni.createFrom().failure(new RouteNotFoundException(id));
        }
        return repository.findById(routeId)
            .onItem().ifNull().failWith(() -> new RouteNotFoundException(id));
    }

    /**
     * Apply the non-null fields of {@code request} and re-validate the merged route.
     */
    public Uni<RouteDto> update(String id, RouteUpdateRequest request) {
        return get(id)
            .onItem().transform(existing -> RouteValidator.applyUpdate(existing, request))
            .onFailure(RouteValidationException.class)
                .invoke(e -> LOG.warnf("Rejected update of route %s: %s",
                    id, ((RouteValidationException) e).getErrors()))
            .chain(repository::update)
            .onItem().ifNull().failWith(() -> new RouteNotFoundException(id))
            .invoke(updated -> LOG.infof("Updated route %s", updated.id()));
    }

    public Uni<Void> delete(String id) {
        UUID routeId = parseId(id);
        if (routeId == null) {
            return Uni.createFrom().failure(new RouteNotFoundException(id));
        }
        return repository.deleteById(routeId)
            .onItem().transform(deleted -> {
                if (!deleted) {
                    throw new RouteNotFoundException(id);
                }
                LOG.infof("Deleted route %s", id);
                return null;
            })
            .replaceWithVoid();
    }

    /**
     * Delete all routes. Development use only.
     */
    public Uni<StatusResponse> reset() {
        return repository.truncate()
            .invoke(() -> LOG.warn("All routes deleted by reset"))
            .replaceWith(StatusResponse.ok("All routes were deleted"));
    }

    private static UUID parseId(String id) {
        if (id == null) {
            return null;
        }
        try {
            return UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            LOG.debugf("Not a route id: %s", id);
            return null;
        }
    }
}
