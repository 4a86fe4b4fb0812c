package com.routeops.api.services;

import com.routeops.api.model.RouteDto;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.sqlclient.Pool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.RowSet;
import io.vertx.mutiny.sqlclient.Tuple;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * SQL access to the {@code routes} table using the Quarkus reactive PostgreSQL client.
 * Each statement borrows a pooled connection.
 */
@ApplicationScoped
public class RouteRepository {

    private static final Logger LOG = Logger.getLogger(RouteRepository.class);

    private static final String COLUMNS =
        "id, flight_id, origin, destination, departure_date, arrival_date, capacity, description, created_at";

    private static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS routes (
            id UUID PRIMARY KEY,
            flight_id TEXT,
            origin TEXT NOT NULL,
            destination TEXT NOT NULL,
            departure_date TIMESTAMPTZ NOT NULL,
            arrival_date TIMESTAMPTZ NOT NULL,
            capacity INTEGER NOT NULL CHECK (capacity > 0),
            description TEXT,
            created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
            CONSTRAINT routes_dates_ordered CHECK (departure_date < arrival_date)
        )""";

    private final Pool client;

    public RouteRepository(Pool client) {
        this.client = client;
    }

    /**
     * Create the routes table and its indexes if they do not exist.
     */
    public Uni<Void> createSchema() {
        LOG.debug("Ensuring routes schema");
        return client.query(CREATE_TABLE).execute()
            .chain(() -> client.query("CREATE INDEX IF NOT EXISTS idx_routes_flight_id ON routes (flight_id)").execute())
            .chain(() -> client.query("CREATE INDEX IF NOT EXISTS idx_routes_created_at ON routes (created_at)").execute())
            .replaceWithVoid();
    }

    /**
     * Insert a route. The database assigns {@code created_at}.
     *
     * @return the stored row
     */
    public Uni<RouteDto> insert(RouteDto route) {
        LOG.debugf("Inserting route %s", route.id());
        Tuple params = Tuple.tuple()
            .addUUID(route.id())
            .addString(route.flightId())
            .addString(route.origin())
            .addString(route.destination())
            .addOffsetDateTime(route.departureDate())
            .addOffsetDateTime(route.arrivalDate())
            .addInteger(route.capacity())
            .addString(route.description());
        return client.preparedQuery(
                "INSERT INTO routes (id, flight_id, origin, destination, departure_date, arrival_date, capacity, description) "
                    + "VALUES ($1, $2, $3, $4, $5, $6, $7, $8) RETURNING " + COLUMNS)
            .execute(params)
            .onItem().transform(rowSet -> mapRowToRoute(rowSet.iterator().next()));
    }

    /**
     * Get route by ID.
     *
     * @return the route, or a null item when no row matches
     */
    public Uni<RouteDto> findById(UUID id) {
        LOG.debugf("Querying route by ID: %s", id);
        return client.preparedQuery("SELECT " + COLUMNS + " FROM routes WHERE id = $1")
            .execute(Tuple.of(id))
            .onItem().transform(this::firstOrNull);
    }

    /**
     * Get a page of routes, newest first, optionally restricted to one flight.
     *
     * @param flightId exact flight_id to match, or null for all routes
     */
    public Uni<List<RouteDto>> findPage(int offset, int limit, String flightId) {
        LOG.debugf("Querying routes with offset=%d, limit=%d, flight=%s", offset, limit, flightId);
        Uni<RowSet<Row>> query;
        if (flightId == null) {
            query = client.preparedQuery("SELECT " + COLUMNS + " FROM routes "
                    + "ORDER BY created_at DESC, id LIMIT $1 OFFSET $2")
                .execute(Tuple.of(limit, offset));
        } else {
            query = client.preparedQuery("SELECT " + COLUMNS + " FROM routes WHERE flight_id = $1 "
                    + "ORDER BY created_at DESC, id LIMIT $2 OFFSET $3")
                .execute(Tuple.of(flightId, limit, offset));
        }
        return query.onItem().transform(rowSet -> {
            List<RouteDto> routes = new ArrayList<>();
            for (Row row : rowSet) {
                routes.add(mapRowToRoute(row));
            }
            LOG.debugf("Retrieved %d routes", routes.size());
            return routes;
        });
    }

    /**
     * Count all routes.
     */
    public Uni<Long> count() {
        return client.query("SELECT COUNT(*) AS total FROM routes")
            .execute()
            .onItem().transform(rowSet -> rowSet.iterator().next().getLong("total"));
    }

    /**
     * Overwrite every mutable column of a route.
     *
     * @return the stored row, or a null item when the route no longer exists
     */
    public Uni<RouteDto> update(RouteDto route) {
        LOG.debugf("Updating route %s", route.id());
        Tuple params = Tuple.tuple()
            .addString(route.flightId())
            .addString(route.origin())
            .addString(route.destination())
            .addOffsetDateTime(route.departureDate())
            .addOffsetDateTime(route.arrivalDate())
            .addInteger(route.capacity())
            .addString(route.description())
            .addUUID(route.id());
        return client.preparedQuery(
                "UPDATE routes SET flight_id = $1, origin = $2, destination = $3, departure_date = $4, "
                    + "arrival_date = $5, capacity = $6, description = $7 WHERE id = $8 RETURNING " + COLUMNS)
            .execute(params)
            .onItem().transform(this::firstOrNull);
    }

    /**
     * Delete route by ID.
     *
     * @return true if a row was removed
     */
    public Uni<Boolean> deleteById(UUID id) {
        LOG.debugf("Deleting route %s", id);
        return client.preparedQuery("DELETE FROM routes WHERE id = $1")
            .execute(Tuple.of(id))
            .onItem().transform(rowSet -> rowSet.rowCount() > 0);
    }

    /**
     * Remove every route. Creates the table first if it is missing.
     */
    public Uni<Void> truncate() {
        LOG.warn("Truncating routes table");
        return createSchema()
            .chain(() -> client.query("TRUNCATE TABLE routes").execute())
            .replaceWithVoid();
    }

    private RouteDto firstOrNull(RowSet<Row> rowSet) {
        if (rowSet.size() == 0) {
            return null;
        }
        return mapRowToRoute(rowSet.iterator().next());
    }

    private RouteDto mapRowToRoute(Row row) {
        return new RouteDto(
            row.getUUID("id"),
            row.getString("flight_id"),
            row.getString("origin"),
            row.getString("destination"),
            row.getOffsetDateTime("departure_date"),
            row.getOffsetDateTime("arrival_date"),
            row.getInteger("capacity"),
            row.getString("description"),
            row.getOffsetDateTime("created_at")
        );
    }
}
