package com.routeops.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A route row from the {@code routes} table.
 * All timestamps are UTC.
 */
public record RouteDto(
    @JsonProperty("id") UUID id,
    @JsonProperty("flight_id") String flightId,
    @JsonProperty("origin") String origin,
    @JsonProperty("destination") String destination,
    @JsonProperty("departure_date") OffsetDateTime departureDate,
    @JsonProperty("arrival_date") OffsetDateTime arrivalDate,
    @JsonProperty("capacity") int capacity,
    @JsonProperty("description") String description,
    @JsonProperty("created_at") OffsetDateTime createdAt
) {

    /**
     * Copy of this route with the mutable fields replaced.
     * The id and created_at are carried over unchanged.
     */
    public RouteDto withFields(String flightId, String origin, String destination,
            OffsetDateTime departureDate, OffsetDateTime arrivalDate,
            int capacity, String description) {
        return new RouteDto(id, flightId, origin, destination,
            departureDate, arrivalDate, capacity, description, createdAt);
    }
}
