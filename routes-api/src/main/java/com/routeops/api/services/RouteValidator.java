package com.routeops.api.services;

import com.routeops.api.model.FieldError;
import com.routeops.api.model.PageRequest;
import com.routeops.api.model.RouteCreateRequest;
import com.routeops.api.model.RouteDto;
import com.routeops.api.model.RouteUpdateRequest;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Input checks for route payloads and list parameters.
 *
 * <p>Every check runs before failing, so a caller gets the complete list of
 * {@link FieldError}s in one {@link RouteValidationException}.</p>
 */
public final class RouteValidator {

    static final String FLIGHT_ID = "flight_id";
    static final String ORIGIN = "origin";
    static final String DESTINATION = "destination";
    static final String DEPARTURE_DATE = "departure_date";
    static final String ARRIVAL_DATE = "arrival_date";
    static final String CAPACITY = "capacity";

    private RouteValidator() {
    }

    /**
     * Validate a create payload and build the route to insert.
     *
     * @param id id to assign to the new route
     * @param request create payload
     * @return route with {@code createdAt} left null for the database to fill
     * @throws RouteValidationException if any field is missing or invalid
     */
    public static RouteDto validateNew(UUID id, RouteCreateRequest request) {
        if (request == null) {
            throw RouteValidationException.of("body", "request body is required");
        }

        List<FieldError> errors = new ArrayList<>();

        requireText(errors, ORIGIN, request.getOrigin());
        requireText(errors, DESTINATION, request.getDestination());
        optionalText(errors, FLIGHT_ID, request.getFlightId());

        OffsetDateTime departure = requireTimestamp(errors, DEPARTURE_DATE, request.getDepartureDate());
        OffsetDateTime arrival = requireTimestamp(errors, ARRIVAL_DATE, request.getArrivalDate());
        checkOrder(errors, departure, arrival);

        if (request.getCapacity() == null) {
            errors.add(FieldError.of(CAPACITY, "is required"));
        } else {
            checkCapacity(errors, request.getCapacity());
        }

        failIfAny(errors);

        return new RouteDto(
            id,
            request.getFlightId(),
            request.getOrigin(),
            request.getDestination(),
            departure,
            arrival,
            Math.toIntExact(request.getCapacity()),
            request.getDescription(),
            null
        );
    }

    /**
     * Merge a partial update onto a stored route and validate the result.
     *
     * @param existing stored route
     * @param request fields to change; null fields keep their stored value
     * @return the merged route
     * @throws RouteValidationException if the payload is empty or the merged route is invalid
     */
    public static RouteDto applyUpdate(RouteDto existing, RouteUpdateRequest request) {
        if (request == null || request.isEmpty()) {
            throw RouteValidationException.of("body", "no fields to update");
        }

        List<FieldError> errors = new ArrayList<>();

        if (request.getOrigin() != null) {
            requireText(errors, ORIGIN, request.getOrigin());
        }
        if (request.getDestination() != null) {
            requireText(errors, DESTINATION, request.getDestination());
        }
        optionalText(errors, FLIGHT_ID, request.getFlightId());

        OffsetDateTime departure = existing.departureDate();
        if (request.getDepartureDate() != null) {
            departure = requireTimestamp(errors, DEPARTURE_DATE, request.getDepartureDate());
        }
        OffsetDateTime arrival = existing.arrivalDate();
        if (request.getArrivalDate() != null) {
            arrival = requireTimestamp(errors, ARRIVAL_DATE, request.getArrivalDate());
        }
        checkOrder(errors, departure, arrival);

        if (request.getCapacity() != null) {
            checkCapacity(errors, request.getCapacity());
        }

        failIfAny(errors);

        int capacity = request.getCapacity() != null
            ? Math.toIntExact(request.getCapacity())
            : existing.capacity();

        return existing.withFields(
            coalesce(request.getFlightId(), existing.flightId()),
            coalesce(request.getOrigin(), existing.origin()),
            coalesce(request.getDestination(), existing.destination()),
            departure,
            arrival,
            capacity,
            coalesce(request.getDescription(), existing.description())
        );
    }

    /**
     * Parse and validate list pagination parameters.
     *
     * @param offset raw {@code offset} query value, 0 when null or blank
     * @param limit raw {@code limit} query value, {@code defaultLimit} when null or blank
     * @throws RouteValidationException if a value is not a non-negative integer
     */
    public static PageRequest parsePage(String offset, String limit, int defaultLimit) {
        List<FieldError> errors = new ArrayList<>();
        Integer parsedOffset = parseNonNegative(errors, "offset", offset, 0);
        Integer parsedLimit = parseNonNegative(errors, "limit", limit, defaultLimit);
        failIfAny(errors);
        return new PageRequest(parsedOffset, parsedLimit);
    }

    private static Integer parseNonNegative(List<FieldError> errors, String field, String value, int fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            errors.add(FieldError.of(field, "must be an integer"));
            return null;
        }
        if (parsed < 0) {
            errors.add(FieldError.of(field, "must be greater than or equal to 0"));
            return null;
        }
        return parsed;
    }

    private static void requireText(List<FieldError> errors, String field, String value) {
        if (value == null) {
            errors.add(FieldError.of(field, "is required"));
        } else if (value.isBlank()) {
            errors.add(FieldError.of(field, "must not be blank"));
        }
    }

    private static void optionalText(List<FieldError> errors, String field, String value) {
        if (value != null && value.isBlank()) {
            errors.add(FieldError.of(field, "must not be blank"));
        }
    }

    private static OffsetDateTime requireTimestamp(List<FieldError> errors, String field, String value) {
        if (value == null || value.isBlank()) {
            errors.add(FieldError.of(field, "is required"));
            return null;
        }
        try {
            return RouteTimestamps.parseUtc(value);
        } catch (DateTimeParseException e) {
            errors.add(FieldError.of(field, "must be an ISO-8601 timestamp"));
            return null;
        }
    }

    // Skipped when either side failed to parse; that error is already reported.
    private static void checkOrder(List<FieldError> errors, OffsetDateTime departure, OffsetDateTime arrival) {
        if (departure != null && arrival != null && !departure.isBefore(arrival)) {
            errors.add(FieldError.of(DEPARTURE_DATE, "must be before arrival_date"));
        }
    }

    private static void checkCapacity(List<FieldError> errors, long capacity) {
        if (capacity <= 0) {
            errors.add(FieldError.of(CAPACITY, "must be greater than 0"));
        } else if (capacity > Integer.MAX_VALUE) {
            errors.add(FieldError.of(CAPACITY, "must be at most " + Integer.MAX_VALUE));
        }
    }

    private static void failIfAny(List<FieldError> errors) {
        if (!errors.isEmpty()) {
            throw new RouteValidationException(errors);
        }
    }

    private static <T> T coalesce(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
