package com.routeops.api.services;

import com.routeops.api.model.FieldError;

import java.util.List;

/**
 * Thrown when a route payload or query parameter is rejected.
 * Carries every field error found, not only the first one.
 */
public class RouteValidationException extends RuntimeException {

    private final List<FieldError> errors;

    public RouteValidationException(List<FieldError> errors) {
        super("Validation failed: " + errors);
        this.errors = List.copyOf(errors);
    }

    public static RouteValidationException of(String field, String message) {
        return new RouteValidationException(List.of(FieldError.of(field, message)));
    }

    public List<FieldError> getErrors() {
        return errors;
    }
}
