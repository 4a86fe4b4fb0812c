package com.routeops.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single rejected input field.
 */
public record FieldError(
    @JsonProperty("field") String field,
    @JsonProperty("message") String message
) {
    public static FieldError of(String field, String message) {
        return new FieldError(field, message);
    }
}
