package com.routeops.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fixed status body for ping and reset endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponse(
    @JsonProperty("status") String status,
    @JsonProperty("message") String message
) {
    public static StatusResponse of(String status) {
        return new StatusResponse(status, null);
    }

    public static StatusResponse ok(String message) {
        return new StatusResponse("ok", message);
    }
}
