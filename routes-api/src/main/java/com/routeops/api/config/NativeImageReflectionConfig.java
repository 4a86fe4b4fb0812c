package com.routeops.api.config;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Registers the JSON model classes for GraalVM native image reflection.
 */
@RegisterForReflection(targets = {
    com.routeops.api.model.RouteDto.class,
    com.routeops.api.model.FieldError.class,
    com.routeops.api.model.RouteCreateRequest.class,
    com.routeops.api.model.RouteUpdateRequest.class,
    com.routeops.api.model.StatusResponse.class
})
public class NativeImageReflectionConfig {
}
