package com.routeops.api.config;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.routeops.api.model.FieldError;
import com.routeops.api.services.RouteNotFoundException;
import com.routeops.api.services.RouteValidationException;
import io.vertx.pgclient.PgException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Exception mappers for consistent JSON error responses.
 */
public class ExceptionMappers {

    private static final Logger LOG = Logger.getLogger(ExceptionMappers.class);

    private static final int UNPROCESSABLE_ENTITY = 422;

    private static final Set<Class<?>> INTEGER_TYPES = Set.of(
        Integer.class, int.class, Long.class, long.class, Short.class, short.class, BigInteger.class);

    @ServerExceptionMapper
    public Response handleRouteNotFound(RouteNotFoundException exception) {
        return error(Response.Status.NOT_FOUND.getStatusCode(), exception.getMessage());
    }

    @ServerExceptionMapper
    public Response handleNotFoundException(NotFoundException exception) {
        return error(Response.Status.NOT_FOUND.getStatusCode(),
            exception.getMessage() != null ? exception.getMessage() : "Resource not found");
    }

    @ServerExceptionMapper
    public Response handleValidation(RouteValidationException exception) {
        return validationError(exception.getErrors());
    }

    /**
     * A JSON value of the wrong type for its field, e.g. {@code "capacity": "abc"}
     * or {@code "capacity": 1.9}. Reported like any other field error.
     */
    @ServerExceptionMapper
    public Response handleMismatchedInput(MismatchedInputException exception) {
        String field = fieldPath(exception.getPath());
        String message = describeExpected(exception.getTargetType());
        LOG.warnf("Rejected request body: %s %s", field, message);
        return validationError(List.of(FieldError.of(field, message)));
    }

    @ServerExceptionMapper
    public Response handleDatabaseError(PgException exception) {
        LOG.errorf(exception, "Database error (SQLSTATE %s)", exception.getSqlState());
        return error(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(), "Database error");
    }

    private static Response validationError(List<FieldError> errors) {
        return Response.status(UNPROCESSABLE_ENTITY)
            .type(MediaType.APPLICATION_JSON)
            .entity(Map.of(
                "error", "Validation failed",
                "status", UNPROCESSABLE_ENTITY,
                "errors", errors,
                "timestamp", System.currentTimeMillis()
            ))
            .build();
    }

    static String fieldPath(List<JsonMappingException.Reference> path) {
        if (path == null || path.isEmpty()) {
            return "body";
        }
        return path.stream()
            .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
            .collect(Collectors.joining("."));
    }

    static String describeExpected(Class<?> targetType) {
        if (targetType == null) {
            return "has an invalid value";
        }
        if (INTEGER_TYPES.contains(targetType)) {
            return "must be an integer";
        }
        if (targetType == String.class) {
            return "must be a string";
        }
        return "has an invalid value";
    }

    private static Response error(int status, String message) {
        return Response.status(status)
            .type(MediaType.APPLICATION_JSON)
            .entity(Map.of(
                "error", message,
                "status", status,
                "timestamp", System.currentTimeMillis()
            ))
            .build();
    }
}
