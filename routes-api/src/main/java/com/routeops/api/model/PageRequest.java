package com.routeops.api.model;

/**
 * Validated list paging parameters.
 */
public record PageRequest(int offset, int limit) {
}
