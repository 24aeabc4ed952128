package com.backstop.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for reporting a component failure.
 *
 * @param errorType simple class name of the host error (e.g. "IllegalStateException")
 * @param message   error message
 * @param domain    "component" (default) or "glass"
 */
public record FailureRequest(
    @JsonProperty("error_type") String errorType,
    String message,
    String domain
) {}
