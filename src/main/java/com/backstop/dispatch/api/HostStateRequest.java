package com.backstop.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for the host state endpoint.
 */
public record HostStateRequest(
    @JsonProperty("host_finishing") boolean hostFinishing,
    @JsonProperty("host_destroyed") boolean hostDestroyed,
    @JsonProperty("mutation_manager_destroyed") boolean mutationManagerDestroyed,
    @JsonProperty("state_saved") boolean stateSaved
) {}
