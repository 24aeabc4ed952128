package com.backstop.core.recovery;

import com.backstop.core.model.Renderable;

import java.util.Optional;

/**
 * Host-supplied attempt to build the live component again.
 */
@FunctionalInterface
public interface RetryCallback {

    /**
     * @return the live renderable, or empty when the host could not build it
     */
    Optional<Renderable> attempt() throws Exception;
}
