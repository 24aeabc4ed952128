package com.backstop.core.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link HostEnvironment} whose state is pushed by the host (through the REST API or
 * directly) rather than observed.
 */
@Component
public class ManagedHostEnvironment implements HostEnvironment {

    private static final Logger log = LoggerFactory.getLogger(ManagedHostEnvironment.class);

    private final AtomicReference<EnvironmentState> state = new AtomicReference<>(EnvironmentState.ACTIVE);
    private final Set<String> cleanupRequests = ConcurrentHashMap.newKeySet();

    @Override
    public EnvironmentState environmentState() {
        return state.get();
    }

    public void update(EnvironmentState newState) {
        EnvironmentState previous = state.getAndSet(newState);
        if (!newState.equals(previous)) {
            log.info("Host state changed: {}", newState);
        }
    }

    @Override
    public void forceCleanup(String componentId) {
        cleanupRequests.add(componentId);
        log.info("Cleanup requested for component {}", componentId);
    }

    /**
     * Components the engine asked the host to clean up, drained on read.
     */
    public Set<String> drainCleanupRequests() {
        Set<String> drained = Set.copyOf(cleanupRequests);
        cleanupRequests.removeAll(drained);
        return drained;
    }
}
