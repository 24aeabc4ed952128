package com.backstop.dispatch.api;

import com.backstop.core.transaction.EnvironmentState;
import com.backstop.core.transaction.ManagedHostEnvironment;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

/**
 * REST controller through which a remote host pushes its lifecycle state and collects
 * cleanup requests.
 */
@RestController
@RequestMapping("/api/v1/host")
public class HostController {

    private final ManagedHostEnvironment host;

    public HostController(ManagedHostEnvironment host) {
        this.host = host;
    }

    @PutMapping("/state")
    public ResponseEntity<EnvironmentState> updateState(@RequestBody HostStateRequest request) {
        var state = new EnvironmentState(request.hostFinishing(), request.hostDestroyed(),
                request.mutationManagerDestroyed(), request.stateSaved());
        host.update(state);
        return ResponseEntity.ok(state);
    }

    @GetMapping("/state")
    public ResponseEntity<EnvironmentState> state() {
        return ResponseEntity.ok(host.environmentState());
    }

    /**
     * GET /api/v1/host/cleanup-requests: Components the engine asked the host to clean
     * up since the last call.
     */
    @GetMapping("/cleanup-requests")
    public ResponseEntity<Set<String>> cleanupRequests() {
        return ResponseEntity.ok(host.drainCleanupRequests());
    }
}
