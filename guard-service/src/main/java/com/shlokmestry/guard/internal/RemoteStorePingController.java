package com.shlokmestry.guard.internal;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.guard.ratelimit.storage.RateLimitStorage;
import com.shlokmestry.guard.ratelimit.storage.RemoteCounterStore;
import com.shlokmestry.guard.ratelimit.storage.StorageException;

@RestController
public class RemoteStorePingController {

    private final RateLimitStorage storage;

    public RemoteStorePingController(RateLimitStorage storage) {
        this.storage = storage;
    }

    @GetMapping("/internal/ratelimit/backend")
    public Map<String, String> backend() {
        return Map.of("storage", storage.type());
    }

    @GetMapping("/internal/ratelimit/ping")
    public ResponseEntity<Map<String, String>> ping() {
        if (!(storage instanceof RemoteCounterStore remote)) {
            return ResponseEntity.ok(Map.of("storage", storage.type(), "reply", "local"));
        }
        try {
            return ResponseEntity.ok(Map.of("storage", storage.type(), "reply", String.valueOf(remote.ping())));
        } catch (StorageException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("storage", storage.type(), "error", e.getMessage()));
        }
    }
}
