package com.dnsfilter.api.health;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Liveness and build info for load balancers.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final boolean ddnsEnabled;

    public HealthController(@Value("${dnsfilter.ddns.enabled:true}") boolean ddnsEnabled) {
        this.ddnsEnabled = ddnsEnabled;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "timestamp", Instant.now().toString()
        ));
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        return ResponseEntity.ok(Map.of(
            "name", "DNS Filter API",
            "version", "1.0.0-SNAPSHOT",
            "ddnsEnabled", ddnsEnabled,
            "timestamp", Instant.now().toString()
        ));
    }
}
