package com.whereq.scribe.controller;

import com.whereq.scribe.config.ScribeProperties;
import com.whereq.scribe.queue.JobQueue;
import com.whereq.scribe.store.JobStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and backend status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private JobStore jobStore;

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private ScribeProperties properties;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and its job backend are reachable")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return jobStore.ping()
                .zipWith(jobQueue.size())
                .map(tuple -> {
                    boolean up = tuple.getT1();
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", up ? "UP" : "DOWN");
                    health.put("service", "whereq-scribe");

                    Map<String, Object> backend = new HashMap<>();
                    backend.put("type", properties.getBackend().name());
                    backend.put("status", up ? "CONNECTED" : "UNREACHABLE");
                    backend.put("queueSize", tuple.getT2());
                    health.put("backend", backend);

                    return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
                })
                .onErrorResume(e -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "DOWN");
                    health.put("service", "whereq-scribe");

                    Map<String, String> backend = new HashMap<>();
                    backend.put("type", properties.getBackend().name());
                    backend.put("status", "ERROR");
                    backend.put("error", String.valueOf(e.getMessage()));
                    health.put("backend", backend);

                    return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health));
                });
    }
}
