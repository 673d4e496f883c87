package com.jewelrec.main.controller;

import com.jewelrec.storage.pool.PoolRegistry;
import com.jewelrec.storage.pool.PoolStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Health Check", description = "Health and pool statistics endpoints for monitoring")
public class HealthController {

    private final PoolRegistry poolRegistry;

    @GetMapping("/health")
    @Operation(summary = "Health check",
               description = "Check if the service is up")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Service is healthy"),
        @ApiResponse(responseCode = "503", description = "Service is unhealthy")
    })
    public ResponseEntity<String> getHealth() {
        log.debug("Health check requested");
        return ResponseEntity.ok("UP");
    }

    @GetMapping("/stats")
    @Operation(summary = "Pool statistics",
               description = "Item count, dimension and index type of every loaded pool")
    @ApiResponse(responseCode = "200", description = "Statistics returned")
    public ResponseEntity<Map<String, List<PoolStats>>> getStats() {
        log.debug("Stats requested");
        return ResponseEntity.ok(Map.of("pools", poolRegistry.stats()));
    }
}
