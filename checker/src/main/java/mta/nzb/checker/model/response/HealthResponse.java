package mta.nzb.checker.model.response;

import java.util.Map;

/**
 * HealthResponse - Structured response for the service's own liveness and readiness probes.
 */
public record HealthResponse(
    String serviceName,
    String type,           // "liveness" or "readiness"
    String status,         // "UP" or "DOWN"
    String timestamp,      // ISO-8601 format
    Map<String, HealthCheck> checks
) {}
