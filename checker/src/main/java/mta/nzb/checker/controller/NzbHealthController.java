package mta.nzb.checker.controller;

import jakarta.validation.Valid;
import mta.nzb.checker.model.request.NzbCandidate;
import mta.nzb.checker.model.response.HealthCheck;
import mta.nzb.checker.model.response.HealthCheckResult;
import mta.nzb.checker.model.response.HealthResponse;
import mta.nzb.checker.service.general.ServiceStatusService;
import mta.nzb.checker.service.health.HealthCheckService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * NzbHealthController
 * REST API endpoints for NZB availability checks.
 */
@RestController
@RequestMapping("/usenet-service")
public class NzbHealthController {

    private static final Logger logger = LoggerFactory.getLogger(NzbHealthController.class);

    private static final String SERVICE_NAME = "NZB Health Checker";

    private final HealthCheckService healthCheckService;
    private final ServiceStatusService serviceStatusService;

    public NzbHealthController(HealthCheckService healthCheckService, ServiceStatusService serviceStatusService) {
        this.healthCheckService = healthCheckService;
        this.serviceStatusService = serviceStatusService;
    }

    /**
     * Server metadata endpoint - exposes service info and available endpoints.
     * GET /usenet-service
     * GET /usenet-service/
     */
    @GetMapping({"", "/"})
    public ResponseEntity<Map<String, Object>> root() {
        logger.debug("Root endpoint accessed");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", SERVICE_NAME);
        response.put("version", "0.0.1-SNAPSHOT");
        response.put("timestamp", Instant.now().toString());

        Map<String, Object> endpoints = new LinkedHashMap<>();

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("live", endpoint("GET", "/usenet-service/health/live",
                "Liveness probe - checks if service process is running",
                Map.of("200", "Service is alive")));
        health.put("ready", endpoint("GET", "/usenet-service/health/ready",
                "Readiness probe - checks that at least one usenet provider is enabled",
                Map.of(
                        "200", "Service ready - providers configured",
                        "503", "Service not ready - no enabled provider"
                )));

        Map<String, Object> nzb = new LinkedHashMap<>();
        Map<String, Object> check = endpoint("POST", "/usenet-service/nzb/health",
                "Fetch an NZB and verify its segments are available on the configured providers",
                Map.of(
                        "200", "Check completed - see 'healthy' and 'status'",
                        "400", "Bad request: validation error or malformed JSON",
                        "422", "NZB is malformed or lists no segments",
                        "502", "NZB could not be downloaded",
                        "503", "No enabled usenet provider configured",
                        "504", "Check exceeded its deadline"
                ));
        check.put("body", Map.of(
                "title", "string (required)",
                "downloadUrl", "string - NZB URL",
                "link", "string - fallback URL used when downloadUrl is blank"
        ));
        nzb.put("checkHealth", check);

        endpoints.put("health", health);
        endpoints.put("nzb", nzb);
        response.put("endpoints", endpoints);

        return ResponseEntity.ok(response);
    }

    /**
     * Liveness - app is running (does not look at providers).
     * GET /usenet-service/health/live
     */
    @GetMapping("/health/live")
    public ResponseEntity<HealthResponse> live() {
        HealthCheck serviceStatus = serviceStatusService.getServiceStatus();

        HealthResponse response = new HealthResponse(
                SERVICE_NAME,
                "liveness",
                "UP",  // liveness is always UP if service is running
                Instant.now().toString(),
                Map.of("service", serviceStatus)
        );

        return ResponseEntity.ok(response);
    }

    /**
     * Readiness - checks whether the service can run health checks.
     * Returns 200 when a provider is enabled, otherwise 503.
     * GET /usenet-service/health/ready
     */
    @GetMapping("/health/ready")
    public ResponseEntity<HealthResponse> ready() {
        HealthCheck serviceStatus = serviceStatusService.getServiceStatus();
        HealthCheck providerStatus = serviceStatusService.getProviderStatus();

        boolean providersUp = "UP".equals(providerStatus.status());

        HealthResponse response = new HealthResponse(
                SERVICE_NAME,
                "readiness",
                providersUp ? "UP" : "DOWN",
                Instant.now().toString(),
                Map.of(
                        "service", serviceStatus,
                        "providers", providerStatus
                )
        );

        HttpStatus httpStatus = providersUp
                ? HttpStatus.OK
                : HttpStatus.SERVICE_UNAVAILABLE;

        return ResponseEntity.status(httpStatus).body(response);
    }

    /**
     * Fetch the candidate's NZB and verify its segments.
     * POST /usenet-service/nzb/health
     * Body: { "title": "string", "downloadUrl": "string", "link": "string" }
     */
    @PostMapping("/nzb/health")
    public ResponseEntity<HealthCheckResult> checkHealth(@Valid @RequestBody NzbCandidate candidate) {
        logger.info("Received NZB health check request: title={}", candidate.title());

        HealthCheckResult result = healthCheckService.checkHealth(candidate);

        return ResponseEntity.ok(result);
    }

    private static Map<String, Object> endpoint(String method, String path, String description,
                                                Map<String, String> responses) {
        Map<String, Object> endpoint = new LinkedHashMap<>();
        endpoint.put("method", method);
        endpoint.put("path", path);
        endpoint.put("description", description);
        endpoint.put("responses", responses);
        return endpoint;
    }
}
