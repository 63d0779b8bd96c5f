package mta.nzb.checker.service.general;

import mta.nzb.checker.config.ProviderSettingsSource;
import mta.nzb.checker.model.ProviderConfig;
import mta.nzb.checker.model.response.HealthCheck;
import mta.nzb.checker.service.verify.SegmentVerifier;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * ServiceStatusService
 * Status of this service for its own liveness and readiness probes.
 * No network I/O: readiness only looks at the provider configuration.
 */
@Service
public class ServiceStatusService {

    private final ProviderSettingsSource providerSettings;

    public ServiceStatusService(ProviderSettingsSource providerSettings) {
        this.providerSettings = providerSettings;
    }

    /**
     * Provider status for the readiness probe.
     * UP when at least one provider is enabled and has a host.
     */
    public HealthCheck getProviderStatus() {
        List<ProviderConfig> enabled = SegmentVerifier.enabledProviders(providerSettings.providers());
        if (enabled.isEmpty()) {
            return new HealthCheck("DOWN", "no enabled usenet providers configured");
        }
        int connections = enabled.stream().mapToInt(ProviderConfig::connectionBudget).sum();
        return new HealthCheck(
                "UP",
                enabled.size() + " enabled provider(s), " + connections + " connection(s)"
        );
    }

    /**
     * Get service status for health response.
     * Always UP since the service is running.
     */
    public HealthCheck getServiceStatus() {
        return new HealthCheck(
                "UP",
                "NZB Health Checker is running and responsive"
        );
    }
}
