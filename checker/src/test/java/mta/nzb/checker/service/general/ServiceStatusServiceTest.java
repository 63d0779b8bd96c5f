package mta.nzb.checker.service.general;

import mta.nzb.checker.model.ProviderConfig;
import mta.nzb.checker.model.response.HealthCheck;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServiceStatusServiceTest {

    @Test
    void getProviderStatus_EnabledProviders_ShouldBeUpWithConnectionCount() {
        List<ProviderConfig> providers = List.of(
                new ProviderConfig("a", "a.example", 563, true, "u", "p", 8, true),
                new ProviderConfig("b", "b.example", 119, false, null, null, 0, true),
                new ProviderConfig("c", "c.example", 119, false, null, null, 20, false));

        HealthCheck status = new ServiceStatusService(() -> providers).getProviderStatus();

        assertEquals("UP", status.status());
        assertEquals("2 enabled provider(s), 9 connection(s)", status.details());
    }

    @Test
    void getProviderStatus_NoProviders_ShouldBeDown() {
        HealthCheck status = new ServiceStatusService(List::of).getProviderStatus();

        assertEquals("DOWN", status.status());
    }

    @Test
    void getServiceStatus_ShouldAlwaysBeUp() {
        assertEquals("UP", new ServiceStatusService(List::of).getServiceStatus().status());
    }
}
