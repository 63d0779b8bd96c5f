package mta.nzb.checker.config;

import mta.nzb.checker.model.ProviderConfig;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * ProviderSettingsSource backed by application properties.
 */
@Component
public class PropertiesProviderSettingsSource implements ProviderSettingsSource {

    private final UsenetProperties properties;

    public PropertiesProviderSettingsSource(UsenetProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<ProviderConfig> providers() {
        return properties.providers();
    }
}
