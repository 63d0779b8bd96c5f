package mta.nzb.checker.config;

import mta.nzb.checker.model.ProviderConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Provider accounts bound from {@code usenet.providers[n].*}.
 */
@ConfigurationProperties(prefix = "usenet")
public record UsenetProperties(List<ProviderConfig> providers) {

    public UsenetProperties {
        providers = providers == null ? List.of() : List.copyOf(providers);
    }
}
