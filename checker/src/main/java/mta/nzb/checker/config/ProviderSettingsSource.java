package mta.nzb.checker.config;

import mta.nzb.checker.model.ProviderConfig;

import java.util.List;

/**
 * Supplies the current provider list, in fallback priority order.
 * Read on every health check so edits made by the settings owner apply to the next request.
 */
public interface ProviderSettingsSource {

    List<ProviderConfig> providers();
}
