package mta.nzb.checker.service.probe;

import mta.nzb.checker.model.ProviderConfig;

/**
 * Creates the direct-dial probe for a provider.
 */
@FunctionalInterface
public interface DirectDialProbeFactory {

    ProviderProbe create(ProviderConfig provider);
}
