package com.llmorchestrator.error;

/**
 * The provider is registered but inactive or has no usable credential.
 */
public class ProviderNotConfiguredException extends ConfigurationException {

    public ProviderNotConfiguredException(String providerId) {
        super("Provider is inactive or has no usable credential", providerId);
    }
}
