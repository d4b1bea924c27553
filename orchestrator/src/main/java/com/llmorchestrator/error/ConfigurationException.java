package com.llmorchestrator.error;

/**
 * A requested provider, model or configuration does not exist or cannot be used.
 */
public class ConfigurationException extends LlmException {

    public ConfigurationException(String message, String providerId) {
        super(LlmErrorKind.CONFIGURATION, message, providerId, null, null, null);
    }
}
