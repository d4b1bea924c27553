package com.llmorchestrator.error;

/**
 * The provider's circuit breaker is open; calls are rejected without reaching the vendor.
 */
public class ProviderUnavailableException extends LlmException {

    public ProviderUnavailableException(String providerId, String message, Throwable cause) {
        super(LlmErrorKind.UNAVAILABLE, message, providerId, null, null, cause);
    }
}
