package com.llmorchestrator.error;

/**
 * Network or connection failure below the HTTP layer.
 */
public class TransportException extends LlmException {

    public TransportException(String providerId, String message, Throwable cause) {
        super(LlmErrorKind.TRANSPORT, message, providerId, null, null, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
