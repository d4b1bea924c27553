package com.llmorchestrator.error;

public class LlmTimeoutException extends LlmException {

    public LlmTimeoutException(String providerId, String message, Throwable cause) {
        super(LlmErrorKind.TIMEOUT, message, providerId, null, null, cause);
    }

    public LlmTimeoutException(String providerId, int httpStatus, String vendorMessage) {
        super(LlmErrorKind.TIMEOUT, "Provider reported a timeout: " + vendorMessage,
                providerId, httpStatus, vendorMessage, null);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
