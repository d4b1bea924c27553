package com.llmorchestrator.error;

public class AuthenticationException extends LlmException {

    public AuthenticationException(String providerId, int httpStatus, String vendorMessage) {
        super(LlmErrorKind.AUTHENTICATION, "Credentials rejected: " + vendorMessage,
                providerId, httpStatus, vendorMessage, null);
    }
}
