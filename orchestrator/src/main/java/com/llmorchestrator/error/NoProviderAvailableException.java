package com.llmorchestrator.error;

public class NoProviderAvailableException extends LlmException {

    public NoProviderAvailableException(String message) {
        super(LlmErrorKind.NO_PROVIDER_AVAILABLE, message, null, null, null, null);
    }
}
