package com.llmorchestrator.error;

public class ProviderNotFoundException extends LlmException {

    public ProviderNotFoundException(String providerId) {
        super(LlmErrorKind.PROVIDER_NOT_FOUND, "Provider not registered", providerId, null, null, null);
    }
}
