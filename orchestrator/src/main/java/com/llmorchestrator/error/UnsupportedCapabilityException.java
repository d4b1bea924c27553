package com.llmorchestrator.error;

import com.llmorchestrator.model.ModelCapability;
import lombok.Getter;

/**
 * A capability was requested from a provider that does not implement it.
 */
@Getter
public class UnsupportedCapabilityException extends LlmException {

    private final ModelCapability capability;

    public UnsupportedCapabilityException(String providerId, ModelCapability capability) {
        super(LlmErrorKind.UNSUPPORTED_CAPABILITY,
                "Provider does not support " + capability.getValue(), providerId, null, null, null);
        this.capability = capability;
    }
}
