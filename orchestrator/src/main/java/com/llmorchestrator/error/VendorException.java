package com.llmorchestrator.error;

/**
 * Any other failure reported by the vendor. Only 5xx responses are transient.
 */
public class VendorException extends LlmException {

    private final boolean transientFailure;

    public VendorException(String providerId, Integer httpStatus, String vendorMessage, boolean transientFailure) {
        this(providerId, httpStatus, vendorMessage, transientFailure, null);
    }

    public VendorException(String providerId, Integer httpStatus, String vendorMessage,
                           boolean transientFailure, Throwable cause) {
        super(LlmErrorKind.VENDOR, "Provider error: " + vendorMessage,
                providerId, httpStatus, vendorMessage, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    @Override
    public boolean isRetryable() {
        return transientFailure;
    }
}
