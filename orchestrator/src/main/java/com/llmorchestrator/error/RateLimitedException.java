package com.llmorchestrator.error;

import java.time.Duration;
import java.util.Optional;

public class RateLimitedException extends LlmException {

    private final Duration retryAfter;

    public RateLimitedException(String providerId, Integer httpStatus, String vendorMessage, Duration retryAfter) {
        super(LlmErrorKind.RATE_LIMITED, "Rate limited: " + vendorMessage,
                providerId, httpStatus, vendorMessage, null);
        this.retryAfter = retryAfter;
    }

    /**
     * Wait time suggested by the vendor (or by the local limiter), if any.
     */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
