package com.llmorchestrator.error;

import lombok.Getter;

/**
 * Base class of every error the orchestration layer surfaces.
 * <p>
 * Carries the originating provider, the HTTP status (if the failure came from a vendor
 * response) and the vendor's own message, so calling code can make its own
 * retry-or-surface decision.
 */
@Getter
public abstract class LlmException extends RuntimeException {

    private final LlmErrorKind kind;
    private final String providerId;
    private final Integer httpStatus;
    private final String vendorMessage;

    /**
     * Number of dispatch attempts made before this error became terminal.
     */
    private volatile int attempts = 1;

    protected LlmException(LlmErrorKind kind, String message, String providerId,
                           Integer httpStatus, String vendorMessage, Throwable cause) {
        super(format(message, providerId, httpStatus), cause);
        this.kind = kind;
        this.providerId = providerId;
        this.httpStatus = httpStatus;
        this.vendorMessage = vendorMessage;
    }

    /**
     * Whether the orchestrator's retry policy may dispatch the call again.
     */
    public boolean isRetryable() {
        return false;
    }

    public LlmException withAttempts(int attempts) {
        this.attempts = Math.max(0, attempts);
        return this;
    }

    private static String format(String message, String providerId, Integer httpStatus) {
        StringBuilder sb = new StringBuilder();
        if (providerId != null && !providerId.isEmpty()) {
            sb.append('[').append(providerId).append("] ");
        }
        sb.append(message);
        if (httpStatus != null) {
            sb.append(" (HTTP ").append(httpStatus).append(')');
        }
        return sb.toString();
    }
}
