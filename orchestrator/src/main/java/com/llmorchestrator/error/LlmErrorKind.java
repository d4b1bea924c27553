package com.llmorchestrator.error;

/**
 * Failure kinds a caller can tell apart, independent of the vendor that produced them.
 */
public enum LlmErrorKind {
    CONFIGURATION,
    AUTHENTICATION,
    RATE_LIMITED,
    CONTENT_FILTERED,
    TIMEOUT,
    TRANSPORT,
    VENDOR,
    NO_PROVIDER_AVAILABLE,
    PROVIDER_NOT_FOUND,
    UNAVAILABLE,
    UNSUPPORTED_CAPABILITY
}
