package com.llmorchestrator.service;

/**
 * Kinds of calls the orchestrator dispatches. The value names the feature in cache keys,
 * metrics and usage records.
 */
public enum LlmOperation {
    CHAT("completion"),
    TOOLS("tools"),
    EMBEDDING("embedding"),
    VISION("vision"),
    STREAM("stream");

    private final String value;

    LlmOperation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
