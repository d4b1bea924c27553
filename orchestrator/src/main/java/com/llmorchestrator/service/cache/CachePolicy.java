package com.llmorchestrator.service.cache;

import com.llmorchestrator.service.LlmOperation;

import java.time.Duration;

/**
 * Which calls may be served from the cache, and for how long.
 * Embeddings are always cacheable; completions and vision only at temperature exactly 0;
 * tool calls and streams never.
 */
public class CachePolicy {

    private final Duration completionTtl;
    private final Duration embeddingTtl;

    public CachePolicy(Duration completionTtl, Duration embeddingTtl) {
        this.completionTtl = completionTtl;
        this.embeddingTtl = embeddingTtl;
    }

    public boolean isCacheable(LlmOperation operation, Double resolvedTemperature) {
        switch (operation) {
            case EMBEDDING:
                return true;
            case CHAT:
            case VISION:
                return resolvedTemperature != null && resolvedTemperature == 0.0;
            default:
                return false;
        }
    }

    public Duration ttlFor(LlmOperation operation) {
        return operation == LlmOperation.EMBEDDING ? embeddingTtl : completionTtl;
    }
}
