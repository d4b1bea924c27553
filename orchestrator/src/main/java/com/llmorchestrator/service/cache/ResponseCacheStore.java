package com.llmorchestrator.service.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key-value storage for serialized responses.
 */
public interface ResponseCacheStore {

    Mono<String> get(String key);

    Mono<Void> put(String key, String value, Duration ttl);

    /**
     * Removes every entry whose key starts with the prefix; emits the number removed.
     */
    Mono<Long> evictByPrefix(String prefix);
}
