package com.llmorchestrator.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.service.LlmOperation;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Response cache used by the orchestrator. Store failures never fail a call: a failed read
 * is a miss and a failed write is skipped.
 */
@Slf4j
public class ResponseCache {

    private final ResponseCacheStore store;
    private final CachePolicy policy;
    private final RequestFingerprint fingerprint;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final boolean enabled;

    public ResponseCache(ResponseCacheStore store, CachePolicy policy, RequestFingerprint fingerprint,
                         ObjectMapper objectMapper, MeterRegistry meterRegistry, boolean enabled) {
        this.store = store;
        this.policy = policy;
        this.fingerprint = fingerprint;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.enabled = enabled;
    }

    public boolean isCacheable(LlmOperation operation, Double resolvedTemperature) {
        return enabled && policy.isCacheable(operation, resolvedTemperature);
    }

    public String key(LlmOperation operation, String providerId, String model, Map<String, Object> request) {
        return fingerprint.key(operation, providerId, model, request);
    }

    public <T> Mono<T> get(String key, Class<T> type) {
        return store.get(key)
                .flatMap(json -> {
                    try {
                        T value = objectMapper.readValue(json, type);
                        meterRegistry.counter("llm.cache", "result", "hit").increment();
                        log.debug("Cache hit for {}", key);
                        return Mono.just(value);
                    } catch (JsonProcessingException e) {
                        log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
                        return Mono.<T>empty();
                    }
                })
                .switchIfEmpty(Mono.defer(() -> {
                    meterRegistry.counter("llm.cache", "result", "miss").increment();
                    return Mono.empty();
                }))
                .onErrorResume(e -> {
                    log.warn("Cache read failed for {}, treating as miss: {}", key, e.getMessage());
                    meterRegistry.counter("llm.cache", "result", "error").increment();
                    return Mono.empty();
                });
    }

    public Mono<Void> put(String key, Object value, LlmOperation operation) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Response for {} cannot be serialized, not caching: {}", key, e.getOriginalMessage());
            return Mono.empty();
        }
        Duration ttl = policy.ttlFor(operation);
        return store.put(key, json, ttl)
                .doOnSuccess(v -> log.debug("Cached {} for {}", key, ttl))
                .onErrorResume(e -> {
                    log.warn("Cache write failed for {}: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    /**
     * Drops every cached response of one provider.
     */
    public Mono<Long> evictProvider(String providerId) {
        return Flux.just(LlmOperation.CHAT, LlmOperation.EMBEDDING, LlmOperation.VISION)
                .concatMap(operation -> store.evictByPrefix(RequestFingerprint.prefix(operation, providerId)))
                .reduce(0L, Long::sum)
                .doOnNext(count -> log.info("Evicted {} cached responses of provider {}", count, providerId));
    }

    public Mono<Long> clear() {
        return store.evictByPrefix(RequestFingerprint.KEY_PREFIX)
                .doOnNext(count -> log.info("Cleared {} cached responses", count));
    }
}
