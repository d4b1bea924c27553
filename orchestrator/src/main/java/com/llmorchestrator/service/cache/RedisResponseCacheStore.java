package com.llmorchestrator.service.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis-backed store, shared between instances.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisResponseCacheStore implements ResponseCacheStore {

    private final ReactiveStringRedisTemplate redisTemplate;

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public Mono<Void> put(String key, String value, Duration ttl) {
        return redisTemplate.opsForValue().set(key, value, ttl)
                .doOnNext(stored -> {
                    if (!stored) {
                        log.warn("Redis did not store cache entry {}", key);
                    }
                })
                .then();
    }

    @Override
    public Mono<Long> evictByPrefix(String prefix) {
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(500).build();
        return redisTemplate.delete(redisTemplate.scan(options));
    }
}
