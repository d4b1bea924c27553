package com.llmorchestrator.service.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisResponseCacheStoreTest {

    @Mock
    private ReactiveStringRedisTemplate redisTemplate;

    @Mock
    private ReactiveValueOperations<String, String> valueOperations;

    @Test
    void writesWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.set("k", "v", Duration.ofMinutes(10))).thenReturn(Mono.just(true));

        StepVerifier.create(new RedisResponseCacheStore(redisTemplate).put("k", "v", Duration.ofMinutes(10)))
                .verifyComplete();
        verify(valueOperations).set("k", "v", Duration.ofMinutes(10));
    }

    @Test
    void readsValue() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("k")).thenReturn(Mono.just("v"));

        StepVerifier.create(new RedisResponseCacheStore(redisTemplate).get("k"))
                .expectNext("v")
                .verifyComplete();
    }

    @Test
    @SuppressWarnings("unchecked")
    void evictsScannedKeys() {
        Flux<String> keys = Flux.just("llm:completion:p:a", "llm:completion:p:b");
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(keys);
        when(redisTemplate.delete(keys)).thenReturn(Mono.just(2L));

        StepVerifier.create(new RedisResponseCacheStore(redisTemplate).evictByPrefix("llm:completion:p:"))
                .expectNext(2L)
                .verifyComplete();
    }
}
