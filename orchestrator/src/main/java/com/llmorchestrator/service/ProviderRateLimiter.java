package com.llmorchestrator.service;

import com.llmorchestrator.error.RateLimitedException;
import com.llmorchestrator.model.ProviderDescriptor;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Outbound requests-per-minute limit per provider, as Bucket4j token buckets. Providers
 * without a configured limit are not throttled.
 */
@Slf4j
public class ProviderRateLimiter {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public Mono<Void> acquire(ProviderDescriptor descriptor) {
        Integer limit = descriptor.getRequestsPerMinute();
        if (limit == null || limit <= 0) {
            return Mono.empty();
        }
        return Mono.defer(() -> {
            Bucket bucket = buckets.computeIfAbsent(descriptor.getIdentifier(), id -> createBucket(limit));
            ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);
            if (probe.isConsumed()) {
                return Mono.empty();
            }
            Duration wait = Duration.ofNanos(probe.getNanosToWaitForRefill());
            log.debug("[{}] Local rate limit of {}/min reached, next token in {} ms",
                    descriptor.getIdentifier(), limit, wait.toMillis());
            return Mono.error(new RateLimitedException(descriptor.getIdentifier(), null,
                    "Local request limit of " + limit + " per minute reached", wait));
        });
    }

    public void reset(String providerId) {
        buckets.remove(providerId);
    }

    private Bucket createBucket(int requestsPerMinute) {
        Bandwidth limit = Bandwidth.classic(requestsPerMinute,
                Refill.greedy(requestsPerMinute, Duration.ofMinutes(1)));
        return Bucket.builder().addLimit(limit).build();
    }
}
