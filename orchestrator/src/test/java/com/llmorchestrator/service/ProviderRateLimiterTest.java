package com.llmorchestrator.service;

import com.llmorchestrator.error.RateLimitedException;
import com.llmorchestrator.model.AdapterType;
import com.llmorchestrator.model.ProviderDescriptor;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderRateLimiterTest {

    private final ProviderRateLimiter limiter = new ProviderRateLimiter();

    @Test
    void rejectsBeyondLimitWithRetryHint() {
        ProviderDescriptor descriptor = descriptor(2);

        StepVerifier.create(limiter.acquire(descriptor)).verifyComplete();
        StepVerifier.create(limiter.acquire(descriptor)).verifyComplete();
        StepVerifier.create(limiter.acquire(descriptor))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(RateLimitedException.class);
                    RateLimitedException limited = (RateLimitedException) error;
                    assertThat(limited.isRetryable()).isTrue();
                    assertThat(limited.getRetryAfter()).isPresent();
                    assertThat(limited.getHttpStatus()).isNull();
                })
                .verify();

        limiter.reset("limited");
        StepVerifier.create(limiter.acquire(descriptor)).verifyComplete();
    }

    @Test
    void unlimitedProvidersAreNeverThrottled() {
        ProviderDescriptor descriptor = descriptor(null);

        for (int i = 0; i < 100; i++) {
            StepVerifier.create(limiter.acquire(descriptor)).verifyComplete();
        }
    }

    private static ProviderDescriptor descriptor(Integer requestsPerMinute) {
        return ProviderDescriptor.builder()
                .identifier("limited")
                .adapterType(AdapterType.OPENAI)
                .requestsPerMinute(requestsPerMinute)
                .build();
    }
}
