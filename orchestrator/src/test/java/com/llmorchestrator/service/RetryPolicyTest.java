package com.llmorchestrator.service;

import com.llmorchestrator.error.AuthenticationException;
import com.llmorchestrator.error.LlmTimeoutException;
import com.llmorchestrator.error.ProviderUnavailableException;
import com.llmorchestrator.error.RateLimitedException;
import com.llmorchestrator.error.TransportException;
import com.llmorchestrator.error.VendorException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    private final RetryPolicy policy =
            new RetryPolicy(Duration.ofMillis(500), Duration.ofSeconds(4), new SimpleMeterRegistry());

    @Test
    void exponentialBackoffIsCapped() {
        TransportException failure = new TransportException("p", "reset", null);

        assertThat(policy.backoff(failure, 0)).isEqualTo(Duration.ofMillis(500));
        assertThat(policy.backoff(failure, 1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoff(failure, 2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoff(failure, 5)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoff(failure, 60)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void retryAfterHintIsHonouredUpToTheCap() {
        assertThat(policy.backoff(new RateLimitedException("p", 429, "slow", Duration.ofSeconds(2)), 0))
                .isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoff(new RateLimitedException("p", 429, "slow", Duration.ofMinutes(5)), 0))
                .isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoff(new RateLimitedException("p", 429, "slow", null), 1))
                .isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void onlyTransientKindsAreRetryable() {
        assertThat(policy.isRetryable(new RateLimitedException("p", 429, "slow", null))).isTrue();
        assertThat(policy.isRetryable(new LlmTimeoutException("p", "late", null))).isTrue();
        assertThat(policy.isRetryable(new TransportException("p", "reset", null))).isTrue();
        assertThat(policy.isRetryable(new VendorException("p", 502, "bad gateway", true))).isTrue();

        assertThat(policy.isRetryable(new VendorException("p", 422, "bad input", false))).isFalse();
        assertThat(policy.isRetryable(new AuthenticationException("p", 401, "no"))).isFalse();
        assertThat(policy.isRetryable(new ProviderUnavailableException("p", "open", null))).isFalse();
        assertThat(policy.isRetryable(new IllegalStateException("bug"))).isFalse();
    }
}
