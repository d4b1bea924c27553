package com.llmorchestrator.service;

import com.llmorchestrator.error.LlmException;
import com.llmorchestrator.error.RateLimitedException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Retry rules shared by every call. Only rate limits, timeouts, transport failures and
 * transient vendor errors are retried. The wait is the vendor's retry-after hint when
 * present, otherwise {@code base * 2^attempt}; both are capped by {@code maxBackoff}.
 * <p>
 * When the budget runs out the last error is rethrown as is.
 */
@Slf4j
public class RetryPolicy {

    private final Duration baseBackoff;
    private final Duration maxBackoff;
    private final MeterRegistry meterRegistry;

    public RetryPolicy(Duration baseBackoff, Duration maxBackoff, MeterRegistry meterRegistry) {
        this.baseBackoff = baseBackoff;
        this.maxBackoff = maxBackoff;
        this.meterRegistry = meterRegistry;
    }

    public Retry forProvider(String providerId, int maxRetries) {
        return forProvider(providerId, maxRetries, () -> true);
    }

    /**
     * @param stillRetryable checked on every failure; a stream that has delivered data
     *                       stops being retryable
     */
    public Retry forProvider(String providerId, int maxRetries, BooleanSupplier stillRetryable) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long attempt = signal.totalRetries();
            if (!isRetryable(failure) || attempt >= maxRetries || !stillRetryable.getAsBoolean()) {
                return Mono.error(failure);
            }
            Duration delay = backoff(failure, attempt);
            log.warn("[{}] Attempt {} failed ({}), retrying in {} ms",
                    providerId, attempt + 1, failure.getMessage(), delay.toMillis());
            meterRegistry.counter("llm.request.retry", "provider", providerId).increment();
            return Mono.delay(delay).thenReturn(attempt);
        }));
    }

    public boolean isRetryable(Throwable failure) {
        return failure instanceof LlmException && ((LlmException) failure).isRetryable();
    }

    Duration backoff(Throwable failure, long attempt) {
        if (failure instanceof RateLimitedException) {
            Duration hint = ((RateLimitedException) failure).getRetryAfter().orElse(null);
            if (hint != null) {
                return min(hint, maxBackoff);
            }
        }
        long factor = 1L << Math.min(attempt, 20);
        return min(baseBackoff.multipliedBy(factor), maxBackoff);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
