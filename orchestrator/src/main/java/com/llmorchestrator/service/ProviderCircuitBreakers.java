package com.llmorchestrator.service;

import com.llmorchestrator.error.LlmException;
import com.llmorchestrator.error.ProviderUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * One Resilience4j circuit breaker per provider. Only failures worth retrying count against
 * the breaker; an open breaker rejects calls with {@link ProviderUnavailableException}.
 */
@Slf4j
public class ProviderCircuitBreakers {

    private final CircuitBreakerRegistry registry;
    private final boolean enabled;

    public ProviderCircuitBreakers(boolean enabled, float failureRateThreshold, int slidingWindowSize,
                                   int minimumNumberOfCalls, Duration waitDurationInOpenState) {
        this.enabled = enabled;
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(minimumNumberOfCalls)
                .waitDurationInOpenState(waitDurationInOpenState)
                .recordException(ProviderCircuitBreakers::countsAsFailure)
                .build();
        this.registry = CircuitBreakerRegistry.of(config);
    }

    public static ProviderCircuitBreakers disabled() {
        return new ProviderCircuitBreakers(false, 50f, 10, 10, Duration.ofSeconds(30));
    }

    public <T> Mono<T> protect(String providerId, Mono<T> call) {
        if (!enabled) {
            return call;
        }
        return call.transformDeferred(CircuitBreakerOperator.of(breaker(providerId)))
                .onErrorMap(CallNotPermittedException.class, e -> unavailable(providerId, e));
    }

    public <T> Flux<T> protect(String providerId, Flux<T> call) {
        if (!enabled) {
            return call;
        }
        return call.transformDeferred(CircuitBreakerOperator.of(breaker(providerId)))
                .onErrorMap(CallNotPermittedException.class, e -> unavailable(providerId, e));
    }

    public CircuitBreaker.State state(String providerId) {
        return breaker(providerId).getState();
    }

    private CircuitBreaker breaker(String providerId) {
        return registry.circuitBreaker(providerId);
    }

    private static ProviderUnavailableException unavailable(String providerId, CallNotPermittedException e) {
        log.warn("[{}] Circuit breaker open, rejecting call", providerId);
        return new ProviderUnavailableException(providerId, "Circuit breaker is open", e);
    }

    private static boolean countsAsFailure(Throwable error) {
        return !(error instanceof LlmException) || ((LlmException) error).isRetryable();
    }
}
