package com.llmorchestrator.service;

import com.llmorchestrator.error.AuthenticationException;
import com.llmorchestrator.error.ProviderUnavailableException;
import com.llmorchestrator.error.VendorException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderCircuitBreakersTest {

    private final ProviderCircuitBreakers breakers =
            new ProviderCircuitBreakers(true, 50f, 4, 4, Duration.ofMinutes(1));

    @Test
    void opensAfterTransientFailuresAndRejectsCalls() {
        for (int i = 0; i < 4; i++) {
            StepVerifier.create(breakers.protect("flaky", Mono.error(new VendorException("flaky", 503, "down", true))))
                    .expectError(VendorException.class)
                    .verify();
        }

        assertThat(breakers.state("flaky")).isEqualTo(CircuitBreaker.State.OPEN);
        StepVerifier.create(breakers.protect("flaky", Mono.just("ok")))
                .expectError(ProviderUnavailableException.class)
                .verify();
    }

    @Test
    void callerErrorsDoNotTripTheBreaker() {
        for (int i = 0; i < 4; i++) {
            StepVerifier.create(breakers.protect("strict", Mono.error(new AuthenticationException("strict", 401, "no"))))
                    .expectError(AuthenticationException.class)
                    .verify();
        }

        assertThat(breakers.state("strict")).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void breakersAreIndependentPerProvider() {
        for (int i = 0; i < 4; i++) {
            breakers.protect("a", Mono.error(new VendorException("a", 500, "x", true))).onErrorResume(e -> Mono.empty()).block();
        }

        StepVerifier.create(breakers.protect("b", Mono.just("ok")))
                .expectNext("ok")
                .verifyComplete();
    }

    @Test
    void disabledBreakersPassThrough() {
        ProviderCircuitBreakers disabled = ProviderCircuitBreakers.disabled();
        for (int i = 0; i < 20; i++) {
            disabled.protect("p", Mono.error(new VendorException("p", 500, "x", true))).onErrorResume(e -> Mono.empty()).block();
        }

        StepVerifier.create(disabled.protect("p", Mono.just(1)))
                .expectNext(1)
                .verifyComplete();
    }
}
