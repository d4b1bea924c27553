package com.llmorchestrator.provider;

import java.util.Optional;

/**
 * Supplies the plaintext credential for a provider's credential reference at call time.
 * Adapters look the value up per request and never keep it.
 */
@FunctionalInterface
public interface CredentialSource {

    Optional<String> resolve(String credentialRef);
}
