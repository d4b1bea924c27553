package com.llmorchestrator.config;

import com.llmorchestrator.provider.CredentialSource;
import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;

import java.util.Optional;

/**
 * Resolves credential references against the Spring {@link Environment}, so a reference can
 * name an environment variable ({@code OPENAI_API_KEY}) or any configured property.
 * Values are read on every call and never stored.
 */
@RequiredArgsConstructor
public class EnvironmentCredentialSource implements CredentialSource {

    private final Environment environment;

    @Override
    public Optional<String> resolve(String credentialRef) {
        if (credentialRef == null || credentialRef.isBlank()) {
            return Optional.empty();
        }
        String value = environment.getProperty(credentialRef);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
