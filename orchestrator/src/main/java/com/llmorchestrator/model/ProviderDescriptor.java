package com.llmorchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Read-only configuration of one provider. Holds a credential reference, never the secret.
 */
@Value
@Builder(toBuilder = true)
public class ProviderDescriptor {
    String identifier;
    String name;
    AdapterType adapterType;
    String endpoint;
    String credentialRef;
    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);
    @Builder.Default
    int maxRetries = 2;
    @Builder.Default
    int priority = 10;
    @Builder.Default
    boolean active = true;
    @Builder.Default
    boolean defaultProvider = false;
    Integer requestsPerMinute;
    @Builder.Default
    Duration streamFirstChunkTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Duration streamIdleTimeout = Duration.ofSeconds(15);
    @Builder.Default
    Map<String, String> extraHeaders = Map.of();
    @Builder.Default
    String apiVersion = "2024-02-01";

    /**
     * Configured endpoint, or the adapter type's default when blank. No trailing slash.
     */
    public String effectiveEndpoint() {
        String url = endpoint == null || endpoint.isBlank() ? adapterType.getDefaultEndpoint() : endpoint;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : identifier;
    }
}
