package com.llmorchestrator.config;

import com.llmorchestrator.model.AdapterType;
import com.llmorchestrator.model.ModelCapability;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@Validated
@ConfigurationProperties(prefix = "llm")
public class LlmProperties {

    /**
     * Provider used when a call names none, unless a provider sets {@code default: true}.
     */
    private String defaultProvider;

    @Valid
    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();

    @Valid
    private List<ModelSettings> models = new ArrayList<>();

    /**
     * Named presets usable with the {@code *WithConfiguration} calls.
     */
    @Valid
    private Map<String, ConfigurationSettings> configurations = new LinkedHashMap<>();

    @Valid
    private RetrySettings retry = new RetrySettings();

    @Valid
    private CacheSettings cache = new CacheSettings();

    @Valid
    private CircuitBreakerSettings circuitBreaker = new CircuitBreakerSettings();

    @Data
    public static class ProviderSettings {
        @NotNull
        private AdapterType type = AdapterType.OPENAI;
        private String name;
        private String endpoint;
        /**
         * Name of the property or environment variable holding the API key.
         */
        private String credentialRef;
        private boolean enabled = true;
        private boolean isDefault;
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
        @Min(0)
        private int maxRetries = 2;
        private int priority = 10;
        @Min(1)
        private Integer requestsPerMinute;
        @NotNull
        private Duration streamFirstChunkTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration streamIdleTimeout = Duration.ofSeconds(15);
        private Map<String, String> headers = new LinkedHashMap<>();
        private String apiVersion = "2024-02-01";
    }

    @Data
    public static class ModelSettings {
        private String identifier;
        @NotBlank
        private String provider;
        @NotBlank
        private String modelId;
        private int contextLength;
        private int maxOutputTokens;
        private Set<ModelCapability> capabilities = new LinkedHashSet<>(Set.of(ModelCapability.CHAT));
        @Min(0)
        private int costInput;
        @Min(0)
        private int costOutput;
        private boolean isDefault;
        private boolean active = true;
    }

    @Data
    public static class ConfigurationSettings {
        private String name;
        /**
         * Provider of {@code model}; without it {@code model} is a catalog identifier.
         */
        private String provider;
        private String model;
        /**
         * Selects the model from the catalog instead of {@code model}.
         */
        @Valid
        private CriteriaSettings criteria;
        private String systemPrompt;
        @DecimalMin("0")
        @DecimalMax("2")
        private double temperature = 0.7;
        @Min(1)
        private int maxTokens = 1000;
        @DecimalMin("0")
        @DecimalMax("1")
        private double topP = 1.0;
        private double frequencyPenalty;
        private double presencePenalty;
        private boolean active = true;
    }

    @Data
    public static class CriteriaSettings {
        private Set<ModelCapability> capabilities = new LinkedHashSet<>();
        private Set<AdapterType> adapterTypes = new LinkedHashSet<>();
        @Min(0)
        private int minContextLength;
        @Min(0)
        private int maxCostInput;
        private boolean preferLowestCost;
    }

    @Data
    public static class RetrySettings {
        @NotNull
        private Duration baseBackoff = Duration.ofMillis(500);
        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class CacheSettings {
        private boolean enabled = true;
        private Backend backend = Backend.MEMORY;
        @NotNull
        private Duration ttl = Duration.ofHours(1);
        @NotNull
        private Duration embeddingTtl = Duration.ofHours(24);
        @Min(1)
        private int maxSize = 10000;

        public enum Backend { MEMORY, REDIS }
    }

    @Data
    public static class CircuitBreakerSettings {
        private boolean enabled = true;
        @DecimalMin("1")
        @DecimalMax("100")
        private float failureRateThreshold = 50f;
        @Min(1)
        private int slidingWindowSize = 20;
        @Min(1)
        private int minimumNumberOfCalls = 10;
        @NotNull
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
    }
}
