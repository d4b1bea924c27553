package com.llmorchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.model.LlmConfiguration;
import com.llmorchestrator.model.ModelDescriptor;
import com.llmorchestrator.model.ModelSelectionCriteria;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.provider.CredentialSource;
import com.llmorchestrator.provider.ProviderAdapterFactory;
import com.llmorchestrator.provider.ProviderRegistry;
import com.llmorchestrator.service.ConfigurationCatalog;
import com.llmorchestrator.service.LlmServiceManager;
import com.llmorchestrator.service.MeterUsageRecorder;
import com.llmorchestrator.service.ModelCatalog;
import com.llmorchestrator.service.ModelSelectionService;
import com.llmorchestrator.service.ProviderCircuitBreakers;
import com.llmorchestrator.service.ProviderRateLimiter;
import com.llmorchestrator.service.RetryPolicy;
import com.llmorchestrator.service.UsageRecorder;
import com.llmorchestrator.service.cache.CachePolicy;
import com.llmorchestrator.service.cache.InMemoryResponseCacheStore;
import com.llmorchestrator.service.cache.RedisResponseCacheStore;
import com.llmorchestrator.service.cache.RequestFingerprint;
import com.llmorchestrator.service.cache.ResponseCache;
import com.llmorchestrator.service.cache.ResponseCacheStore;
import com.llmorchestrator.service.event.LlmEventBus;
import com.llmorchestrator.service.event.LlmEventListener;
import com.llmorchestrator.service.feature.CompletionService;
import com.llmorchestrator.service.feature.EmbeddingService;
import com.llmorchestrator.service.feature.TranslationService;
import com.llmorchestrator.service.feature.VisionService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Configuration
@EnableConfigurationProperties(LlmProperties.class)
public class LlmOrchestratorConfig {

    @Bean
    @ConditionalOnMissingBean(CredentialSource.class)
    public CredentialSource credentialSource(Environment environment) {
        return new EnvironmentCredentialSource(environment);
    }

    @Bean
    public ProviderAdapterFactory providerAdapterFactory(ObjectProvider<WebClient.Builder> webClientBuilder,
                                                         CredentialSource credentialSource,
                                                         ObjectMapper objectMapper) {
        return new ProviderAdapterFactory(webClientBuilder.getIfAvailable(WebClient::builder),
                credentialSource, objectMapper);
    }

    @Bean
    public ProviderRegistry providerRegistry(LlmProperties properties, ProviderAdapterFactory factory) {
        ProviderRegistry registry = new ProviderRegistry();
        for (Map.Entry<String, LlmProperties.ProviderSettings> entry : properties.getProviders().entrySet()) {
            ProviderDescriptor descriptor = toDescriptor(entry.getKey(), entry.getValue(), properties.getDefaultProvider());
            registry.register(factory.create(descriptor));
        }
        log.info("Provider registry initialized with {} providers", properties.getProviders().size());
        return registry;
    }

    @Bean
    public ModelCatalog modelCatalog(LlmProperties properties) {
        List<ModelDescriptor> models = properties.getModels().stream()
                .map(LlmOrchestratorConfig::toModel)
                .collect(Collectors.toList());
        return new ModelCatalog(models);
    }

    @Bean
    public ModelSelectionService modelSelectionService(ModelCatalog modelCatalog, ProviderRegistry registry) {
        return new ModelSelectionService(modelCatalog, registry);
    }

    @Bean
    public ConfigurationCatalog configurationCatalog(LlmProperties properties) {
        List<LlmConfiguration> configurations = properties.getConfigurations().entrySet().stream()
                .map(entry -> toConfiguration(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
        log.info("Loaded {} LLM configurations", configurations.size());
        return new ConfigurationCatalog(configurations);
    }

    @Bean
    public RetryPolicy retryPolicy(LlmProperties properties, MeterRegistry meterRegistry) {
        LlmProperties.RetrySettings retry = properties.getRetry();
        return new RetryPolicy(retry.getBaseBackoff(), retry.getMaxBackoff(), meterRegistry);
    }

    @Bean
    public ProviderCircuitBreakers providerCircuitBreakers(LlmProperties properties) {
        LlmProperties.CircuitBreakerSettings settings = properties.getCircuitBreaker();
        return new ProviderCircuitBreakers(settings.isEnabled(), settings.getFailureRateThreshold(),
                settings.getSlidingWindowSize(), settings.getMinimumNumberOfCalls(),
                settings.getWaitDurationInOpenState());
    }

    @Bean
    public ProviderRateLimiter providerRateLimiter() {
        return new ProviderRateLimiter();
    }

    @Bean
    public ResponseCacheStore responseCacheStore(LlmProperties properties,
                                                 ObjectProvider<ReactiveStringRedisTemplate> redisTemplate) {
        LlmProperties.CacheSettings cache = properties.getCache();
        if (cache.getBackend() == LlmProperties.CacheSettings.Backend.REDIS) {
            ReactiveStringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template != null) {
                log.info("Response cache backed by Redis");
                return new RedisResponseCacheStore(template);
            }
            log.warn("Redis cache backend requested but no Redis template is configured, using memory");
        }
        return new InMemoryResponseCacheStore(cache.getMaxSize());
    }

    @Bean
    public ResponseCache responseCache(ResponseCacheStore store, LlmProperties properties,
                                       ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        LlmProperties.CacheSettings cache = properties.getCache();
        return new ResponseCache(store, new CachePolicy(cache.getTtl(), cache.getEmbeddingTtl()),
                new RequestFingerprint(objectMapper), objectMapper, meterRegistry, cache.isEnabled());
    }

    @Bean
    public LlmEventBus llmEventBus(ObjectProvider<LlmEventListener> listeners) {
        return new LlmEventBus(listeners.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean(UsageRecorder.class)
    public UsageRecorder usageRecorder(MeterRegistry meterRegistry) {
        return new MeterUsageRecorder(meterRegistry);
    }

    @Bean
    public LlmServiceManager llmServiceManager(ProviderRegistry registry, ModelCatalog modelCatalog,
                                               RetryPolicy retryPolicy, ProviderCircuitBreakers circuitBreakers,
                                               ProviderRateLimiter rateLimiter, ResponseCache responseCache,
                                               LlmEventBus eventBus, UsageRecorder usageRecorder,
                                               MeterRegistry meterRegistry, ConfigurationCatalog configurationCatalog,
                                               ModelSelectionService modelSelectionService) {
        return new LlmServiceManager(registry, modelCatalog, retryPolicy, circuitBreakers, rateLimiter,
                responseCache, eventBus, usageRecorder, meterRegistry, configurationCatalog, modelSelectionService);
    }

    @Bean
    public CompletionService completionService(LlmServiceManager llmServiceManager, ObjectMapper objectMapper) {
        return new CompletionService(llmServiceManager, objectMapper);
    }

    @Bean
    public EmbeddingService embeddingService(LlmServiceManager llmServiceManager) {
        return new EmbeddingService(llmServiceManager);
    }

    @Bean
    public VisionService visionService(LlmServiceManager llmServiceManager) {
        return new VisionService(llmServiceManager);
    }

    @Bean
    public TranslationService translationService(LlmServiceManager llmServiceManager) {
        return new TranslationService(llmServiceManager);
    }

    static ProviderDescriptor toDescriptor(String id, LlmProperties.ProviderSettings settings, String defaultProvider) {
        return ProviderDescriptor.builder()
                .identifier(id)
                .name(settings.getName())
                .adapterType(settings.getType())
                .endpoint(settings.getEndpoint())
                .credentialRef(settings.getCredentialRef())
                .active(settings.isEnabled())
                .defaultProvider(settings.isDefault() || id.equals(defaultProvider))
                .timeout(settings.getTimeout())
                .maxRetries(settings.getMaxRetries())
                .priority(settings.getPriority())
                .requestsPerMinute(settings.getRequestsPerMinute())
                .streamFirstChunkTimeout(settings.getStreamFirstChunkTimeout())
                .streamIdleTimeout(settings.getStreamIdleTimeout())
                .extraHeaders(Map.copyOf(settings.getHeaders()))
                .apiVersion(settings.getApiVersion())
                .build();
    }

    static ModelDescriptor toModel(LlmProperties.ModelSettings settings) {
        String identifier = settings.getIdentifier() != null
                ? settings.getIdentifier()
                : settings.getProvider() + ":" + settings.getModelId();
        return ModelDescriptor.builder()
                .identifier(identifier)
                .providerId(settings.getProvider())
                .modelId(settings.getModelId())
                .contextLength(settings.getContextLength())
                .maxOutputTokens(settings.getMaxOutputTokens())
                .capabilities(Set.copyOf(settings.getCapabilities()))
                .costInput(settings.getCostInput())
                .costOutput(settings.getCostOutput())
                .defaultModel(settings.isDefault())
                .active(settings.isActive())
                .build();
    }

    static LlmConfiguration toConfiguration(String id, LlmProperties.ConfigurationSettings settings) {
        LlmProperties.CriteriaSettings criteria = settings.getCriteria();
        return LlmConfiguration.builder()
                .identifier(id)
                .name(settings.getName() != null ? settings.getName() : id)
                .provider(settings.getProvider())
                .model(settings.getModel())
                .criteria(criteria == null ? null : ModelSelectionCriteria.builder()
                        .capabilities(Set.copyOf(criteria.getCapabilities()))
                        .adapterTypes(Set.copyOf(criteria.getAdapterTypes()))
                        .minContextLength(criteria.getMinContextLength())
                        .maxCostInput(criteria.getMaxCostInput())
                        .preferLowestCost(criteria.isPreferLowestCost())
                        .build())
                .systemPrompt(settings.getSystemPrompt())
                .temperature(settings.getTemperature())
                .maxTokens(settings.getMaxTokens())
                .topP(settings.getTopP())
                .frequencyPenalty(settings.getFrequencyPenalty())
                .presencePenalty(settings.getPresencePenalty())
                .active(settings.isActive())
                .build();
    }
}
