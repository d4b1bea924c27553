package com.llmorchestrator.service;

import com.llmorchestrator.error.ConfigurationException;
import com.llmorchestrator.error.LlmException;
import com.llmorchestrator.error.LlmTimeoutException;
import com.llmorchestrator.error.TransportException;
import com.llmorchestrator.error.UnsupportedCapabilityException;
import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.ContentPart;
import com.llmorchestrator.model.EmbeddingResponse;
import com.llmorchestrator.model.LlmConfiguration;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.MessageRole;
import com.llmorchestrator.model.ModelCapability;
import com.llmorchestrator.model.ModelDescriptor;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.StreamChunk;
import com.llmorchestrator.model.UsageStatistics;
import com.llmorchestrator.model.VisionResponse;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.EmbeddingOptions;
import com.llmorchestrator.model.options.RequestOptions;
import com.llmorchestrator.model.options.ToolOptions;
import com.llmorchestrator.model.options.VisionOptions;
import com.llmorchestrator.provider.EmbeddingCapable;
import com.llmorchestrator.provider.LlmProvider;
import com.llmorchestrator.provider.ProviderCapabilities;
import com.llmorchestrator.provider.ProviderRegistry;
import com.llmorchestrator.provider.StreamingCapable;
import com.llmorchestrator.provider.ToolCapable;
import com.llmorchestrator.provider.VisionCapable;
import com.llmorchestrator.service.cache.ResponseCache;
import com.llmorchestrator.service.event.AfterResponseEvent;
import com.llmorchestrator.service.event.BeforeRequestEvent;
import com.llmorchestrator.service.event.LlmEventBus;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ConnectTimeoutException;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/**
 * Single entry point for LLM calls.
 * <p>
 * Every call resolves its options and provider, publishes a before-request event, checks
 * the provider's capability, consults the response cache, dispatches under the provider's
 * timeout, circuit breaker and rate limit, retries what is retryable, publishes an
 * after-response event and reports usage. Exactly one provider serves a call; a failure is
 * surfaced to the caller rather than sent to another provider.
 */
@Slf4j
@RequiredArgsConstructor
public class LlmServiceManager {

    static final double DEFAULT_TEMPERATURE = 0.7;
    static final int DEFAULT_CHAT_MAX_TOKENS = 4096;
    static final int DEFAULT_VISION_MAX_TOKENS = 1024;

    private final ProviderRegistry registry;
    private final ModelCatalog modelCatalog;
    private final RetryPolicy retryPolicy;
    private final ProviderCircuitBreakers circuitBreakers;
    private final ProviderRateLimiter rateLimiter;
    private final ResponseCache cache;
    private final LlmEventBus eventBus;
    private final UsageRecorder usageRecorder;
    private final MeterRegistry meterRegistry;
    private final ConfigurationCatalog configurations;
    private final ModelSelectionService modelSelection;

    public Mono<CompletionResponse> chat(List<Message> messages, ChatOptions options) {
        ChatOptions resolved = chatDefaults(options);
        return execute(Call.<ChatOptions, CompletionResponse>builder()
                .operation(LlmOperation.CHAT)
                .capability(ModelCapability.CHAT)
                .modelCapability(ModelCapability.CHAT)
                .optionsType(ChatOptions.class)
                .responseType(CompletionResponse.class)
                .options(resolved)
                .fallbackModel(LlmProvider::getDefaultModel)
                .temperature(ChatOptions::getTemperature)
                .request(o -> Map.of("messages", withSystemPrompt(messages, o.getSystemPrompt()), "options", o))
                .dispatch((provider, o) -> provider.complete(withSystemPrompt(messages, o.getSystemPrompt()), o))
                .usage(CompletionResponse::getUsage)
                .withUsage(CompletionResponse::withUsage)
                .responseModel(CompletionResponse::getModel)
                .characters(r -> r.getContent().length())
                .build());
    }

    public Mono<CompletionResponse> complete(String prompt, ChatOptions options) {
        return chat(List.of(Message.user(prompt)), options);
    }

    public Mono<CompletionResponse> chatWithTools(List<Message> messages, ToolOptions options) {
        ToolOptions base = options != null ? options : ToolOptions.builder().build();
        ToolOptions resolved = base.toBuilder()
                .temperature(base.getTemperature() != null ? base.getTemperature() : DEFAULT_TEMPERATURE)
                .maxTokens(base.getMaxTokens() != null ? base.getMaxTokens() : DEFAULT_CHAT_MAX_TOKENS)
                .build();
        return execute(Call.<ToolOptions, CompletionResponse>builder()
                .operation(LlmOperation.TOOLS)
                .capability(ModelCapability.TOOLS)
                .modelCapability(ModelCapability.CHAT)
                .optionsType(ToolOptions.class)
                .responseType(CompletionResponse.class)
                .options(resolved)
                .fallbackModel(LlmProvider::getDefaultModel)
                .temperature(ToolOptions::getTemperature)
                .request(o -> Map.of("messages", messages, "options", o))
                .dispatch((provider, o) -> ((ToolCapable) provider)
                        .completeWithTools(withSystemPrompt(messages, o.getSystemPrompt()), o))
                .usage(CompletionResponse::getUsage)
                .withUsage(CompletionResponse::withUsage)
                .responseModel(CompletionResponse::getModel)
                .characters(r -> r.getContent().length())
                .build());
    }

    /**
     * Chat using a named configuration's model and options.
     */
    public Mono<CompletionResponse> chatWithConfiguration(List<Message> messages, String configurationId) {
        return Mono.defer(() -> chat(messages, configuredOptions(configurationId)));
    }

    public Mono<CompletionResponse> completeWithConfiguration(String prompt, String configurationId) {
        return chatWithConfiguration(List.of(Message.user(prompt)), configurationId);
    }

    public Flux<StreamChunk> streamChatWithConfiguration(List<Message> messages, String configurationId) {
        return Flux.defer(() -> streamChat(messages, configuredOptions(configurationId)));
    }

    public Mono<EmbeddingResponse> embed(List<String> input, EmbeddingOptions options) {
        if (input == null || input.isEmpty()) {
            return Mono.error(new IllegalArgumentException("Embedding input must not be empty"));
        }
        List<String> texts = List.copyOf(input);
        return execute(Call.<EmbeddingOptions, EmbeddingResponse>builder()
                .operation(LlmOperation.EMBEDDING)
                .capability(ModelCapability.EMBEDDINGS)
                .modelCapability(ModelCapability.EMBEDDINGS)
                .optionsType(EmbeddingOptions.class)
                .responseType(EmbeddingResponse.class)
                .options(options != null ? options : EmbeddingOptions.defaults())
                .fallbackModel(provider -> null)
                .temperature(o -> null)
                .request(o -> Map.of("input", texts, "options", o))
                .dispatch((provider, o) -> ((EmbeddingCapable) provider).embed(texts, o))
                .usage(EmbeddingResponse::getUsage)
                .withUsage(EmbeddingResponse::withUsage)
                .responseModel(EmbeddingResponse::getModel)
                .characters(r -> texts.stream().mapToLong(String::length).sum())
                .build());
    }

    public Mono<EmbeddingResponse> embed(String input, EmbeddingOptions options) {
        return embed(List.of(input), options);
    }

    public Mono<VisionResponse> analyzeImage(List<ContentPart> content, VisionOptions options) {
        VisionOptions base = options != null ? options : VisionOptions.builder().build();
        VisionOptions resolved = base.toBuilder()
                .temperature(base.getTemperature() != null ? base.getTemperature() : DEFAULT_TEMPERATURE)
                .maxTokens(base.getMaxTokens() != null ? base.getMaxTokens() : DEFAULT_VISION_MAX_TOKENS)
                .build();
        List<ContentPart> parts = List.copyOf(content);
        return execute(Call.<VisionOptions, VisionResponse>builder()
                .operation(LlmOperation.VISION)
                .capability(ModelCapability.VISION)
                .modelCapability(ModelCapability.VISION)
                .optionsType(VisionOptions.class)
                .responseType(VisionResponse.class)
                .options(resolved)
                .fallbackModel(provider -> null)
                .temperature(VisionOptions::getTemperature)
                .request(o -> Map.of("content", parts, "options", o))
                .dispatch((provider, o) -> ((VisionCapable) provider).analyzeImage(parts, o))
                .usage(VisionResponse::getUsage)
                .withUsage(VisionResponse::withUsage)
                .responseModel(VisionResponse::getModel)
                .characters(r -> r.getDescription().length())
                .build());
    }

    /**
     * Streams a chat completion as ordered chunks. Never cached. The call is retried only
     * while no chunk has been delivered; a first-chunk timeout and an idle timeout between
     * chunks apply independently.
     */
    public Flux<StreamChunk> streamChat(List<Message> messages, ChatOptions options) {
        ChatOptions defaults = chatDefaults(options);
        return Flux.defer(() -> {
            long start = System.nanoTime();
            Selection<ChatOptions> selection = select(LlmOperation.STREAM, ModelCapability.CHAT,
                    ChatOptions.class, defaults, LlmProvider::getDefaultModel);
            LlmProvider provider = selection.provider();
            ChatOptions resolved = selection.options();
            String providerId = provider.getIdentifier();
            ProviderDescriptor descriptor = provider.getDescriptor();
            AtomicInteger attempts = new AtomicInteger();
            AtomicBoolean delivered = new AtomicBoolean();
            AtomicInteger chunkCount = new AtomicInteger();
            AtomicLong characters = new AtomicLong();

            Flux<String> deltas;
            if (provider instanceof StreamingCapable) {
                StreamingCapable streaming = (StreamingCapable) provider;
                List<Message> prepared = withSystemPrompt(messages, resolved.getSystemPrompt());
                deltas = Flux.defer(() -> {
                            attempts.incrementAndGet();
                            Flux<String> attempt = Flux.defer(() -> streaming.streamChat(prepared, resolved))
                                    .timeout(Mono.delay(descriptor.getStreamFirstChunkTimeout()),
                                            item -> Mono.delay(descriptor.getStreamIdleTimeout()));
                            return rateLimiter.acquire(descriptor)
                                    .thenMany(circuitBreakers.protect(providerId, attempt))
                                    .onErrorMap(e -> normalizeStreamError(providerId, delivered.get(), e));
                        })
                        .doOnNext(delta -> delivered.set(true))
                        .retryWhen(retryPolicy.forProvider(providerId, descriptor.getMaxRetries(),
                                () -> !delivered.get()));
            } else {
                deltas = Flux.error(new UnsupportedCapabilityException(providerId, ModelCapability.STREAMING));
            }

            return deltas
                    .map(delta -> new StreamChunk(providerId, resolved.getModel(), chunkCount.getAndIncrement(), delta))
                    .doOnNext(chunk -> characters.addAndGet(chunk.getDelta().length()))
                    .doOnComplete(() -> {
                        publishAfter(streamEvent(providerId, resolved.getModel(), start, attempts, chunkCount, characters)
                                .build(), "success");
                        recordUsage(new UsageRecord(LlmOperation.STREAM.getValue(), providerId, resolved.getModel(),
                                0, 0, characters.get(), null));
                    })
                    .doOnCancel(() -> {
                        log.debug("[{}] Stream cancelled after {} chunks", providerId, chunkCount.get());
                        publishAfter(streamEvent(providerId, resolved.getModel(), start, attempts, chunkCount, characters)
                                .cancelled(true)
                                .build(), "cancelled");
                        recordUsage(new UsageRecord(LlmOperation.STREAM.getValue(), providerId, resolved.getModel(),
                                0, 0, characters.get(), null));
                    })
                    .onErrorMap(LlmException.class, e -> e.withAttempts(attempts.get()))
                    .doOnError(error -> {
                        countError(providerId, error);
                        publishAfter(streamEvent(providerId, resolved.getModel(), start, attempts, chunkCount, characters)
                                .error(error)
                                .build(), "error");
                    });
        });
    }

    private static AfterResponseEvent.AfterResponseEventBuilder streamEvent(String providerId, String model, long start,
                                                                            AtomicInteger attempts,
                                                                            AtomicInteger chunkCount,
                                                                            AtomicLong characters) {
        return AfterResponseEvent.builder()
                .operation(LlmOperation.STREAM)
                .providerId(providerId)
                .model(model)
                .duration(Duration.ofNanos(System.nanoTime() - start))
                .attempts(attempts.get())
                .streamed(true)
                .chunkCount(chunkCount.get())
                .characterCount(characters.get());
    }

    /**
     * Blocking, single-use iterator over {@link #streamChat}. Close it to abandon the stream.
     */
    public ChatStream openChatStream(List<Message> messages, ChatOptions options) {
        return new ChatStream(streamChat(messages, options));
    }

    /**
     * Whether the provider (or, without an identifier, the provider a call would use)
     * supports the capability. Never calls the vendor.
     */
    public boolean supportsCapability(ModelCapability capability, String providerId) {
        Optional<LlmProvider> provider;
        if (providerId != null) {
            provider = registry.find(providerId);
        } else {
            try {
                provider = Optional.of(registry.resolve(null));
            } catch (LlmException e) {
                log.debug("No provider to check {} against: {}", capability, e.getMessage());
                provider = Optional.empty();
            }
        }
        return provider.map(p -> ProviderCapabilities.supports(p, capability)).orElse(false);
    }

    public List<LlmProvider> getAvailableProviders() {
        return registry.selectByPriority();
    }

    public Mono<Long> evictCachedResponses(String providerId) {
        return cache.evictProvider(providerId);
    }

    public Mono<Long> clearCachedResponses() {
        return cache.clear();
    }

    private <O extends RequestOptions, R> Mono<R> execute(Call<O, R> call) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            Selection<O> selection = select(call.operation, call.modelCapability, call.optionsType,
                    call.options, call.fallbackModel);
            return dispatch(call, selection.provider(), selection.options(), start);
        });
    }

    private <O extends RequestOptions, R> Mono<R> dispatch(Call<O, R> call, LlmProvider provider, O options, long start) {
        String providerId = provider.getIdentifier();
        ProviderDescriptor descriptor = provider.getDescriptor();
        AtomicInteger attempts = new AtomicInteger();
        AtomicBoolean cached = new AtomicBoolean();

        Mono<R> outcome;
        if (!ProviderCapabilities.supports(provider, call.capability)) {
            outcome = Mono.error(new UnsupportedCapabilityException(providerId, call.capability));
        } else {
            Mono<R> live = Mono.defer(() -> {
                        attempts.incrementAndGet();
                        Mono<R> attempt = Mono.defer(() -> call.dispatch.apply(provider, options))
                                .timeout(descriptor.getTimeout());
                        return rateLimiter.acquire(descriptor)
                                .then(circuitBreakers.protect(providerId, attempt))
                                .onErrorMap(e -> normalizeError(providerId, descriptor.getTimeout(), e));
                    })
                    .retryWhen(retryPolicy.forProvider(providerId, descriptor.getMaxRetries()))
                    .map(response -> applyCost(call, providerId, options.getModel(), response));

            if (cache.isCacheable(call.operation, call.temperature.apply(options))) {
                String key = cache.key(call.operation, providerId, options.getModel(), call.request.apply(options));
                outcome = cache.get(key, call.responseType)
                        .doOnNext(hit -> cached.set(true))
                        .switchIfEmpty(live.flatMap(response ->
                                cache.put(key, response, call.operation).thenReturn(response)));
            } else {
                outcome = live;
            }
        }

        return outcome
                .doOnNext(response -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                    String model = options.getModel() != null ? options.getModel() : call.responseModel.apply(response);
                    publishAfter(AfterResponseEvent.builder()
                            .operation(call.operation)
                            .providerId(providerId)
                            .model(model)
                            .response(response)
                            .duration(elapsed)
                            .cached(cached.get())
                            .attempts(attempts.get())
                            .build(), cached.get() ? "cached" : "success");
                    if (!cached.get()) {
                        UsageStatistics usage = call.usage.apply(response);
                        recordUsage(new UsageRecord(call.operation.getValue(), providerId, model,
                                usage.getPromptTokens(), usage.getCompletionTokens(),
                                call.characters.applyAsLong(response), usage.getEstimatedCost()));
                    }
                })
                .onErrorMap(LlmException.class, e -> e.withAttempts(attempts.get()))
                .doOnError(error -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                    countError(providerId, error);
                    publishAfter(AfterResponseEvent.builder()
                            .operation(call.operation)
                            .providerId(providerId)
                            .model(options.getModel())
                            .error(error)
                            .duration(elapsed)
                            .attempts(attempts.get())
                            .build(), "error");
                });
    }

    private <O extends RequestOptions> Selection<O> select(LlmOperation operation, ModelCapability modelCapability,
                                                          Class<O> optionsType, O options,
                                                          Function<LlmProvider, String> fallbackModel) {
        LlmProvider provider = registry.resolve(options.getProvider());
        O resolved = resolveModel(provider, optionsType, options, modelCapability, fallbackModel);

        BeforeRequestEvent<O> event = new BeforeRequestEvent<>(operation, provider.getIdentifier(), optionsType, resolved);
        eventBus.publishBefore(event);
        O replaced = event.getOptions();
        if (replaced != resolved) {
            String requested = replaced.getProvider();
            if (requested != null && !requested.equals(provider.getIdentifier())) {
                log.debug("Listener moved {} call from {} to {}", operation, provider.getIdentifier(), requested);
                provider = registry.selectExplicit(requested);
            }
            resolved = resolveModel(provider, optionsType, replaced, modelCapability, fallbackModel);
        }
        log.debug("{} call routed to {} (model {})", operation, provider.getIdentifier(), resolved.getModel());
        return new Selection<>(provider, resolved);
    }

    private ChatOptions configuredOptions(String configurationId) {
        LlmConfiguration configuration = configurations.require(configurationId);
        ModelDescriptor model = modelSelection.resolveModel(configuration).orElseThrow(() ->
                new ConfigurationException(configuration.usesCriteriaSelection()
                        ? "No active model matches the criteria of configuration '" + configurationId + "'"
                        : "Configuration '" + configurationId + "' has no usable model assigned", null));
        log.debug("Configuration {} resolved to {}:{}", configurationId, model.getProviderId(), model.getModelId());
        return configuration.toChatOptions(model);
    }

    private <O extends RequestOptions> O resolveModel(LlmProvider provider, Class<O> optionsType, O options,
                                                     ModelCapability modelCapability,
                                                     Function<LlmProvider, String> fallbackModel) {
        String providerId = provider.getIdentifier();
        O result = optionsType.cast(options.withProvider(providerId));
        if (result.getModel() == null) {
            String model = modelCatalog.defaultModelFor(providerId, modelCapability)
                    .orElseGet(() -> fallbackModel.apply(provider));
            if (model != null) {
                result = optionsType.cast(result.withModel(model));
            }
        }
        return result;
    }

    private <R> R applyCost(Call<?, R> call, String providerId, String requestedModel, R response) {
        UsageStatistics usage = call.usage.apply(response);
        Optional<Double> cost = modelCatalog.estimateCost(providerId, requestedModel, usage)
                .or(() -> modelCatalog.estimateCost(providerId, call.responseModel.apply(response), usage));
        return cost.map(c -> call.withUsage.apply(response, usage.withEstimatedCost(c))).orElse(response);
    }

    private Throwable normalizeError(String providerId, Duration timeout, Throwable error) {
        if (error instanceof TimeoutException) {
            return new LlmTimeoutException(providerId, "No response within " + timeout.toMillis() + " ms", error);
        }
        if (error instanceof TransportException && hasTimeoutCause(error)) {
            return new LlmTimeoutException(providerId, "Connection timed out", error);
        }
        return error;
    }

    private Throwable normalizeStreamError(String providerId, boolean delivered, Throwable error) {
        if (error instanceof TimeoutException) {
            String message = delivered ? "Stream went idle" : "No stream data before the first-chunk timeout";
            return new LlmTimeoutException(providerId, message, error);
        }
        return normalizeError(providerId, Duration.ZERO, error);
    }

    private static boolean hasTimeoutCause(Throwable error) {
        for (Throwable cause = error.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof TimeoutException
                    || cause instanceof SocketTimeoutException
                    || cause instanceof io.netty.handler.timeout.TimeoutException
                    || cause instanceof ConnectTimeoutException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces a leading system message with the prompt, or prepends one.
     */
    static List<Message> withSystemPrompt(List<Message> messages, String systemPrompt) {
        if (systemPrompt == null || systemPrompt.isBlank()) {
            return messages;
        }
        List<Message> result = new ArrayList<>(messages.size() + 1);
        result.add(Message.system(systemPrompt));
        boolean leadingSystem = !messages.isEmpty() && messages.get(0).getRole() == MessageRole.SYSTEM;
        result.addAll(leadingSystem ? messages.subList(1, messages.size()) : messages);
        return List.copyOf(result);
    }

    private static ChatOptions chatDefaults(ChatOptions options) {
        ChatOptions base = options != null ? options : ChatOptions.defaults();
        return base.toBuilder()
                .temperature(base.getTemperature() != null ? base.getTemperature() : DEFAULT_TEMPERATURE)
                .maxTokens(base.getMaxTokens() != null ? base.getMaxTokens() : DEFAULT_CHAT_MAX_TOKENS)
                .build();
    }

    private void publishAfter(AfterResponseEvent event, String outcome) {
        meterRegistry.timer("llm.request.latency",
                        "provider", event.getProviderId(),
                        "operation", event.getOperation().getValue(),
                        "outcome", outcome)
                .record(event.getDuration());
        eventBus.publishAfter(event);
    }

    private void countError(String providerId, Throwable error) {
        String kind = error instanceof LlmException ? ((LlmException) error).getKind().name() : error.getClass().getSimpleName();
        meterRegistry.counter("llm.request.error", "provider", providerId, "kind", kind).increment();
        log.warn("[{}] Call failed: {}", providerId, error.getMessage());
    }

    private void recordUsage(UsageRecord record) {
        try {
            usageRecorder.record(record);
        } catch (RuntimeException e) {
            log.warn("Usage recorder failed for {} {}: {}", record.feature(), record.providerModel(), e.getMessage());
        }
    }

    private record Selection<O extends RequestOptions>(LlmProvider provider, O options) {
    }

    @Builder
    private static final class Call<O extends RequestOptions, R> {
        private final LlmOperation operation;
        private final ModelCapability capability;
        private final ModelCapability modelCapability;
        private final Class<O> optionsType;
        private final Class<R> responseType;
        private final O options;
        private final Function<LlmProvider, String> fallbackModel;
        private final Function<O, Double> temperature;
        private final Function<O, Map<String, Object>> request;
        private final BiFunction<LlmProvider, O, Mono<R>> dispatch;
        private final Function<R, UsageStatistics> usage;
        private final BiFunction<R, UsageStatistics, R> withUsage;
        private final Function<R, String> responseModel;
        private final ToLongFunction<R> characters;
    }
}
