package com.llmorchestrator.service;

import com.llmorchestrator.model.AdapterType;
import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.EmbeddingResponse;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.UsageStatistics;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.EmbeddingOptions;
import com.llmorchestrator.provider.EmbeddingCapable;
import com.llmorchestrator.provider.LlmProvider;
import com.llmorchestrator.provider.StreamingCapable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.IntFunction;
import java.util.stream.Collectors;

/**
 * Scripted provider: each behaviour receives the zero-based call number.
 */
class StubProvider implements LlmProvider, StreamingCapable, EmbeddingCapable {

    private final ProviderDescriptor descriptor;
    final AtomicInteger completeCalls = new AtomicInteger();
    final AtomicInteger streamCalls = new AtomicInteger();
    final AtomicInteger embedCalls = new AtomicInteger();
    final List<ChatOptions> seenOptions = new CopyOnWriteArrayList<>();
    final List<List<Message>> seenMessages = new CopyOnWriteArrayList<>();

    private BiFunction<Integer, List<Message>, Mono<CompletionResponse>> completion;
    private IntFunction<Flux<String>> stream;

    StubProvider(String id, int priority) {
        this(ProviderDescriptor.builder()
                .identifier(id)
                .adapterType(AdapterType.OPENAI)
                .priority(priority)
                .maxRetries(2)
                .build());
    }

    StubProvider(ProviderDescriptor descriptor) {
        this.descriptor = descriptor;
        this.completion = (call, messages) -> Mono.just(reply(descriptor.getIdentifier() + " says hello"));
        this.stream = call -> Flux.just("Hel", "lo");
    }

    static CompletionResponse reply(String content) {
        return CompletionResponse.builder()
                .content(content)
                .model("stub-model")
                .usage(UsageStatistics.fromTokens(10, 5))
                .build();
    }

    StubProvider onComplete(IntFunction<Mono<CompletionResponse>> behaviour) {
        this.completion = (call, messages) -> behaviour.apply(call);
        return this;
    }

    /**
     * Behaviour that also sees the messages of the call.
     */
    StubProvider onChat(BiFunction<Integer, List<Message>, Mono<CompletionResponse>> behaviour) {
        this.completion = behaviour;
        return this;
    }

    StubProvider onStream(IntFunction<Flux<String>> behaviour) {
        this.stream = behaviour;
        return this;
    }

    @Override
    public ProviderDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public boolean isAvailable() {
        return descriptor.isActive();
    }

    @Override
    public String getDefaultModel() {
        return "stub-default";
    }

    @Override
    public Mono<CompletionResponse> complete(List<Message> messages, ChatOptions options) {
        int call = completeCalls.getAndIncrement();
        seenOptions.add(options);
        seenMessages.add(messages);
        return completion.apply(call, messages);
    }

    @Override
    public Flux<String> streamChat(List<Message> messages, ChatOptions options) {
        return stream.apply(streamCalls.getAndIncrement());
    }

    @Override
    public Mono<EmbeddingResponse> embed(List<String> input, EmbeddingOptions options) {
        embedCalls.incrementAndGet();
        return Mono.just(EmbeddingResponse.builder()
                .embeddings(input.stream().map(text -> List.of((double) text.length(), 1.0)).collect(Collectors.toList()))
                .model(options.getModel() != null ? options.getModel() : "stub-embed")
                .usage(UsageStatistics.fromTokens(input.size(), 0))
                .build());
    }
}
