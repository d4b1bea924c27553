package com.llmorchestrator.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.ContentPart;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.VisionResponse;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.ToolOptions;
import com.llmorchestrator.model.options.VisionOptions;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * OpenRouter. Attribution headers ({@code HTTP-Referer}, {@code X-Title}) come from the
 * provider's extra headers; a title is sent when none is configured.
 */
public class OpenRouterProvider extends OpenAiCompatibleProvider
        implements VisionCapable, StreamingCapable, ToolCapable {

    private static final String DEFAULT_MODEL = "openai/gpt-4o-mini";

    public OpenRouterProvider(ProviderDescriptor descriptor, WebClient.Builder webClientBuilder,
                              CredentialSource credentials, ObjectMapper objectMapper) {
        super(descriptor, webClientBuilder, credentials, objectMapper);
    }

    @Override
    public String getDefaultModel() {
        return DEFAULT_MODEL;
    }

    @Override
    protected Map<String, String> defaultHeaders() {
        return Map.of("X-Title", "LLM Orchestrator");
    }

    @Override
    public Mono<VisionResponse> analyzeImage(List<ContentPart> content, VisionOptions options) {
        return doAnalyzeImage(content, options);
    }

    @Override
    public Flux<String> streamChat(List<Message> messages, ChatOptions options) {
        return doStreamChat(messages, options);
    }

    @Override
    public Mono<CompletionResponse> completeWithTools(List<Message> messages, ToolOptions options) {
        return doCompleteWithTools(messages, options);
    }
}
