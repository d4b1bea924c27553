package com.llmorchestrator.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.ToolOptions;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

public class GroqProvider extends OpenAiCompatibleProvider implements StreamingCapable, ToolCapable {

    private static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";

    public GroqProvider(ProviderDescriptor descriptor, WebClient.Builder webClientBuilder,
                        CredentialSource credentials, ObjectMapper objectMapper) {
        super(descriptor, webClientBuilder, credentials, objectMapper);
    }

    @Override
    public String getDefaultModel() {
        return DEFAULT_MODEL;
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
