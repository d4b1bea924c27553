package com.llmorchestrator.service.feature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.ResponseFormat;
import com.llmorchestrator.service.LlmServiceManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Single-prompt text generation in a few common shapes.
 */
@Slf4j
@RequiredArgsConstructor
public class CompletionService {

    static final String MARKDOWN_INSTRUCTION = "Format your response in clean, well-structured Markdown.";

    private final LlmServiceManager llmManager;
    private final ObjectMapper objectMapper;

    public Mono<CompletionResponse> complete(String prompt, ChatOptions options) {
        if (prompt == null || prompt.isBlank()) {
            return Mono.error(new IllegalArgumentException("Prompt must not be empty"));
        }
        return llmManager.complete(prompt, options != null ? options : ChatOptions.defaults());
    }

    /**
     * Asks for a JSON object and decodes it. A reply that is not valid JSON fails with
     * {@link IllegalArgumentException}.
     */
    public Mono<Map<String, Object>> completeJson(String prompt, ChatOptions options) {
        ChatOptions base = options != null ? options : ChatOptions.defaults();
        return complete(prompt, base.withResponseFormat(ResponseFormat.JSON))
                .map(response -> {
                    try {
                        return objectMapper.readValue(response.getContent(), new TypeReference<Map<String, Object>>() {
                        });
                    } catch (JsonProcessingException e) {
                        throw new IllegalArgumentException("Failed to decode JSON response: " + e.getOriginalMessage(), e);
                    }
                });
    }

    public Mono<String> completeMarkdown(String prompt, ChatOptions options) {
        ChatOptions base = options != null ? options : ChatOptions.defaults();
        String systemPrompt = base.getSystemPrompt() != null
                ? (base.getSystemPrompt() + "\n\n" + MARKDOWN_INSTRUCTION).trim()
                : MARKDOWN_INSTRUCTION;
        return complete(prompt, base.toBuilder()
                .responseFormat(ResponseFormat.MARKDOWN)
                .systemPrompt(systemPrompt)
                .build())
                .map(CompletionResponse::getContent);
    }

    /**
     * Low temperature, for consistent factual answers. Explicit values in {@code options} win.
     */
    public Mono<CompletionResponse> completeFactual(String prompt, ChatOptions options) {
        return complete(prompt, overlay(ChatOptions.factual(), options));
    }

    public Mono<CompletionResponse> completeCreative(String prompt, ChatOptions options) {
        return complete(prompt, overlay(ChatOptions.creative(), options));
    }

    private static ChatOptions overlay(ChatOptions preset, ChatOptions options) {
        if (options == null) {
            return preset;
        }
        return options.toBuilder()
                .temperature(options.getTemperature() != null ? options.getTemperature() : preset.getTemperature())
                .topP(options.getTopP() != null ? options.getTopP() : preset.getTopP())
                .presencePenalty(options.getPresencePenalty() != null
                        ? options.getPresencePenalty() : preset.getPresencePenalty())
                .build();
    }
}
