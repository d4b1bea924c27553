package com.llmorchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.ContentPart;
import com.llmorchestrator.model.EmbeddingResponse;
import com.llmorchestrator.model.FinishReason;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.UsageStatistics;
import com.llmorchestrator.model.VisionResponse;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.EmbeddingOptions;
import com.llmorchestrator.model.options.VisionOptions;
import com.llmorchestrator.stream.OllamaStreamDecoder;
import com.llmorchestrator.stream.StreamFraming;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Local Ollama server. Needs no credential; images must be inline base64.
 */
public class OllamaProvider extends AbstractProvider implements EmbeddingCapable, VisionCapable, StreamingCapable {

    private static final String DEFAULT_MODEL = "llama3.2";
    private static final String DEFAULT_EMBEDDING_MODEL = "nomic-embed-text";
    private static final String DEFAULT_VISION_MODEL = "llava";

    public OllamaProvider(ProviderDescriptor descriptor, WebClient.Builder webClientBuilder,
                          CredentialSource credentials, ObjectMapper objectMapper) {
        super(descriptor, webClientBuilder, credentials, objectMapper);
    }

    @Override
    public String getDefaultModel() {
        return DEFAULT_MODEL;
    }

    @Override
    public Mono<CompletionResponse> complete(List<Message> messages, ChatOptions options) {
        String model = modelOrDefault(options.getModel());
        return postJson("/api/chat", chatBody(model, messages, options, false))
                .map(json -> parseCompletion(json, model));
    }

    @Override
    public Flux<String> streamChat(List<Message> messages, ChatOptions options) {
        String model = modelOrDefault(options.getModel());
        return postStream("/api/chat", Map.of(), chatBody(model, messages, options, true),
                StreamFraming.NDJSON, new OllamaStreamDecoder(objectMapper));
    }

    @Override
    public Mono<VisionResponse> analyzeImage(List<ContentPart> content, VisionOptions options) {
        String model = options.getModel() != null ? options.getModel() : DEFAULT_VISION_MODEL;
        boolean remoteImage = content.stream().anyMatch(p -> p.isImage() && !p.isInlineImage());
        if (remoteImage) {
            return Mono.error(new IllegalArgumentException("Ollama accepts inline base64 images only"));
        }
        List<Message> messages = new ArrayList<>();
        if (options.getSystemPrompt() != null) {
            messages.add(Message.system(options.getSystemPrompt()));
        }
        messages.add(Message.userWithParts(content));
        ChatOptions chat = ChatOptions.builder()
                .temperature(options.getTemperature())
                .maxTokens(options.getMaxTokens())
                .build();
        return postJson("/api/chat", chatBody(model, messages, chat, false)).map(json -> {
            CompletionResponse completion = parseCompletion(json, model);
            return VisionResponse.builder()
                    .description(completion.getContent())
                    .model(completion.getModel())
                    .usage(completion.getUsage())
                    .provider(getIdentifier())
                    .build();
        });
    }

    @Override
    public Mono<EmbeddingResponse> embed(List<String> input, EmbeddingOptions options) {
        String model = options.getModel() != null ? options.getModel() : DEFAULT_EMBEDDING_MODEL;
        return Flux.fromIterable(input)
                .concatMap(text -> postJson("/api/embeddings", Map.of("model", model, "prompt", text)))
                .map(json -> {
                    List<Double> vector = new ArrayList<>();
                    json.path("embedding").forEach(v -> vector.add(v.asDouble()));
                    return List.copyOf(vector);
                })
                .collectList()
                .map(vectors -> EmbeddingResponse.builder()
                        .embeddings(List.copyOf(vectors))
                        .model(model)
                        .usage(UsageStatistics.EMPTY)
                        .provider(getIdentifier())
                        .build());
    }

    private Map<String, Object> chatBody(String model, List<Message> messages, ChatOptions options, boolean stream) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages.stream().map(this::messageToMap).collect(Collectors.toList()));
        body.put("stream", stream);
        Map<String, Object> modelOptions = new LinkedHashMap<>();
        if (options.getTemperature() != null) {
            modelOptions.put("temperature", options.getTemperature());
        }
        if (options.getMaxTokens() != null) {
            modelOptions.put("num_predict", options.getMaxTokens());
        }
        if (options.getTopP() != null) {
            modelOptions.put("top_p", options.getTopP());
        }
        if (options.getStopSequences() != null && !options.getStopSequences().isEmpty()) {
            modelOptions.put("stop", options.getStopSequences());
        }
        if (!modelOptions.isEmpty()) {
            body.put("options", modelOptions);
        }
        if (options.wantsJson()) {
            body.put("format", "json");
        }
        return body;
    }

    private Map<String, Object> messageToMap(Message message) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("role", message.getRole().getValue());
        map.put("content", message.text());
        if (message.hasParts()) {
            List<String> images = message.getParts().stream()
                    .filter(ContentPart::isInlineImage)
                    .map(ContentPart::inlineData)
                    .collect(Collectors.toList());
            if (!images.isEmpty()) {
                map.put("images", images);
            }
        }
        return map;
    }

    private CompletionResponse parseCompletion(JsonNode json, String requestedModel) {
        String doneReason = text(json.path("done_reason"));
        return CompletionResponse.builder()
                .content(text(json.path("message").path("content")))
                .model(text(json.path("model"), requestedModel))
                .usage(usage(json.path("prompt_eval_count"), json.path("eval_count")))
                .finishReason("length".equals(doneReason) ? FinishReason.LENGTH : FinishReason.STOP)
                .provider(getIdentifier())
                .build();
    }
}
