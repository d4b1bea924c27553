package com.llmorchestrator.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.error.ContentFilteredException;
import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.ContentPart;
import com.llmorchestrator.model.EmbeddingResponse;
import com.llmorchestrator.model.FinishReason;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.MessageRole;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.ToolCall;
import com.llmorchestrator.model.ToolDefinition;
import com.llmorchestrator.model.UsageStatistics;
import com.llmorchestrator.model.VisionResponse;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.EmbeddingOptions;
import com.llmorchestrator.model.options.ToolOptions;
import com.llmorchestrator.model.options.VisionOptions;
import com.llmorchestrator.stream.GeminiStreamDecoder;
import com.llmorchestrator.stream.StreamFraming;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Google Gemini ({@code generativelanguage} API). The key is passed as the {@code key}
 * query parameter and masked in logs.
 */
public class GeminiProvider extends AbstractProvider
        implements EmbeddingCapable, VisionCapable, StreamingCapable, ToolCapable {

    private static final String DEFAULT_MODEL = "gemini-2.0-flash";
    private static final String DEFAULT_EMBEDDING_MODEL = "text-embedding-004";
    private static final Set<String> FILTER_REASONS =
            Set.of("SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII");

    public GeminiProvider(ProviderDescriptor descriptor, WebClient.Builder webClientBuilder,
                          CredentialSource credentials, ObjectMapper objectMapper) {
        super(descriptor, webClientBuilder, credentials, objectMapper);
    }

    @Override
    public String getDefaultModel() {
        return DEFAULT_MODEL;
    }

    @Override
    protected void applyAuth(HttpHeaders headers, String credential) {
        // key travels in the query string
    }

    @Override
    protected void customizeUri(UriBuilder uriBuilder, String credential) {
        uriBuilder.queryParam("key", credential);
    }

    @Override
    protected String loggablePath(String path) {
        return path + "?key=***";
    }

    @Override
    public Mono<CompletionResponse> complete(List<Message> messages, ChatOptions options) {
        String model = modelOrDefault(options.getModel());
        Map<String, Object> body = contentsBody(messages, options);
        return postJson("/models/" + model + ":generateContent", body)
                .flatMap(json -> parseCompletion(json, model));
    }

    @Override
    public Mono<CompletionResponse> completeWithTools(List<Message> messages, ToolOptions options) {
        String model = modelOrDefault(options.getModel());
        Map<String, Object> body = contentsBody(messages, options.toChatOptions());
        List<Map<String, Object>> declarations = options.getTools().stream()
                .map(this::toolToMap)
                .collect(Collectors.toList());
        body.put("tools", List.of(Map.of("functionDeclarations", declarations)));
        if (options.getToolChoice() != null) {
            Map<String, Object> config = new LinkedHashMap<>();
            if (options.isNamedToolChoice()) {
                config.put("mode", "ANY");
                config.put("allowedFunctionNames", List.of(options.getToolChoice()));
            } else {
                config.put("mode", "required".equals(options.getToolChoice()) ? "ANY"
                        : options.getToolChoice().toUpperCase(Locale.ROOT));
            }
            body.put("toolConfig", Map.of("functionCallingConfig", config));
        }
        return postJson("/models/" + model + ":generateContent", body)
                .flatMap(json -> parseCompletion(json, model));
    }

    @Override
    public Flux<String> streamChat(List<Message> messages, ChatOptions options) {
        String model = modelOrDefault(options.getModel());
        return postStream("/models/" + model + ":streamGenerateContent", Map.of("alt", "sse"),
                contentsBody(messages, options), StreamFraming.SSE, new GeminiStreamDecoder(objectMapper));
    }

    @Override
    public Mono<VisionResponse> analyzeImage(List<ContentPart> content, VisionOptions options) {
        String model = modelOrDefault(options.getModel());
        List<Message> messages = new ArrayList<>();
        if (options.getSystemPrompt() != null) {
            messages.add(Message.system(options.getSystemPrompt()));
        }
        messages.add(Message.userWithParts(content));
        ChatOptions chat = ChatOptions.builder()
                .temperature(options.getTemperature())
                .maxTokens(options.getMaxTokens())
                .build();
        return postJson("/models/" + model + ":generateContent", contentsBody(messages, chat))
                .flatMap(json -> parseCompletion(json, model))
                .map(completion -> VisionResponse.builder()
                        .description(completion.getContent())
                        .model(completion.getModel())
                        .usage(completion.getUsage())
                        .provider(getIdentifier())
                        .metadata(Map.of("finish_reason", completion.getFinishReason().getValue()))
                        .build());
    }

    /**
     * One {@code embedContent} call per input, in input order.
     */
    @Override
    public Mono<EmbeddingResponse> embed(List<String> input, EmbeddingOptions options) {
        String model = options.getModel() != null ? options.getModel() : DEFAULT_EMBEDDING_MODEL;
        return Flux.fromIterable(input)
                .concatMap(text -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("model", "models/" + model);
                    body.put("content", Map.of("parts", List.of(Map.of("text", text))));
                    if (options.getDimensions() != null) {
                        body.put("outputDimensionality", options.getDimensions());
                    }
                    return postJson("/models/" + model + ":embedContent", body);
                })
                .map(json -> {
                    List<Double> vector = new ArrayList<>();
                    json.path("embedding").path("values").forEach(v -> vector.add(v.asDouble()));
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

    private Map<String, Object> contentsBody(List<Message> messages, ChatOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        String system = messages.stream()
                .filter(m -> m.getRole() == MessageRole.SYSTEM)
                .map(Message::text)
                .collect(Collectors.joining("\n\n"));
        if (!system.isEmpty()) {
            body.put("systemInstruction", Map.of("parts", List.of(Map.of("text", system))));
        }
        body.put("contents", messages.stream()
                .filter(m -> m.getRole() != MessageRole.SYSTEM)
                .map(this::contentToMap)
                .collect(Collectors.toList()));
        Map<String, Object> generation = new LinkedHashMap<>();
        if (options.getTemperature() != null) {
            generation.put("temperature", options.getTemperature());
        }
        if (options.getMaxTokens() != null) {
            generation.put("maxOutputTokens", options.getMaxTokens());
        }
        if (options.getTopP() != null) {
            generation.put("topP", options.getTopP());
        }
        if (options.getStopSequences() != null && !options.getStopSequences().isEmpty()) {
            generation.put("stopSequences", options.getStopSequences());
        }
        if (options.wantsJson()) {
            generation.put("responseMimeType", "application/json");
        }
        if (!generation.isEmpty()) {
            body.put("generationConfig", generation);
        }
        return body;
    }

    private Map<String, Object> contentToMap(Message message) {
        List<Map<String, Object>> parts = new ArrayList<>();
        if (message.getRole() == MessageRole.TOOL) {
            String name = message.getName() != null ? message.getName() : message.getToolCallId();
            parts.add(Map.of("functionResponse", Map.of("name", name, "response", Map.of("content", message.text()))));
            return Map.of("role", "user", "parts", parts);
        }
        if (message.hasParts()) {
            for (ContentPart part : message.getParts()) {
                if (part.isInlineImage()) {
                    parts.add(Map.of("inline_data", Map.of("mime_type", part.inlineMediaType(), "data", part.inlineData())));
                } else if (part.isImage()) {
                    parts.add(Map.of("file_data", Map.of("mime_type", guessMimeType(part.getImageUrl()),
                            "file_uri", part.getImageUrl())));
                } else {
                    parts.add(Map.of("text", part.getText() != null ? part.getText() : ""));
                }
            }
        } else if (!message.text().isEmpty()) {
            parts.add(Map.of("text", message.text()));
        }
        if (message.getToolCalls() != null) {
            for (ToolCall call : message.getToolCalls()) {
                parts.add(Map.of("functionCall", Map.of("name", call.getName(), "args", parseArguments(call.getArguments()))));
            }
        }
        String role = message.getRole() == MessageRole.ASSISTANT ? "model" : "user";
        return Map.of("role", role, "parts", parts);
    }

    private Map<String, Object> toolToMap(ToolDefinition tool) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", tool.getName());
        if (tool.getDescription() != null) {
            map.put("description", tool.getDescription());
        }
        map.put("parameters", tool.getParameters());
        return map;
    }

    private Mono<CompletionResponse> parseCompletion(JsonNode json, String requestedModel) {
        JsonNode candidates = json.path("candidates");
        String blockReason = text(json.path("promptFeedback").path("blockReason"));
        if (candidates.isEmpty() && !blockReason.isEmpty()) {
            return Mono.error(new ContentFilteredException(getIdentifier(), null,
                    "Prompt blocked: " + blockReason, Map.of("blockReason", blockReason)));
        }
        JsonNode candidate = candidates.path(0);
        StringBuilder content = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        int index = 0;
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.has("functionCall")) {
                JsonNode call = part.get("functionCall");
                toolCalls.add(ToolCall.builder()
                        .id("call_" + index++)
                        .name(text(call.path("name")))
                        .arguments(call.has("args") ? call.get("args").toString() : "{}")
                        .build());
            } else {
                content.append(text(part.path("text")));
            }
        }
        JsonNode usage = json.path("usageMetadata");
        FinishReason finishReason = toolCalls.isEmpty()
                ? mapFinishReason(text(candidate.path("finishReason")))
                : FinishReason.TOOL_CALLS;
        Map<String, Object> metadata = new HashMap<>();
        if (!text(candidate.path("finishReason")).isEmpty()) {
            metadata.put("finishReason", text(candidate.path("finishReason")));
        }
        return Mono.just(CompletionResponse.builder()
                .content(content.toString())
                .model(text(json.path("modelVersion"), requestedModel))
                .usage(usage(usage.path("promptTokenCount"), usage.path("candidatesTokenCount")))
                .finishReason(finishReason)
                .provider(getIdentifier())
                .toolCalls(List.copyOf(toolCalls))
                .metadata(Map.copyOf(metadata))
                .build());
    }

    static FinishReason mapFinishReason(String reason) {
        if ("MAX_TOKENS".equals(reason)) {
            return FinishReason.LENGTH;
        }
        if (FILTER_REASONS.contains(reason)) {
            return FinishReason.CONTENT_FILTER;
        }
        return FinishReason.STOP;
    }

    private JsonNode parseArguments(String arguments) {
        try {
            return objectMapper.readTree(arguments == null || arguments.isBlank() ? "{}" : arguments);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool call arguments are not valid JSON", e);
        }
    }

    private static String guessMimeType(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".png")) {
            return "image/png";
        }
        if (lower.endsWith(".gif")) {
            return "image/gif";
        }
        if (lower.endsWith(".webp")) {
            return "image/webp";
        }
        return "image/jpeg";
    }
}
