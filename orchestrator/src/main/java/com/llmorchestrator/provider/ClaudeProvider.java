package com.llmorchestrator.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.ContentPart;
import com.llmorchestrator.model.FinishReason;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.MessageRole;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.ToolCall;
import com.llmorchestrator.model.ToolDefinition;
import com.llmorchestrator.model.VisionResponse;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.ToolOptions;
import com.llmorchestrator.model.options.VisionOptions;
import com.llmorchestrator.stream.ClaudeStreamDecoder;
import com.llmorchestrator.stream.StreamFraming;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Anthropic Messages API. System messages travel in the top-level {@code system} field.
 */
public class ClaudeProvider extends AbstractProvider implements VisionCapable, StreamingCapable, ToolCapable {

    private static final String DEFAULT_MODEL = "claude-sonnet-4-20250514";
    private static final String API_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 4096;

    public ClaudeProvider(ProviderDescriptor descriptor, WebClient.Builder webClientBuilder,
                          CredentialSource credentials, ObjectMapper objectMapper) {
        super(descriptor, webClientBuilder, credentials, objectMapper);
    }

    @Override
    public String getDefaultModel() {
        return DEFAULT_MODEL;
    }

    @Override
    protected Map<String, String> defaultHeaders() {
        return Map.of("anthropic-version", API_VERSION);
    }

    @Override
    protected void applyAuth(HttpHeaders headers, String credential) {
        headers.set("x-api-key", credential);
    }

    @Override
    public Mono<CompletionResponse> complete(List<Message> messages, ChatOptions options) {
        String model = modelOrDefault(options.getModel());
        return postJson("/messages", messagesBody(model, messages, options))
                .map(json -> parseCompletion(json, model));
    }

    @Override
    public Mono<CompletionResponse> completeWithTools(List<Message> messages, ToolOptions options) {
        String model = modelOrDefault(options.getModel());
        Map<String, Object> body = messagesBody(model, messages, options.toChatOptions());
        body.put("tools", options.getTools().stream().map(this::toolToMap).collect(Collectors.toList()));
        if (options.getToolChoice() != null) {
            body.put("tool_choice", toolChoice(options));
        }
        return postJson("/messages", body).map(json -> parseCompletion(json, model));
    }

    @Override
    public Flux<String> streamChat(List<Message> messages, ChatOptions options) {
        String model = modelOrDefault(options.getModel());
        Map<String, Object> body = messagesBody(model, messages, options);
        body.put("stream", true);
        return postStream("/messages", Map.of(), body, StreamFraming.SSE, new ClaudeStreamDecoder(objectMapper));
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
        return postJson("/messages", messagesBody(model, messages, chat)).map(json -> {
            CompletionResponse completion = parseCompletion(json, model);
            return VisionResponse.builder()
                    .description(completion.getContent())
                    .model(completion.getModel())
                    .usage(completion.getUsage())
                    .provider(getIdentifier())
                    .metadata(Map.of("finish_reason", completion.getFinishReason().getValue()))
                    .build();
        });
    }

    private Map<String, Object> messagesBody(String model, List<Message> messages, ChatOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", options.getMaxTokens() != null ? options.getMaxTokens() : DEFAULT_MAX_TOKENS);
        String system = messages.stream()
                .filter(m -> m.getRole() == MessageRole.SYSTEM)
                .map(Message::text)
                .collect(Collectors.joining("\n\n"));
        if (!system.isEmpty()) {
            body.put("system", system);
        }
        body.put("messages", messages.stream()
                .filter(m -> m.getRole() != MessageRole.SYSTEM)
                .map(this::messageToMap)
                .collect(Collectors.toList()));
        if (options.getTemperature() != null) {
            // Anthropic accepts [0, 1]
            body.put("temperature", Math.min(1.0, options.getTemperature()));
        }
        if (options.getTopP() != null) {
            body.put("top_p", options.getTopP());
        }
        if (options.getStopSequences() != null && !options.getStopSequences().isEmpty()) {
            body.put("stop_sequences", options.getStopSequences());
        }
        return body;
    }

    private Map<String, Object> messageToMap(Message message) {
        if (message.getRole() == MessageRole.TOOL) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("type", "tool_result");
            result.put("tool_use_id", message.getToolCallId());
            result.put("content", message.text());
            return Map.of("role", "user", "content", List.of(result));
        }
        String role = message.getRole() == MessageRole.ASSISTANT ? "assistant" : "user";
        boolean hasToolCalls = message.getToolCalls() != null && !message.getToolCalls().isEmpty();
        if (!message.hasParts() && !hasToolCalls) {
            return Map.of("role", role, "content", message.text());
        }
        List<Map<String, Object>> blocks = new ArrayList<>();
        if (message.hasParts()) {
            for (ContentPart part : message.getParts()) {
                if (part.isImage()) {
                    blocks.add(imageBlock(part));
                } else {
                    blocks.add(Map.of("type", "text", "text", nullToEmpty(part.getText())));
                }
            }
        } else if (!message.text().isEmpty()) {
            blocks.add(Map.of("type", "text", "text", message.text()));
        }
        if (hasToolCalls) {
            for (ToolCall call : message.getToolCalls()) {
                blocks.add(Map.of("type", "tool_use", "id", call.getId(), "name", call.getName(),
                        "input", parseArguments(call.getArguments())));
            }
        }
        return Map.of("role", role, "content", blocks);
    }

    private Map<String, Object> imageBlock(ContentPart part) {
        Map<String, Object> source = new LinkedHashMap<>();
        if (part.isInlineImage()) {
            source.put("type", "base64");
            source.put("media_type", part.inlineMediaType());
            source.put("data", part.inlineData());
        } else {
            source.put("type", "url");
            source.put("url", part.getImageUrl());
        }
        return Map.of("type", "image", "source", source);
    }

    private Map<String, Object> toolToMap(ToolDefinition tool) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", tool.getName());
        if (tool.getDescription() != null) {
            map.put("description", tool.getDescription());
        }
        map.put("input_schema", tool.getParameters());
        return map;
    }

    private Map<String, Object> toolChoice(ToolOptions options) {
        if (options.isNamedToolChoice()) {
            return Map.of("type", "tool", "name", options.getToolChoice());
        }
        switch (options.getToolChoice()) {
            case "required":
                return Map.of("type", "any");
            case "none":
                return Map.of("type", "none");
            default:
                return Map.of("type", "auto");
        }
    }

    private JsonNode parseArguments(String arguments) {
        try {
            return objectMapper.readTree(arguments == null || arguments.isBlank() ? "{}" : arguments);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool call arguments are not valid JSON", e);
        }
    }

    private CompletionResponse parseCompletion(JsonNode json, String requestedModel) {
        StringBuilder content = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode block : json.path("content")) {
            String type = text(block.path("type"));
            if ("text".equals(type)) {
                content.append(text(block.path("text")));
            } else if ("tool_use".equals(type)) {
                toolCalls.add(ToolCall.builder()
                        .id(text(block.path("id")))
                        .name(text(block.path("name")))
                        .arguments(block.has("input") ? block.get("input").toString() : "{}")
                        .build());
            }
        }
        JsonNode usage = json.path("usage");
        return CompletionResponse.builder()
                .content(content.toString())
                .model(text(json.path("model"), requestedModel))
                .usage(usage(usage.path("input_tokens"), usage.path("output_tokens")))
                .finishReason(mapStopReason(text(json.path("stop_reason"))))
                .provider(getIdentifier())
                .toolCalls(List.copyOf(toolCalls))
                .metadata(json.hasNonNull("id") ? Map.of("id", text(json.path("id"))) : Map.of())
                .build();
    }

    static FinishReason mapStopReason(String stopReason) {
        switch (stopReason) {
            case "max_tokens":
                return FinishReason.LENGTH;
            case "tool_use":
                return FinishReason.TOOL_CALLS;
            case "refusal":
                return FinishReason.CONTENT_FILTER;
            default:
                return FinishReason.STOP;
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
