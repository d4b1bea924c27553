package com.llmorchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.error.VendorException;
import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.ContentPart;
import com.llmorchestrator.model.EmbeddingResponse;
import com.llmorchestrator.model.FinishReason;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.ToolCall;
import com.llmorchestrator.model.ToolDefinition;
import com.llmorchestrator.model.VisionResponse;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.EmbeddingOptions;
import com.llmorchestrator.model.options.ToolOptions;
import com.llmorchestrator.model.options.VisionOptions;
import com.llmorchestrator.stream.OpenAiStreamDecoder;
import com.llmorchestrator.stream.StreamFraming;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.FloatBuffer;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The {@code chat/completions} dialect shared by OpenAI and the vendors that copy it.
 * <p>
 * Capability methods are protected here; each concrete adapter exposes only the ones
 * its vendor supports by implementing the matching capability interface.
 */
public abstract class OpenAiCompatibleProvider extends AbstractProvider {

    protected OpenAiCompatibleProvider(ProviderDescriptor descriptor, WebClient.Builder webClientBuilder,
                                       CredentialSource credentials, ObjectMapper objectMapper) {
        super(descriptor, webClientBuilder, credentials, objectMapper);
    }

    protected String chatPath(String model) {
        return "/chat/completions";
    }

    protected String embeddingsPath(String model) {
        return "/embeddings";
    }

    protected String defaultEmbeddingModel() {
        return "text-embedding-3-small";
    }

    protected String defaultVisionModel() {
        return getDefaultModel();
    }

    @Override
    public Mono<CompletionResponse> complete(List<Message> messages, ChatOptions options) {
        String model = modelOrDefault(options.getModel());
        Map<String, Object> body = chatBody(model, messages, options);
        if (options.wantsJson()) {
            body.put("response_format", Map.of("type", "json_object"));
        }
        return postJson(chatPath(model), body).map(json -> parseCompletion(json, model));
    }

    protected Mono<CompletionResponse> doCompleteWithTools(List<Message> messages, ToolOptions options) {
        String model = modelOrDefault(options.getModel());
        Map<String, Object> body = chatBody(model, messages, options.toChatOptions());
        body.put("tools", options.getTools().stream().map(this::toolToMap).collect(Collectors.toList()));
        if (options.getToolChoice() != null) {
            body.put("tool_choice", options.isNamedToolChoice()
                    ? Map.of("type", "function", "function", Map.of("name", options.getToolChoice()))
                    : options.getToolChoice());
        }
        if (options.getParallelToolCalls() != null) {
            body.put("parallel_tool_calls", options.getParallelToolCalls());
        }
        return postJson(chatPath(model), body).map(json -> parseCompletion(json, model));
    }

    protected Flux<String> doStreamChat(List<Message> messages, ChatOptions options) {
        String model = modelOrDefault(options.getModel());
        Map<String, Object> body = chatBody(model, messages, options);
        body.put("stream", true);
        return postStream(chatPath(model), Map.of(), body, StreamFraming.SSE, new OpenAiStreamDecoder(objectMapper));
    }

    protected Mono<EmbeddingResponse> doEmbed(List<String> input, EmbeddingOptions options) {
        String model = options.getModel() != null ? options.getModel() : defaultEmbeddingModel();
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("input", input);
        if (options.getDimensions() != null) {
            body.put("dimensions", options.getDimensions());
        }
        if (options.getEncodingFormat() != null) {
            body.put("encoding_format", options.getEncodingFormat());
        }
        return postJson(embeddingsPath(model), body).map(json -> {
            List<JsonNode> data = new ArrayList<>();
            json.path("data").forEach(data::add);
            data.sort((a, b) -> Integer.compare(a.path("index").asInt(0), b.path("index").asInt(0)));
            List<List<Double>> vectors = new ArrayList<>(data.size());
            for (JsonNode item : data) {
                vectors.add(embeddingVector(item.path("embedding")));
            }
            JsonNode usage = json.path("usage");
            return EmbeddingResponse.builder()
                    .embeddings(List.copyOf(vectors))
                    .model(text(json.path("model"), model))
                    .usage(usage(usage.path("prompt_tokens"), usage.path("completion_tokens")))
                    .provider(getIdentifier())
                    .build();
        });
    }

    /**
     * A vector given either as a JSON array or, for {@code encoding_format=base64}, as
     * little-endian float32 values.
     */
    List<Double> embeddingVector(JsonNode embedding) {
        if (embedding.isArray()) {
            List<Double> vector = new ArrayList<>(embedding.size());
            embedding.forEach(v -> vector.add(v.asDouble()));
            return List.copyOf(vector);
        }
        if (embedding.isTextual()) {
            byte[] bytes;
            try {
                bytes = Base64.getDecoder().decode(embedding.asText());
            } catch (IllegalArgumentException e) {
                throw new VendorException(getIdentifier(), null, "Embedding is not valid base64", false, e);
            }
            if (bytes.length % Float.BYTES != 0) {
                throw new VendorException(getIdentifier(), null,
                        "Base64 embedding has " + bytes.length + " bytes, not a whole number of floats", false);
            }
            FloatBuffer floats = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer();
            List<Double> vector = new ArrayList<>(floats.remaining());
            while (floats.hasRemaining()) {
                vector.add((double) floats.get());
            }
            return List.copyOf(vector);
        }
        throw new VendorException(getIdentifier(), null,
                "Embedding response item has no vector (" + embedding.getNodeType() + ")", false);
    }

    protected Mono<VisionResponse> doAnalyzeImage(List<ContentPart> content, VisionOptions options) {
        String model = options.getModel() != null ? options.getModel() : defaultVisionModel();
        List<Message> messages = new ArrayList<>();
        if (options.getSystemPrompt() != null) {
            messages.add(Message.system(options.getSystemPrompt()));
        }
        String detail = options.getDetail();
        messages.add(Message.userWithParts(content.stream()
                .map(part -> part.isImage() && part.getDetail() == null && detail != null
                        ? ContentPart.image(part.getImageUrl(), detail) : part)
                .collect(Collectors.toList())));
        ChatOptions chat = ChatOptions.builder()
                .temperature(options.getTemperature())
                .maxTokens(options.getMaxTokens())
                .build();
        return postJson(chatPath(model), chatBody(model, messages, chat)).map(json -> {
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

    protected Map<String, Object> chatBody(String model, List<Message> messages, ChatOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages.stream().map(this::messageToMap).collect(Collectors.toList()));
        if (options.getTemperature() != null) {
            body.put("temperature", options.getTemperature());
        }
        if (options.getMaxTokens() != null) {
            body.put("max_tokens", options.getMaxTokens());
        }
        if (options.getTopP() != null) {
            body.put("top_p", options.getTopP());
        }
        if (options.getFrequencyPenalty() != null) {
            body.put("frequency_penalty", options.getFrequencyPenalty());
        }
        if (options.getPresencePenalty() != null) {
            body.put("presence_penalty", options.getPresencePenalty());
        }
        if (options.getStopSequences() != null && !options.getStopSequences().isEmpty()) {
            body.put("stop", options.getStopSequences());
        }
        return body;
    }

    protected Map<String, Object> messageToMap(Message message) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("role", message.getRole().getValue());
        if (message.hasParts()) {
            List<Map<String, Object>> parts = new ArrayList<>();
            for (ContentPart part : message.getParts()) {
                if (part.isImage()) {
                    Map<String, Object> image = new LinkedHashMap<>();
                    image.put("url", part.getImageUrl());
                    if (part.getDetail() != null) {
                        image.put("detail", part.getDetail());
                    }
                    parts.add(Map.of("type", "image_url", "image_url", image));
                } else {
                    parts.add(Map.of("type", "text", "text", part.getText() != null ? part.getText() : ""));
                }
            }
            map.put("content", parts);
        } else {
            map.put("content", message.getContent() != null ? message.getContent() : "");
        }
        if (message.getToolCallId() != null) {
            map.put("tool_call_id", message.getToolCallId());
        }
        if (message.getName() != null) {
            map.put("name", message.getName());
        }
        if (message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
            map.put("tool_calls", message.getToolCalls().stream()
                    .map(call -> Map.of(
                            "id", call.getId(),
                            "type", "function",
                            "function", Map.of("name", call.getName(), "arguments", call.getArguments())))
                    .collect(Collectors.toList()));
        }
        return map;
    }

    private Map<String, Object> toolToMap(ToolDefinition tool) {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", tool.getName());
        if (tool.getDescription() != null) {
            function.put("description", tool.getDescription());
        }
        function.put("parameters", tool.getParameters());
        return Map.of("type", "function", "function", function);
    }

    protected CompletionResponse parseCompletion(JsonNode json, String requestedModel) {
        JsonNode choice = json.path("choices").path(0);
        JsonNode message = choice.path("message");
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.path("function");
            toolCalls.add(ToolCall.builder()
                    .id(text(call.path("id")))
                    .name(text(function.path("name")))
                    .arguments(text(function.path("arguments"), "{}"))
                    .build());
        }
        JsonNode usage = json.path("usage");
        Map<String, Object> metadata = new HashMap<>();
        if (json.hasNonNull("id")) {
            metadata.put("id", text(json.path("id")));
        }
        return CompletionResponse.builder()
                .content(text(message.path("content")))
                .model(text(json.path("model"), requestedModel))
                .usage(usage(usage.path("prompt_tokens"), usage.path("completion_tokens")))
                .finishReason(FinishReason.fromValue(text(choice.path("finish_reason"), null)))
                .provider(getIdentifier())
                .toolCalls(List.copyOf(toolCalls))
                .metadata(Map.copyOf(metadata))
                .build();
    }
}
