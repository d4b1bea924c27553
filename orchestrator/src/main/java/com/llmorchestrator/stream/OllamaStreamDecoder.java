package com.llmorchestrator.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@code api/chat} NDJSON lines: {@code message.content}, ended by {@code "done": true}.
 */
public class OllamaStreamDecoder extends JsonStreamDecoder {

    public OllamaStreamDecoder(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    protected StreamEvent decode(JsonNode node) {
        if (node.has("error")) {
            return errorEvent(node.get("error"));
        }
        String content = text(node.path("message").path("content"));
        if (node.path("done").asBoolean(false)) {
            return content.isEmpty() ? StreamEvent.end() : StreamEvent.last(content);
        }
        return content.isEmpty() ? StreamEvent.skip() : StreamEvent.delta(content);
    }
}
