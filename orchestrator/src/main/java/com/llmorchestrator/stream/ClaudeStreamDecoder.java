package com.llmorchestrator.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Messages API events. Text arrives in {@code content_block_delta} events of type
 * {@code text_delta}; {@code message_stop} ends the stream.
 */
public class ClaudeStreamDecoder extends JsonStreamDecoder {

    public ClaudeStreamDecoder(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    protected StreamEvent decode(JsonNode node) {
        switch (text(node.path("type"))) {
            case "content_block_delta":
                JsonNode delta = node.path("delta");
                if ("text_delta".equals(text(delta.path("type")))) {
                    return StreamEvent.delta(text(delta.path("text")));
                }
                return StreamEvent.skip();
            case "message_stop":
                return StreamEvent.end();
            case "error":
                JsonNode error = node.path("error");
                String message = text(error.path("message"));
                boolean overloaded = "overloaded_error".equals(text(error.path("type")));
                return StreamEvent.error(message.isEmpty() ? "Unknown provider error" : message, overloaded);
            default:
                return StreamEvent.skip();
        }
    }
}
