package com.llmorchestrator.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@code streamGenerateContent?alt=sse} events. There is no end marker; the stream ends with the body.
 */
public class GeminiStreamDecoder extends JsonStreamDecoder {

    public GeminiStreamDecoder(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    protected StreamEvent decode(JsonNode node) {
        if (node.has("error")) {
            return errorEvent(node.get("error"));
        }
        String blockReason = text(node.path("promptFeedback").path("blockReason"));
        if (!blockReason.isEmpty() && node.path("candidates").isEmpty()) {
            return StreamEvent.error("Prompt blocked: " + blockReason, false);
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : node.path("candidates").path(0).path("content").path("parts")) {
            sb.append(text(part.path("text")));
        }
        return sb.length() == 0 ? StreamEvent.skip() : StreamEvent.delta(sb.toString());
    }
}
