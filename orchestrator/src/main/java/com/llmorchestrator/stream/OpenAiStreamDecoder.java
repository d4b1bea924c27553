package com.llmorchestrator.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@code chat/completions} chunks: {@code choices[0].delta.content}, ended by {@code [DONE]}.
 */
public class OpenAiStreamDecoder extends JsonStreamDecoder {

    public OpenAiStreamDecoder(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public StreamEvent decode(String payload) {
        if ("[DONE]".equals(payload.trim())) {
            return StreamEvent.end();
        }
        return super.decode(payload);
    }

    @Override
    protected StreamEvent decode(JsonNode node) {
        if (node.has("error")) {
            return errorEvent(node.get("error"));
        }
        String content = text(node.path("choices").path(0).path("delta").path("content"));
        return content.isEmpty() ? StreamEvent.skip() : StreamEvent.delta(content);
    }
}
