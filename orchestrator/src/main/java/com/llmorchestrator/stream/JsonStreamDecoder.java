package com.llmorchestrator.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Base for decoders whose payloads are JSON documents. Malformed payloads are logged and skipped.
 */
@Slf4j
public abstract class JsonStreamDecoder implements StreamDecoder {

    private final ObjectMapper objectMapper;

    protected JsonStreamDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public StreamEvent decode(String payload) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed stream payload ({} chars): {}", payload.length(), e.getOriginalMessage());
            return StreamEvent.skip();
        }
        if (node == null || node.isMissingNode()) {
            return StreamEvent.skip();
        }
        return decode(node);
    }

    protected abstract StreamEvent decode(JsonNode node);

    protected static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isTextual() ? node.textValue() : node.asText();
    }

    protected static StreamEvent errorEvent(JsonNode error) {
        String message = error.isTextual() ? error.textValue() : text(error.path("message"));
        return StreamEvent.error(message.isEmpty() ? "Unknown provider error" : message, false);
    }
}
