package com.llmorchestrator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A function the model may call; {@code parameters} is a JSON schema object.
 */
@Value
@Builder
@Jacksonized
public class ToolDefinition {
    String name;
    String description;
    Map<String, Object> parameters;

    public Map<String, Object> getParameters() {
        return parameters != null ? parameters : Map.of("type", "object", "properties", Map.of());
    }
}
