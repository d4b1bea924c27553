package com.llmorchestrator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A tool invocation requested by the model. {@code arguments} is the raw JSON string.
 */
@Value
@Builder
@Jacksonized
public class ToolCall {
    String id;
    String name;
    String arguments;
}
