package com.llmorchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class CompletionResponse {
    @Builder.Default
    String content = "";
    String model;
    @With
    @Builder.Default
    UsageStatistics usage = UsageStatistics.EMPTY;
    @Builder.Default
    FinishReason finishReason = FinishReason.STOP;
    String provider;
    @Builder.Default
    List<ToolCall> toolCalls = List.of();
    @Builder.Default
    Map<String, Object> metadata = Map.of();

    @JsonIgnore
    public String getText() {
        return content;
    }

    @JsonIgnore
    public boolean isComplete() {
        return finishReason == FinishReason.STOP;
    }

    @JsonIgnore
    public boolean wasTruncated() {
        return finishReason == FinishReason.LENGTH;
    }

    @JsonIgnore
    public boolean wasFiltered() {
        return finishReason == FinishReason.CONTENT_FILTER;
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
