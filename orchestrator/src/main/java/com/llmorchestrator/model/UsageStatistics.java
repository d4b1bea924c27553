package com.llmorchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.With;

/**
 * Token accounting for one call. Built only through {@link #fromTokens}, so the total
 * always equals prompt plus completion.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class UsageStatistics {

    public static final UsageStatistics EMPTY = new UsageStatistics(0, 0, 0, null);

    int promptTokens;
    int completionTokens;
    int totalTokens;
    @With
    Double estimatedCost;

    public static UsageStatistics fromTokens(int promptTokens, int completionTokens) {
        return fromTokens(promptTokens, completionTokens, null);
    }

    @JsonCreator
    public static UsageStatistics fromTokens(@JsonProperty("promptTokens") int promptTokens,
                                             @JsonProperty("completionTokens") int completionTokens,
                                             @JsonProperty("estimatedCost") Double estimatedCost) {
        int prompt = Math.max(0, promptTokens);
        int completion = Math.max(0, completionTokens);
        return new UsageStatistics(prompt, completion, prompt + completion, estimatedCost);
    }
}
