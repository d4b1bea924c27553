package com.llmorchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class VisionResponse {
    @Builder.Default
    String description = "";
    String model;
    @With
    @Builder.Default
    UsageStatistics usage = UsageStatistics.EMPTY;
    String provider;
    @Builder.Default
    Map<String, Object> metadata = Map.of();

    @JsonIgnore
    public String getText() {
        return description;
    }
}
