package com.llmorchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class TranslationResult {

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    String translation;
    String sourceLanguage;
    String targetLanguage;
    double confidence;
    UsageStatistics usage;
    @Builder.Default
    List<String> alternatives = List.of();
    @Builder.Default
    Map<String, Object> metadata = Map.of();

    public boolean isConfident() {
        return isConfident(DEFAULT_CONFIDENCE_THRESHOLD);
    }

    public boolean isConfident(double threshold) {
        return confidence >= threshold;
    }

    /**
     * Confidence heuristic derived from how the generation ended.
     */
    public static double confidenceFor(FinishReason finishReason) {
        if (finishReason == FinishReason.STOP) {
            return 0.9;
        }
        if (finishReason == FinishReason.LENGTH) {
            return 0.6;
        }
        return 0.5;
    }
}
