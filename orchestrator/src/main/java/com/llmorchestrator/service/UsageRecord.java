package com.llmorchestrator.service;

/**
 * What one completed call consumed. {@code feature} is the operation name.
 */
public record UsageRecord(String feature, String providerId, String model,
                          int promptTokens, int completionTokens, long characters, Double estimatedCost) {

    public String providerModel() {
        return providerId + ":" + (model != null ? model : "default");
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
