package com.llmorchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * A model offered by a provider. Costs are integer cents per million tokens.
 */
@Value
@Builder
public class ModelDescriptor {
    String identifier;
    String providerId;
    String modelId;
    int contextLength;
    int maxOutputTokens;
    @Builder.Default
    Set<ModelCapability> capabilities = Set.of(ModelCapability.CHAT);
    int costInput;
    int costOutput;
    boolean defaultModel;
    @Builder.Default
    boolean active = true;

    public boolean hasCapability(ModelCapability capability) {
        return capabilities.contains(capability);
    }

    /**
     * Estimated cost of the usage in major currency units.
     */
    public double estimateCost(UsageStatistics usage) {
        double cents = (usage.getPromptTokens() * (double) costInput
                + usage.getCompletionTokens() * (double) costOutput) / 1_000_000.0;
        return cents / 100.0;
    }
}
