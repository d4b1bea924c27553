package com.llmorchestrator.model;

import com.llmorchestrator.model.options.ChatOptions;
import lombok.Builder;
import lombok.Value;

/**
 * A named preset of chat options bound to a model.
 * <p>
 * In fixed mode the model is named directly, either by catalog identifier or by provider
 * and model id. When {@code criteria} is set the model is picked from the catalog at call
 * time instead.
 */
@Value
@Builder
public class LlmConfiguration {
    String identifier;
    String name;
    String provider;
    String model;
    ModelSelectionCriteria criteria;
    String systemPrompt;
    @Builder.Default
    double temperature = 0.7;
    @Builder.Default
    int maxTokens = 1000;
    @Builder.Default
    double topP = 1.0;
    double frequencyPenalty;
    double presencePenalty;
    @Builder.Default
    boolean active = true;

    public boolean usesCriteriaSelection() {
        return criteria != null;
    }

    public ChatOptions toChatOptions(ModelDescriptor resolvedModel) {
        return ChatOptions.builder()
                .provider(resolvedModel.getProviderId())
                .model(resolvedModel.getModelId())
                .temperature(temperature)
                .maxTokens(maxTokens)
                .topP(topP)
                .frequencyPenalty(frequencyPenalty)
                .presencePenalty(presencePenalty)
                .systemPrompt(systemPrompt != null && !systemPrompt.isBlank() ? systemPrompt : null)
                .build();
    }
}
