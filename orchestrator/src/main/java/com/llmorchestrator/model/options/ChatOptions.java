package com.llmorchestrator.model.options;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Options for chat and single-prompt completions.
 * <p>
 * Numeric fields are clamped when the object is built: temperature to [0, 2],
 * topP to [0, 1], penalties to [-2, 2] and maxTokens to at least 1.
 */
@Value
@With
public class ChatOptions implements RequestOptions {

    String provider;
    String model;
    Double temperature;
    Integer maxTokens;
    Double topP;
    Double frequencyPenalty;
    Double presencePenalty;
    String systemPrompt;
    List<String> stopSequences;
    ResponseFormat responseFormat;

    @Builder(toBuilder = true)
    public ChatOptions(String provider, String model, Double temperature, Integer maxTokens, Double topP,
                       Double frequencyPenalty, Double presencePenalty, String systemPrompt,
                       List<String> stopSequences, ResponseFormat responseFormat) {
        this.provider = provider;
        this.model = model;
        this.temperature = OptionBounds.temperature(temperature);
        this.maxTokens = OptionBounds.atLeastOne(maxTokens);
        this.topP = OptionBounds.topP(topP);
        this.frequencyPenalty = OptionBounds.penalty(frequencyPenalty);
        this.presencePenalty = OptionBounds.penalty(presencePenalty);
        this.systemPrompt = systemPrompt;
        this.stopSequences = stopSequences != null ? List.copyOf(stopSequences) : null;
        this.responseFormat = responseFormat;
    }

    public static ChatOptions defaults() {
        return ChatOptions.builder().build();
    }

    public static ChatOptions factual() {
        return ChatOptions.builder().temperature(0.2).topP(0.9).build();
    }

    public static ChatOptions creative() {
        return ChatOptions.builder().temperature(1.2).topP(1.0).presencePenalty(0.6).build();
    }

    public static ChatOptions balanced() {
        return ChatOptions.builder().temperature(0.7).maxTokens(4096).build();
    }

    public static ChatOptions json() {
        return ChatOptions.builder().temperature(0.3).responseFormat(ResponseFormat.JSON).build();
    }

    public static ChatOptions code() {
        return ChatOptions.builder().temperature(0.2).maxTokens(8192).topP(0.95).frequencyPenalty(0.0).build();
    }

    public boolean wantsJson() {
        return responseFormat == ResponseFormat.JSON;
    }
}
