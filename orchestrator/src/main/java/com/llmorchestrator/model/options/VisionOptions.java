package com.llmorchestrator.model.options;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Set;

@Value
@With
public class VisionOptions implements RequestOptions {

    private static final Set<String> DETAIL_LEVELS = Set.of("auto", "low", "high");

    String provider;
    String model;
    Double temperature;
    Integer maxTokens;
    String systemPrompt;
    String detail;

    @Builder(toBuilder = true)
    public VisionOptions(String provider, String model, Double temperature, Integer maxTokens,
                         String systemPrompt, String detail) {
        this.provider = provider;
        this.model = model;
        this.temperature = OptionBounds.temperature(temperature);
        this.maxTokens = OptionBounds.atLeastOne(maxTokens);
        this.systemPrompt = systemPrompt;
        this.detail = OptionBounds.oneOf(detail, DETAIL_LEVELS, "detail");
    }

    public static VisionOptions altText() {
        return VisionOptions.builder().maxTokens(100).temperature(0.5).detail("auto").build();
    }

    public static VisionOptions title() {
        return VisionOptions.builder().maxTokens(50).temperature(0.7).detail("auto").build();
    }

    public static VisionOptions detailed() {
        return VisionOptions.builder().maxTokens(500).temperature(0.7).detail("high").build();
    }

    public static VisionOptions quick() {
        return VisionOptions.builder().maxTokens(200).temperature(0.5).detail("low").build();
    }

    public static VisionOptions comprehensive() {
        return VisionOptions.builder().maxTokens(1000).temperature(0.7).detail("high").build();
    }
}
