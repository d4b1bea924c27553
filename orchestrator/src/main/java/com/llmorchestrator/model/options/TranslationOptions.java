package com.llmorchestrator.model.options;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Map;
import java.util.Set;

@Value
@With
public class TranslationOptions implements RequestOptions {

    private static final Set<String> FORMALITIES = Set.of("default", "formal", "informal");
    private static final Set<String> DOMAINS = Set.of("general", "technical", "medical", "legal", "marketing");

    String provider;
    String model;
    Double temperature;
    Integer maxTokens;
    String formality;
    String domain;
    Map<String, String> glossary;
    String context;
    boolean preserveFormatting;

    @Builder(toBuilder = true)
    public TranslationOptions(String provider, String model, Double temperature, Integer maxTokens,
                              String formality, String domain, Map<String, String> glossary,
                              String context, Boolean preserveFormatting) {
        this.provider = provider;
        this.model = model;
        this.temperature = OptionBounds.temperature(temperature);
        this.maxTokens = OptionBounds.atLeastOne(maxTokens);
        this.formality = OptionBounds.oneOf(formality, FORMALITIES, "formality");
        this.domain = OptionBounds.oneOf(domain, DOMAINS, "domain");
        this.glossary = glossary != null ? Map.copyOf(glossary) : Map.of();
        this.context = context;
        this.preserveFormatting = preserveFormatting == null || preserveFormatting;
    }

    public static TranslationOptions defaults() {
        return TranslationOptions.builder().build();
    }

    public static TranslationOptions formal() {
        return TranslationOptions.builder().formality("formal").build();
    }

    public static TranslationOptions technical() {
        return TranslationOptions.builder().domain("technical").temperature(0.2).build();
    }
}
