package com.llmorchestrator.model.options;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.Set;

@Value
@With
public class EmbeddingOptions implements RequestOptions {

    private static final Set<String> ENCODING_FORMATS = Set.of("float", "base64");

    String provider;
    String model;
    Integer dimensions;
    String encodingFormat;

    @Builder(toBuilder = true)
    public EmbeddingOptions(String provider, String model, Integer dimensions, String encodingFormat) {
        this.provider = provider;
        this.model = model;
        this.dimensions = OptionBounds.atLeastOne(dimensions);
        this.encodingFormat = OptionBounds.oneOf(encodingFormat, ENCODING_FORMATS, "encoding_format");
    }

    public static EmbeddingOptions defaults() {
        return EmbeddingOptions.builder().build();
    }
}
