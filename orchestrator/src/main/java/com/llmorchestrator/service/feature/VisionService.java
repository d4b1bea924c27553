package com.llmorchestrator.service.feature;

import com.llmorchestrator.model.ContentPart;
import com.llmorchestrator.model.VisionResponse;
import com.llmorchestrator.model.options.VisionOptions;
import com.llmorchestrator.service.LlmServiceManager;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Image captioning: alt text, titles and descriptions.
 */
@RequiredArgsConstructor
public class VisionService {

    static final String PROMPT_ALT_TEXT = "Generate a concise alt text for this image, under 125 characters, "
            + "focused on essential information for screen readers. Be descriptive but brief.";
    static final String PROMPT_TITLE = "Generate an SEO-optimized title for this image, under 60 characters, "
            + "that is compelling and keyword-rich for search rankings.";
    static final String PROMPT_DESCRIPTION = "Provide a comprehensive description of this image including subjects, "
            + "setting, colors, mood, composition, and notable details.";

    private static final Pattern DATA_URI = Pattern.compile("^data:image/(png|jpeg|jpg|gif|webp);base64,.*", Pattern.DOTALL);

    private final LlmServiceManager llmManager;

    public Mono<String> generateAltText(String imageUrl, VisionOptions options) {
        return analyzeImage(imageUrl, PROMPT_ALT_TEXT, withDefaults(options, 100, 0.5));
    }

    public Flux<String> generateAltText(List<String> imageUrls, VisionOptions options) {
        return batch(imageUrls, PROMPT_ALT_TEXT, withDefaults(options, 100, 0.5));
    }

    public Mono<String> generateTitle(String imageUrl, VisionOptions options) {
        return analyzeImage(imageUrl, PROMPT_TITLE, withDefaults(options, 50, 0.7));
    }

    public Flux<String> generateTitle(List<String> imageUrls, VisionOptions options) {
        return batch(imageUrls, PROMPT_TITLE, withDefaults(options, 50, 0.7));
    }

    public Mono<String> generateDescription(String imageUrl, VisionOptions options) {
        return analyzeImage(imageUrl, PROMPT_DESCRIPTION, withDefaults(options, 500, 0.7));
    }

    public Flux<String> generateDescription(List<String> imageUrls, VisionOptions options) {
        return batch(imageUrls, PROMPT_DESCRIPTION, withDefaults(options, 500, 0.7));
    }

    public Mono<String> analyzeImage(String imageUrl, String prompt, VisionOptions options) {
        return analyzeImageFull(imageUrl, prompt, options).map(VisionResponse::getDescription);
    }

    public Mono<VisionResponse> analyzeImageFull(String imageUrl, String prompt, VisionOptions options) {
        try {
            validateImageUrl(imageUrl);
        } catch (IllegalArgumentException e) {
            return Mono.error(e);
        }
        VisionOptions resolved = options != null ? options : VisionOptions.builder().build();
        String detail = resolved.getDetail() != null ? resolved.getDetail() : "auto";
        return llmManager.analyzeImage(List.of(ContentPart.text(prompt), ContentPart.image(imageUrl, detail)), resolved);
    }

    private Flux<String> batch(List<String> imageUrls, String prompt, VisionOptions options) {
        return Flux.fromIterable(imageUrls).concatMap(url -> analyzeImage(url, prompt, options));
    }

    private static VisionOptions withDefaults(VisionOptions options, int maxTokens, double temperature) {
        VisionOptions base = options != null ? options : VisionOptions.builder().build();
        return base.toBuilder()
                .maxTokens(base.getMaxTokens() != null ? base.getMaxTokens() : maxTokens)
                .temperature(base.getTemperature() != null ? base.getTemperature() : temperature)
                .build();
    }

    static void validateImageUrl(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new IllegalArgumentException("Image URL must not be empty");
        }
        if (imageUrl.startsWith("data:")) {
            if (!DATA_URI.matcher(imageUrl).matches()) {
                throw new IllegalArgumentException("Invalid data URI, expected data:image/{png|jpeg|gif|webp};base64,...");
            }
            return;
        }
        if (!imageUrl.startsWith("http://") && !imageUrl.startsWith("https://")) {
            throw new IllegalArgumentException("Image URL must be http(s) or a base64 data URI");
        }
    }
}
