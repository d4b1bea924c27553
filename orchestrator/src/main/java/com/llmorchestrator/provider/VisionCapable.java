package com.llmorchestrator.provider;

import com.llmorchestrator.model.ContentPart;
import com.llmorchestrator.model.VisionResponse;
import com.llmorchestrator.model.options.VisionOptions;
import reactor.core.publisher.Mono;

import java.util.List;

public interface VisionCapable {

    List<String> DEFAULT_IMAGE_FORMATS = List.of("png", "jpeg", "jpg", "gif", "webp");

    Mono<VisionResponse> analyzeImage(List<ContentPart> content, VisionOptions options);

    default List<String> getSupportedImageFormats() {
        return DEFAULT_IMAGE_FORMATS;
    }

    /**
     * Largest accepted image in bytes.
     */
    default long getMaxImageSize() {
        return 20L * 1024 * 1024;
    }
}
