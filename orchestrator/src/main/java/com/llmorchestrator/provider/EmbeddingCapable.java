package com.llmorchestrator.provider;

import com.llmorchestrator.model.EmbeddingResponse;
import com.llmorchestrator.model.options.EmbeddingOptions;
import reactor.core.publisher.Mono;

import java.util.List;

public interface EmbeddingCapable {

    Mono<EmbeddingResponse> embed(List<String> input, EmbeddingOptions options);
}
