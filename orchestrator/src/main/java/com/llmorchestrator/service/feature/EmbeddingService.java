package com.llmorchestrator.service.feature;

import com.llmorchestrator.model.EmbeddingResponse;
import com.llmorchestrator.model.options.EmbeddingOptions;
import com.llmorchestrator.service.LlmServiceManager;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Text embeddings and vector similarity helpers.
 */
@RequiredArgsConstructor
public class EmbeddingService {

    private final LlmServiceManager llmManager;

    public Mono<List<Double>> embed(String text, EmbeddingOptions options) {
        return embedFull(text, options).map(EmbeddingResponse::vector);
    }

    public Mono<EmbeddingResponse> embedFull(String text, EmbeddingOptions options) {
        if (text == null || text.isBlank()) {
            return Mono.error(new IllegalArgumentException("Text must not be empty"));
        }
        return llmManager.embed(text, options);
    }

    /**
     * One vector per text, in input order. An empty batch yields an empty list without a call.
     */
    public Mono<List<List<Double>>> embedBatch(List<String> texts, EmbeddingOptions options) {
        if (texts == null || texts.isEmpty()) {
            return Mono.just(List.of());
        }
        return llmManager.embed(texts, options).map(EmbeddingResponse::getEmbeddings);
    }

    public double cosineSimilarity(List<Double> a, List<Double> b) {
        return EmbeddingResponse.cosineSimilarity(a, b);
    }

    /**
     * The {@code topK} candidates most similar to the query, best first.
     */
    public List<SimilarityMatch> findMostSimilar(List<Double> query, List<List<Double>> candidates, int topK) {
        List<SimilarityMatch> matches = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            matches.add(new SimilarityMatch(i, cosineSimilarity(query, candidates.get(i))));
        }
        return matches.stream()
                .sorted(Comparator.comparingDouble(SimilarityMatch::similarity).reversed())
                .limit(Math.max(0, topK))
                .collect(Collectors.toList());
    }

    public double[][] pairwiseSimilarities(List<List<Double>> vectors) {
        int n = vectors.size();
        double[][] result = new double[n][n];
        for (int i = 0; i < n; i++) {
            result[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double similarity = cosineSimilarity(vectors.get(i), vectors.get(j));
                result[i][j] = similarity;
                result[j][i] = similarity;
            }
        }
        return result;
    }

    public List<Double> normalize(List<Double> vector) {
        return EmbeddingResponse.normalize(vector);
    }
}
