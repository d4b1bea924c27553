package com.llmorchestrator.service.feature;

/**
 * A candidate vector's position in the candidate list and its similarity to the query.
 */
public record SimilarityMatch(int index, double similarity) {
}
