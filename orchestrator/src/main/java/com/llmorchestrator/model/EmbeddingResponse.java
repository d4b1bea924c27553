package com.llmorchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.llmorchestrator.error.DimensionMismatchException;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class EmbeddingResponse {
    @Builder.Default
    List<List<Double>> embeddings = List.of();
    String model;
    @With
    @Builder.Default
    UsageStatistics usage = UsageStatistics.EMPTY;
    String provider;

    /**
     * First vector, or an empty list when the provider returned none.
     */
    @JsonIgnore
    public List<Double> vector() {
        return embeddings.isEmpty() ? List.of() : embeddings.get(0);
    }

    @JsonIgnore
    public int dimensions() {
        return vector().size();
    }

    @JsonIgnore
    public int count() {
        return embeddings.size();
    }

    public static double cosineSimilarity(List<Double> a, List<Double> b) {
        if (a.size() != b.size()) {
            throw new DimensionMismatchException(a.size(), b.size());
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Scales the vector to unit length. A zero vector is returned unchanged.
     */
    public static List<Double> normalize(List<Double> vector) {
        double sum = 0.0;
        for (double v : vector) {
            sum += v * v;
        }
        if (sum == 0.0) {
            return List.copyOf(vector);
        }
        double norm = Math.sqrt(sum);
        List<Double> result = new ArrayList<>(vector.size());
        for (double v : vector) {
            result.add(v / norm);
        }
        return List.copyOf(result);
    }
}
