package com.llmorchestrator.service.feature;

import com.llmorchestrator.model.EmbeddingResponse;
import com.llmorchestrator.model.options.EmbeddingOptions;
import com.llmorchestrator.service.LlmServiceManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceTest {

    @Mock
    private LlmServiceManager llmManager;

    @InjectMocks
    private EmbeddingService service;

    @Test
    void embedReturnsFirstVector() {
        when(llmManager.embed(any(String.class), any()))
                .thenReturn(Mono.just(EmbeddingResponse.builder().embeddings(List.of(List.of(0.1, 0.2))).build()));

        StepVerifier.create(service.embed("hello", EmbeddingOptions.defaults()))
                .expectNext(List.of(0.1, 0.2))
                .verifyComplete();
    }

    @Test
    void emptyBatchSkipsProvider() {
        StepVerifier.create(service.embedBatch(List.of(), null))
                .expectNext(List.of())
                .verifyComplete();
        StepVerifier.create(service.embed("", null))
                .expectError(IllegalArgumentException.class)
                .verify();
        verifyNoInteractions(llmManager);
    }

    @Test
    void findMostSimilarRanksCandidates() {
        List<Double> query = List.of(1.0, 0.0);
        List<List<Double>> candidates = List.of(
                List.of(0.0, 1.0),
                List.of(1.0, 0.1),
                List.of(0.7, 0.7));

        List<SimilarityMatch> matches = service.findMostSimilar(query, candidates, 2);

        assertThat(matches).extracting(SimilarityMatch::index).containsExactly(1, 2);
        assertThat(matches.get(0).similarity()).isGreaterThan(matches.get(1).similarity());
    }

    @Test
    void pairwiseMatrixIsSymmetric() {
        double[][] matrix = service.pairwiseSimilarities(List.of(List.of(1.0, 0.0), List.of(0.0, 1.0), List.of(1.0, 1.0)));

        assertThat(matrix[0][0]).isEqualTo(1.0);
        assertThat(matrix[0][1]).isCloseTo(0.0, within(1e-9));
        assertThat(matrix[0][2]).isCloseTo(matrix[2][0], within(1e-12));
        assertThat(matrix[1][2]).isCloseTo(Math.sqrt(0.5), within(1e-9));
    }
}
