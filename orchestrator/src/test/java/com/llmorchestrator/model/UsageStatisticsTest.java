package com.llmorchestrator.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UsageStatisticsTest {

    @Test
    void totalIsSumOfPromptAndCompletion() {
        UsageStatistics usage = UsageStatistics.fromTokens(120, 30);

        assertThat(usage.getTotalTokens()).isEqualTo(150);
        assertThat(usage.getEstimatedCost()).isNull();
    }

    @Test
    void negativeCountsAreClampedToZero() {
        UsageStatistics usage = UsageStatistics.fromTokens(-5, 10);

        assertThat(usage.getPromptTokens()).isZero();
        assertThat(usage.getTotalTokens()).isEqualTo(10);
    }

    @Test
    void jsonRoundTripRecomputesTotal() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        String json = "{\"promptTokens\":3,\"completionTokens\":4,\"totalTokens\":99,\"estimatedCost\":0.5}";

        UsageStatistics usage = mapper.readValue(json, UsageStatistics.class);

        assertThat(usage.getTotalTokens()).isEqualTo(7);
        assertThat(usage.getEstimatedCost()).isEqualTo(0.5);
    }

    @Test
    void unknownFinishReasonReadsAsStop() {
        assertThat(FinishReason.fromValue("something_new")).isEqualTo(FinishReason.STOP);
        assertThat(FinishReason.fromValue(null)).isEqualTo(FinishReason.STOP);
        assertThat(FinishReason.fromValue("length")).isEqualTo(FinishReason.LENGTH);
    }
}
