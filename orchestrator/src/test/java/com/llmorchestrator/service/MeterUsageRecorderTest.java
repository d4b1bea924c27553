package com.llmorchestrator.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MeterUsageRecorderTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final MeterUsageRecorder recorder = new MeterUsageRecorder(meterRegistry);

    @Test
    void countsTokensPerFeatureAndModel() {
        recorder.record(new UsageRecord("completion", "openai", "gpt-4o", 10, 5, 0, 0.02));
        recorder.record(new UsageRecord("completion", "openai", "gpt-4o", 2, 3, 0, null));

        assertThat(meterRegistry.counter("llm.usage.requests", "feature", "completion", "model", "openai:gpt-4o").count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.counter("llm.usage.tokens", "feature", "completion", "model", "openai:gpt-4o",
                "type", "prompt").count()).isEqualTo(12.0);
        assertThat(meterRegistry.counter("llm.usage.tokens", "feature", "completion", "model", "openai:gpt-4o",
                "type", "completion").count()).isEqualTo(8.0);
        assertThat(meterRegistry.counter("llm.usage.cost", "feature", "completion", "model", "openai:gpt-4o").count())
                .isEqualTo(0.02);
    }

    @Test
    void streamsReportCharacters() {
        recorder.record(new UsageRecord("stream", "local", null, 0, 0, 42, null));

        assertThat(meterRegistry.counter("llm.usage.characters", "feature", "stream", "model", "local:default").count())
                .isEqualTo(42.0);
        assertThat(meterRegistry.find("llm.usage.cost").counters()).isEmpty();
    }
}
