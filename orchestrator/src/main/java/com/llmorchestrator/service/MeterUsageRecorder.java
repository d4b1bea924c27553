package com.llmorchestrator.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes usage as Micrometer counters tagged by feature and {@code provider:model}.
 */
@Slf4j
@RequiredArgsConstructor
public class MeterUsageRecorder implements UsageRecorder {

    private final MeterRegistry meterRegistry;

    @Override
    public void record(UsageRecord record) {
        String model = record.providerModel();
        meterRegistry.counter("llm.usage.requests", "feature", record.feature(), "model", model).increment();
        meterRegistry.counter("llm.usage.tokens", "feature", record.feature(), "model", model, "type", "prompt")
                .increment(record.promptTokens());
        meterRegistry.counter("llm.usage.tokens", "feature", record.feature(), "model", model, "type", "completion")
                .increment(record.completionTokens());
        if (record.characters() > 0) {
            meterRegistry.counter("llm.usage.characters", "feature", record.feature(), "model", model)
                    .increment(record.characters());
        }
        if (record.estimatedCost() != null) {
            meterRegistry.counter("llm.usage.cost", "feature", record.feature(), "model", model)
                    .increment(record.estimatedCost());
        }
        log.debug("Usage {} {}: {} tokens", record.feature(), model, record.totalTokens());
    }
}
