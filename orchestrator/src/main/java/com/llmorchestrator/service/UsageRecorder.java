package com.llmorchestrator.service;

/**
 * Sink notified after every successful call. Best-effort: the orchestrator logs and ignores
 * anything it throws.
 */
@FunctionalInterface
public interface UsageRecorder {

    void record(UsageRecord record);
}
