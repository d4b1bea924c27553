package com.llmorchestrator.service.event;

import com.llmorchestrator.service.LlmOperation;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Outcome of a call, published once per call whether it succeeded, failed or was served
 * from the cache. For streams, {@code response} is {@code null} and only the chunk and
 * character counts are reported. A stream the caller abandons is reported as
 * {@code cancelled}, with the counts delivered up to that point.
 */
@Value
@Builder
public class AfterResponseEvent {
    LlmOperation operation;
    String providerId;
    String model;
    Object response;
    Throwable error;
    Duration duration;
    boolean cached;
    int attempts;
    boolean streamed;
    boolean cancelled;
    int chunkCount;
    long characterCount;

    public boolean isSuccess() {
        return error == null && !cancelled;
    }
}
