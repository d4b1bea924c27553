package com.llmorchestrator.model;

import lombok.Value;

/**
 * One incremental piece of a streamed completion. {@code index} is zero-based.
 */
@Value
public class StreamChunk {
    String providerId;
    String model;
    int index;
    String delta;
}
