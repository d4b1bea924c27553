package com.llmorchestrator.stream;

/**
 * Turns one vendor payload into a {@link StreamEvent}.
 */
@FunctionalInterface
public interface StreamDecoder {

    StreamEvent decode(String payload);
}
