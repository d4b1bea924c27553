package com.llmorchestrator.stream;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What a single decoded payload means for the stream.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StreamEvent {

    private static final StreamEvent SKIP = new StreamEvent(null, false, null, false);
    private static final StreamEvent END = new StreamEvent(null, true, null, false);

    String text;
    boolean end;
    String errorMessage;
    boolean transientError;

    public static StreamEvent delta(String text) {
        return new StreamEvent(text, false, null, false);
    }

    /**
     * A final payload that still carries text.
     */
    public static StreamEvent last(String text) {
        return new StreamEvent(text, true, null, false);
    }

    public static StreamEvent skip() {
        return SKIP;
    }

    public static StreamEvent end() {
        return END;
    }

    public static StreamEvent error(String message, boolean transientError) {
        return new StreamEvent(null, true, message, transientError);
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public boolean isError() {
        return errorMessage != null;
    }
}
