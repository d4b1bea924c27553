package com.llmorchestrator.service;

import com.llmorchestrator.model.StreamChunk;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Iterator;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Blocking, pull-based view of a streamed completion. Holds at most one chunk ahead of the
 * reader. Single use: it can be iterated once, and closing it cancels the underlying request.
 * <p>
 * Must not be iterated on a non-blocking (event loop) thread.
 */
public class ChatStream implements Iterable<StreamChunk>, AutoCloseable {

    private final Flux<StreamChunk> chunks;
    private final Sinks.One<Boolean> closed = Sinks.one();
    private final AtomicBoolean iterated = new AtomicBoolean();

    ChatStream(Flux<StreamChunk> chunks) {
        this.chunks = chunks;
    }

    @Override
    public Iterator<StreamChunk> iterator() {
        if (!iterated.compareAndSet(false, true)) {
            throw new IllegalStateException("A chat stream can only be iterated once; start a new call to stream again");
        }
        return chunks.takeUntilOther(closed.asMono()).toIterable(1).iterator();
    }

    /**
     * Reads the remaining chunks and joins their text.
     */
    public String collectText() {
        StringBuilder sb = new StringBuilder();
        for (StreamChunk chunk : this) {
            sb.append(chunk.getDelta());
        }
        return sb.toString();
    }

    @Override
    public void close() {
        closed.tryEmitValue(Boolean.TRUE);
    }
}
