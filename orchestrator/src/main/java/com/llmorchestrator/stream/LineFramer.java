package com.llmorchestrator.stream;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a chunked response body into text lines. Chunks may end anywhere, including in the
 * middle of a multi-byte character; bytes are only decoded once a full line is available.
 * <p>
 * One instance holds the state of one body and is not thread-safe.
 */
public class LineFramer {

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    /**
     * Lines of the body, without terminators. Every buffer is released once read.
     */
    public static Flux<String> lines(Flux<DataBuffer> body) {
        return Flux.defer(() -> {
            LineFramer framer = new LineFramer();
            return body.concatMapIterable(framer::feed)
                    .concatWith(Mono.fromSupplier(framer::flush));
        });
    }

    List<String> feed(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return feed(bytes);
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    public List<String> feed(byte[] bytes) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                pending.write(bytes, start, i - start);
                lines.add(takeLine());
                start = i + 1;
            }
        }
        pending.write(bytes, start, bytes.length - start);
        return lines;
    }

    /**
     * Trailing text after the last line break, or {@code null} if there is none.
     */
    public String flush() {
        if (pending.size() == 0) {
            return null;
        }
        return takeLine();
    }

    private String takeLine() {
        String line = pending.toString(StandardCharsets.UTF_8);
        pending.reset();
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        return line;
    }
}
