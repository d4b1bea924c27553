package com.llmorchestrator.stream;

import com.llmorchestrator.error.VendorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import reactor.core.publisher.Flux;

/**
 * Turns a raw streaming response body into the ordered text deltas it carries.
 * <p>
 * The result is lazy and single-pass: nothing is read until subscription, and the body is
 * cancelled as soon as the vendor's end marker arrives.
 */
@Slf4j
public final class StreamingPipeline {

    private StreamingPipeline() {
    }

    public static Flux<String> decode(Flux<DataBuffer> body, StreamFraming framing,
                                      StreamDecoder decoder, String providerId) {
        return decodePayloads(framing.payloads(LineFramer.lines(body)), decoder, providerId);
    }

    static Flux<String> decodePayloads(Flux<String> payloads, StreamDecoder decoder, String providerId) {
        return payloads
                .map(decoder::decode)
                .takeUntil(StreamEvent::isEnd)
                .<String>handle((event, sink) -> {
                    if (event.isError()) {
                        log.warn("[{}] Stream error event: {}", providerId, event.getErrorMessage());
                        sink.error(new VendorException(providerId, null, event.getErrorMessage(),
                                event.isTransientError()));
                        return;
                    }
                    if (event.hasText()) {
                        sink.next(event.getText());
                    }
                });
    }
}
