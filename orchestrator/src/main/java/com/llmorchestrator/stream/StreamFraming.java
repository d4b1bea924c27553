package com.llmorchestrator.stream;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * How event payloads are laid out on top of lines.
 */
public enum StreamFraming {

    /**
     * Server-sent events: consecutive {@code data:} lines form one payload, a blank line ends it.
     * Comments and {@code event:}, {@code id:}, {@code retry:} fields are ignored.
     */
    SSE {
        @Override
        public Flux<String> payloads(Flux<String> lines) {
            return Flux.defer(() -> {
                List<String> data = new ArrayList<>();
                return lines.concatMapIterable(line -> {
                    if (line.isEmpty()) {
                        return drain(data);
                    }
                    if (line.startsWith("data:")) {
                        String value = line.substring(5);
                        data.add(value.startsWith(" ") ? value.substring(1) : value);
                    }
                    return List.<String>of();
                }).concatWith(Mono.fromSupplier(() -> data.isEmpty() ? null : String.join("\n", data)));
            });
        }
    },

    /**
     * Newline-delimited JSON: every non-blank line is a payload.
     */
    NDJSON {
        @Override
        public Flux<String> payloads(Flux<String> lines) {
            return lines.filter(line -> !line.isBlank());
        }
    };

    public abstract Flux<String> payloads(Flux<String> lines);

    private static List<String> drain(List<String> data) {
        if (data.isEmpty()) {
            return List.of();
        }
        String payload = String.join("\n", data);
        data.clear();
        return List.of(payload);
    }
}
