package com.llmorchestrator.provider;

import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.options.ChatOptions;
import reactor.core.publisher.Flux;

import java.util.List;

public interface StreamingCapable {

    /**
     * Text deltas in the order the vendor produced them. Lazy: nothing is sent before subscription.
     */
    Flux<String> streamChat(List<Message> messages, ChatOptions options);
}
