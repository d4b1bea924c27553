package com.llmorchestrator.provider;

import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.options.ChatOptions;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Base contract every provider adapter implements. Optional behaviour is expressed
 * through the capability interfaces ({@link EmbeddingCapable}, {@link VisionCapable},
 * {@link StreamingCapable}, {@link ToolCapable}).
 */
public interface LlmProvider {

    ProviderDescriptor getDescriptor();

    default String getIdentifier() {
        return getDescriptor().getIdentifier();
    }

    default String getName() {
        return getDescriptor().displayName();
    }

    /**
     * Active and, when the vendor needs one, holding a usable credential.
     */
    boolean isAvailable();

    String getDefaultModel();

    Mono<CompletionResponse> complete(List<Message> messages, ChatOptions options);
}
