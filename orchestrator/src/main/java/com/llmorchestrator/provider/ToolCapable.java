package com.llmorchestrator.provider;

import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.options.ToolOptions;
import reactor.core.publisher.Mono;

import java.util.List;

public interface ToolCapable {

    Mono<CompletionResponse> completeWithTools(List<Message> messages, ToolOptions options);
}
