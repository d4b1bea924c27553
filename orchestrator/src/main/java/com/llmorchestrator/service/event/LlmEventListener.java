package com.llmorchestrator.service.event;

/**
 * Extension hook around every orchestrated call. Invoked synchronously on the calling thread.
 */
public interface LlmEventListener {

    default void beforeRequest(BeforeRequestEvent<?> event) {
    }

    default void afterResponse(AfterResponseEvent event) {
    }
}
