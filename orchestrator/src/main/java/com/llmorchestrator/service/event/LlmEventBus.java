package com.llmorchestrator.service.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Invokes every listener in order. A failing listener is logged and skipped so it cannot
 * break the call or the listeners after it.
 */
@Slf4j
public class LlmEventBus {

    private final List<LlmEventListener> listeners;

    public LlmEventBus(List<LlmEventListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    public static LlmEventBus empty() {
        return new LlmEventBus(List.of());
    }

    public void publishBefore(BeforeRequestEvent<?> event) {
        for (LlmEventListener listener : listeners) {
            try {
                listener.beforeRequest(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on before-request for {}: {}",
                        listener.getClass().getSimpleName(), event.getOperation(), e.getMessage(), e);
            }
        }
    }

    public void publishAfter(AfterResponseEvent event) {
        for (LlmEventListener listener : listeners) {
            try {
                listener.afterResponse(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on after-response for {}: {}",
                        listener.getClass().getSimpleName(), event.getOperation(), e.getMessage(), e);
            }
        }
    }
}
