package com.llmorchestrator.service.event;

import com.llmorchestrator.model.options.RequestOptions;
import com.llmorchestrator.service.LlmOperation;
import lombok.Getter;

/**
 * Published before dispatch. Listeners may replace the resolved options, including the
 * provider; they cannot cancel the call.
 */
@Getter
public class BeforeRequestEvent<O extends RequestOptions> {

    private final LlmOperation operation;
    private final String providerId;
    private final Class<O> optionsType;
    private O options;

    public BeforeRequestEvent(LlmOperation operation, String providerId, Class<O> optionsType, O options) {
        this.operation = operation;
        this.providerId = providerId;
        this.optionsType = optionsType;
        this.options = options;
    }

    public void setOptions(O options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.options = options;
    }

    /**
     * Untyped variant for listeners that handle every operation.
     */
    public void replaceOptions(RequestOptions options) {
        if (!optionsType.isInstance(options)) {
            throw new IllegalArgumentException("Expected " + optionsType.getSimpleName()
                    + " for " + operation + " but got " + (options == null ? "null" : options.getClass().getSimpleName()));
        }
        setOptions(optionsType.cast(options));
    }
}
