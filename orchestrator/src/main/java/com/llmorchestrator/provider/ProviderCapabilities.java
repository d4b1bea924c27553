package com.llmorchestrator.provider;

import com.llmorchestrator.model.ModelCapability;

import java.util.EnumSet;
import java.util.Set;

/**
 * Answers capability questions from the interfaces an adapter implements, without calling it.
 */
public final class ProviderCapabilities {

    private ProviderCapabilities() {
    }

    public static boolean supports(LlmProvider provider, ModelCapability capability) {
        switch (capability) {
            case CHAT:
            case COMPLETION:
            case JSON_MODE:
                return true;
            case EMBEDDINGS:
                return provider instanceof EmbeddingCapable;
            case VISION:
                return provider instanceof VisionCapable;
            case STREAMING:
                return provider instanceof StreamingCapable;
            case TOOLS:
                return provider instanceof ToolCapable;
            default:
                return false;
        }
    }

    public static Set<ModelCapability> of(LlmProvider provider) {
        Set<ModelCapability> result = EnumSet.noneOf(ModelCapability.class);
        for (ModelCapability capability : ModelCapability.values()) {
            if (supports(provider, capability)) {
                result.add(capability);
            }
        }
        return result;
    }
}
