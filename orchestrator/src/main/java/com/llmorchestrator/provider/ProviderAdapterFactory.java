package com.llmorchestrator.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.model.AdapterType;
import com.llmorchestrator.model.ProviderDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.EnumMap;
import java.util.Map;

/**
 * Builds the adapter for a provider descriptor from its {@link AdapterType}.
 */
@Slf4j
public class ProviderAdapterFactory {

    @FunctionalInterface
    public interface AdapterConstructor {
        LlmProvider create(ProviderDescriptor descriptor, WebClient.Builder webClientBuilder,
                           CredentialSource credentials, ObjectMapper objectMapper);
    }

    private final WebClient.Builder webClientBuilder;
    private final CredentialSource credentials;
    private final ObjectMapper objectMapper;
    private final Map<AdapterType, AdapterConstructor> constructors = new EnumMap<>(AdapterType.class);

    public ProviderAdapterFactory(WebClient.Builder webClientBuilder, CredentialSource credentials,
                                  ObjectMapper objectMapper) {
        this.webClientBuilder = webClientBuilder;
        this.credentials = credentials;
        this.objectMapper = objectMapper;
        constructors.put(AdapterType.OPENAI, OpenAiProvider::new);
        constructors.put(AdapterType.CUSTOM, OpenAiProvider::new);
        constructors.put(AdapterType.AZURE_OPENAI, AzureOpenAiProvider::new);
        constructors.put(AdapterType.OPENROUTER, OpenRouterProvider::new);
        constructors.put(AdapterType.MISTRAL, MistralProvider::new);
        constructors.put(AdapterType.GROQ, GroqProvider::new);
        constructors.put(AdapterType.ANTHROPIC, ClaudeProvider::new);
        constructors.put(AdapterType.GEMINI, GeminiProvider::new);
        constructors.put(AdapterType.OLLAMA, OllamaProvider::new);
    }

    /**
     * Replaces the built-in adapter for a type.
     */
    public void register(AdapterType type, AdapterConstructor constructor) {
        constructors.put(type, constructor);
    }

    public LlmProvider create(ProviderDescriptor descriptor) {
        AdapterConstructor constructor = constructors.get(descriptor.getAdapterType());
        if (constructor == null) {
            log.warn("No adapter for type {} (provider {}), using the OpenAI-compatible adapter",
                    descriptor.getAdapterType(), descriptor.getIdentifier());
            constructor = OpenAiProvider::new;
        }
        LlmProvider provider = constructor.create(descriptor, webClientBuilder, credentials, objectMapper);
        log.info("Created {} adapter for provider {}", descriptor.getAdapterType(), descriptor.getIdentifier());
        return provider;
    }
}
