package com.llmorchestrator.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.ContentPart;
import com.llmorchestrator.model.EmbeddingResponse;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.VisionResponse;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.EmbeddingOptions;
import com.llmorchestrator.model.options.ToolOptions;
import com.llmorchestrator.model.options.VisionOptions;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Azure OpenAI. Models are addressed as deployments and the key goes in the {@code api-key} header.
 */
public class AzureOpenAiProvider extends OpenAiCompatibleProvider
        implements EmbeddingCapable, VisionCapable, StreamingCapable, ToolCapable {

    private static final String DEFAULT_DEPLOYMENT = "gpt-4o";

    public AzureOpenAiProvider(ProviderDescriptor descriptor, WebClient.Builder webClientBuilder,
                               CredentialSource credentials, ObjectMapper objectMapper) {
        super(descriptor, webClientBuilder, credentials, objectMapper);
    }

    @Override
    public String getDefaultModel() {
        return DEFAULT_DEPLOYMENT;
    }

    @Override
    protected String chatPath(String model) {
        return "/openai/deployments/" + model + "/chat/completions";
    }

    @Override
    protected String embeddingsPath(String model) {
        return "/openai/deployments/" + model + "/embeddings";
    }

    @Override
    protected void applyAuth(HttpHeaders headers, String credential) {
        headers.set("api-key", credential);
    }

    @Override
    protected void customizeUri(UriBuilder uriBuilder, String credential) {
        uriBuilder.queryParam("api-version", descriptor.getApiVersion());
    }

    @Override
    public Mono<EmbeddingResponse> embed(List<String> input, EmbeddingOptions options) {
        return doEmbed(input, options);
    }

    @Override
    public Mono<VisionResponse> analyzeImage(List<ContentPart> content, VisionOptions options) {
        return doAnalyzeImage(content, options);
    }

    @Override
    public Flux<String> streamChat(List<Message> messages, ChatOptions options) {
        return doStreamChat(messages, options);
    }

    @Override
    public Mono<CompletionResponse> completeWithTools(List<Message> messages, ToolOptions options) {
        return doCompleteWithTools(messages, options);
    }
}
