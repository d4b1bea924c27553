package com.llmorchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.error.AuthenticationException;
import com.llmorchestrator.error.ContentFilteredException;
import com.llmorchestrator.error.LlmErrorKind;
import com.llmorchestrator.error.ProviderNotConfiguredException;
import com.llmorchestrator.error.RateLimitedException;
import com.llmorchestrator.error.TransportException;
import com.llmorchestrator.error.VendorException;
import com.llmorchestrator.model.AdapterType;
import com.llmorchestrator.model.FinishReason;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.EmbeddingOptions;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiProviderTest {

    private static final String COMPLETION = "{"
            + "\"id\":\"chatcmpl-1\",\"model\":\"gpt-4o-2024-08-06\","
            + "\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"Hi there\"},"
            + "\"finish_reason\":\"length\"}],"
            + "\"usage\":{\"prompt_tokens\":12,\"completion_tokens\":3,\"total_tokens\":15}}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExchangeStubs stubs = new ExchangeStubs();

    @Test
    void parsesCompletionAndSendsBearerKey() throws Exception {
        stubs.respond(HttpStatus.OK, COMPLETION);

        StepVerifier.create(provider("sk-test").complete(List.of(Message.user("Hello")), ChatOptions.defaults()))
                .assertNext(response -> {
                    assertThat(response.getContent()).isEqualTo("Hi there");
                    assertThat(response.getModel()).isEqualTo("gpt-4o-2024-08-06");
                    assertThat(response.getUsage().getTotalTokens()).isEqualTo(15);
                    assertThat(response.getFinishReason()).isEqualTo(FinishReason.LENGTH);
                    assertThat(response.getProvider()).isEqualTo("openai");
                })
                .verifyComplete();

        ClientRequest request = stubs.lastRequest();
        assertThat(request.url().toString()).isEqualTo("https://api.openai.com/v1/chat/completions");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");
        JsonNode body = objectMapper.readTree(ExchangeStubs.bodyOf(request));
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.path("messages").path(0).path("content").asText()).isEqualTo("Hello");
    }

    @Test
    void jsonModeSetsResponseFormat() throws Exception {
        stubs.respond(HttpStatus.OK, COMPLETION);

        provider("sk-test").complete(List.of(Message.user("data")), ChatOptions.json()).block();

        JsonNode body = objectMapper.readTree(ExchangeStubs.bodyOf(stubs.lastRequest()));
        assertThat(body.path("response_format").path("type").asText()).isEqualTo("json_object");
    }

    @Test
    void missingFieldsBecomeEmptyValues() {
        stubs.respond(HttpStatus.OK, "{}");

        StepVerifier.create(provider("sk-test").complete(List.of(Message.user("Hello")), ChatOptions.defaults()))
                .assertNext(response -> {
                    assertThat(response.getContent()).isEmpty();
                    assertThat(response.getModel()).isEqualTo("gpt-4o");
                    assertThat(response.getUsage().getTotalTokens()).isZero();
                    assertThat(response.getFinishReason()).isEqualTo(FinishReason.STOP);
                    assertThat(response.getToolCalls()).isEmpty();
                })
                .verifyComplete();
    }

    @Test
    void unauthorizedMapsToAuthentication() {
        stubs.respond(HttpStatus.UNAUTHORIZED, "{\"error\":{\"message\":\"Incorrect API key provided\"}}");

        StepVerifier.create(provider("bad").complete(List.of(Message.user("Hello")), ChatOptions.defaults()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(AuthenticationException.class);
                    AuthenticationException auth = (AuthenticationException) error;
                    assertThat(auth.getKind()).isEqualTo(LlmErrorKind.AUTHENTICATION);
                    assertThat(auth.getHttpStatus()).isEqualTo(401);
                    assertThat(auth.getVendorMessage()).isEqualTo("Incorrect API key provided");
                    assertThat(auth.isRetryable()).isFalse();
                    assertThat(auth.getMessage()).doesNotContain("bad");
                })
                .verify();
    }

    @Test
    void tooManyRequestsCarriesRetryAfter() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "7");
        stubs.respond(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":{\"message\":\"Rate limit reached\"}}", headers);

        StepVerifier.create(provider("sk-test").complete(List.of(Message.user("Hello")), ChatOptions.defaults()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(RateLimitedException.class);
                    assertThat(((RateLimitedException) error).getRetryAfter()).contains(Duration.ofSeconds(7));
                    assertThat(((RateLimitedException) error).isRetryable()).isTrue();
                })
                .verify();
    }

    @Test
    void contentPolicyRejectionMapsToContentFiltered() {
        stubs.respond(HttpStatus.BAD_REQUEST,
                "{\"error\":{\"message\":\"Your request was rejected\",\"code\":\"content_policy_violation\"}}");

        StepVerifier.create(provider("sk-test").complete(List.of(Message.user("Hello")), ChatOptions.defaults()))
                .expectError(ContentFilteredException.class)
                .verify();
    }

    @Test
    void serverErrorIsTransientVendorError() {
        stubs.respond(HttpStatus.SERVICE_UNAVAILABLE, "upstream down");

        StepVerifier.create(provider("sk-test").complete(List.of(Message.user("Hello")), ChatOptions.defaults()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(VendorException.class);
                    assertThat(((VendorException) error).isRetryable()).isTrue();
                    assertThat(((VendorException) error).getVendorMessage()).isEqualTo("Unknown provider error");
                })
                .verify();
    }

    @Test
    void missingCredentialFailsBeforeAnyRequest() {
        OpenAiProvider provider = new OpenAiProvider(descriptor(), stubs.builder(), ref -> Optional.empty(), objectMapper);

        assertThat(provider.isAvailable()).isFalse();
        StepVerifier.create(provider.complete(List.of(Message.user("Hello")), ChatOptions.defaults()))
                .expectError(ProviderNotConfiguredException.class)
                .verify();
        assertThat(stubs.requests).isEmpty();
    }

    @Test
    void streamsDeltasFromSse() {
        stubs.respondStream(MediaType.TEXT_EVENT_STREAM,
                "data: {\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}\n\n"
                        + "data: {\"choices\":[{\"delta\":{\"content\":\" there\"}}]}\n\n"
                        + "data: [DONE]\n\n");

        StepVerifier.create(provider("sk-test").streamChat(List.of(Message.user("Hello")), ChatOptions.defaults()))
                .expectNext("Hi", " there")
                .verifyComplete();
    }

    @Test
    void embeddingsAreReturnedInInputOrder() {
        stubs.respond(HttpStatus.OK, "{\"model\":\"text-embedding-3-small\",\"data\":["
                + "{\"index\":1,\"embedding\":[0.3,0.4]},"
                + "{\"index\":0,\"embedding\":[0.1,0.2]}],"
                + "\"usage\":{\"prompt_tokens\":4,\"total_tokens\":4}}");

        StepVerifier.create(provider("sk-test").embed(List.of("a", "b"), EmbeddingOptions.defaults()))
                .assertNext(response -> {
                    assertThat(response.getEmbeddings()).containsExactly(List.of(0.1, 0.2), List.of(0.3, 0.4));
                    assertThat(response.getUsage().getPromptTokens()).isEqualTo(4);
                    assertThat(response.getModel()).isEqualTo("text-embedding-3-small");
                })
                .verifyComplete();
    }

    @Test
    void base64EmbeddingsAreDecodedAsLittleEndianFloats() throws Exception {
        // [1.0f, 0.0f]
        stubs.respond(HttpStatus.OK, "{\"model\":\"text-embedding-3-small\",\"data\":["
                + "{\"index\":0,\"embedding\":\"AACAPwAAAAA=\"}],"
                + "\"usage\":{\"prompt_tokens\":1,\"total_tokens\":1}}");

        StepVerifier.create(provider("sk-test").embed(List.of("a"),
                        EmbeddingOptions.builder().encodingFormat("base64").build()))
                .assertNext(response -> assertThat(response.getEmbeddings()).containsExactly(List.of(1.0, 0.0)))
                .verifyComplete();

        JsonNode body = objectMapper.readTree(ExchangeStubs.bodyOf(stubs.lastRequest()));
        assertThat(body.path("encoding_format").asText()).isEqualTo("base64");
    }

    @Test
    void embeddingWithoutVectorIsAVendorError() {
        stubs.respond(HttpStatus.OK, "{\"data\":[{\"index\":0,\"embedding\":{}}]}");

        StepVerifier.create(provider("sk-test").embed(List.of("a"), EmbeddingOptions.defaults()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(VendorException.class);
                    assertThat(((VendorException) error).isRetryable()).isFalse();
                })
                .verify();
    }

    @Test
    void truncatedBase64EmbeddingIsAVendorError() {
        stubs.respond(HttpStatus.OK, "{\"data\":[{\"index\":0,\"embedding\":\"AACAPwAA\"}]}");

        StepVerifier.create(provider("sk-test").embed(List.of("a"),
                        EmbeddingOptions.builder().encodingFormat("base64").build()))
                .expectError(VendorException.class)
                .verify();
    }

    @Test
    void connectionFailureBecomesTransportError() {
        stubs.fail(new WebClientRequestException(new ConnectException("Connection refused"), HttpMethod.POST,
                URI.create("https://api.openai.com/v1/chat/completions"), HttpHeaders.EMPTY));

        StepVerifier.create(provider("sk-test").complete(List.of(Message.user("Hello")), ChatOptions.defaults()))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(TransportException.class);
                    TransportException transport = (TransportException) error;
                    assertThat(transport.getKind()).isEqualTo(LlmErrorKind.TRANSPORT);
                    assertThat(transport.isRetryable()).isTrue();
                    assertThat(transport.getProviderId()).isEqualTo("openai");
                    assertThat(transport).hasRootCauseInstanceOf(ConnectException.class);
                })
                .verify();
    }

    private OpenAiProvider provider(String key) {
        return new OpenAiProvider(descriptor(), stubs.builder(), ref -> Optional.of(key), objectMapper);
    }

    private static ProviderDescriptor descriptor() {
        return ProviderDescriptor.builder()
                .identifier("openai")
                .adapterType(AdapterType.OPENAI)
                .credentialRef("OPENAI_API_KEY")
                .build();
    }
}
