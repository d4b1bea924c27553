package com.llmorchestrator.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.error.AuthenticationException;
import com.llmorchestrator.error.ContentFilteredException;
import com.llmorchestrator.error.LlmException;
import com.llmorchestrator.error.LlmTimeoutException;
import com.llmorchestrator.error.ProviderNotConfiguredException;
import com.llmorchestrator.error.RateLimitedException;
import com.llmorchestrator.error.TransportException;
import com.llmorchestrator.error.VendorException;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.UsageStatistics;
import com.llmorchestrator.stream.StreamDecoder;
import com.llmorchestrator.stream.StreamFraming;
import com.llmorchestrator.stream.StreamingPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.DecodingException;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Shared plumbing for HTTP adapters: client construction, per-call credential lookup,
 * vendor error mapping and tolerant JSON reading.
 * <p>
 * Adapters never retry; that is the orchestrator's job.
 */
@Slf4j
public abstract class AbstractProvider implements LlmProvider {

    protected final ProviderDescriptor descriptor;
    protected final ObjectMapper objectMapper;
    protected final WebClient webClient;
    private final CredentialSource credentials;

    protected AbstractProvider(ProviderDescriptor descriptor,
                               WebClient.Builder webClientBuilder,
                               CredentialSource credentials,
                               ObjectMapper objectMapper) {
        this.descriptor = descriptor;
        this.credentials = credentials;
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder.clone()
                .baseUrl(descriptor.effectiveEndpoint())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeaders(headers -> {
                    defaultHeaders().forEach(headers::set);
                    descriptor.getExtraHeaders().forEach(headers::set);
                })
                .build();
    }

    @Override
    public ProviderDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public boolean isAvailable() {
        return descriptor.isActive() && (!requiresCredential() || credential().isPresent());
    }

    protected boolean requiresCredential() {
        return descriptor.getAdapterType().requiresApiKey();
    }

    /**
     * Headers sent on every request regardless of configuration (for example an API version).
     */
    protected Map<String, String> defaultHeaders() {
        return Map.of();
    }

    /**
     * Puts the credential where the vendor expects it. Bearer token by default.
     */
    protected void applyAuth(HttpHeaders headers, String credential) {
        if (credential != null) {
            headers.setBearerAuth(credential);
        }
    }

    /**
     * Adds query parameters every request needs (API version, key-in-query auth).
     */
    protected void customizeUri(UriBuilder uriBuilder, String credential) {
    }

    /**
     * How a request path appears in logs. Never includes the credential.
     */
    protected String loggablePath(String path) {
        return path;
    }

    protected Mono<JsonNode> postJson(String path, Object body) {
        return Mono.defer(() -> {
            String credential = requireCredential();
            log.debug("[{}] POST {}", getIdentifier(), loggablePath(path));
            return webClient.post()
                    .uri(builder -> buildUri(builder, path, Map.of(), credential))
                    .headers(headers -> applyAuth(headers, credential))
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toException)
                    .bodyToMono(JsonNode.class)
                    .defaultIfEmpty(objectMapper.createObjectNode());
        }).onErrorMap(this::isUnmapped, this::mapTransportError);
    }

    protected Flux<String> postStream(String path, Map<String, String> query, Object body,
                                      StreamFraming framing, StreamDecoder decoder) {
        return Flux.defer(() -> {
            String credential = requireCredential();
            log.debug("[{}] POST {} (stream)", getIdentifier(), loggablePath(path));
            Flux<DataBuffer> bodyFlux = webClient.post()
                    .uri(builder -> buildUri(builder, path, query, credential))
                    .headers(headers -> applyAuth(headers, credential))
                    .accept(framing == StreamFraming.SSE ? MediaType.TEXT_EVENT_STREAM : MediaType.APPLICATION_NDJSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toException)
                    .bodyToFlux(DataBuffer.class);
            return StreamingPipeline.decode(bodyFlux, framing, decoder, getIdentifier());
        }).onErrorMap(this::isUnmapped, this::mapTransportError);
    }

    private URI buildUri(UriBuilder builder, String path, Map<String, String> query, String credential) {
        builder.path(path);
        query.forEach(builder::queryParam);
        customizeUri(builder, credential);
        return builder.build();
    }

    private String requireCredential() {
        if (!descriptor.isActive()) {
            throw new ProviderNotConfiguredException(getIdentifier());
        }
        Optional<String> credential = credential();
        if (requiresCredential() && credential.isEmpty()) {
            throw new ProviderNotConfiguredException(getIdentifier());
        }
        return credential.orElse(null);
    }

    private Optional<String> credential() {
        String ref = descriptor.getCredentialRef();
        if (ref == null || ref.isBlank()) {
            return Optional.empty();
        }
        return credentials.resolve(ref).filter(value -> !value.isBlank());
    }

    private Mono<? extends Throwable> toException(ClientResponse response) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> mapHttpError(response.statusCode().value(), response.headers().asHttpHeaders(), body));
    }

    /**
     * Maps a non-2xx vendor response to the most specific error kind.
     */
    protected LlmException mapHttpError(int status, HttpHeaders headers, String body) {
        JsonNode json = parseQuietly(body);
        String message = extractErrorMessage(json);
        log.warn("[{}] HTTP {} from provider: {}", getIdentifier(), status, message);
        if (status == 401 || status == 403) {
            return new AuthenticationException(getIdentifier(), status, message);
        }
        if (status == 429) {
            return new RateLimitedException(getIdentifier(), status, message, parseRetryAfter(headers));
        }
        if (status == 400 && isContentPolicyError(json)) {
            return new ContentFilteredException(getIdentifier(), status, message, Map.of("code", errorCode(json)));
        }
        if (status == 408) {
            return new LlmTimeoutException(getIdentifier(), status, message);
        }
        return new VendorException(getIdentifier(), status, message, status >= 500);
    }

    private boolean isUnmapped(Throwable error) {
        return !(error instanceof LlmException);
    }

    private Throwable mapTransportError(Throwable error) {
        if (error instanceof WebClientRequestException) {
            log.warn("[{}] Transport failure: {}", getIdentifier(), error.getMessage());
            return new TransportException(getIdentifier(), "Transport failure: " + error.getMessage(), error);
        }
        if (error instanceof DecodingException) {
            return new VendorException(getIdentifier(), null, "Malformed response body", false, error);
        }
        return error;
    }

    static Duration parseRetryAfter(HttpHeaders headers) {
        String millis = headers.getFirst("retry-after-ms");
        if (millis != null) {
            try {
                return Duration.ofMillis(Math.max(0L, (long) Double.parseDouble(millis.trim())));
            } catch (NumberFormatException e) {
                log.debug("Ignoring unparseable retry-after-ms header: {}", millis);
            }
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Math.max(0L, Long.parseLong(value.trim())));
        } catch (NumberFormatException e) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration wait = Duration.between(ZonedDateTime.now(at.getZone()), at);
                return wait.isNegative() ? Duration.ZERO : wait;
            } catch (DateTimeParseException ex) {
                log.debug("Ignoring unparseable Retry-After header: {}", value);
                return null;
            }
        }
    }

    private JsonNode parseQuietly(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.missingNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return objectMapper.missingNode();
        }
    }

    static String extractErrorMessage(JsonNode json) {
        JsonNode error = json.path("error");
        String message = text(error.path("message"));
        if (message.isEmpty() && error.isTextual()) {
            message = error.textValue();
        }
        if (message.isEmpty()) {
            message = text(json.path("message"));
        }
        return message.isEmpty() ? "Unknown provider error" : message;
    }

    private static String errorCode(JsonNode json) {
        JsonNode error = json.path("error");
        String code = text(error.path("code"));
        return code.isEmpty() ? text(error.path("type")) : code;
    }

    private static boolean isContentPolicyError(JsonNode json) {
        JsonNode error = json.path("error");
        String marker = (text(error.path("code")) + " " + text(error.path("type")) + " " + text(error.path("status")))
                .toLowerCase(Locale.ROOT);
        return marker.contains("content_policy") || marker.contains("content_filter") || marker.contains("safety");
    }

    /**
     * Text of a node, or an empty string when the node is missing or null.
     */
    protected static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isTextual() ? node.textValue() : node.toString();
    }

    protected static String text(JsonNode node, String fallback) {
        String value = text(node);
        return value.isEmpty() ? fallback : value;
    }

    /**
     * Usage from vendor counts. Negative counts are clamped to zero.
     */
    protected UsageStatistics usage(JsonNode prompt, JsonNode completion) {
        int promptTokens = prompt.asInt(0);
        int completionTokens = completion.asInt(0);
        if (promptTokens < 0 || completionTokens < 0) {
            log.warn("[{}] Provider reported negative token counts ({}, {}), clamping to 0",
                    getIdentifier(), promptTokens, completionTokens);
        }
        return UsageStatistics.fromTokens(Math.max(0, promptTokens), Math.max(0, completionTokens));
    }

    protected String modelOrDefault(String model) {
        return model != null && !model.isBlank() ? model : getDefaultModel();
    }
}
