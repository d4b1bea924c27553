package com.llmorchestrator.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.model.AdapterType;
import com.llmorchestrator.model.ContentPart;
import com.llmorchestrator.model.FinishReason;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.ToolDefinition;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.ToolOptions;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ClaudeProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExchangeStubs stubs = new ExchangeStubs();

    @Test
    void systemMessagesAreLiftedAndHeadersSet() throws Exception {
        stubs.respond(HttpStatus.OK, "{\"id\":\"msg_1\",\"model\":\"claude-sonnet-4-20250514\","
                + "\"content\":[{\"type\":\"text\",\"text\":\"Paris\"}],"
                + "\"stop_reason\":\"end_turn\",\"usage\":{\"input_tokens\":20,\"output_tokens\":1}}");

        List<Message> messages = List.of(
                Message.system("You are terse."),
                Message.system("Answer in one word."),
                Message.user("Capital of France?"));
        StepVerifier.create(provider().complete(messages, ChatOptions.builder().temperature(1.8).build()))
                .assertNext(response -> {
                    assertThat(response.getContent()).isEqualTo("Paris");
                    assertThat(response.getUsage().getPromptTokens()).isEqualTo(20);
                    assertThat(response.getFinishReason()).isEqualTo(FinishReason.STOP);
                    assertThat(response.getMetadata()).containsEntry("id", "msg_1");
                })
                .verifyComplete();

        ClientRequest request = stubs.lastRequest();
        assertThat(request.url().toString()).isEqualTo("https://api.anthropic.com/v1/messages");
        assertThat(request.headers().getFirst("x-api-key")).isEqualTo("sk-ant");
        assertThat(request.headers().getFirst("anthropic-version")).isEqualTo("2023-06-01");

        JsonNode body = objectMapper.readTree(ExchangeStubs.bodyOf(request));
        assertThat(body.path("system").asText()).isEqualTo("You are terse.\n\nAnswer in one word.");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(4096);
        assertThat(body.path("temperature").asDouble()).isEqualTo(1.0);
        assertThat(body.path("messages")).hasSize(1);
        assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("user");
    }

    @Test
    void inlineImagesBecomeBase64Blocks() throws Exception {
        stubs.respond(HttpStatus.OK, "{\"content\":[{\"type\":\"text\",\"text\":\"A cat\"}]}");

        Message message = Message.userWithParts(List.of(
                ContentPart.text("What is this?"),
                ContentPart.image("data:image/png;base64,iVBORw0KGgo=")));
        provider().complete(List.of(message), ChatOptions.defaults()).block();

        JsonNode content = objectMapper.readTree(ExchangeStubs.bodyOf(stubs.lastRequest()))
                .path("messages").path(0).path("content");
        assertThat(content.path(1).path("type").asText()).isEqualTo("image");
        assertThat(content.path(1).path("source").path("type").asText()).isEqualTo("base64");
        assertThat(content.path(1).path("source").path("media_type").asText()).isEqualTo("image/png");
        assertThat(content.path(1).path("source").path("data").asText()).isEqualTo("iVBORw0KGgo=");
    }

    @Test
    void toolUseBlocksBecomeToolCalls() throws Exception {
        stubs.respond(HttpStatus.OK, "{\"content\":[{\"type\":\"tool_use\",\"id\":\"toolu_1\","
                + "\"name\":\"get_weather\",\"input\":{\"city\":\"Berlin\"}}],\"stop_reason\":\"tool_use\"}");
        ToolDefinition weather = ToolDefinition.builder().name("get_weather").description("Current weather").build();

        StepVerifier.create(provider().completeWithTools(List.of(Message.user("Weather in Berlin?")),
                        ToolOptions.builder().tools(List.of(weather)).toolChoice("get_weather").build()))
                .assertNext(response -> {
                    assertThat(response.getFinishReason()).isEqualTo(FinishReason.TOOL_CALLS);
                    assertThat(response.getToolCalls()).hasSize(1);
                    assertThat(response.getToolCalls().get(0).getName()).isEqualTo("get_weather");
                    assertThat(response.getToolCalls().get(0).getArguments()).isEqualTo("{\"city\":\"Berlin\"}");
                })
                .verifyComplete();

        JsonNode body = objectMapper.readTree(ExchangeStubs.bodyOf(stubs.lastRequest()));
        assertThat(body.path("tools").path(0).path("input_schema").path("type").asText()).isEqualTo("object");
        assertThat(body.path("tool_choice").path("type").asText()).isEqualTo("tool");
        assertThat(body.path("tool_choice").path("name").asText()).isEqualTo("get_weather");
    }

    @Test
    void stopReasonMapping() {
        assertThat(ClaudeProvider.mapStopReason("max_tokens")).isEqualTo(FinishReason.LENGTH);
        assertThat(ClaudeProvider.mapStopReason("refusal")).isEqualTo(FinishReason.CONTENT_FILTER);
        assertThat(ClaudeProvider.mapStopReason("")).isEqualTo(FinishReason.STOP);
    }

    private ClaudeProvider provider() {
        ProviderDescriptor descriptor = ProviderDescriptor.builder()
                .identifier("claude")
                .adapterType(AdapterType.ANTHROPIC)
                .credentialRef("ANTHROPIC_API_KEY")
                .build();
        return new ClaudeProvider(descriptor, stubs.builder(), ref -> Optional.of("sk-ant"), objectMapper);
    }
}
