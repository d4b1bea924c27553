package com.llmorchestrator.service.feature;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.ResponseFormat;
import com.llmorchestrator.service.LlmServiceManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompletionServiceTest {

    @Mock
    private LlmServiceManager llmManager;

    private CompletionService service;

    @BeforeEach
    void setUp() {
        service = new CompletionService(llmManager, new ObjectMapper());
    }

    @Test
    void blankPromptIsRejectedWithoutCall() {
        StepVerifier.create(service.complete("  ", null))
                .expectError(IllegalArgumentException.class)
                .verify();
        verifyNoInteractions(llmManager);
    }

    @Test
    void completeJsonDecodesObject() {
        when(llmManager.complete(eq("list colors"), any(ChatOptions.class)))
                .thenReturn(Mono.just(reply("{\"colors\":[\"red\",\"blue\"],\"count\":2}")));

        StepVerifier.create(service.completeJson("list colors", null))
                .assertNext(json -> {
                    assertThat(json).containsEntry("count", 2);
                    assertThat(json.get("colors")).asList().containsExactly("red", "blue");
                })
                .verifyComplete();

        ArgumentCaptor<ChatOptions> options = ArgumentCaptor.forClass(ChatOptions.class);
        verify(llmManager).complete(eq("list colors"), options.capture());
        assertThat(options.getValue().getResponseFormat()).isEqualTo(ResponseFormat.JSON);
    }

    @Test
    void completeJsonFailsOnProse() {
        when(llmManager.complete(any(), any())).thenReturn(Mono.just(reply("Sure! Here are some colors.")));

        StepVerifier.create(service.completeJson("list colors", null))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(IllegalArgumentException.class)
                        .hasMessageStartingWith("Failed to decode JSON response"))
                .verify();
    }

    @Test
    void completeMarkdownAppendsFormattingInstruction() {
        when(llmManager.complete(any(), any())).thenReturn(Mono.just(reply("# Title")));

        StepVerifier.create(service.completeMarkdown("write", ChatOptions.builder().systemPrompt("Be brief.").build()))
                .expectNext("# Title")
                .verifyComplete();

        ArgumentCaptor<ChatOptions> options = ArgumentCaptor.forClass(ChatOptions.class);
        verify(llmManager).complete(eq("write"), options.capture());
        assertThat(options.getValue().getSystemPrompt())
                .isEqualTo("Be brief.\n\n" + CompletionService.MARKDOWN_INSTRUCTION);
        assertThat(options.getValue().getResponseFormat()).isEqualTo(ResponseFormat.MARKDOWN);
    }

    @Test
    void presetsFillOnlyMissingValues() {
        when(llmManager.complete(any(), any())).thenReturn(Mono.just(reply("ok")));

        service.completeFactual("q", null).block();
        service.completeCreative("q", ChatOptions.builder().temperature(0.9).model("m").build()).block();

        ArgumentCaptor<ChatOptions> options = ArgumentCaptor.forClass(ChatOptions.class);
        verify(llmManager, org.mockito.Mockito.times(2)).complete(eq("q"), options.capture());
        assertThat(options.getAllValues().get(0).getTemperature()).isEqualTo(0.2);
        ChatOptions creative = options.getAllValues().get(1);
        assertThat(creative.getTemperature()).isEqualTo(0.9);
        assertThat(creative.getPresencePenalty()).isEqualTo(0.6);
        assertThat(creative.getModel()).isEqualTo("m");
    }

    private static CompletionResponse reply(String content) {
        return CompletionResponse.builder().content(content).model("m").build();
    }
}
