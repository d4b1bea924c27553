package com.llmorchestrator.service.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.service.LlmOperation;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequestFingerprintTest {

    private final RequestFingerprint fingerprint = new RequestFingerprint(new ObjectMapper());

    @Test
    void keyHasOperationProviderAndModel() {
        String key = fingerprint.key(LlmOperation.CHAT, "openai", "gpt-4o", Map.of("messages", List.of("hi")));

        assertThat(key).startsWith("llm:completion:openai:gpt-4o:");
        assertThat(key.substring(key.lastIndexOf(':') + 1)).hasSize(64);
        assertThat(fingerprint.key(LlmOperation.EMBEDDING, "openai", null, Map.of()))
                .startsWith("llm:embedding:openai:default:");
    }

    @Test
    void keyIgnoresMapOrderAndStreamFlag() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("messages", List.of(Message.user("hi")));
        first.put("options", Map.of("b", 2, "a", 1));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("options", Map.of("a", 1, "b", 2));
        second.put("stream", true);
        second.put("user", "someone");
        second.put("messages", List.of(Message.user("hi")));

        assertThat(fingerprint.hash(first)).isEqualTo(fingerprint.hash(second));
    }

    @Test
    void differentOptionsGiveDifferentKeys() {
        Map<String, Object> cold = Map.of("options", ChatOptions.builder().temperature(0.0).maxTokens(10).build());
        Map<String, Object> longer = Map.of("options", ChatOptions.builder().temperature(0.0).maxTokens(20).build());

        assertThat(fingerprint.hash(cold)).isNotEqualTo(fingerprint.hash(longer));
    }

    @Test
    void canonicalJsonSortsProperties() throws Exception {
        assertThat(fingerprint.canonicalJson(Map.of("z", 1, "a", Map.of("y", 2, "b", 3))))
                .isEqualTo("{\"a\":{\"b\":3,\"y\":2},\"z\":1}");
    }
}
