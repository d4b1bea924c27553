package com.llmorchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Collectors;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {
    MessageRole role;
    String content;
    List<ContentPart> parts;
    String toolCallId;
    String name;
    List<ToolCall> toolCalls;

    public static Message system(String content) {
        return Message.builder().role(MessageRole.SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(MessageRole.USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(MessageRole.ASSISTANT).content(content).build();
    }

    public static Message tool(String toolCallId, String content) {
        return Message.builder().role(MessageRole.TOOL).toolCallId(toolCallId).content(content).build();
    }

    public static Message userWithParts(List<ContentPart> parts) {
        return Message.builder().role(MessageRole.USER).parts(List.copyOf(parts)).build();
    }

    @JsonIgnore
    public boolean hasParts() {
        return parts != null && !parts.isEmpty();
    }

    /**
     * Plain text of the message: {@code content}, or the text parts joined by newlines.
     */
    @JsonIgnore
    public String text() {
        if (content != null) {
            return content;
        }
        if (!hasParts()) {
            return "";
        }
        return parts.stream()
                .filter(p -> p.getType() == ContentPart.Type.TEXT && p.getText() != null)
                .map(ContentPart::getText)
                .collect(Collectors.joining("\n"));
    }
}
