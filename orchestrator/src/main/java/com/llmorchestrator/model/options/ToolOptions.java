package com.llmorchestrator.model.options;

import com.llmorchestrator.model.ToolDefinition;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;
import java.util.Set;

/**
 * Chat options plus the tools the model may call.
 * {@code toolChoice} is {@code auto}, {@code none}, {@code required} or the name of one of the tools.
 */
@Value
@With
public class ToolOptions implements RequestOptions {

    private static final Set<String> TOOL_CHOICES = Set.of("auto", "none", "required");

    String provider;
    String model;
    Double temperature;
    Integer maxTokens;
    Double topP;
    Double frequencyPenalty;
    Double presencePenalty;
    String systemPrompt;
    List<String> stopSequences;
    List<ToolDefinition> tools;
    String toolChoice;
    Boolean parallelToolCalls;

    @Builder(toBuilder = true)
    public ToolOptions(String provider, String model, Double temperature, Integer maxTokens, Double topP,
                       Double frequencyPenalty, Double presencePenalty, String systemPrompt,
                       List<String> stopSequences, List<ToolDefinition> tools, String toolChoice,
                       Boolean parallelToolCalls) {
        this.provider = provider;
        this.model = model;
        this.temperature = OptionBounds.temperature(temperature);
        this.maxTokens = OptionBounds.atLeastOne(maxTokens);
        this.topP = OptionBounds.topP(topP);
        this.frequencyPenalty = OptionBounds.penalty(frequencyPenalty);
        this.presencePenalty = OptionBounds.penalty(presencePenalty);
        this.systemPrompt = systemPrompt;
        this.stopSequences = stopSequences != null ? List.copyOf(stopSequences) : null;
        this.tools = tools != null ? List.copyOf(tools) : List.of();
        this.toolChoice = validateToolChoice(toolChoice, this.tools);
        this.parallelToolCalls = parallelToolCalls;
    }

    public static ToolOptions auto(List<ToolDefinition> tools) {
        return ToolOptions.builder().tools(tools).toolChoice("auto").build();
    }

    public static ToolOptions required(List<ToolDefinition> tools) {
        return ToolOptions.builder().tools(tools).toolChoice("required").build();
    }

    public boolean isNamedToolChoice() {
        return toolChoice != null && !TOOL_CHOICES.contains(toolChoice);
    }

    /**
     * The sampling fields of these options without the tools.
     */
    public ChatOptions toChatOptions() {
        return ChatOptions.builder()
                .provider(provider)
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .topP(topP)
                .frequencyPenalty(frequencyPenalty)
                .presencePenalty(presencePenalty)
                .systemPrompt(systemPrompt)
                .stopSequences(stopSequences)
                .build();
    }

    private static String validateToolChoice(String choice, List<ToolDefinition> tools) {
        if (choice == null || TOOL_CHOICES.contains(choice)) {
            return choice;
        }
        boolean known = tools.stream().anyMatch(t -> choice.equals(t.getName()));
        if (!known) {
            throw new IllegalArgumentException(
                    "tool_choice must be auto, none, required or a defined tool name, got '" + choice + "'");
        }
        return choice;
    }
}
