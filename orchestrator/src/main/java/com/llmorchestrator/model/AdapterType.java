package com.llmorchestrator.model;

/**
 * The vendor dialect a provider speaks.
 */
public enum AdapterType {
    OPENAI("OpenAI", "https://api.openai.com/v1", true),
    ANTHROPIC("Anthropic (Claude)", "https://api.anthropic.com/v1", true),
    GEMINI("Google Gemini", "https://generativelanguage.googleapis.com/v1beta", true),
    OPENROUTER("OpenRouter", "https://openrouter.ai/api/v1", true),
    MISTRAL("Mistral AI", "https://api.mistral.ai/v1", true),
    GROQ("Groq", "https://api.groq.com/openai/v1", true),
    OLLAMA("Ollama (Local)", "http://localhost:11434", false),
    AZURE_OPENAI("Azure OpenAI", "", true),
    CUSTOM("Custom (OpenAI-compatible)", "", true);

    private final String label;
    private final String defaultEndpoint;
    private final boolean requiresApiKey;

    AdapterType(String label, String defaultEndpoint, boolean requiresApiKey) {
        this.label = label;
        this.defaultEndpoint = defaultEndpoint;
        this.requiresApiKey = requiresApiKey;
    }

    public String getLabel() {
        return label;
    }

    public String getDefaultEndpoint() {
        return defaultEndpoint;
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }
}
