package com.llmorchestrator.model;

public enum ModelCapability {
    CHAT("chat"),
    COMPLETION("completion"),
    EMBEDDINGS("embeddings"),
    VISION("vision"),
    STREAMING("streaming"),
    TOOLS("tools"),
    JSON_MODE("json_mode"),
    AUDIO("audio");

    private final String value;

    ModelCapability(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ModelCapability fromValue(String value) {
        for (ModelCapability capability : values()) {
            if (capability.value.equalsIgnoreCase(value) || capability.name().equalsIgnoreCase(value)) {
                return capability;
            }
        }
        throw new IllegalArgumentException("Unknown capability: " + value);
    }
}
