package com.llmorchestrator.error;

import java.util.Map;

public class ContentFilteredException extends LlmException {

    private final Map<String, Object> metadata;

    public ContentFilteredException(String providerId, Integer httpStatus, String vendorMessage,
                                    Map<String, Object> metadata) {
        super(LlmErrorKind.CONTENT_FILTERED, "Content refused by provider policy: " + vendorMessage,
                providerId, httpStatus, vendorMessage, null);
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
