package com.llmorchestrator.model.options;

public enum ResponseFormat {
    TEXT,
    JSON,
    MARKDOWN
}
