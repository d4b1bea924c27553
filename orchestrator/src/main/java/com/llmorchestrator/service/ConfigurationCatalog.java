package com.llmorchestrator.service;

import com.llmorchestrator.error.ConfigurationException;
import com.llmorchestrator.model.LlmConfiguration;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named configurations by identifier.
 */
@Slf4j
public class ConfigurationCatalog {

    private final Map<String, LlmConfiguration> configurations = new ConcurrentHashMap<>();

    public ConfigurationCatalog(List<LlmConfiguration> configurations) {
        configurations.forEach(this::register);
    }

    public void register(LlmConfiguration configuration) {
        configurations.put(configuration.getIdentifier(), configuration);
        log.debug("Registered configuration {} ({})", configuration.getIdentifier(),
                configuration.usesCriteriaSelection() ? "criteria" : "fixed");
    }

    public Optional<LlmConfiguration> find(String identifier) {
        return Optional.ofNullable(identifier).map(configurations::get);
    }

    /**
     * The active configuration with this identifier.
     *
     * @throws ConfigurationException if it is unknown or inactive
     */
    public LlmConfiguration require(String identifier) {
        return find(identifier)
                .filter(LlmConfiguration::isActive)
                .orElseThrow(() -> new ConfigurationException(
                        "Configuration '" + identifier + "' does not exist or is inactive", null));
    }
}
