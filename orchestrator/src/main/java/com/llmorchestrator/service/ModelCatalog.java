package com.llmorchestrator.service;

import com.llmorchestrator.model.ModelCapability;
import com.llmorchestrator.model.ModelDescriptor;
import com.llmorchestrator.model.UsageStatistics;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Configured models per provider: default model lookup and cost estimation.
 */
@Slf4j
public class ModelCatalog {

    private final List<ModelDescriptor> models = new CopyOnWriteArrayList<>();

    public ModelCatalog(List<ModelDescriptor> models) {
        models.forEach(this::register);
    }

    public void register(ModelDescriptor model) {
        models.removeIf(m -> m.getProviderId().equals(model.getProviderId())
                && m.getModelId().equals(model.getModelId()));
        models.add(model);
        log.debug("Catalogued model {} for provider {}", model.getModelId(), model.getProviderId());
    }

    /**
     * Active models across all providers, in catalog order.
     */
    public List<ModelDescriptor> activeModels() {
        return models.stream()
                .filter(ModelDescriptor::isActive)
                .collect(Collectors.toList());
    }

    public List<ModelDescriptor> modelsFor(String providerId) {
        return models.stream()
                .filter(m -> m.getProviderId().equals(providerId))
                .filter(ModelDescriptor::isActive)
                .collect(Collectors.toList());
    }

    public Optional<ModelDescriptor> find(String providerId, String modelId) {
        if (modelId == null) {
            return Optional.empty();
        }
        return models.stream()
                .filter(m -> m.getProviderId().equals(providerId))
                .filter(m -> modelId.equals(m.getModelId()) || modelId.equals(m.getIdentifier()))
                .findFirst();
    }

    public Optional<ModelDescriptor> findByIdentifier(String identifier) {
        return models.stream()
                .filter(m -> identifier.equals(m.getIdentifier()))
                .findFirst();
    }

    /**
     * The provider's model for a capability: one flagged default if there is one,
     * otherwise the first catalogued model having the capability.
     */
    public Optional<String> defaultModelFor(String providerId, ModelCapability capability) {
        List<ModelDescriptor> candidates = modelsFor(providerId).stream()
                .filter(m -> m.hasCapability(capability))
                .collect(Collectors.toList());
        return candidates.stream()
                .filter(ModelDescriptor::isDefaultModel)
                .findFirst()
                .or(() -> candidates.stream().findFirst())
                .map(ModelDescriptor::getModelId);
    }

    public Optional<Double> estimateCost(String providerId, String modelId, UsageStatistics usage) {
        return find(providerId, modelId).map(model -> model.estimateCost(usage));
    }
}
