package com.llmorchestrator.service;

import com.llmorchestrator.model.LlmConfiguration;
import com.llmorchestrator.model.ModelCapability;
import com.llmorchestrator.model.ModelDescriptor;
import com.llmorchestrator.model.ModelSelectionCriteria;
import com.llmorchestrator.provider.LlmProvider;
import com.llmorchestrator.provider.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Picks the catalogued model a configuration runs on.
 * <p>
 * Candidates for criteria selection are active models on a registered, available provider.
 * They are ranked by provider priority (highest first), then by known total cost when the
 * criteria prefer the cheapest, then default models first, then catalog order.
 */
@Slf4j
@RequiredArgsConstructor
public class ModelSelectionService {

    private final ModelCatalog modelCatalog;
    private final ProviderRegistry registry;

    public Optional<ModelDescriptor> resolveModel(LlmConfiguration configuration) {
        if (configuration.usesCriteriaSelection()) {
            return findMatchingModel(configuration.getCriteria());
        }
        String model = configuration.getModel();
        if (model == null || model.isBlank()) {
            return Optional.empty();
        }
        Optional<ModelDescriptor> fixed = configuration.getProvider() != null
                ? modelCatalog.find(configuration.getProvider(), model)
                : modelCatalog.findByIdentifier(model);
        return fixed.filter(ModelDescriptor::isActive);
    }

    public Optional<ModelDescriptor> findMatchingModel(ModelSelectionCriteria criteria) {
        List<ModelDescriptor> candidates = findCandidates(criteria);
        if (candidates.isEmpty()) {
            log.debug("No catalogued model matches {}", criteria);
            return Optional.empty();
        }
        Comparator<ModelDescriptor> order = Comparator.comparingInt(
                (ModelDescriptor m) -> registry.priorityOf(m.getProviderId())).reversed();
        if (criteria.isPreferLowestCost()) {
            order = order.thenComparingLong(ModelSelectionService::knownTotalCost);
        }
        order = order.thenComparing(m -> !m.isDefaultModel());
        candidates.sort(order);
        return Optional.of(candidates.get(0));
    }

    /**
     * Every active model meeting the criteria, in catalog order.
     */
    public List<ModelDescriptor> findCandidates(ModelSelectionCriteria criteria) {
        return modelCatalog.activeModels().stream()
                .filter(m -> matches(m, criteria))
                .collect(Collectors.toList());
    }

    public boolean matches(ModelDescriptor model, ModelSelectionCriteria criteria) {
        Optional<LlmProvider> provider = registry.find(model.getProviderId()).filter(LlmProvider::isAvailable);
        if (provider.isEmpty()) {
            return false;
        }
        for (ModelCapability capability : criteria.getCapabilities()) {
            if (!model.hasCapability(capability)) {
                return false;
            }
        }
        if (!criteria.getAdapterTypes().isEmpty()
                && !criteria.getAdapterTypes().contains(provider.get().getDescriptor().getAdapterType())) {
            return false;
        }
        // unknown context length cannot satisfy a minimum
        if (criteria.getMinContextLength() > 0 && model.getContextLength() < criteria.getMinContextLength()) {
            return false;
        }
        // unknown cost passes
        return criteria.getMaxCostInput() <= 0 || model.getCostInput() <= criteria.getMaxCostInput();
    }

    private static long knownTotalCost(ModelDescriptor model) {
        long total = (long) model.getCostInput() + model.getCostOutput();
        return total == 0 ? Long.MAX_VALUE : total;
    }
}
