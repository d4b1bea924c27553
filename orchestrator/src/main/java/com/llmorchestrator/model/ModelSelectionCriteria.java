package com.llmorchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Requirements a catalogued model must meet to serve a criteria-based configuration.
 * Zero for {@code minContextLength} or {@code maxCostInput} means no limit.
 */
@Value
@Builder
public class ModelSelectionCriteria {
    @Builder.Default
    Set<ModelCapability> capabilities = Set.of();
    @Builder.Default
    Set<AdapterType> adapterTypes = Set.of();
    int minContextLength;
    int maxCostInput;
    boolean preferLowestCost;
}
