package com.llmorchestrator.provider;

import com.llmorchestrator.error.NoProviderAvailableException;
import com.llmorchestrator.error.ProviderNotConfiguredException;
import com.llmorchestrator.error.ProviderNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Registered providers and their priorities.
 * <p>
 * Writers swap in a new immutable snapshot; readers never lock. Selection is deterministic
 * for a given snapshot.
 */
@Slf4j
public class ProviderRegistry {

    private final AtomicReference<Map<String, Registration>> snapshot =
            new AtomicReference<>(Collections.emptyMap());

    /**
     * Registers a provider. Registering the same identifier again replaces the adapter and
     * priority but keeps the original registration position.
     */
    public void register(LlmProvider provider, int priority) {
        String id = provider.getIdentifier();
        snapshot.updateAndGet(current -> {
            Map<String, Registration> next = new LinkedHashMap<>(current);
            next.put(id, new Registration(provider, priority));
            return Collections.unmodifiableMap(next);
        });
        log.info("Registered provider {} ({}) with priority {}", id, provider.getName(), priority);
    }

    public void register(LlmProvider provider) {
        register(provider, provider.getDescriptor().getPriority());
    }

    public boolean unregister(String providerId) {
        boolean[] removed = new boolean[1];
        snapshot.updateAndGet(current -> {
            removed[0] = current.containsKey(providerId);
            if (!removed[0]) {
                return current;
            }
            Map<String, Registration> next = new LinkedHashMap<>(current);
            next.remove(providerId);
            return Collections.unmodifiableMap(next);
        });
        return removed[0];
    }

    public Optional<LlmProvider> find(String providerId) {
        Registration registration = snapshot.get().get(providerId);
        return registration != null ? Optional.of(registration.provider()) : Optional.empty();
    }

    /**
     * All registered providers in registration order, active or not.
     */
    public List<LlmProvider> providers() {
        return snapshot.get().values().stream()
                .map(Registration::provider)
                .collect(Collectors.toUnmodifiableList());
    }

    public int priorityOf(String providerId) {
        Registration registration = snapshot.get().get(providerId);
        if (registration == null) {
            throw new ProviderNotFoundException(providerId);
        }
        return registration.priority();
    }

    public LlmProvider selectExplicit(String providerId) {
        Registration registration = snapshot.get().get(providerId);
        if (registration == null) {
            throw new ProviderNotFoundException(providerId);
        }
        if (!registration.provider().isAvailable()) {
            throw new ProviderNotConfiguredException(providerId);
        }
        return registration.provider();
    }

    public Optional<LlmProvider> findDefault() {
        return snapshot.get().values().stream()
                .map(Registration::provider)
                .filter(p -> p.getDescriptor().isDefaultProvider())
                .filter(LlmProvider::isAvailable)
                .findFirst();
    }

    public LlmProvider selectDefault() {
        return findDefault().orElseThrow(() -> new NoProviderAvailableException("No active default provider"));
    }

    /**
     * Active providers by descending priority; equal priorities keep registration order.
     */
    public List<LlmProvider> selectByPriority() {
        List<Registration> active = new ArrayList<>();
        for (Registration registration : snapshot.get().values()) {
            if (registration.provider().isAvailable()) {
                active.add(registration);
            }
        }
        active.sort(Comparator.comparingInt(Registration::priority).reversed());
        return active.stream().map(Registration::provider).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Selection used for every call: the explicit provider if given, else the default
     * provider, else the highest-priority active provider.
     */
    public LlmProvider resolve(String explicitProviderId) {
        if (explicitProviderId != null && !explicitProviderId.isBlank()) {
            return selectExplicit(explicitProviderId);
        }
        Optional<LlmProvider> defaultProvider = findDefault();
        if (defaultProvider.isPresent()) {
            return defaultProvider.get();
        }
        List<LlmProvider> ordered = selectByPriority();
        if (ordered.isEmpty()) {
            throw new NoProviderAvailableException("No active provider is registered");
        }
        return ordered.get(0);
    }

    private record Registration(LlmProvider provider, int priority) {
    }
}
