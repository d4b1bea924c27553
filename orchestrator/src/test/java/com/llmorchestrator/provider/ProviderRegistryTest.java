package com.llmorchestrator.provider;

import com.llmorchestrator.error.NoProviderAvailableException;
import com.llmorchestrator.error.ProviderNotConfiguredException;
import com.llmorchestrator.error.ProviderNotFoundException;
import com.llmorchestrator.model.AdapterType;
import com.llmorchestrator.model.CompletionResponse;
import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.model.options.ChatOptions;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRegistryTest {

    private final ProviderRegistry registry = new ProviderRegistry();

    @Test
    void ordersActiveProvidersByDescendingPriority() {
        registry.register(provider("low", true, false), 5);
        registry.register(provider("high", true, false), 100);
        registry.register(provider("mid", true, false), 50);

        assertThat(ids(registry.selectByPriority())).containsExactly("high", "mid", "low");
    }

    @Test
    void equalPrioritiesKeepRegistrationOrder() {
        registry.register(provider("a", true, false), 10);
        registry.register(provider("b", true, false), 10);
        registry.register(provider("c", true, false), 10);

        for (int i = 0; i < 5; i++) {
            assertThat(ids(registry.selectByPriority())).containsExactly("a", "b", "c");
        }
    }

    @Test
    void inactiveProvidersAreSkipped() {
        registry.register(provider("top", false, false), 100);
        registry.register(provider("second", true, false), 50);

        assertThat(registry.resolve(null).getIdentifier()).isEqualTo("second");
    }

    @Test
    void defaultProviderWinsOverPriority() {
        registry.register(provider("top", true, false), 100);
        registry.register(provider("preferred", true, true), 1);

        assertThat(registry.resolve(null).getIdentifier()).isEqualTo("preferred");
        assertThat(registry.resolve("top").getIdentifier()).isEqualTo("top");
    }

    @Test
    void inactiveDefaultFallsBackToPriority() {
        registry.register(provider("preferred", false, true), 100);
        registry.register(provider("other", true, false), 1);

        assertThat(registry.findDefault()).isEmpty();
        assertThat(registry.resolve(null).getIdentifier()).isEqualTo("other");
        assertThatThrownBy(registry::selectDefault).isInstanceOf(NoProviderAvailableException.class);
    }

    @Test
    void explicitSelectionErrors() {
        registry.register(provider("off", false, false), 10);

        assertThatThrownBy(() -> registry.selectExplicit("missing")).isInstanceOf(ProviderNotFoundException.class);
        assertThatThrownBy(() -> registry.selectExplicit("off")).isInstanceOf(ProviderNotConfiguredException.class);
    }

    @Test
    void emptyRegistryHasNoProvider() {
        assertThatThrownBy(() -> registry.resolve(null)).isInstanceOf(NoProviderAvailableException.class);
    }

    @Test
    void reRegisteringKeepsPositionAndUpdatesPriority() {
        registry.register(provider("a", true, false), 10);
        registry.register(provider("b", true, false), 10);
        registry.register(provider("a", true, false), 10);

        assertThat(ids(registry.providers())).containsExactly("a", "b");

        registry.register(provider("b", true, false), 20);
        assertThat(registry.priorityOf("b")).isEqualTo(20);
        assertThat(ids(registry.selectByPriority())).containsExactly("b", "a");
    }

    @Test
    void unregisterRemovesProvider() {
        registry.register(provider("a", true, false), 10);

        assertThat(registry.unregister("a")).isTrue();
        assertThat(registry.unregister("a")).isFalse();
        assertThat(registry.find("a")).isEmpty();
    }

    @Test
    void registerWithoutPriorityUsesDescriptor() {
        LlmProvider provider = new FixedProvider(ProviderDescriptor.builder()
                .identifier("d").adapterType(AdapterType.OPENAI).priority(42).build());

        registry.register(provider);

        assertThat(registry.priorityOf("d")).isEqualTo(42);
    }

    private static List<String> ids(List<LlmProvider> providers) {
        return providers.stream().map(LlmProvider::getIdentifier).collect(Collectors.toList());
    }

    private static LlmProvider provider(String id, boolean active, boolean isDefault) {
        return new FixedProvider(ProviderDescriptor.builder()
                .identifier(id)
                .adapterType(AdapterType.OPENAI)
                .active(active)
                .defaultProvider(isDefault)
                .build());
    }

    private static final class FixedProvider implements LlmProvider {
        private final ProviderDescriptor descriptor;

        private FixedProvider(ProviderDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        @Override
        public ProviderDescriptor getDescriptor() {
            return descriptor;
        }

        @Override
        public boolean isAvailable() {
            return descriptor.isActive();
        }

        @Override
        public String getDefaultModel() {
            return "fixed";
        }

        @Override
        public Mono<CompletionResponse> complete(List<Message> messages, ChatOptions options) {
            return Mono.just(CompletionResponse.builder().content(descriptor.getIdentifier()).build());
        }
    }
}
