package com.llmorchestrator.config;

import com.llmorchestrator.model.AdapterType;
import com.llmorchestrator.model.LlmConfiguration;
import com.llmorchestrator.model.ModelCapability;
import com.llmorchestrator.model.ModelDescriptor;
import com.llmorchestrator.model.ProviderDescriptor;
import com.llmorchestrator.provider.CredentialSource;
import com.llmorchestrator.provider.OllamaProvider;
import com.llmorchestrator.provider.OpenAiProvider;
import com.llmorchestrator.provider.ProviderRegistry;
import com.llmorchestrator.service.ConfigurationCatalog;
import com.llmorchestrator.service.LlmServiceManager;
import com.llmorchestrator.service.ModelCatalog;
import com.llmorchestrator.service.ModelSelectionService;
import com.llmorchestrator.service.cache.InMemoryResponseCacheStore;
import com.llmorchestrator.service.cache.ResponseCacheStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class LlmOrchestratorConfigTest {

    @Autowired
    private ProviderRegistry registry;

    @Autowired
    private ModelCatalog modelCatalog;

    @Autowired
    private ResponseCacheStore cacheStore;

    @Autowired
    private CredentialSource credentialSource;

    @Autowired
    private LlmServiceManager llmServiceManager;

    @Autowired
    private ConfigurationCatalog configurationCatalog;

    @Autowired
    private ModelSelectionService modelSelectionService;

    @Test
    void providersAreBuiltFromProperties() {
        assertThat(registry.find("primary")).get().isInstanceOf(OpenAiProvider.class);
        assertThat(registry.find("local")).get().isInstanceOf(OllamaProvider.class);
        assertThat(registry.resolve(null).getIdentifier()).isEqualTo("primary");
        assertThat(registry.selectByPriority())
                .extracting(p -> p.getIdentifier())
                .containsExactly("primary", "local");
        assertThat(llmServiceManager.getAvailableProviders()).hasSize(2);
    }

    @Test
    void modelsAreCatalogued() {
        assertThat(modelCatalog.defaultModelFor("primary", ModelCapability.CHAT)).contains("gpt-4o-mini");
        assertThat(modelCatalog.find("primary", "gpt-4o-mini")).isPresent();
    }

    @Test
    void configurationsAreLoadedAndResolvable() {
        LlmConfiguration support = configurationCatalog.require("support");
        assertThat(support.getSystemPrompt()).isEqualTo("You are a support assistant.");
        assertThat(support.getTemperature()).isEqualTo(0.2);
        assertThat(support.getMaxTokens()).isEqualTo(1000);
        assertThat(support.usesCriteriaSelection()).isFalse();
        assertThat(modelSelectionService.resolveModel(support)).map(ModelDescriptor::getModelId).contains("gpt-4o-mini");

        LlmConfiguration embedder = configurationCatalog.require("cheapest-embedder");
        assertThat(embedder.usesCriteriaSelection()).isTrue();
        assertThat(embedder.getCriteria().getCapabilities()).containsExactly(ModelCapability.EMBEDDINGS);
        assertThat(modelSelectionService.resolveModel(embedder)).map(ModelDescriptor::getProviderId).contains("primary");
    }

    @Test
    void memoryCacheAndEnvironmentCredentials() {
        assertThat(cacheStore).isInstanceOf(InMemoryResponseCacheStore.class);
        assertThat(credentialSource).isInstanceOf(EnvironmentCredentialSource.class);
        assertThat(credentialSource.resolve("TEST_PRIMARY_KEY")).contains("test-key");
        assertThat(credentialSource.resolve("NOT_CONFIGURED_ANYWHERE_KEY")).isEmpty();
        assertThat(credentialSource.resolve(" ")).isEmpty();
    }

    @Test
    void descriptorTakesDefaultFromTopLevelSetting() {
        LlmProperties.ProviderSettings settings = new LlmProperties.ProviderSettings();
        settings.setType(AdapterType.GROQ);
        settings.setTimeout(Duration.ofSeconds(5));

        ProviderDescriptor descriptor = LlmOrchestratorConfig.toDescriptor("fast", settings, "fast");

        assertThat(descriptor.getIdentifier()).isEqualTo("fast");
        assertThat(descriptor.getAdapterType()).isEqualTo(AdapterType.GROQ);
        assertThat(descriptor.isDefaultProvider()).isTrue();
        assertThat(descriptor.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(LlmOrchestratorConfig.toDescriptor("fast", settings, "other").isDefaultProvider()).isFalse();
    }
}
