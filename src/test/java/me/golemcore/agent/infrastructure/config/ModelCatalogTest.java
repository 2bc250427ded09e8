package me.golemcore.agent.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.ModelCandidate;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.ReasoningEffort;
import me.golemcore.agent.domain.model.SdkException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelCatalogTest {

    private RuntimeProperties properties;
    private ModelCatalog catalog;

    @BeforeEach
    void setUp() {
        properties = new RuntimeProperties();
        catalog = new ModelCatalog(properties, new ObjectMapper());
    }

    @Test
    void shouldLoadBundledCatalogInOrder() {
        catalog.load();

        List<ModelCandidate> candidates = catalog.getCandidates();
        assertEquals(4, candidates.size());
        ModelCandidate first = candidates.get(0);
        assertEquals("openai", first.getProvider());
        assertEquals("gpt-5.1", first.getModel());
        assertEquals(400000, first.getContextWindow());
        assertEquals(List.of(ReasoningEffort.MINIMAL, ReasoningEffort.LOW, ReasoningEffort.MEDIUM,
                ReasoningEffort.HIGH), first.getReasoningLevels());
        assertFalse(candidates.get(1).supportsReasoning());
    }

    @Test
    void shouldSkipIncompleteEntriesAndApplyDefaults() {
        properties.getModels().setCatalog("catalog/partial-models.json");

        catalog.load();

        List<ModelCandidate> candidates = catalog.getCandidates();
        assertEquals(2, candidates.size());
        assertEquals("llama3", candidates.get(0).getDisplayName());
        assertEquals(128000, candidates.get(0).getContextWindow());
        assertTrue(catalog.find("anthropic", "claude-opus-4-1").isPresent());
        assertTrue(catalog.find("anthropic", "missing").isEmpty());
    }

    @Test
    void shouldFailOnMalformedCatalog() {
        properties.getModels().setCatalog("catalog/broken-models.json");

        SdkException thrown = assertThrows(SdkException.class, catalog::load);
        assertEquals(ErrorCode.CONFIG_INVALID, thrown.getError().getCode());
    }

    @Test
    void shouldTreatMissingCatalogAsEmpty() {
        properties.getModels().setCatalog("catalog/absent.json");

        catalog.load();

        assertTrue(catalog.getCandidates().isEmpty());
        SdkException thrown = assertThrows(SdkException.class, catalog::defaultSelection);
        assertEquals(ErrorCode.CONFIG_MISSING, thrown.getError().getCode());
    }

    // ===== Default selection =====

    @Test
    void shouldClampConfiguredDefault() {
        properties.getModels().setDefaultProvider("openai");
        properties.getModels().setDefaultModel("gpt-4.1");
        properties.getModels().setDefaultReasoning("high");
        catalog.load();

        assertEquals(new ModelSelection("openai", "gpt-4.1", ReasoningEffort.OFF), catalog.defaultSelection());
    }

    @Test
    void shouldKeepRequestedReasoningForModelOutsideCatalog() {
        properties.getModels().setDefaultProvider("relay");
        properties.getModels().setDefaultModel("custom");
        properties.getModels().setDefaultReasoning("low");
        catalog.load();

        assertEquals(new ModelSelection("relay", "custom", ReasoningEffort.LOW), catalog.defaultSelection());
    }

    @Test
    void shouldFallBackToFirstCandidate() {
        properties.getModels().setDefaultReasoning("xhigh");
        catalog.load();

        assertEquals(new ModelSelection("openai", "gpt-5.1", ReasoningEffort.HIGH), catalog.defaultSelection());
    }
}
