package me.golemcore.agent.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.ModelCandidate;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.ReasoningEffort;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of selectable models loaded from {@code classpath:models.json}.
 *
 * <p>
 * The file lists models in cycling order:
 *
 * <pre>
 * {
 *   "models": [
 *     { "provider": "openai", "model": "gpt-5.1", "displayName": "GPT-5.1",
 *       "contextWindow": 400000, "reasoning": ["low", "medium", "high"] }
 *   ]
 * }
 * </pre>
 */
@Service
@Slf4j
public class ModelCatalog {

    private final RuntimeProperties properties;
    private final ObjectMapper objectMapper;
    private List<ModelCandidate> candidates = List.of();

    public ModelCatalog(RuntimeProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        load();
    }

    public void load() {
        String location = properties.getModels().getCatalog();
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            log.warn("[ModelCatalog] {} not found on classpath, catalog is empty", location);
            candidates = List.of();
            return;
        }
        try (InputStream is = resource.getInputStream()) {
            CatalogFile file = objectMapper.readValue(is, CatalogFile.class);
            candidates = toCandidates(file);
            log.info("[ModelCatalog] Loaded {} models from {}", candidates.size(), location);
        } catch (IOException e) {
            throw new SdkException(SdkError.config(ErrorCode.CONFIG_INVALID,
                    "Failed to read model catalog " + location + ": " + e.getMessage()), e);
        }
    }

    public List<ModelCandidate> getCandidates() {
        return candidates;
    }

    public Optional<ModelCandidate> find(String provider, String model) {
        return candidates.stream()
                .filter(c -> c.getProvider().equals(provider) && c.getModel().equals(model))
                .findFirst();
    }

    /**
     * Resolves the configured default, falling back to the first catalog entry.
     *
     * @throws SdkException
     *             with {@code CONFIG_MISSING} when nothing can be selected
     */
    public ModelSelection defaultSelection() {
        RuntimeProperties.ModelsProperties models = properties.getModels();
        ReasoningEffort requested = ReasoningEffort.fromValue(models.getDefaultReasoning());
        if (models.getDefaultProvider() != null && models.getDefaultModel() != null) {
            ReasoningEffort effective = find(models.getDefaultProvider(), models.getDefaultModel())
                    .map(c -> c.clamp(requested))
                    .orElse(requested);
            return new ModelSelection(models.getDefaultProvider(), models.getDefaultModel(), effective);
        }
        if (candidates.isEmpty()) {
            throw new SdkException(SdkError.config(ErrorCode.CONFIG_MISSING,
                    "No model configured: set agent.models.default-provider/default-model or add models.json"));
        }
        ModelCandidate first = candidates.get(0);
        return new ModelSelection(first.getProvider(), first.getModel(), first.clamp(requested));
    }

    private List<ModelCandidate> toCandidates(CatalogFile file) {
        if (file == null || file.getModels() == null) {
            return List.of();
        }
        List<ModelCandidate> result = new ArrayList<>();
        for (CatalogEntry entry : file.getModels()) {
            if (entry.getProvider() == null || entry.getModel() == null) {
                log.warn("[ModelCatalog] Skipping entry without provider/model: {}", entry);
                continue;
            }
            ModelCandidate.ModelCandidateBuilder builder = ModelCandidate.builder()
                    .provider(entry.getProvider())
                    .model(entry.getModel())
                    .displayName(entry.getDisplayName() != null ? entry.getDisplayName() : entry.getModel())
                    .contextWindow(entry.getContextWindow());
            for (String level : entry.getReasoning()) {
                builder.reasoningLevel(ReasoningEffort.fromValue(level));
            }
            result.add(builder.build());
        }
        return Collections.unmodifiableList(result);
    }

    @Data
    public static class CatalogFile {
        private List<CatalogEntry> models = new ArrayList<>();
    }

    @Data
    public static class CatalogEntry {
        private String provider;
        private String model;
        private String displayName;
        private int contextWindow = 128000;
        private List<String> reasoning = new ArrayList<>();
    }
}
