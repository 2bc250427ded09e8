package me.golemcore.agent.domain.model;

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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable cursor over the model candidates and reasoning levels. Every
 * operation is a total function returning a new instance; nothing here reads
 * the network or disk.
 */
public final class CycleState {

    private final List<ModelCandidate> candidates;
    private final int modelIndex;
    private final List<ReasoningEffort> levels;
    private final int reasoningIndex;

    public CycleState(List<ModelCandidate> candidates, int modelIndex, List<ReasoningEffort> levels,
            int reasoningIndex) {
        if (candidates == null || candidates.isEmpty()) {
            throw new SdkException(SdkError.config(ErrorCode.CONFIG_MISSING, "No model candidates configured"));
        }
        if (levels == null || levels.isEmpty()) {
            throw new SdkException(SdkError.config(ErrorCode.CONFIG_INVALID, "No reasoning levels configured"));
        }
        this.candidates = List.copyOf(candidates);
        this.levels = List.copyOf(levels);
        this.modelIndex = Math.floorMod(modelIndex, this.candidates.size());
        this.reasoningIndex = Math.floorMod(reasoningIndex, this.levels.size());
    }

    public static CycleState of(List<ModelCandidate> candidates) {
        return new CycleState(candidates, 0, Arrays.asList(ReasoningEffort.values()), 0);
    }

    public CycleState cycleModel(CycleDirection direction) {
        return new CycleState(candidates, modelIndex + direction.step(), levels, reasoningIndex);
    }

    public CycleState cycleReasoning(CycleDirection direction) {
        return new CycleState(candidates, modelIndex, levels, reasoningIndex + direction.step());
    }

    /**
     * Moves the cursor to the given candidate, keeping the reasoning index.
     */
    public CycleState select(String provider, String model) {
        for (int i = 0; i < candidates.size(); i++) {
            ModelCandidate candidate = candidates.get(i);
            if (candidate.getProvider().equals(provider) && candidate.getModel().equals(model)) {
                return new CycleState(candidates, i, levels, reasoningIndex);
            }
        }
        throw new SdkException(SdkError.config(ErrorCode.CONFIG_INVALID,
                "Unknown model candidate: " + provider + "/" + model));
    }

    public ModelCandidate currentCandidate() {
        return candidates.get(modelIndex);
    }

    public ReasoningEffort requestedReasoning() {
        return levels.get(reasoningIndex);
    }

    public ReasoningEffort effectiveReasoning() {
        return currentCandidate().clamp(requestedReasoning());
    }

    public ModelSelection selection() {
        ModelCandidate candidate = currentCandidate();
        return new ModelSelection(candidate.getProvider(), candidate.getModel(), effectiveReasoning());
    }

    public List<ModelCandidate> getCandidates() {
        return candidates;
    }

    public List<ReasoningEffort> getLevels() {
        return levels;
    }

    public int getModelIndex() {
        return modelIndex;
    }

    public int getReasoningIndex() {
        return reasoningIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CycleState)) {
            return false;
        }
        CycleState that = (CycleState) o;
        return modelIndex == that.modelIndex
                && reasoningIndex == that.reasoningIndex
                && candidates.equals(that.candidates)
                && levels.equals(that.levels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidates, modelIndex, levels, reasoningIndex);
    }

    @Override
    public String toString() {
        return "CycleState{" + currentCandidate().getProvider() + "/" + currentCandidate().getModel()
                + ", reasoning=" + requestedReasoning() + "}";
    }
}
