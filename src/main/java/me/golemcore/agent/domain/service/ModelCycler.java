package me.golemcore.agent.domain.service;

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

import me.golemcore.agent.domain.model.CycleDirection;
import me.golemcore.agent.domain.model.CycleState;
import me.golemcore.agent.domain.model.ModelCandidate;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.ReasoningEffort;

import java.util.List;

/**
 * Model and reasoning-level cycling used by front ends (e.g. a hotkey that
 * flips through models). Pure functions over {@link CycleState}.
 */
public final class ModelCycler {

    private ModelCycler() {
    }

    /**
     * Starts a cycle positioned on {@code selection} when it is one of the
     * candidates, otherwise on the first candidate.
     */
    public static CycleState start(List<ModelCandidate> candidates, ModelSelection selection) {
        CycleState state = CycleState.of(candidates);
        if (selection == null) {
            return state;
        }
        for (ModelCandidate candidate : state.getCandidates()) {
            if (candidate.getProvider().equals(selection.provider())
                    && candidate.getModel().equals(selection.model())) {
                state = state.select(selection.provider(), selection.model());
                break;
            }
        }
        int reasoningIndex = state.getLevels().indexOf(selection.reasoning());
        if (reasoningIndex < 0) {
            return state;
        }
        return new CycleState(state.getCandidates(), state.getModelIndex(), state.getLevels(), reasoningIndex);
    }

    public static CycleState cycleModel(CycleState state, CycleDirection direction) {
        return state.cycleModel(direction);
    }

    public static CycleState cycleReasoning(CycleState state, CycleDirection direction) {
        return state.cycleReasoning(direction);
    }

    public static ReasoningEffort effectiveReasoning(CycleState state) {
        return state.effectiveReasoning();
    }

    public static ModelSelection selection(CycleState state) {
        return state.selection();
    }
}
