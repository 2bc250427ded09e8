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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A selectable (provider, model) pair with the reasoning levels it accepts.
 */
@Value
@Builder
public class ModelCandidate {

    String provider;
    String model;
    String displayName;
    int contextWindow;

    /** Supported reasoning levels; empty when the model has no reasoning control. */
    @Singular
    List<ReasoningEffort> reasoningLevels;

    public boolean supportsReasoning() {
        return !reasoningLevels.isEmpty();
    }

    /**
     * Returns {@code requested} when supported, otherwise the nearest supported
     * level (ties resolve to the lower one). {@link ReasoningEffort#OFF} is
     * always honoured, and models without reasoning control always yield it.
     */
    public ReasoningEffort clamp(ReasoningEffort requested) {
        if (!supportsReasoning() || requested == null || requested == ReasoningEffort.OFF) {
            return ReasoningEffort.OFF;
        }
        if (reasoningLevels.contains(requested)) {
            return requested;
        }
        ReasoningEffort best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (ReasoningEffort level : reasoningLevels) {
            int distance = Math.abs(level.ordinal() - requested.ordinal());
            if (distance < bestDistance
                    || (distance == bestDistance && best != null && level.ordinal() < best.ordinal())) {
                best = level;
                bestDistance = distance;
            }
        }
        return best;
    }
}
