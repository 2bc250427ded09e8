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
import lombok.Value;
import lombok.With;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of a conversation. The orchestrator replaces its snapshot
 * on every mutation; readers never observe a half-applied change.
 */
@Value
@Builder(toBuilder = true)
public class ConversationState {

    String systemPrompt;

    @Builder.Default
    List<ConversationTurn> turns = List.of();

    @With
    @Builder.Default
    AgentStatus status = AgentStatus.IDLE;

    @With
    ModelSelection selection;

    @With
    @Builder.Default
    UsageTotals usage = UsageTotals.EMPTY;

    public static ConversationState initial(ModelSelection selection, String systemPrompt) {
        return ConversationState.builder()
                .selection(selection)
                .systemPrompt(systemPrompt)
                .build();
    }

    public ConversationState withTurn(ConversationTurn turn) {
        List<ConversationTurn> next = new ArrayList<>(turns.size() + 1);
        next.addAll(turns);
        next.add(turn);
        return toBuilder().turns(Collections.unmodifiableList(next)).build();
    }

    public ConversationState addUsage(UsageTotals delta) {
        return withUsage(usage.plus(delta));
    }

    public boolean isRunning() {
        return status == AgentStatus.RUNNING;
    }

    public int getTurnCount() {
        return turns.size();
    }
}
