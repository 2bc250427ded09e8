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

/**
 * Event broadcast by the orchestrator while a turn runs. {@code TURN_COMPLETE}
 * is always the last event of a turn; a failed turn emits {@code ERROR}
 * immediately before it and carries the same error.
 */
@Value
@Builder
public class TurnEvent {

    TurnEventType type;
    String turnId;
    long sequence;

    String text;
    ToolCall toolCall;
    ToolResult toolResult;

    /** Set on ERROR and on a failed TURN_COMPLETE. */
    SdkError error;

    /** Set on a successful TURN_COMPLETE. */
    TurnOutcome outcome;

    public boolean isSuccessfulCompletion() {
        return type == TurnEventType.TURN_COMPLETE && error == null;
    }
}
