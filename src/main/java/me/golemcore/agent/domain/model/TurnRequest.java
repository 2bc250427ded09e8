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

import java.time.Duration;
import java.util.List;

/**
 * Input of one orchestrator turn.
 */
@Value
@Builder
public class TurnRequest {

    String prompt;

    @Singular
    List<Attachment> attachments;

    /** Cancels the turn when exceeded; {@code null} means no deadline. */
    Duration timeout;

    public static TurnRequest of(String prompt) {
        return TurnRequest.builder().prompt(prompt).build();
    }
}
