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
 * Result of a one-shot run.
 */
@Value
@Builder
public class RunResult {

    String text;
    UsageTotals usage;
    String provider;
    String model;
    String stopReason;
    long durationMs;

    public static RunResult from(TurnOutcome outcome) {
        ModelSelection selection = outcome.getSelection();
        return RunResult.builder()
                .text(outcome.getText())
                .usage(outcome.getUsage())
                .provider(selection != null ? selection.provider() : null)
                .model(selection != null ? selection.model() : null)
                .stopReason(outcome.getStopReason())
                .durationMs(outcome.getDuration() != null ? outcome.getDuration().toMillis() : 0L)
                .build();
    }
}
