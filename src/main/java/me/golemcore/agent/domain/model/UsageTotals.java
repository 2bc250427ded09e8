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
 * Running token and cost totals.
 */
@Value
@Builder
public class UsageTotals {

    public static final UsageTotals EMPTY = UsageTotals.builder().build();

    long inputTokens;
    long outputTokens;
    double cost;

    public static UsageTotals of(long inputTokens, long outputTokens) {
        return UsageTotals.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .build();
    }

    public long getTotalTokens() {
        return inputTokens + outputTokens;
    }

    public UsageTotals plus(UsageTotals other) {
        if (other == null) {
            return this;
        }
        return UsageTotals.builder()
                .inputTokens(inputTokens + other.inputTokens)
                .outputTokens(outputTokens + other.outputTokens)
                .cost(cost + other.cost)
                .build();
    }
}
