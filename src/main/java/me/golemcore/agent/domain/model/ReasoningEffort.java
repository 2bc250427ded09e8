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

import java.util.Locale;

/**
 * Discrete reasoning (thinking) levels, ordered from least to most
 * deliberation.
 */
public enum ReasoningEffort {

    OFF, MINIMAL, LOW, MEDIUM, HIGH, XHIGH;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReasoningEffort fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OFF;
        }
        return ReasoningEffort.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
