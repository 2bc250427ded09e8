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

import java.time.Instant;
import java.util.Map;

/**
 * Diagnostic event emitted by the runtime for external observers.
 */
@Value
@Builder
public class InstrumentationEvent {

    public static final String PROMPT_START = "prompt.process.start";
    public static final String PROMPT_COMPLETE = "prompt.process.complete";
    public static final String PROMPT_ERROR = "prompt.process.error";
    public static final String HOOK_ERROR = "hook.error";
    public static final String VALIDATION_ISSUE = "extensibility.validation-issue";
    public static final String TRANSPORT_FAILOVER = "transport.failover";
    public static final String CREDENTIALS_REFRESH = "credentials.refresh";

    String type;
    String sessionId;
    Instant timestamp;

    @Singular
    Map<String, Object> attributes;

    public static InstrumentationEvent of(String type, Map<String, Object> attributes) {
        return InstrumentationEvent.builder()
                .type(type)
                .timestamp(Instant.now())
                .attributes(attributes)
                .build();
    }
}
