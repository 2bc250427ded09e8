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
import me.golemcore.agent.port.outbound.HookMessageSink;
import me.golemcore.agent.port.outbound.InstrumentationSink;

import java.time.Duration;

/**
 * Per-session overrides. Unset fields fall back to the runtime configuration.
 */
@Value
@Builder(toBuilder = true)
public class SessionOptions {

    public static final SessionOptions DEFAULT = SessionOptions.builder().build();

    String sessionId;
    String systemPrompt;
    ModelSelection selection;
    Duration turnTimeout;
    HookMessageSink hookMessageSink;
    InstrumentationSink instrumentationSink;
}
