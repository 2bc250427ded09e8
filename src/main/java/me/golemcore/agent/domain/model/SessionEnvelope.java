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

/**
 * Tagged item of the streaming call shape. Exactly one payload field is set,
 * matching {@link #type()}.
 */
public record SessionEnvelope(
        EnvelopeType type,
        TurnEvent event,
        HookMessage hookMessage,
        InstrumentationEvent instrumentation,
        RunResult result,
        SdkError error) {

    public static SessionEnvelope agent(TurnEvent event) {
        return new SessionEnvelope(EnvelopeType.AGENT, event, null, null, null, null);
    }

    public static SessionEnvelope hookMessage(HookMessage message) {
        return new SessionEnvelope(EnvelopeType.HOOK_MESSAGE, null, message, null, null, null);
    }

    public static SessionEnvelope instrumentation(InstrumentationEvent event) {
        return new SessionEnvelope(EnvelopeType.INSTRUMENTATION, null, null, event, null, null);
    }

    public static SessionEnvelope end(RunResult result) {
        return new SessionEnvelope(EnvelopeType.END, null, null, null, result, null);
    }

    public static SessionEnvelope error(SdkError error) {
        return new SessionEnvelope(EnvelopeType.ERROR, null, null, null, null, error);
    }
}
