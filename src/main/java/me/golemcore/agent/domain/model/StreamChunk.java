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
 * Canonical unit produced by a transport. Backend-specific frames are mapped
 * to chunks inside the transport; nothing past it sees wire formats.
 */
@Value
@Builder
public class StreamChunk {

    public enum Type {
        TEXT, THINKING, TOOL_CALL, USAGE, DONE
    }

    Type type;
    String text;
    ToolCall toolCall;
    UsageTotals usage;
    String stopReason;

    public static StreamChunk text(String text) {
        return StreamChunk.builder().type(Type.TEXT).text(text).build();
    }

    public static StreamChunk thinking(String text) {
        return StreamChunk.builder().type(Type.THINKING).text(text).build();
    }

    public static StreamChunk toolCall(ToolCall call) {
        return StreamChunk.builder().type(Type.TOOL_CALL).toolCall(call).build();
    }

    public static StreamChunk usage(UsageTotals usage) {
        return StreamChunk.builder().type(Type.USAGE).usage(usage).build();
    }

    public static StreamChunk done(String stopReason) {
        return StreamChunk.builder().type(Type.DONE).stopReason(stopReason).build();
    }
}
