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
import java.util.List;

/**
 * One entry of the conversation: a user prompt, an assistant reply (possibly
 * requesting tools) or a tool result.
 */
@Value
@Builder
public class ConversationTurn {

    public enum Role {
        USER, ASSISTANT, TOOL
    }

    Role role;
    String text;

    /** Tool calls requested by an assistant turn. */
    @Singular
    List<ToolCall> toolCalls;

    /** For tool turns: the call this result answers. */
    String toolCallId;
    String toolName;

    @Singular
    List<Attachment> attachments;

    Instant timestamp;

    public static ConversationTurn user(String text, List<Attachment> attachments, Instant timestamp) {
        return ConversationTurn.builder()
                .role(Role.USER)
                .text(text)
                .attachments(attachments != null ? attachments : List.of())
                .timestamp(timestamp)
                .build();
    }

    public static ConversationTurn assistant(String text, List<ToolCall> toolCalls, Instant timestamp) {
        return ConversationTurn.builder()
                .role(Role.ASSISTANT)
                .text(text)
                .toolCalls(toolCalls != null ? toolCalls : List.of())
                .timestamp(timestamp)
                .build();
    }

    public static ConversationTurn tool(ToolCall call, ToolResult result, Instant timestamp) {
        return ConversationTurn.builder()
                .role(Role.TOOL)
                .text(result.toModelText())
                .toolCallId(call.getId())
                .toolName(call.getName())
                .timestamp(timestamp)
                .build();
    }
}
