package me.golemcore.agent.adapter.outbound.transport.protocol;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.agent.domain.model.Attachment;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.ReasoningEffort;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.model.UsageTotals;
import okhttp3.Request;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * OpenAI-compatible {@code /chat/completions} streaming.
 */
public class OpenAiChatProtocol extends AbstractJsonProtocol {

    public static final String ID = "openai-chat";
    private static final String DONE_MARKER = "[DONE]";

    public OpenAiChatProtocol(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Request buildRequest(Endpoint endpoint, ConversationState conversation, TurnOptions options) {
        ModelSelection selection = options.getSelection();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", selection.model());
        body.put("stream", true);
        body.putObject("stream_options").put("include_usage", true);
        body.put("max_completion_tokens", options.getMaxOutputTokens());
        if (selection.reasoning() != null && selection.reasoning() != ReasoningEffort.OFF) {
            body.put("reasoning_effort", selection.reasoning().wireValue());
        }

        ArrayNode messages = body.putArray("messages");
        if (conversation.getSystemPrompt() != null && !conversation.getSystemPrompt().isBlank()) {
            messages.addObject().put("role", "system").put("content", conversation.getSystemPrompt());
        }
        for (ConversationTurn turn : conversation.getTurns()) {
            messages.add(toMessage(turn));
        }

        if (!options.getTools().isEmpty()) {
            ArrayNode tools = body.putArray("tools");
            for (ToolDefinition tool : options.getTools()) {
                ObjectNode function = tools.addObject().put("type", "function").putObject("function");
                function.put("name", tool.getName());
                function.put("description", tool.getDescription());
                function.set("parameters", toJson(tool.getInputSchema()));
            }
        }
        return post(endpoint, body);
    }

    private ObjectNode toMessage(ConversationTurn turn) {
        ObjectNode message = objectMapper.createObjectNode();
        switch (turn.getRole()) {
        case USER -> {
            message.put("role", "user");
            if (turn.getAttachments().isEmpty()) {
                message.put("content", turn.getText());
            } else {
                ArrayNode content = message.putArray("content");
                content.addObject().put("type", "text").put("text", turn.getText());
                for (Attachment attachment : turn.getAttachments()) {
                    if (attachment.getType() == Attachment.Type.IMAGE) {
                        content.addObject().put("type", "image_url")
                                .putObject("image_url").put("url", dataUrl(attachment));
                    }
                }
            }
        }
        case ASSISTANT -> {
            message.put("role", "assistant");
            message.put("content", turn.getText() != null ? turn.getText() : "");
            if (!turn.getToolCalls().isEmpty()) {
                ArrayNode calls = message.putArray("tool_calls");
                for (ToolCall call : turn.getToolCalls()) {
                    ObjectNode node = calls.addObject().put("id", call.getId()).put("type", "function");
                    node.putObject("function")
                            .put("name", call.getName())
                            .put("arguments", writeArguments(call.getArguments()));
                }
            }
        }
        case TOOL -> {
            message.put("role", "tool");
            message.put("tool_call_id", turn.getToolCallId());
            message.put("content", turn.getText());
        }
        }
        return message;
    }

    @Override
    public FrameDecoder newDecoder() {
        return new Decoder();
    }

    private final class Decoder implements FrameDecoder {

        private final Map<Integer, PartialToolCall> toolCalls = new TreeMap<>();
        private String finishReason;
        private boolean done;

        @Override
        public List<StreamChunk> decode(String event, String data) {
            if (DONE_MARKER.equals(data.trim())) {
                return complete();
            }
            JsonNode frame = readFrame(data);
            if (frame.has("error")) {
                throw streamError(frame.path("error").path("message").asText(frame.path("error").toString()));
            }

            List<StreamChunk> chunks = new ArrayList<>();
            JsonNode choice = frame.path("choices").path(0);
            JsonNode delta = choice.path("delta");
            String reasoning = delta.path("reasoning_content").asText(null);
            if (reasoning != null && !reasoning.isEmpty()) {
                chunks.add(StreamChunk.thinking(reasoning));
            }
            String text = delta.path("content").asText(null);
            if (text != null && !text.isEmpty()) {
                chunks.add(StreamChunk.text(text));
            }
            for (JsonNode call : delta.path("tool_calls")) {
                int index = call.path("index").asInt(toolCalls.size());
                PartialToolCall partial = toolCalls.computeIfAbsent(index, i -> new PartialToolCall());
                if (call.hasNonNull("id")) {
                    partial.id = call.get("id").asText();
                }
                JsonNode function = call.path("function");
                if (function.hasNonNull("name")) {
                    partial.name = function.get("name").asText();
                }
                if (function.hasNonNull("arguments")) {
                    partial.arguments.append(function.get("arguments").asText());
                }
            }
            if (choice.hasNonNull("finish_reason")) {
                finishReason = choice.get("finish_reason").asText();
            }
            JsonNode usage = frame.path("usage");
            if (usage.isObject()) {
                chunks.add(StreamChunk.usage(UsageTotals.of(
                        longValue(usage, "prompt_tokens"), longValue(usage, "completion_tokens"))));
            }
            return chunks;
        }

        @Override
        public boolean isDone() {
            return done;
        }

        @Override
        public List<StreamChunk> finish() {
            if (done) {
                return List.of();
            }
            // Some compatible servers close the stream without [DONE].
            if (finishReason == null) {
                throw truncated(ID);
            }
            return complete();
        }

        private List<StreamChunk> complete() {
            done = true;
            List<StreamChunk> chunks = new ArrayList<>();
            for (PartialToolCall partial : toolCalls.values()) {
                chunks.add(StreamChunk.toolCall(ToolCall.builder()
                        .id(partial.id)
                        .name(partial.name)
                        .arguments(parseArguments(partial.arguments.toString()))
                        .build()));
            }
            toolCalls.clear();
            chunks.add(StreamChunk.done(finishReason != null ? finishReason : "stop"));
            return chunks;
        }
    }

    private static final class PartialToolCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
    }
}
