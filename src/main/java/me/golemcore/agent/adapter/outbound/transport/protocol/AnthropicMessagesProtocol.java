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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic {@code /v1/messages} streaming.
 */
public class AnthropicMessagesProtocol extends AbstractJsonProtocol {

    public static final String ID = "anthropic-messages";
    static final String API_VERSION = "2023-06-01";

    private static final Map<ReasoningEffort, Integer> THINKING_BUDGETS = Map.of(
            ReasoningEffort.MINIMAL, 1024,
            ReasoningEffort.LOW, 2048,
            ReasoningEffort.MEDIUM, 8192,
            ReasoningEffort.HIGH, 16384,
            ReasoningEffort.XHIGH, 32768);

    public AnthropicMessagesProtocol(ObjectMapper objectMapper) {
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
        Integer budget = selection.reasoning() != null ? THINKING_BUDGETS.get(selection.reasoning()) : null;
        // max_tokens must exceed the thinking budget
        body.put("max_tokens", budget != null ? budget + options.getMaxOutputTokens() : options.getMaxOutputTokens());
        if (budget != null) {
            body.putObject("thinking").put("type", "enabled").put("budget_tokens", budget);
        }
        if (conversation.getSystemPrompt() != null && !conversation.getSystemPrompt().isBlank()) {
            body.put("system", conversation.getSystemPrompt());
        }

        ArrayNode messages = body.putArray("messages");
        ObjectNode pendingToolResults = null;
        for (ConversationTurn turn : conversation.getTurns()) {
            if (turn.getRole() == ConversationTurn.Role.TOOL) {
                // Consecutive tool results travel in one user message.
                if (pendingToolResults == null) {
                    pendingToolResults = messages.addObject().put("role", "user");
                    pendingToolResults.putArray("content");
                }
                ((ArrayNode) pendingToolResults.get("content")).addObject()
                        .put("type", "tool_result")
                        .put("tool_use_id", turn.getToolCallId())
                        .put("content", turn.getText());
                continue;
            }
            pendingToolResults = null;
            messages.add(toMessage(turn));
        }

        if (!options.getTools().isEmpty()) {
            ArrayNode tools = body.putArray("tools");
            for (ToolDefinition tool : options.getTools()) {
                ObjectNode node = tools.addObject()
                        .put("name", tool.getName())
                        .put("description", tool.getDescription());
                node.set("input_schema", toJson(tool.getInputSchema()));
            }
        }

        Endpoint versioned = endpoint.getHeaders().containsKey("anthropic-version")
                ? endpoint
                : endpoint.toBuilder().header("anthropic-version", API_VERSION).build();
        return post(versioned, body);
    }

    private ObjectNode toMessage(ConversationTurn turn) {
        ObjectNode message = objectMapper.createObjectNode();
        ArrayNode content;
        if (turn.getRole() == ConversationTurn.Role.USER) {
            message.put("role", "user");
            content = message.putArray("content");
            for (Attachment attachment : turn.getAttachments()) {
                String type = attachment.getType() == Attachment.Type.IMAGE ? "image" : "document";
                content.addObject().put("type", type).putObject("source")
                        .put("type", "base64")
                        .put("media_type", attachment.getMimeType())
                        .put("data", base64(attachment));
            }
            content.addObject().put("type", "text").put("text", turn.getText());
            return message;
        }
        message.put("role", "assistant");
        content = message.putArray("content");
        if (turn.getText() != null && !turn.getText().isEmpty()) {
            content.addObject().put("type", "text").put("text", turn.getText());
        }
        for (ToolCall call : turn.getToolCalls()) {
            ObjectNode toolUse = content.addObject()
                    .put("type", "tool_use")
                    .put("id", call.getId())
                    .put("name", call.getName());
            toolUse.set("input", toJson(call.getArguments() != null ? call.getArguments() : Map.of()));
        }
        return message;
    }

    @Override
    public FrameDecoder newDecoder() {
        return new Decoder();
    }

    private final class Decoder implements FrameDecoder {

        private final Map<Integer, ToolBlock> toolBlocks = new HashMap<>();
        private long inputTokens;
        private String stopReason;
        private boolean done;

        @Override
        public List<StreamChunk> decode(String event, String data) {
            JsonNode frame = readFrame(data);
            String type = frame.path("type").asText(event != null ? event : "");
            List<StreamChunk> chunks = new ArrayList<>();
            switch (type) {
            case "message_start" -> inputTokens = longValue(frame.path("message").path("usage"), "input_tokens");
            case "content_block_start" -> {
                JsonNode block = frame.path("content_block");
                if ("tool_use".equals(block.path("type").asText())) {
                    toolBlocks.put(frame.path("index").asInt(),
                            new ToolBlock(block.path("id").asText(), block.path("name").asText()));
                }
            }
            case "content_block_delta" -> decodeDelta(frame, chunks);
            case "content_block_stop" -> {
                ToolBlock block = toolBlocks.remove(frame.path("index").asInt());
                if (block != null) {
                    chunks.add(StreamChunk.toolCall(ToolCall.builder()
                            .id(block.id)
                            .name(block.name)
                            .arguments(parseArguments(block.json.toString()))
                            .build()));
                }
            }
            case "message_delta" -> {
                JsonNode delta = frame.path("delta");
                if (delta.hasNonNull("stop_reason")) {
                    stopReason = delta.get("stop_reason").asText();
                }
                JsonNode usage = frame.path("usage");
                if (usage.isObject()) {
                    chunks.add(StreamChunk.usage(UsageTotals.of(inputTokens, longValue(usage, "output_tokens"))));
                }
            }
            case "message_stop" -> {
                done = true;
                chunks.add(StreamChunk.done(stopReason != null ? stopReason : "end_turn"));
            }
            case "error" -> throw streamError(frame.path("error").path("type").asText("error") + ": "
                    + frame.path("error").path("message").asText());
            default -> {
                // ping and unknown events carry nothing
            }
            }
            return chunks;
        }

        private void decodeDelta(JsonNode frame, List<StreamChunk> chunks) {
            JsonNode delta = frame.path("delta");
            switch (delta.path("type").asText()) {
            case "text_delta" -> chunks.add(StreamChunk.text(delta.path("text").asText()));
            case "thinking_delta" -> chunks.add(StreamChunk.thinking(delta.path("thinking").asText()));
            case "input_json_delta" -> {
                ToolBlock block = toolBlocks.get(frame.path("index").asInt());
                if (block != null) {
                    block.json.append(delta.path("partial_json").asText());
                }
            }
            default -> {
                // signature_delta and future delta types are ignored
            }
            }
        }

        @Override
        public boolean isDone() {
            return done;
        }

        @Override
        public List<StreamChunk> finish() {
            if (!done) {
                throw truncated(ID);
            }
            return List.of();
        }
    }

    private static final class ToolBlock {
        private final String id;
        private final String name;
        private final StringBuilder json = new StringBuilder();

        private ToolBlock(String id, String name) {
            this.id = id;
            this.name = name;
        }
    }
}
