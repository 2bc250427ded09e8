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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.agent.domain.model.Attachment;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.model.UsageTotals;
import okhttp3.Request;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical frames exchanged with an app relay. The relay receives the whole
 * conversation and streams back chunks already in canonical form:
 *
 * <pre>
 * data: {"type":"text","text":"Hel"}
 * data: {"type":"tool_call","id":"c1","name":"search","arguments":{"q":"x"}}
 * data: {"type":"usage","inputTokens":12,"outputTokens":3}
 * data: {"type":"done","stopReason":"stop"}
 * data: {"type":"error","code":"OVERLOADED","message":"busy"}
 * </pre>
 */
public class RelayFrameProtocol extends AbstractJsonProtocol {

    public static final String ID = "relay";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    public RelayFrameProtocol(ObjectMapper objectMapper) {
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
        body.put("provider", selection.provider());
        body.put("model", selection.model());
        body.put("reasoning", selection.reasoning().wireValue());
        body.put("maxOutputTokens", options.getMaxOutputTokens());
        body.put("systemPrompt", conversation.getSystemPrompt());

        ArrayNode turns = body.putArray("turns");
        for (ConversationTurn turn : conversation.getTurns()) {
            ObjectNode node = turns.addObject()
                    .put("role", turn.getRole().name().toLowerCase(Locale.ROOT))
                    .put("text", turn.getText());
            if (turn.getToolCallId() != null) {
                node.put("toolCallId", turn.getToolCallId()).put("toolName", turn.getToolName());
            }
            if (!turn.getToolCalls().isEmpty()) {
                ArrayNode calls = node.putArray("toolCalls");
                for (ToolCall call : turn.getToolCalls()) {
                    ObjectNode callNode = calls.addObject().put("id", call.getId()).put("name", call.getName());
                    callNode.set("arguments", toJson(call.getArguments() != null ? call.getArguments() : Map.of()));
                }
            }
            if (!turn.getAttachments().isEmpty()) {
                ArrayNode attachments = node.putArray("attachments");
                for (Attachment attachment : turn.getAttachments()) {
                    attachments.addObject()
                            .put("type", attachment.getType().name().toLowerCase(Locale.ROOT))
                            .put("mimeType", attachment.getMimeType())
                            .put("filename", attachment.getFilename())
                            .put("data", base64(attachment));
                }
            }
        }

        ArrayNode tools = body.putArray("tools");
        for (ToolDefinition tool : options.getTools()) {
            ObjectNode node = tools.addObject().put("name", tool.getName()).put("description", tool.getDescription());
            node.set("inputSchema", toJson(tool.getInputSchema()));
        }
        return post(endpoint, body);
    }

    @Override
    public FrameDecoder newDecoder() {
        return new FrameDecoder() {

            private boolean done;

            @Override
            public List<StreamChunk> decode(String event, String data) {
                JsonNode frame = readFrame(data);
                String type = frame.path("type").asText();
                return switch (type) {
                case "text" -> List.of(StreamChunk.text(frame.path("text").asText()));
                case "thinking" -> List.of(StreamChunk.thinking(frame.path("text").asText()));
                case "tool_call" -> List.of(StreamChunk.toolCall(ToolCall.builder()
                        .id(frame.path("id").asText())
                        .name(frame.path("name").asText())
                        .arguments(frame.path("arguments").isObject()
                                ? objectMapper.convertValue(frame.path("arguments"), MAP_TYPE)
                                : Map.of())
                        .build()));
                case "usage" -> List.of(StreamChunk.usage(UsageTotals.builder()
                        .inputTokens(longValue(frame, "inputTokens"))
                        .outputTokens(longValue(frame, "outputTokens"))
                        .cost(frame.path("cost").asDouble(0.0))
                        .build()));
                case "done" -> {
                    done = true;
                    yield List.of(StreamChunk.done(frame.path("stopReason").asText("stop")));
                }
                case "error" -> throw relayError(frame);
                default -> List.of();
                };
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
        };
    }

    private static SdkException relayError(JsonNode frame) {
        String message = frame.path("message").asText("Relay error");
        String code = frame.path("code").asText(null);
        if (code != null) {
            try {
                return new SdkException(SdkError.of(ErrorCode.valueOf(code.toUpperCase(Locale.ROOT)), message));
            } catch (IllegalArgumentException e) {
                return streamError(message);
            }
        }
        return streamError(message);
    }
}
