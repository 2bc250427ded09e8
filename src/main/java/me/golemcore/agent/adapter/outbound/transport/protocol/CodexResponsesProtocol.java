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

/**
 * ChatGPT Codex {@code /responses} streaming (subscription backend).
 *
 * <p>
 * Requests are never stored server-side, so the whole conversation is sent on
 * every round and encrypted reasoning is requested back.
 */
public class CodexResponsesProtocol extends AbstractJsonProtocol {

    public static final String ID = "codex-responses";
    public static final String ORIGINATOR = "codex_cli_rs";

    public CodexResponsesProtocol(ObjectMapper objectMapper) {
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
        body.put("instructions", conversation.getSystemPrompt() != null ? conversation.getSystemPrompt() : "");
        body.put("store", false);
        body.put("stream", true);
        body.putArray("include").add("reasoning.encrypted_content");
        if (selection.reasoning() != null && selection.reasoning() != ReasoningEffort.OFF) {
            body.putObject("reasoning").put("effort", selection.reasoning().wireValue()).put("summary", "auto");
        }

        ArrayNode input = body.putArray("input");
        for (ConversationTurn turn : conversation.getTurns()) {
            appendItems(input, turn);
        }

        if (!options.getTools().isEmpty()) {
            body.put("tool_choice", "auto");
            ArrayNode tools = body.putArray("tools");
            for (ToolDefinition tool : options.getTools()) {
                ObjectNode node = tools.addObject()
                        .put("type", "function")
                        .put("name", tool.getName())
                        .put("description", tool.getDescription());
                node.set("parameters", toJson(tool.getInputSchema()));
            }
        }

        Endpoint withHeaders = endpoint.toBuilder()
                .header("OpenAI-Beta", "responses=experimental")
                .header("originator", ORIGINATOR)
                .build();
        return post(withHeaders, body);
    }

    private void appendItems(ArrayNode input, ConversationTurn turn) {
        switch (turn.getRole()) {
        case USER -> {
            ObjectNode message = input.addObject().put("type", "message").put("role", "user");
            ArrayNode content = message.putArray("content");
            content.addObject().put("type", "input_text").put("text", turn.getText());
            for (Attachment attachment : turn.getAttachments()) {
                if (attachment.getType() == Attachment.Type.IMAGE) {
                    content.addObject().put("type", "input_image").put("image_url", dataUrl(attachment));
                }
            }
        }
        case ASSISTANT -> {
            if (turn.getText() != null && !turn.getText().isEmpty()) {
                ObjectNode message = input.addObject().put("type", "message").put("role", "assistant");
                message.putArray("content").addObject().put("type", "output_text").put("text", turn.getText());
            }
            for (ToolCall call : turn.getToolCalls()) {
                input.addObject()
                        .put("type", "function_call")
                        .put("call_id", call.getId())
                        .put("name", call.getName())
                        .put("arguments", writeArguments(call.getArguments()));
            }
        }
        case TOOL -> input.addObject()
                .put("type", "function_call_output")
                .put("call_id", turn.getToolCallId())
                .put("output", turn.getText());
        }
    }

    @Override
    public FrameDecoder newDecoder() {
        return new Decoder();
    }

    private final class Decoder implements FrameDecoder {

        private boolean done;

        @Override
        public List<StreamChunk> decode(String event, String data) {
            JsonNode frame = readFrame(data);
            String type = frame.path("type").asText(event != null ? event : "");
            List<StreamChunk> chunks = new ArrayList<>();
            switch (type) {
            case "response.output_text.delta" -> chunks.add(StreamChunk.text(frame.path("delta").asText()));
            case "response.reasoning_summary_text.delta" ->
                chunks.add(StreamChunk.thinking(frame.path("delta").asText()));
            case "response.output_item.done" -> {
                JsonNode item = frame.path("item");
                if ("function_call".equals(item.path("type").asText())) {
                    chunks.add(StreamChunk.toolCall(ToolCall.builder()
                            .id(item.path("call_id").asText())
                            .name(item.path("name").asText())
                            .arguments(parseArguments(item.path("arguments").asText()))
                            .build()));
                }
            }
            case "response.completed", "response.done" -> {
                JsonNode response = frame.path("response");
                JsonNode usage = response.path("usage");
                if (usage.isObject()) {
                    chunks.add(StreamChunk.usage(UsageTotals.of(
                            longValue(usage, "input_tokens"), longValue(usage, "output_tokens"))));
                }
                done = true;
                chunks.add(StreamChunk.done(response.path("status").asText("completed")));
            }
            case "response.failed" -> throw streamError(
                    frame.path("response").path("error").path("message").asText("Response failed"));
            case "error" -> throw streamError(frame.path("message").asText(frame.toString()));
            default -> {
                // created, in_progress, content_part and similar lifecycle events
            }
            }
            return chunks;
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
}
