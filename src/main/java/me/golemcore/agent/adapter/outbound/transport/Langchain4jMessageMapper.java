package me.golemcore.agent.adapter.outbound.transport;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.Attachment;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolDefinition;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Converts the canonical conversation and tool definitions to langchain4j
 * types, and tool requests back.
 */
@Slf4j
class Langchain4jMessageMapper {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    Langchain4jMessageMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    List<ChatMessage> toMessages(ConversationState conversation) {
        List<ChatMessage> messages = new ArrayList<>();
        if (conversation.getSystemPrompt() != null && !conversation.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(conversation.getSystemPrompt()));
        }
        for (ConversationTurn turn : conversation.getTurns()) {
            switch (turn.getRole()) {
            case USER -> messages.add(toUserMessage(turn));
            case ASSISTANT -> {
                if (turn.getToolCalls().isEmpty()) {
                    messages.add(AiMessage.from(turn.getText() != null ? turn.getText() : ""));
                } else {
                    List<ToolExecutionRequest> requests = turn.getToolCalls().stream()
                            .map(call -> ToolExecutionRequest.builder()
                                    .id(call.getId())
                                    .name(call.getName())
                                    .arguments(toJson(call.getArguments()))
                                    .build())
                            .toList();
                    messages.add(turn.getText() != null && !turn.getText().isEmpty()
                            ? AiMessage.from(turn.getText(), requests)
                            : AiMessage.from(requests));
                }
            }
            case TOOL -> messages.add(ToolExecutionResultMessage.from(
                    turn.getToolCallId(), turn.getToolName(), turn.getText()));
            }
        }
        return messages;
    }

    private UserMessage toUserMessage(ConversationTurn turn) {
        List<Attachment> images = turn.getAttachments().stream()
                .filter(a -> a.getType() == Attachment.Type.IMAGE)
                .toList();
        if (images.isEmpty()) {
            return UserMessage.from(turn.getText());
        }
        List<Content> contents = new ArrayList<>();
        contents.add(TextContent.from(turn.getText()));
        for (Attachment image : images) {
            contents.add(ImageContent.from(Base64.getEncoder().encodeToString(image.getData()), image.getMimeType()));
        }
        return UserMessage.from(contents);
    }

    List<ToolSpecification> toToolSpecifications(List<ToolDefinition> tools) {
        return tools.stream().map(this::toToolSpecification).toList();
    }

    ToolCall toToolCall(ToolExecutionRequest request) {
        return ToolCall.builder()
                .id(request.id())
                .name(request.name())
                .arguments(parseJson(request.arguments()))
                .build();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification toToolSpecification(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null) {
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");
            if (properties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(), toSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toSchemaElement(Map<String, Object> schema) {
        String type = schema.get("type") instanceof String value ? value : "string";
        String description = (String) schema.get("description");
        List<String> enumValues = (List<String>) schema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (schema.get("items") instanceof Map<?, ?> items) {
                builder.items(toSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty((String) entry.getKey(),
                            toSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private String toJson(Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            log.warn("[Langchain4j] Failed to serialize tool arguments: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[Langchain4j] Failed to parse tool arguments: {}", e.getOriginalMessage());
            return Map.of("_raw", json);
        }
    }
}
