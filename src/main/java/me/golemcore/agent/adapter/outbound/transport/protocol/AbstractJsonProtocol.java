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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.Attachment;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.system.ErrorClassifier;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.util.Base64;
import java.util.Map;

/**
 * JSON helpers shared by the SSE protocols.
 */
@Slf4j
public abstract class AbstractJsonProtocol implements WireProtocol {

    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    protected final ObjectMapper objectMapper;

    protected AbstractJsonProtocol(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected Request post(Endpoint endpoint, ObjectNode body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new SdkException(SdkError.request(ErrorCode.INVALID_INPUT,
                    "Failed to encode request: " + e.getOriginalMessage()), e);
        }
        Request.Builder builder = new Request.Builder()
                .url(endpoint.getUrl())
                .header("Accept", "text/event-stream")
                .post(RequestBody.create(json, JSON));
        endpoint.getHeaders().forEach(builder::header);
        return builder.build();
    }

    protected JsonNode readFrame(String data) {
        try {
            return objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw new SdkException(SdkError.provider(ErrorCode.UNKNOWN,
                    "Malformed stream frame: " + e.getOriginalMessage()), e);
        }
    }

    protected Map<String, Object> parseArguments(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("[Transport] Failed to parse tool arguments: {}", e.getOriginalMessage());
            return Map.of("_raw", json);
        }
    }

    protected String writeArguments(Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            log.warn("[Transport] Failed to serialize tool arguments: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    protected JsonNode toJson(Object value) {
        return objectMapper.valueToTree(value);
    }

    protected static String dataUrl(Attachment attachment) {
        return "data:" + attachment.getMimeType() + ";base64," + base64(attachment);
    }

    protected static String base64(Attachment attachment) {
        return Base64.getEncoder().encodeToString(attachment.getData());
    }

    /**
     * Error reported inside the stream by the backend.
     */
    protected static SdkException streamError(String message) {
        SdkError byMessage = ErrorClassifier.classifyFromMessage(message);
        return new SdkException(byMessage != null ? byMessage : SdkError.provider(ErrorCode.UNKNOWN, message));
    }

    protected static SdkException truncated(String protocol) {
        return new SdkException(SdkError.request(ErrorCode.NETWORK,
                "Stream ended before completion (" + protocol + ")"));
    }

    protected static long longValue(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asLong() : 0L;
    }
}
