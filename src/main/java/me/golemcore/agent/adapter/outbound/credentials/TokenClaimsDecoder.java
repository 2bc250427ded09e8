package me.golemcore.agent.adapter.outbound.credentials;

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
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;

import java.io.IOException;
import java.util.Base64;

/**
 * Reads claims from a JWT payload. The signature is not verified: the token
 * came straight from the token endpoint over TLS.
 */
public class TokenClaimsDecoder {

    static final String AUTH_CLAIM = "https://api.openai.com/auth";
    static final String ACCOUNT_ID_CLAIM = "chatgpt_account_id";

    private final ObjectMapper objectMapper;

    public TokenClaimsDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the account id of the token: the {@code chatgpt_account_id} of the
     * auth claim, else the subject.
     *
     * @throws SdkException
     *             CONFIG_INVALID when the token is malformed or carries neither
     */
    public String accountId(String token) {
        JsonNode payload = payload(token);
        JsonNode auth = payload.path(AUTH_CLAIM);
        String accountId = auth.path(ACCOUNT_ID_CLAIM).asText("");
        if (!accountId.isBlank()) {
            return accountId;
        }
        String subject = payload.path("sub").asText("");
        if (!subject.isBlank()) {
            return subject;
        }
        throw malformed("Token carries no account id");
    }

    JsonNode payload(String token) {
        if (token == null) {
            throw malformed("Token is missing");
        }
        String[] parts = token.split("\\.");
        if (parts.length < 2 || parts[1].isEmpty()) {
            throw malformed("Token is not a JWT");
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw malformed("Token payload is not a JSON object");
            }
            return node;
        } catch (IllegalArgumentException | IOException e) {
            throw malformed("Token payload cannot be decoded");
        }
    }

    private static SdkException malformed(String message) {
        return new SdkException(SdkError.config(ErrorCode.CONFIG_INVALID, message));
    }
}
