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
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/**
 * Talks to the OAuth token endpoint: exchanges an authorization code and
 * refreshes an access token. Calls block and are meant to run off the caller's
 * thread.
 */
@Slf4j
public class OAuthTokenClient {

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String tokenUrl;
    private final String clientId;

    public OAuthTokenClient(OkHttpClient httpClient, ObjectMapper objectMapper, String tokenUrl, String clientId) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
    }

    public TokenResponse exchange(String code, String codeVerifier, String redirectUri) {
        FormBody body = new FormBody.Builder()
                .add("grant_type", "authorization_code")
                .add("client_id", clientId)
                .add("code", code)
                .add("code_verifier", codeVerifier)
                .add("redirect_uri", redirectUri)
                .build();
        return post(body, "Token exchange");
    }

    public TokenResponse refresh(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new SdkException(SdkError.provider(ErrorCode.AUTH, "No refresh token available"));
        }
        FormBody body = new FormBody.Builder()
                .add("grant_type", "refresh_token")
                .add("refresh_token", refreshToken)
                .add("client_id", clientId)
                .build();
        return post(body, "Token refresh");
    }

    private TokenResponse post(FormBody body, String operation) {
        Request request = new Request.Builder()
                .url(tokenUrl)
                .header("Accept", "application/json")
                .post(body)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String payload = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                log.warn("[OAuth] {} failed: HTTP {}", operation, response.code());
                throw new SdkException(SdkError.provider(ErrorCode.AUTH,
                        operation + " failed: HTTP " + response.code()));
            }
            return parse(payload, operation);
        } catch (IOException e) {
            throw new SdkException(SdkError.request(ErrorCode.NETWORK, operation + " failed: " + e.getMessage()), e);
        }
    }

    TokenResponse parse(String payload, String operation) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw invalid(operation, "response is not JSON");
        }
        if (node == null || !node.isObject()) {
            throw invalid(operation, "response is not a JSON object");
        }
        String accessToken = node.path("access_token").asText("");
        String refreshToken = node.path("refresh_token").asText("");
        JsonNode expiresIn = node.path("expires_in");
        if (accessToken.isBlank()) {
            throw invalid(operation, "missing access_token");
        }
        if (refreshToken.isBlank()) {
            throw invalid(operation, "missing refresh_token");
        }
        if (!expiresIn.isNumber()) {
            throw invalid(operation, "missing numeric expires_in");
        }
        String idToken = node.path("id_token").asText(null);
        return TokenResponse.builder()
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .idToken(idToken)
                .expiresInSeconds(expiresIn.asLong())
                .build();
    }

    private static SdkException invalid(String operation, String detail) {
        return new SdkException(SdkError.provider(ErrorCode.AUTH, operation + " returned an invalid response: "
                + detail));
    }

    /**
     * Validated token endpoint answer.
     */
    @Value
    @Builder
    public static class TokenResponse {
        String accessToken;
        String refreshToken;
        String idToken;
        long expiresInSeconds;

        @Override
        public String toString() {
            return "TokenResponse{expiresInSeconds=" + expiresInSeconds + "}";
        }
    }
}
