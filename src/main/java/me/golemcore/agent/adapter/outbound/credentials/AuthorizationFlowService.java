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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.AuthorizationFlowState;
import me.golemcore.agent.domain.model.Credentials;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.infrastructure.config.RuntimeProperties;
import okhttp3.HttpUrl;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs the browser-based PKCE authorization against the OAuth provider.
 *
 * <p>
 * Only one flow is pending at a time: starting a new one closes the previous
 * listener and fails its future as cancelled.
 */
@Slf4j
public class AuthorizationFlowService {

    private final RuntimeProperties.CredentialsProperties properties;
    private final PkceGenerator pkce;
    private final OAuthTokenClient tokenClient;
    private final CredentialManager credentialManager;
    private final Clock clock;
    private final Executor executor;

    private PendingFlow pending;

    public AuthorizationFlowService(RuntimeProperties.CredentialsProperties properties, PkceGenerator pkce,
            OAuthTokenClient tokenClient, CredentialManager credentialManager, Clock clock, Executor executor) {
        this.properties = properties;
        this.pkce = pkce;
        this.tokenClient = tokenClient;
        this.credentialManager = credentialManager;
        this.clock = clock;
        this.executor = executor;
    }

    public synchronized AuthorizationSession begin() {
        supersedePending();

        String verifier = pkce.verifier();
        String state = pkce.state();
        OAuthCallbackServer server = OAuthCallbackServer.start(properties.getCallbackHost(),
                properties.getCallbackPort(), properties.getRedirectPath(), state, properties.getCallbackTimeout());
        AuthorizationFlowState flow = AuthorizationFlowState.builder()
                .state(state)
                .codeVerifier(verifier)
                .codeChallenge(pkce.challenge(verifier))
                .redirectPort(server.port())
                .redirectUri("http://localhost:" + server.port() + properties.getRedirectPath())
                .createdAt(Instant.now(clock))
                .build();
        credentialManager.markFlowPending();

        CompletableFuture<Credentials> credentials = server.authorizationCode()
                .thenApplyAsync(code -> complete(flow, code), executor);
        PendingFlow current = new PendingFlow(server, credentials);
        pending = current;
        credentials.whenComplete((result, error) -> onFinished(current, error));

        log.info("[OAuth] Authorization flow started on port {}", flow.getRedirectPort());
        return new AuthorizationSession(authorizationUrl(flow), flow.getRedirectPort(), credentials);
    }

    /**
     * Cancels the pending flow, if any.
     */
    public synchronized void cancel() {
        if (pending != null) {
            supersedePending();
            credentialManager.onFlowAbandoned();
        }
    }

    String authorizationUrl(AuthorizationFlowState flow) {
        HttpUrl base = HttpUrl.parse(properties.getAuthorizeUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid authorize URL: " + properties.getAuthorizeUrl());
        }
        return base.newBuilder()
                .addQueryParameter("response_type", "code")
                .addQueryParameter("client_id", properties.getClientId())
                .addQueryParameter("redirect_uri", flow.getRedirectUri())
                .addQueryParameter("scope", properties.getScope())
                .addQueryParameter("code_challenge", flow.getCodeChallenge())
                .addQueryParameter("code_challenge_method", "S256")
                .addQueryParameter("state", flow.getState())
                .addQueryParameter("id_token_add_organizations", "true")
                .addQueryParameter("codex_cli_simplified_flow", "true")
                .addQueryParameter("originator", "codex_cli_rs")
                .build()
                .toString();
    }

    private Credentials complete(AuthorizationFlowState flow, String code) {
        credentialManager.markCodeReceived();
        credentialManager.markExchanging();
        OAuthTokenClient.TokenResponse response = tokenClient.exchange(code, flow.getCodeVerifier(),
                flow.getRedirectUri());
        Credentials credentials = credentialManager.fromTokenResponse(response, null);
        credentialManager.onAuthorized(credentials);
        return credentials;
    }

    private void supersedePending() {
        PendingFlow previous = pending;
        pending = null;
        if (previous == null) {
            return;
        }
        log.info("[OAuth] Superseding pending authorization flow");
        previous.credentials.completeExceptionally(
                new SdkException(SdkError.cancelled("Superseded by a newer authorization flow")));
        previous.server.close();
    }

    private synchronized void onFinished(PendingFlow flow, Throwable error) {
        flow.server.close();
        if (pending != flow) {
            return;
        }
        pending = null;
        if (error != null) {
            log.warn("[OAuth] Authorization flow failed: {}", error.getMessage());
            credentialManager.onFlowAbandoned();
        }
    }

    private record PendingFlow(OAuthCallbackServer server, CompletableFuture<Credentials> credentials) {
    }
}
