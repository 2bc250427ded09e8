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
import me.golemcore.agent.domain.model.CredentialState;
import me.golemcore.agent.domain.model.Credentials;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.system.ErrorClassifier;
import me.golemcore.agent.port.outbound.CredentialStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the stored credentials of the token-gated backend and keeps them fresh.
 *
 * <p>
 * Refreshes are single-flight: every caller arriving while a refresh runs
 * joins the same refresh, and at most one request reaches the token endpoint.
 * Callers get dependent copies, so cancelling one never cancels the shared
 * refresh. A
 * failed refresh clears the store, so the user has to authorize again.
 */
@Slf4j
public class CredentialManager {

    private final CredentialStore store;
    private final OAuthTokenClient tokenClient;
    private final TokenClaimsDecoder claimsDecoder;
    private final Clock clock;
    private final Duration refreshSkew;
    private final Executor executor;

    private final AtomicReference<CredentialState> state = new AtomicReference<>();
    private final Object refreshLock = new Object();
    private CompletableFuture<Credentials> inFlight;

    public CredentialManager(CredentialStore store, OAuthTokenClient tokenClient, TokenClaimsDecoder claimsDecoder,
            Clock clock, Duration refreshSkew, Executor executor) {
        this.store = store;
        this.tokenClient = tokenClient;
        this.claimsDecoder = claimsDecoder;
        this.clock = clock;
        this.refreshSkew = refreshSkew;
        this.executor = executor;
        this.state.set(store.load().isPresent() ? CredentialState.AUTHENTICATED : CredentialState.UNAUTHENTICATED);
    }

    public CredentialState getState() {
        return state.get();
    }

    public Optional<Credentials> currentCredentials() {
        return store.load();
    }

    /**
     * Returns credentials whose access token is valid for at least the refresh
     * skew, refreshing first when needed.
     */
    public CompletableFuture<Credentials> getValidCredentials() {
        Optional<Credentials> stored = store.load();
        if (stored.isEmpty()) {
            return CompletableFuture.failedFuture(notAuthenticated());
        }
        Credentials credentials = stored.get();
        if (!credentials.isExpiringWithin(clock, refreshSkew)) {
            return CompletableFuture.completedFuture(credentials);
        }
        return refresh(credentials);
    }

    /**
     * Refreshes regardless of expiry, e.g. after the backend rejected the
     * access token.
     */
    public CompletableFuture<Credentials> forceRefresh() {
        Optional<Credentials> stored = store.load();
        if (stored.isEmpty()) {
            return CompletableFuture.failedFuture(notAuthenticated());
        }
        return refresh(stored.get());
    }

    /**
     * Drops stored credentials. Idempotent.
     */
    public void logout() {
        store.clear();
        state.set(CredentialState.UNAUTHENTICATED);
        log.info("[Credentials] Logged out");
    }

    void markFlowPending() {
        state.set(CredentialState.FLOW_PENDING);
    }

    void markCodeReceived() {
        state.set(CredentialState.CODE_RECEIVED);
    }

    void markExchanging() {
        state.set(CredentialState.EXCHANGING);
    }

    void onAuthorized(Credentials credentials) {
        store.save(credentials);
        state.set(CredentialState.AUTHENTICATED);
        log.info("[Credentials] Authorized account {}", credentials.getAccountId());
    }

    void onFlowAbandoned() {
        state.set(store.load().isPresent() ? CredentialState.AUTHENTICATED : CredentialState.UNAUTHENTICATED);
    }

    Credentials fromTokenResponse(OAuthTokenClient.TokenResponse response, String fallbackAccountId) {
        String accountId = fallbackAccountId;
        String claimsSource = response.getIdToken() != null ? response.getIdToken() : response.getAccessToken();
        try {
            accountId = claimsDecoder.accountId(claimsSource);
        } catch (SdkException e) {
            if (fallbackAccountId == null) {
                throw e;
            }
            log.debug("[Credentials] Keeping previous account id: {}", e.getMessage());
        }
        return Credentials.builder()
                .accessToken(response.getAccessToken())
                .refreshToken(response.getRefreshToken())
                .expiresAt(Instant.now(clock).plusSeconds(response.getExpiresInSeconds()))
                .accountId(accountId)
                .build();
    }

    private CompletableFuture<Credentials> refresh(Credentials current) {
        synchronized (refreshLock) {
            if (inFlight != null) {
                return inFlight.copy();
            }
            state.set(CredentialState.REFRESHING);
            CompletableFuture<Credentials> future = CompletableFuture.supplyAsync(() -> doRefresh(current), executor);
            inFlight = future;
            future.whenComplete((credentials, error) -> {
                synchronized (refreshLock) {
                    if (inFlight == future) {
                        inFlight = null;
                    }
                }
            });
            return future.copy();
        }
    }

    private Credentials doRefresh(Credentials current) {
        log.info("[Credentials] Refreshing access token");
        try {
            OAuthTokenClient.TokenResponse response = tokenClient.refresh(current.getRefreshToken());
            Credentials refreshed = fromTokenResponse(response, current.getAccountId());
            store.save(refreshed);
            state.set(CredentialState.AUTHENTICATED);
            log.info("[Credentials] Access token refreshed, expires at {}", refreshed.getExpiresAt());
            return refreshed;
        } catch (RuntimeException e) {
            SdkError error = ErrorClassifier.classify(e);
            log.warn("[Credentials] Refresh failed, clearing stored credentials: {}", error);
            try {
                store.clear();
            } catch (RuntimeException clearError) { // NOSONAR - refresh failure is reported below
                log.warn("[Credentials] Failed to clear credentials: {}", clearError.getMessage());
            }
            state.set(CredentialState.FAILED);
            throw new CompletionException(new SdkException(error, e));
        }
    }

    private static SdkException notAuthenticated() {
        return new SdkException(SdkError.provider(ErrorCode.AUTH,
                "Not authenticated: run the authorization flow first"));
    }
}
