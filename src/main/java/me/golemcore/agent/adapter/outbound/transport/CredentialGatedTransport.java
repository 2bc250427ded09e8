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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.adapter.outbound.credentials.CredentialManager;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.Credentials;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.HttpStatusException;
import me.golemcore.agent.domain.model.InstrumentationEvent;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.system.CancellationToken;
import me.golemcore.agent.port.outbound.Transport;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Transport for a backend that needs OAuth credentials. Fetches valid
 * credentials before each call and, when the backend still answers 401,
 * forces one refresh and retries once. Disposing a turn never cancels a
 * refresh other turns may be waiting on.
 */
@Slf4j
public class CredentialGatedTransport implements Transport {

    private final String id;
    private final Set<String> providers;
    private final CredentialManager credentialManager;
    private final Function<Credentials, Transport> delegateFactory;

    /**
     * @param delegateFactory
     *            builds the transport that carries the given credentials
     */
    public CredentialGatedTransport(String id, Set<String> providers, CredentialManager credentialManager,
            Function<Credentials, Transport> delegateFactory) {
        this.id = id;
        this.providers = Set.copyOf(providers);
        this.credentialManager = credentialManager;
        this.delegateFactory = delegateFactory;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean supports(ModelSelection selection) {
        return providers.isEmpty() || providers.contains(selection.provider());
    }

    @Override
    public Flux<StreamChunk> run(ConversationState conversation, TurnOptions options, CancellationToken token) {
        return Mono.fromFuture(credentialManager::getValidCredentials, true)
                .flatMapMany(credentials -> delegateFactory.apply(credentials).run(conversation, options, token))
                .onErrorResume(error -> isUnauthorized(error) && !token.isCancelled(),
                        error -> retryWithRefresh(conversation, options, token));
    }

    private Flux<StreamChunk> retryWithRefresh(ConversationState conversation, TurnOptions options,
            CancellationToken token) {
        log.info("[Credentials] {} rejected the access token, refreshing", id);
        reportRefresh(options);
        return Mono.fromFuture(credentialManager::forceRefresh, true)
                .flatMapMany(credentials -> delegateFactory.apply(credentials).run(conversation, options, token))
                .onErrorMap(CredentialGatedTransport::isUnauthorized,
                        error -> new SdkException(SdkError.provider(ErrorCode.AUTH,
                                "Credentials rejected after refresh"), error));
    }

    private void reportRefresh(TurnOptions options) {
        try {
            options.getInstrumentation().onEvent(InstrumentationEvent.of(InstrumentationEvent.CREDENTIALS_REFRESH,
                    Map.of("transport", id, "reason", "unauthorized")));
        } catch (RuntimeException e) { // NOSONAR - instrumentation must not break the retry
            log.warn("[Credentials] instrumentation sink failed: {}", e.getMessage());
        }
    }

    static boolean isUnauthorized(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof HttpStatusException http && http.isUnauthorized()) {
                return true;
            }
            if (current.getCause() == current) {
                return false;
            }
            current = current.getCause();
        }
        return false;
    }
}
