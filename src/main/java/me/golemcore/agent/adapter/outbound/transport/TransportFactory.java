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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.adapter.outbound.credentials.CredentialManager;
import me.golemcore.agent.adapter.outbound.transport.protocol.AnthropicMessagesProtocol;
import me.golemcore.agent.adapter.outbound.transport.protocol.CodexResponsesProtocol;
import me.golemcore.agent.adapter.outbound.transport.protocol.Endpoint;
import me.golemcore.agent.adapter.outbound.transport.protocol.OpenAiChatProtocol;
import me.golemcore.agent.adapter.outbound.transport.protocol.RelayFrameProtocol;
import me.golemcore.agent.adapter.outbound.transport.protocol.WireProtocol;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.infrastructure.config.RuntimeProperties;
import me.golemcore.agent.port.outbound.Transport;
import okhttp3.OkHttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Builds the routed transport from the {@code agent.providers} entries.
 */
@Slf4j
public class TransportFactory {

    private static final String OPENAI_DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String ANTHROPIC_DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
    private static final String ANY_PROVIDER = "*";

    private final RuntimeProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CredentialManager credentialManager;
    private final Map<String, WireProtocol> protocols = new LinkedHashMap<>();

    public TransportFactory(RuntimeProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper,
            CredentialManager credentialManager) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.credentialManager = credentialManager;
        register(new OpenAiChatProtocol(objectMapper));
        register(new AnthropicMessagesProtocol(objectMapper));
        register(new CodexResponsesProtocol(objectMapper));
        register(new RelayFrameProtocol(objectMapper));
    }

    /**
     * Creates the router over every enabled provider, in the configured order.
     */
    public RouterTransport createRouter() {
        Map<String, RuntimeProperties.ProviderProperties> providers = properties.getProviders();
        List<String> order = new ArrayList<>(properties.getRouter().getOrder());
        for (String id : providers.keySet()) {
            if (!order.contains(id)) {
                order.add(id);
            }
        }

        List<Transport> candidates = new ArrayList<>();
        for (String id : order) {
            RuntimeProperties.ProviderProperties provider = providers.get(id);
            if (provider == null) {
                throw new SdkException(SdkError.config(ErrorCode.CONFIG_INVALID,
                        "Router order names unknown provider: " + id));
            }
            if (!provider.isEnabled()) {
                log.debug("[Transport] Provider {} disabled", id);
                continue;
            }
            candidates.add(create(id, provider));
        }

        FailoverPolicy policy;
        try {
            policy = FailoverPolicy.of(properties.getRouter().getFailoverCodes());
        } catch (IllegalArgumentException e) {
            throw new SdkException(SdkError.config(ErrorCode.CONFIG_INVALID,
                    "Unknown failover code in " + properties.getRouter().getFailoverCodes()), e);
        }
        log.info("[Transport] Router candidates: {}, failover on {}",
                candidates.stream().map(Transport::getId).toList(), policy.getCodes());
        return new RouterTransport(candidates, policy);
    }

    public Transport create(String id, RuntimeProperties.ProviderProperties provider) {
        Set<String> serves = serves(id, provider);
        return switch (provider.getType()) {
        case DIRECT -> {
            WireProtocol protocol = protocol(provider.getProtocol());
            yield new DirectProviderTransport(id, serves, directEndpoint(protocol, provider), protocol, httpClient);
        }
        case LANGCHAIN4J -> new Langchain4jTransport(id, serves, langchain4jModels(provider), objectMapper);
        case RELAY -> new AppRelayTransport(id, serves, relayEndpoint(id, provider), httpClient, objectMapper);
        case CODEX -> codexTransport(id, serves, provider);
        };
    }

    WireProtocol protocol(String protocolId) {
        WireProtocol protocol = protocols.get(protocolId);
        if (protocol == null) {
            throw new SdkException(SdkError.config(ErrorCode.CONFIG_INVALID,
                    "Unknown wire protocol: " + protocolId + ", expected one of " + protocols.keySet()));
        }
        return protocol;
    }

    private void register(WireProtocol protocol) {
        protocols.put(protocol.getId(), protocol);
    }

    private static Set<String> serves(String id, RuntimeProperties.ProviderProperties provider) {
        if (provider.getServes().contains(ANY_PROVIDER)) {
            return Set.of();
        }
        Set<String> serves = new LinkedHashSet<>();
        serves.add(id);
        serves.addAll(provider.getServes());
        return serves;
    }

    private Endpoint directEndpoint(WireProtocol protocol, RuntimeProperties.ProviderProperties provider) {
        Endpoint.EndpointBuilder endpoint = Endpoint.builder().headers(provider.getHeaders());
        String apiKey = provider.getApiKey();
        switch (protocol.getId()) {
        case AnthropicMessagesProtocol.ID -> {
            endpoint.url(trimSlash(baseUrl(provider, ANTHROPIC_DEFAULT_BASE_URL)) + "/messages");
            if (apiKey != null && !apiKey.isBlank()) {
                endpoint.header("x-api-key", apiKey);
            }
        }
        case OpenAiChatProtocol.ID -> {
            endpoint.url(trimSlash(baseUrl(provider, OPENAI_DEFAULT_BASE_URL)) + "/chat/completions");
            bearer(endpoint, apiKey);
        }
        default -> {
            endpoint.url(requireBaseUrl(protocol.getId(), provider));
            bearer(endpoint, apiKey);
        }
        }
        return endpoint.build();
    }

    private Endpoint relayEndpoint(String id, RuntimeProperties.ProviderProperties provider) {
        Endpoint.EndpointBuilder endpoint = Endpoint.builder()
                .url(requireBaseUrl(id, provider))
                .headers(provider.getHeaders());
        bearer(endpoint, provider.getApiKey());
        return endpoint.build();
    }

    private Transport codexTransport(String id, Set<String> serves, RuntimeProperties.ProviderProperties provider) {
        WireProtocol protocol = protocol(CodexResponsesProtocol.ID);
        String url = provider.getBaseUrl() != null ? provider.getBaseUrl()
                : properties.getCredentials().getCodexBaseUrl();
        Endpoint base = Endpoint.builder().url(url).headers(provider.getHeaders()).build();
        return new CredentialGatedTransport(id, serves, credentialManager, credentials -> {
            Endpoint.EndpointBuilder endpoint = base.toBuilder()
                    .header("Authorization", "Bearer " + credentials.getAccessToken());
            if (credentials.getAccountId() != null) {
                endpoint.header("chatgpt-account-id", credentials.getAccountId());
            }
            return new DirectProviderTransport(id, serves, endpoint.build(), protocol, httpClient);
        });
    }

    private Function<ModelSelection, StreamingChatModel> langchain4jModels(
            RuntimeProperties.ProviderProperties provider) {
        Duration timeout = Duration.ofMillis(properties.getHttp().getReadTimeout());
        boolean anthropic = AnthropicMessagesProtocol.ID.equals(provider.getProtocol());
        Map<String, StreamingChatModel> cache = new ConcurrentHashMap<>();
        return selection -> cache.computeIfAbsent(selection.model(), modelName -> anthropic
                ? createAnthropicModel(modelName, provider, timeout)
                : createOpenAiModel(modelName, provider, timeout));
    }

    private static StreamingChatModel createAnthropicModel(String modelName,
            RuntimeProperties.ProviderProperties config, Duration timeout) {
        var builder = AnthropicStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxTokens(8192)
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private static StreamingChatModel createOpenAiModel(String modelName,
            RuntimeProperties.ProviderProperties config, Duration timeout) {
        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private static void bearer(Endpoint.EndpointBuilder endpoint, String apiKey) {
        if (apiKey != null && !apiKey.isBlank()) {
            endpoint.header("Authorization", "Bearer " + apiKey);
        }
    }

    private static String baseUrl(RuntimeProperties.ProviderProperties provider, String fallback) {
        return provider.getBaseUrl() != null && !provider.getBaseUrl().isBlank() ? provider.getBaseUrl() : fallback;
    }

    private static String requireBaseUrl(String id, RuntimeProperties.ProviderProperties provider) {
        if (provider.getBaseUrl() == null || provider.getBaseUrl().isBlank()) {
            throw new SdkException(SdkError.config(ErrorCode.CONFIG_MISSING, "Provider " + id + " has no base-url"));
        }
        return provider.getBaseUrl();
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
