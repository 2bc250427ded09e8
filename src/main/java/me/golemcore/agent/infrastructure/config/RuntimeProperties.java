package me.golemcore.agent.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of the agent runtime, bound from {@code application.yml}.
 *
 * <p>
 * Everything lives under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link HttpProperties} - shared OkHttp client timeouts and pool</li>
 * <li>{@link ProviderProperties} - one entry per backend under
 * {@code agent.providers.<id>}</li>
 * <li>{@link RouterProperties} - candidate order and failover codes</li>
 * <li>{@link CredentialsProperties} - OAuth flow and credential file</li>
 * <li>{@link SessionProperties} - queue, timeouts and tool rounds</li>
 * <li>{@link ModelsProperties} - model catalog and default selection</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class RuntimeProperties {

    private HttpProperties http = new HttpProperties();
    private Map<String, ProviderProperties> providers = new LinkedHashMap<>();
    private RouterProperties router = new RouterProperties();
    private CredentialsProperties credentials = new CredentialsProperties();
    private SessionProperties session = new SessionProperties();
    private ModelsProperties models = new ModelsProperties();

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 120000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    /**
     * Transport kinds a provider entry can be served by.
     */
    public enum TransportType {
        /** Raw SSE over OkHttp with a {@code protocol}. */
        DIRECT,
        /** langchain4j streaming chat model (OpenAI-compatible or Anthropic). */
        LANGCHAIN4J,
        /** Relay endpoint speaking canonical chunk frames. */
        RELAY,
        /** Codex responses endpoint gated by OAuth credentials. */
        CODEX
    }

    @Data
    public static class ProviderProperties {
        private boolean enabled = true;
        private TransportType type = TransportType.DIRECT;
        private String protocol = "openai-chat";
        /**
         * Provider ids this backend serves. Empty means only its own id,
         * {@code *} means any provider.
         */
        private List<String> serves = new ArrayList<>();
        private String baseUrl;
        private String apiKey;
        private Map<String, String> headers = new LinkedHashMap<>();
    }

    @Data
    public static class RouterProperties {
        /** Provider ids in failover order; empty means declaration order. */
        private List<String> order = new ArrayList<>();
        private List<String> failoverCodes = new ArrayList<>(List.of("NETWORK", "TIMEOUT", "OVERLOADED",
                "SERVER_ERROR"));
    }

    @Data
    public static class CredentialsProperties {
        private String clientId = "app_EMoamEEZ73f0CkXaXp7hrann";
        private String authorizeUrl = "https://auth.openai.com/oauth/authorize";
        private String tokenUrl = "https://auth.openai.com/oauth/token";
        private String redirectPath = "/auth/callback";
        private String scope = "openid profile email offline_access";
        private String callbackHost = "127.0.0.1";
        private int callbackPort = 0;
        private Duration callbackTimeout = Duration.ofSeconds(60);
        private Duration refreshSkew = Duration.ofMinutes(5);
        private String file = "${user.home}/.golemcore/agent/credentials.json";
        private String codexBaseUrl = "https://chatgpt.com/backend-api/codex/responses";
    }

    @Data
    public static class SessionProperties {
        private String systemPrompt = "You are a helpful assistant.";
        private Duration turnTimeout = Duration.ofMinutes(10);
        private int maxQueuedPrompts = 100;
        private int maxToolRounds = 5;
        private Duration toolTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class ModelsProperties {
        private String catalog = "models.json";
        private String defaultProvider;
        private String defaultModel;
        private String defaultReasoning = "medium";
    }
}
