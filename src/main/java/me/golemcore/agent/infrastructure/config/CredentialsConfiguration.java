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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.adapter.outbound.credentials.AuthorizationFlowService;
import me.golemcore.agent.adapter.outbound.credentials.CredentialManager;
import me.golemcore.agent.adapter.outbound.credentials.FileCredentialStore;
import me.golemcore.agent.adapter.outbound.credentials.OAuthTokenClient;
import me.golemcore.agent.adapter.outbound.credentials.PkceGenerator;
import me.golemcore.agent.adapter.outbound.credentials.TokenClaimsDecoder;
import me.golemcore.agent.port.outbound.CredentialStore;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ForkJoinPool;

/**
 * Wires the OAuth credential subsystem from {@code agent.credentials.*}.
 */
@Configuration
public class CredentialsConfiguration {

    @Bean
    public CredentialStore credentialStore(RuntimeProperties properties, ObjectMapper objectMapper) {
        String file = properties.getCredentials().getFile()
                .replace("${user.home}", System.getProperty("user.home"));
        return new FileCredentialStore(Path.of(file), objectMapper);
    }

    @Bean
    public OAuthTokenClient oauthTokenClient(RuntimeProperties properties, OkHttpClient okHttpClient,
            ObjectMapper objectMapper) {
        RuntimeProperties.CredentialsProperties credentials = properties.getCredentials();
        return new OAuthTokenClient(okHttpClient, objectMapper, credentials.getTokenUrl(), credentials.getClientId());
    }

    @Bean
    public CredentialManager credentialManager(RuntimeProperties properties, CredentialStore credentialStore,
            OAuthTokenClient oauthTokenClient, ObjectMapper objectMapper, Clock clock) {
        return new CredentialManager(credentialStore, oauthTokenClient, new TokenClaimsDecoder(objectMapper), clock,
                properties.getCredentials().getRefreshSkew(), ForkJoinPool.commonPool());
    }

    @Bean
    public AuthorizationFlowService authorizationFlowService(RuntimeProperties properties,
            OAuthTokenClient oauthTokenClient, CredentialManager credentialManager, Clock clock) {
        return new AuthorizationFlowService(properties.getCredentials(), new PkceGenerator(), oauthTokenClient,
                credentialManager, clock, ForkJoinPool.commonPool());
    }
}
