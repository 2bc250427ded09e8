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
import me.golemcore.agent.adapter.outbound.credentials.CredentialManager;
import me.golemcore.agent.adapter.outbound.transport.TransportFactory;
import me.golemcore.agent.port.outbound.Transport;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the routed transport as the single {@link Transport} bean.
 */
@Configuration
public class TransportConfiguration {

    @Bean
    public TransportFactory transportFactory(RuntimeProperties properties, OkHttpClient okHttpClient,
            ObjectMapper objectMapper, CredentialManager credentialManager) {
        return new TransportFactory(properties, okHttpClient, objectMapper, credentialManager);
    }

    @Bean
    public Transport transport(TransportFactory transportFactory) {
        return transportFactory.createRouter();
    }
}
