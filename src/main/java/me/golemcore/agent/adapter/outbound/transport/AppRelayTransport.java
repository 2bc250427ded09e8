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
import me.golemcore.agent.adapter.outbound.transport.protocol.Endpoint;
import me.golemcore.agent.adapter.outbound.transport.protocol.RelayFrameProtocol;
import okhttp3.OkHttpClient;

import java.util.Set;

/**
 * Sends the conversation to an app relay, which calls the model on the
 * client's behalf and streams canonical chunk frames back.
 */
public class AppRelayTransport extends DirectProviderTransport {

    public AppRelayTransport(String id, Set<String> providers, Endpoint endpoint, OkHttpClient httpClient,
            ObjectMapper objectMapper) {
        super(id, providers, endpoint, new RelayFrameProtocol(objectMapper), httpClient);
    }
}
