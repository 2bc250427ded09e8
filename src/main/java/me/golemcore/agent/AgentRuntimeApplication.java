package me.golemcore.agent;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the GolemCore agent runtime.
 *
 * <p>
 * The runtime streams model turns through pluggable transports, keeps OAuth
 * credentials fresh for token-gated backends, and serializes prompts per
 * session. Embedders obtain {@link me.golemcore.agent.domain.service.AgentRunner}
 * from the context and open sessions with it.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Domain Layer       → AgentOrchestrator, SessionRuntime, PromptQueue
 * Ports              → Transport, CredentialStore, sinks
 * Adapters           → Direct/Relay/Langchain4j/Codex transports, Router, OAuth
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentRuntimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentRuntimeApplication.class, args);
    }

}
