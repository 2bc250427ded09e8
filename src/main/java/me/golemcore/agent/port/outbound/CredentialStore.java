package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.model.Credentials;

import java.util.Optional;

/**
 * Port for persisting the single credential set of the token-gated backend.
 */
public interface CredentialStore {

    /**
     * Loads stored credentials. A missing store means unauthenticated and yields
     * an empty result rather than an error.
     */
    Optional<Credentials> load();

    /**
     * Atomically replaces the stored credentials.
     */
    void save(Credentials credentials);

    /**
     * Removes stored credentials. Idempotent.
     */
    void clear();
}
