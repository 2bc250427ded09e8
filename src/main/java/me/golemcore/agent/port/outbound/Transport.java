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

import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.system.CancellationToken;
import reactor.core.publisher.Flux;

/**
 * Port for producing a canonical chunk stream from one model backend. Each
 * implementation owns the mapping from its backend's wire protocol; nothing
 * outside the transport layer depends on wire details.
 */
public interface Transport {

    /**
     * Returns the transport identifier used in logs and routing (e.g. "openai",
     * "codex", "relay").
     */
    String getId();

    /**
     * Runs one backend call for the conversation. The returned flux is lazy:
     * nothing is sent until it is subscribed. It terminates with completion or
     * an error, and must stop and release its connection when {@code token} is
     * cancelled or the subscription is disposed.
     */
    Flux<StreamChunk> run(ConversationState conversation, TurnOptions options, CancellationToken token);

    /**
     * Checks whether this transport can serve the given selection.
     */
    default boolean supports(ModelSelection selection) {
        return true;
    }
}
