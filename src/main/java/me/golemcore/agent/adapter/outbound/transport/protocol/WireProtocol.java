package me.golemcore.agent.adapter.outbound.transport.protocol;

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
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.TurnOptions;
import okhttp3.Request;

import java.util.List;

/**
 * Request encoding and Server-Sent-Events decoding of one backend API.
 * Implementations are stateless; per-stream state lives in the
 * {@link FrameDecoder} returned by {@link #newDecoder()}.
 */
public interface WireProtocol {

    String getId();

    Request buildRequest(Endpoint endpoint, ConversationState conversation, TurnOptions options);

    FrameDecoder newDecoder();

    /**
     * Stateful decoder for the events of a single response stream.
     */
    interface FrameDecoder {

        /**
         * Maps one SSE event to zero or more chunks.
         *
         * @param event
         *            the {@code event:} field, or null when absent
         * @param data
         *            the joined {@code data:} lines
         */
        List<StreamChunk> decode(String event, String data);

        /**
         * True once the terminal frame was seen; the reader stops there.
         */
        boolean isDone();

        /**
         * Called when the body ends. Flushes buffered chunks or fails when the
         * stream was cut before its terminal frame.
         */
        List<StreamChunk> finish();
    }
}
