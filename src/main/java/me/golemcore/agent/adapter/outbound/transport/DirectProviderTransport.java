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
import me.golemcore.agent.adapter.outbound.transport.protocol.Endpoint;
import me.golemcore.agent.adapter.outbound.transport.protocol.WireProtocol;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.HttpStatusException;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.TurnCancelledException;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.system.CancellationToken;
import me.golemcore.agent.port.outbound.Transport;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.Set;

/**
 * Streams one backend call over OkHttp and decodes its Server-Sent-Events with
 * a {@link WireProtocol}.
 *
 * <p>
 * The blocking read runs on the bounded-elastic scheduler. Cancelling the
 * token or disposing the subscription cancels the OkHttp {@link Call}, which
 * unblocks the reader and closes the connection.
 */
@Slf4j
public class DirectProviderTransport implements Transport {

    private final String id;
    private final Set<String> providers;
    private final Endpoint endpoint;
    private final WireProtocol protocol;
    private final OkHttpClient httpClient;

    /**
     * @param providers
     *            provider ids this transport serves; empty serves any provider
     */
    public DirectProviderTransport(String id, Set<String> providers, Endpoint endpoint, WireProtocol protocol,
            OkHttpClient httpClient) {
        this.id = id;
        this.providers = Set.copyOf(providers);
        this.endpoint = endpoint;
        this.protocol = protocol;
        this.httpClient = httpClient;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean supports(ModelSelection selection) {
        return providers.isEmpty() || providers.contains(selection.provider());
    }

    public WireProtocol getProtocol() {
        return protocol;
    }

    @Override
    public Flux<StreamChunk> run(ConversationState conversation, TurnOptions options, CancellationToken token) {
        return Flux.<StreamChunk>create(sink -> stream(conversation, options, token, sink))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @SuppressWarnings("PMD.CloseResource") // Call is cancelled, not closed
    private void stream(ConversationState conversation, TurnOptions options, CancellationToken token,
            FluxSink<StreamChunk> sink) {
        Call call;
        try {
            Request request = protocol.buildRequest(endpoint, conversation, options);
            call = httpClient.newCall(request);
        } catch (RuntimeException e) {
            sink.error(e);
            return;
        }
        CancellationToken.Registration registration = token.onCancel(call::cancel);
        sink.onDispose(() -> {
            call.cancel();
            registration.close();
        });
        if (token.isCancelled()) {
            sink.error(new TurnCancelledException(token.getReason()));
            return;
        }

        log.debug("[Transport] {} -> {} ({})", id, options.getSelection().qualifiedName(), protocol.getId());
        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                String errorBody = body != null ? body.string() : "";
                throw new HttpStatusException(response.code(), errorBody);
            }
            if (body == null) {
                throw new IOException("Empty response body");
            }
            WireProtocol.FrameDecoder decoder = protocol.newDecoder();
            SseEventReader.read(body.source(), (event, data) -> {
                for (StreamChunk chunk : decoder.decode(event, data)) {
                    sink.next(chunk);
                }
                return !decoder.isDone() && !sink.isCancelled();
            });
            if (sink.isCancelled()) {
                return;
            }
            for (StreamChunk chunk : decoder.finish()) {
                sink.next(chunk);
            }
            sink.complete();
        } catch (IOException | RuntimeException e) {
            if (token.isCancelled()) {
                sink.error(new TurnCancelledException(token.getReason()));
            } else {
                log.debug("[Transport] {} failed: {}", id, e.getMessage());
                sink.error(e);
            }
        }
    }
}
