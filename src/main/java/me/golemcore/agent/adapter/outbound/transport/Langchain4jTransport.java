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
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.TurnCancelledException;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.model.UsageTotals;
import me.golemcore.agent.domain.system.CancellationToken;
import me.golemcore.agent.port.outbound.Transport;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Streams through a langchain4j {@link StreamingChatModel}. Partial responses
 * become text chunks; the complete response contributes tool calls, usage and
 * the stop reason.
 *
 * <p>
 * langchain4j offers no way to abort an in-flight stream, so cancellation
 * fails the flux at once and drops whatever the model still delivers.
 */
@Slf4j
public class Langchain4jTransport implements Transport {

    private final String id;
    private final Set<String> providers;
    private final Function<ModelSelection, StreamingChatModel> modelFactory;
    private final Langchain4jMessageMapper mapper;

    public Langchain4jTransport(String id, Set<String> providers,
            Function<ModelSelection, StreamingChatModel> modelFactory,
            ObjectMapper objectMapper) {
        this.id = id;
        this.providers = Set.copyOf(providers);
        this.modelFactory = modelFactory;
        this.mapper = new Langchain4jMessageMapper(objectMapper);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean supports(ModelSelection selection) {
        return providers.isEmpty() || providers.contains(selection.provider());
    }

    @Override
    public Flux<StreamChunk> run(ConversationState conversation, TurnOptions options, CancellationToken token) {
        return Flux.create(sink -> stream(conversation, options, token, sink));
    }

    private void stream(ConversationState conversation, TurnOptions options, CancellationToken token,
            FluxSink<StreamChunk> sink) {
        AtomicBoolean active = new AtomicBoolean(true);
        CancellationToken.Registration registration = token.onCancel(() -> {
            if (active.compareAndSet(true, false)) {
                sink.error(new TurnCancelledException(token.getReason()));
            }
        });
        sink.onDispose(() -> {
            active.set(false);
            registration.close();
        });
        if (!active.get()) {
            return;
        }

        ChatRequest request;
        StreamingChatModel model;
        try {
            model = modelFactory.apply(options.getSelection());
            List<ToolSpecification> tools = mapper.toToolSpecifications(options.getTools());
            ChatRequest.Builder builder = ChatRequest.builder().messages(mapper.toMessages(conversation));
            if (!tools.isEmpty()) {
                builder.toolSpecifications(tools);
            }
            request = builder.build();
        } catch (RuntimeException e) {
            if (active.compareAndSet(true, false)) {
                sink.error(e);
            }
            return;
        }

        log.debug("[Langchain4j] {} -> {}", id, options.getSelection().qualifiedName());
        model.chat(request, new StreamingChatResponseHandler() {
            @Override
            public void onPartialResponse(String partialResponse) {
                if (active.get() && partialResponse != null && !partialResponse.isEmpty()) {
                    sink.next(StreamChunk.text(partialResponse));
                }
            }

            @Override
            public void onCompleteResponse(ChatResponse response) {
                if (!active.compareAndSet(true, false)) {
                    return;
                }
                AiMessage message = response.aiMessage();
                if (message != null && message.hasToolExecutionRequests()) {
                    for (ToolExecutionRequest toolRequest : message.toolExecutionRequests()) {
                        sink.next(StreamChunk.toolCall(mapper.toToolCall(toolRequest)));
                    }
                }
                TokenUsage usage = response.tokenUsage();
                if (usage != null) {
                    sink.next(StreamChunk.usage(UsageTotals.of(
                            usage.inputTokenCount() != null ? usage.inputTokenCount() : 0,
                            usage.outputTokenCount() != null ? usage.outputTokenCount() : 0)));
                }
                String stopReason = response.finishReason() != null
                        ? response.finishReason().name().toLowerCase(Locale.ROOT)
                        : "stop";
                sink.next(StreamChunk.done(stopReason));
                sink.complete();
            }

            @Override
            public void onError(Throwable error) {
                if (active.compareAndSet(true, false)) {
                    sink.error(error);
                }
            }
        });
    }
}
