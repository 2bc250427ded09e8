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
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.InstrumentationEvent;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.system.CancellationToken;
import me.golemcore.agent.domain.system.ErrorClassifier;
import me.golemcore.agent.port.outbound.Transport;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a turn to the transports that serve the selected provider and fails
 * over between them.
 *
 * <p>
 * Each candidate's chunks are buffered until it completes, so a failure never
 * leaves a partial answer downstream: the consumer sees the complete output of
 * exactly one candidate, or an error. Candidates whose id equals the
 * provider are tried first, the rest keep their configured order.
 */
@Slf4j
public class RouterTransport implements Transport {

    private final List<Transport> candidates;
    private final FailoverPolicy policy;

    public RouterTransport(List<Transport> candidates, FailoverPolicy policy) {
        this.candidates = List.copyOf(candidates);
        this.policy = policy;
    }

    @Override
    public String getId() {
        return "router";
    }

    @Override
    public boolean supports(ModelSelection selection) {
        return candidates.stream().anyMatch(t -> t.supports(selection));
    }

    public List<Transport> getCandidates() {
        return candidates;
    }

    @Override
    public Flux<StreamChunk> run(ConversationState conversation, TurnOptions options, CancellationToken token) {
        return Flux.defer(() -> {
            List<Transport> eligible = eligible(options.getSelection());
            if (eligible.isEmpty()) {
                return Flux.error(new SdkException(SdkError.config(ErrorCode.CONFIG_MISSING,
                        "No transport configured for provider " + options.getSelection().provider())));
            }
            return attempt(eligible, 0, conversation, options, token);
        });
    }

    List<Transport> eligible(ModelSelection selection) {
        List<Transport> preferred = new ArrayList<>();
        List<Transport> others = new ArrayList<>();
        for (Transport candidate : candidates) {
            if (!candidate.supports(selection)) {
                continue;
            }
            if (candidate.getId().equals(selection.provider())) {
                preferred.add(candidate);
            } else {
                others.add(candidate);
            }
        }
        preferred.addAll(others);
        return preferred;
    }

    private Flux<StreamChunk> attempt(List<Transport> eligible, int index, ConversationState conversation,
            TurnOptions options, CancellationToken token) {
        Transport candidate = eligible.get(index);
        return candidate.run(conversation, options, token)
                .collectList()
                .flatMapMany(Flux::fromIterable)
                .onErrorResume(error -> {
                    if (token.isCancelled()) {
                        return Flux.error(error);
                    }
                    SdkError classified = ErrorClassifier.classify(error);
                    boolean hasNext = index + 1 < eligible.size();
                    if (!hasNext || !policy.shouldFailover(classified)) {
                        return Flux.error(error);
                    }
                    Transport next = eligible.get(index + 1);
                    log.warn("[Router] failover {} -> {}: {}", candidate.getId(), next.getId(), classified);
                    reportFailover(options, candidate, next, classified);
                    return attempt(eligible, index + 1, conversation, options, token);
                });
    }

    private void reportFailover(TurnOptions options, Transport from, Transport to, SdkError error) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("from", from.getId());
        attrs.put("to", to.getId());
        attrs.put("code", error.getCode().name());
        attrs.put("message", error.getMessage());
        try {
            options.getInstrumentation().onEvent(InstrumentationEvent.of(InstrumentationEvent.TRANSPORT_FAILOVER,
                    attrs));
        } catch (RuntimeException e) { // NOSONAR - instrumentation must not break routing
            log.warn("[Router] instrumentation sink failed: {}", e.getMessage());
        }
    }
}
