package me.golemcore.agent.domain.service;

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
import me.golemcore.agent.domain.loop.AgentOrchestrator;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.CycleState;
import me.golemcore.agent.domain.model.ExtensionLoadIssue;
import me.golemcore.agent.domain.model.HookMessage;
import me.golemcore.agent.domain.model.InstrumentationEvent;
import me.golemcore.agent.domain.model.ModelCandidate;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.Result;
import me.golemcore.agent.domain.model.RunResult;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.model.SessionEnvelope;
import me.golemcore.agent.domain.model.SessionOptions;
import me.golemcore.agent.domain.model.SubmitOptions;
import me.golemcore.agent.domain.system.ErrorClassifier;
import me.golemcore.agent.infrastructure.config.ModelCatalog;
import me.golemcore.agent.infrastructure.config.RuntimeProperties;
import me.golemcore.agent.port.outbound.HookMessageSink;
import me.golemcore.agent.port.outbound.InstrumentationSink;
import me.golemcore.agent.port.outbound.Transport;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Entry point of the runtime. Opens sessions and offers the one-shot and
 * streaming call shapes on top of them.
 */
@Service
@Slf4j
public class AgentRunner {

    private final Transport transport;
    private final ToolRegistry toolRegistry;
    private final HookRegistry hookRegistry;
    private final ModelCatalog modelCatalog;
    private final RuntimeProperties properties;
    private final ScheduledExecutorService turnScheduler;
    private final Clock clock;

    public AgentRunner(Transport transport, ToolRegistry toolRegistry, HookRegistry hookRegistry,
            ModelCatalog modelCatalog, RuntimeProperties properties, ScheduledExecutorService turnScheduler,
            Clock clock) {
        this.transport = transport;
        this.toolRegistry = toolRegistry;
        this.hookRegistry = hookRegistry;
        this.modelCatalog = modelCatalog;
        this.properties = properties;
        this.turnScheduler = turnScheduler;
        this.clock = clock;
    }

    /**
     * Opens a conversational session.
     *
     * @throws SdkException
     *             with a config error when no model can be selected
     */
    public AgentSession openSession(SessionOptions options) {
        SessionOptions effective = options != null ? options : SessionOptions.DEFAULT;
        RuntimeProperties.SessionProperties session = properties.getSession();

        ModelSelection selection = effective.getSelection() != null
                ? effective.getSelection()
                : modelCatalog.defaultSelection();
        String systemPrompt = effective.getSystemPrompt() != null
                ? effective.getSystemPrompt()
                : session.getSystemPrompt();
        Duration turnTimeout = effective.getTurnTimeout() != null
                ? effective.getTurnTimeout()
                : session.getTurnTimeout();
        String sessionId = effective.getSessionId() != null
                ? effective.getSessionId()
                : UUID.randomUUID().toString();

        AgentOrchestrator orchestrator = new AgentOrchestrator(transport, toolRegistry,
                ConversationState.initial(selection, systemPrompt), turnScheduler, clock,
                session.getMaxToolRounds());
        SessionRuntime runtime = new SessionRuntime(sessionId, orchestrator, hookRegistry,
                new PromptQueue(session.getMaxQueuedPrompts(), clock), turnTimeout, clock,
                effective.getHookMessageSink(), effective.getInstrumentationSink());

        reportIssues(sessionId, effective.getInstrumentationSink());

        List<ModelCandidate> candidates = modelCatalog.getCandidates();
        CycleState cycle = candidates.isEmpty() ? null : ModelCycler.start(candidates, selection);
        log.info("[Runner] Opened session {} on {}", sessionId, selection.qualifiedName());
        return new AgentSession(runtime, cycle);
    }

    /**
     * Runs a single prompt in a fresh session and closes it.
     */
    public Result<RunResult> runOnce(String prompt, SessionOptions options) {
        AgentSession session;
        try {
            session = openSession(options);
        } catch (RuntimeException e) {
            return Result.err(ErrorClassifier.classify(e));
        }
        try (session) {
            return session.chat(prompt).map(RunResult::from);
        }
    }

    /**
     * Runs a single prompt and streams everything it produces. The flux is cold:
     * the session opens on subscription and closes when the stream terminates
     * or is cancelled. It always ends with an {@code END} or {@code ERROR}
     * envelope.
     */
    public Flux<SessionEnvelope> stream(String prompt, SessionOptions options) {
        return stream(prompt, options, SubmitOptions.DEFAULT);
    }

    public Flux<SessionEnvelope> stream(String prompt, SessionOptions options, SubmitOptions submitOptions) {
        SessionOptions base = options != null ? options : SessionOptions.DEFAULT;
        return Flux.create(sink -> {
            HookMessageSink userHooks = base.getHookMessageSink();
            InstrumentationSink userInstrumentation = base.getInstrumentationSink();
            SessionOptions wired = base.toBuilder()
                    .hookMessageSink(message -> forwardHookMessage(sink, userHooks, message))
                    .instrumentationSink(event -> forwardInstrumentation(sink, userInstrumentation, event))
                    .build();

            AgentSession session;
            try {
                session = openSession(wired);
            } catch (RuntimeException e) {
                sink.next(SessionEnvelope.error(ErrorClassifier.classify(e)));
                sink.complete();
                return;
            }
            sink.onDispose(session::close);
            session.subscribe(event -> sink.next(SessionEnvelope.agent(event)));
            session.submit(prompt, submitOptions).whenComplete((result, failure) -> {
                if (failure != null) {
                    sink.next(SessionEnvelope.error(ErrorClassifier.classify(failure)));
                } else if (result.isOk()) {
                    sink.next(SessionEnvelope.end(RunResult.from(result.getOrThrow())));
                } else {
                    sink.next(SessionEnvelope.error(result.errorOrNull()));
                }
                sink.complete();
            });
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    private void forwardHookMessage(FluxSink<SessionEnvelope> sink, HookMessageSink delegate,
            HookMessage message) {
        if (delegate != null) {
            delegate.onHookMessage(message);
        }
        sink.next(SessionEnvelope.hookMessage(message));
    }

    private void forwardInstrumentation(FluxSink<SessionEnvelope> sink, InstrumentationSink delegate,
            InstrumentationEvent event) {
        if (delegate != null) {
            delegate.onEvent(event);
        }
        sink.next(SessionEnvelope.instrumentation(event));
    }

    private void reportIssues(String sessionId, InstrumentationSink sink) {
        List<ExtensionLoadIssue> issues = new ArrayList<>(toolRegistry.getIssues());
        issues.addAll(hookRegistry.getIssues());
        if (issues.isEmpty() || sink == null) {
            return;
        }
        for (ExtensionLoadIssue issue : issues) {
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put("extensionType", issue.extensionType());
            attrs.put("extensionId", issue.extensionId() != null ? issue.extensionId() : "");
            attrs.put("message", issue.message());
            try {
                sink.onEvent(InstrumentationEvent.builder()
                        .type(InstrumentationEvent.VALIDATION_ISSUE)
                        .sessionId(sessionId)
                        .timestamp(Instant.now(clock))
                        .attributes(attrs)
                        .build());
            } catch (RuntimeException e) { // NOSONAR - sinks are external and must not break the session
                log.warn("[Runner] instrumentation sink failed: {}", e.getMessage());
            }
        }
    }
}
