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
import me.golemcore.agent.domain.loop.Subscription;
import me.golemcore.agent.domain.loop.TurnEventListener;
import me.golemcore.agent.domain.model.CancellationReason;
import me.golemcore.agent.domain.model.DeliveryMode;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.ErrorKind;
import me.golemcore.agent.domain.model.HookMessage;
import me.golemcore.agent.domain.model.InstrumentationEvent;
import me.golemcore.agent.domain.model.PromptQueueEntry;
import me.golemcore.agent.domain.model.Result;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.model.SubmitOptions;
import me.golemcore.agent.domain.model.TurnOutcome;
import me.golemcore.agent.domain.model.TurnRequest;
import me.golemcore.agent.domain.system.ErrorClassifier;
import me.golemcore.agent.domain.system.ResourceScope;
import me.golemcore.agent.port.outbound.HookMessageSink;
import me.golemcore.agent.port.outbound.InstrumentationSink;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Serializes prompts of one session onto the {@link AgentOrchestrator}.
 *
 * <p>
 * Supports:
 * </p>
 * <ul>
 * <li>queue mode: prompts wait and run strictly in submission order;</li>
 * <li>interrupt mode: the running turn is cancelled and the prompt runs next,
 * while prompts already queued keep their place behind it;</li>
 * <li>a per-turn deadline that cancels through the same path as an abort;</li>
 * <li>scoped teardown on {@link #close()}.</li>
 * </ul>
 *
 * <p>
 * All failures are returned as {@link Result#err(SdkError)}; nothing is thrown
 * past this class.
 */
@Slf4j
public class SessionRuntime implements AutoCloseable {

    private final String sessionId;
    private final AgentOrchestrator orchestrator;
    private final HookRegistry hookRegistry;
    private final PromptQueue queue;
    private final Duration turnTimeout;
    private final Clock clock;
    private final HookMessageSink hookMessageSink;
    private final InstrumentationSink instrumentationSink;
    private final ExecutorService loopExecutor;
    private final ResourceScope scope;

    private final Object lock = new Object();
    private ResourceScope abortScope;
    private PromptQueueEntry activeEntry;
    private boolean activeCancelRequested;
    private boolean closed;

    public SessionRuntime(String sessionId, AgentOrchestrator orchestrator, HookRegistry hookRegistry,
            PromptQueue queue, Duration turnTimeout, Clock clock, HookMessageSink hookMessageSink,
            InstrumentationSink instrumentationSink) {
        this.sessionId = sessionId;
        this.orchestrator = orchestrator;
        this.hookRegistry = hookRegistry;
        this.queue = queue;
        this.turnTimeout = turnTimeout;
        this.clock = clock;
        this.hookMessageSink = hookMessageSink != null ? hookMessageSink : HookMessageSink.NOOP;
        this.instrumentationSink = instrumentationSink != null ? instrumentationSink : InstrumentationSink.NOOP;
        this.scope = new ResourceScope("session-" + sessionId);
        this.abortScope = new ResourceScope("abort-" + sessionId);
        this.loopExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "agent-session-" + sessionId);
            t.setDaemon(true);
            return t;
        });
        orchestrator.setInstrumentation(this::emitInstrumentation);
    }

    public String getSessionId() {
        return sessionId;
    }

    public AgentOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public PromptQueue getQueue() {
        return queue;
    }

    /**
     * Registers an event listener for the lifetime of this session.
     */
    public Subscription subscribe(TurnEventListener listener) {
        Subscription subscription = orchestrator.subscribe(listener);
        scope.register(subscription);
        return () -> {
            scope.unregister(subscription);
            subscription.unsubscribe();
        };
    }

    /**
     * Registers an externally held resource released on {@link #close()}.
     */
    public <T extends AutoCloseable> T register(T resource) {
        return scope.register(resource);
    }

    /**
     * Registers a resource released by the next {@link #abort()} (or by
     * {@link #close()}), e.g. a pending authorization flow.
     */
    public <T extends AutoCloseable> T registerUntilAbort(T resource) {
        ResourceScope current;
        synchronized (lock) {
            current = abortScope;
        }
        return current.register(resource);
    }

    public Result<TurnOutcome> submitPromptAndWait(String prompt, SubmitOptions options) {
        try {
            return submit(prompt, options).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.err(SdkError.cancelled("Interrupted while waiting for the prompt"));
        } catch (ExecutionException e) {
            return Result.err(ErrorClassifier.classify(e.getCause()));
        }
    }

    /**
     * Submits a prompt. The future always completes normally with a
     * {@link Result}.
     */
    public CompletableFuture<Result<TurnOutcome>> submit(String prompt, SubmitOptions options) {
        SubmitOptions effective = options != null ? options : SubmitOptions.DEFAULT;
        if (prompt == null || prompt.isBlank()) {
            return CompletableFuture.completedFuture(
                    Result.err(SdkError.request(ErrorCode.INVALID_INPUT, "Empty prompt")));
        }

        PromptQueueEntry entry;
        boolean interruptActive = false;
        synchronized (lock) {
            if (closed) {
                return CompletableFuture.completedFuture(
                        Result.err(SdkError.config(ErrorCode.CONFIG_INVALID, "Session is closed")));
            }
            try {
                entry = queue.submit(prompt, effective.getAttachments(), effective.getMode());
            } catch (SdkException e) {
                return CompletableFuture.completedFuture(Result.err(e.getError()));
            }
            if (activeEntry == null) {
                startNextLocked();
            } else if (effective.getMode() == DeliveryMode.INTERRUPT) {
                interruptActive = true;
                activeCancelRequested = true;
            }
        }

        if (interruptActive) {
            log.info("[Session] {} interrupt #{} cancels the running turn ({} queued)",
                    sessionId, entry.getSequence(), queue.size());
            orchestrator.abort(CancellationReason.INTERRUPT);
        }
        return entry.getCompletion();
    }

    /**
     * Cancels the running turn. Queued prompts are kept and continue to run.
     *
     * @return true if a turn was running
     */
    public boolean abort() {
        ResourceScope released;
        synchronized (lock) {
            if (activeEntry != null) {
                activeCancelRequested = true;
            }
            released = abortScope;
            if (!closed) {
                abortScope = new ResourceScope("abort-" + sessionId);
            }
        }
        try {
            return orchestrator.abort(CancellationReason.ABORT);
        } finally {
            released.close();
        }
    }

    /**
     * Removes every queued (not yet started) prompt and completes it as
     * cancelled.
     *
     * @return the removed prompts in execution order
     */
    public List<String> drainQueue() {
        List<PromptQueueEntry> drained = queue.drain();
        List<String> prompts = new ArrayList<>(drained.size());
        for (PromptQueueEntry entry : drained) {
            entry.complete(Result.err(SdkError.cancelled("Removed from queue")));
            prompts.add(entry.getPrompt());
        }
        return prompts;
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    public boolean isBusy() {
        synchronized (lock) {
            return activeEntry != null;
        }
    }

    @Override
    public void close() {
        List<PromptQueueEntry> drained;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            activeCancelRequested = true;
            drained = queue.drain();
        }
        try {
            orchestrator.abort(CancellationReason.CLOSE);
            for (PromptQueueEntry entry : drained) {
                entry.complete(Result.err(SdkError.cancelled("Session closed")));
            }
        } finally {
            ResourceScope pendingAbort;
            synchronized (lock) {
                pendingAbort = abortScope;
            }
            pendingAbort.close();
            scope.close();
            orchestrator.setInstrumentation(InstrumentationSink.NOOP);
            loopExecutor.shutdown();
            log.debug("[Session] {} closed ({} queued prompts cancelled)", sessionId, drained.size());
        }
    }

    private void startNextLocked() {
        PromptQueueEntry next = queue.poll();
        activeEntry = next;
        activeCancelRequested = false;
        if (next == null) {
            return;
        }
        try {
            loopExecutor.execute(() -> runEntry(next));
        } catch (RejectedExecutionException e) {
            activeEntry = null;
            next.complete(Result.err(SdkError.cancelled("Session closed")));
        }
    }

    private void runEntry(PromptQueueEntry entry) {
        Instant startedAt = Instant.now(clock);
        emitInstrumentation(InstrumentationEvent.PROMPT_START, attributes(entry, null));
        Result<TurnOutcome> result;
        try {
            result = execute(entry);
        } catch (RuntimeException e) { // NOSONAR - every failure must reach the submitter as a Result
            result = Result.err(ErrorClassifier.classify(e));
        }

        if (result.isOk()) {
            Map<String, Object> attrs = attributes(entry, null);
            attrs.put("durationMs", Duration.between(startedAt, Instant.now(clock)).toMillis());
            emitInstrumentation(InstrumentationEvent.PROMPT_COMPLETE, attrs);
        } else {
            emitInstrumentation(InstrumentationEvent.PROMPT_ERROR, attributes(entry, result.errorOrNull()));
        }
        entry.complete(result);
        onEntryFinished(entry);
    }

    private Result<TurnOutcome> execute(PromptQueueEntry entry) {
        List<HookMessage> hookMessages;
        try {
            hookMessages = hookRegistry.runBeforeTurn(entry.getPrompt(), orchestrator.getState());
        } catch (SdkException e) {
            SdkError error = e.getError();
            if (error.getKind() == ErrorKind.HOOK) {
                Map<String, Object> attrs = new LinkedHashMap<>();
                attrs.put("hookId", error.getHookId());
                attrs.put("error", error.getMessage());
                emitInstrumentation(InstrumentationEvent.HOOK_ERROR, attrs);
            }
            return Result.err(error);
        }
        for (HookMessage message : hookMessages) {
            deliverHookMessage(message);
        }

        CompletableFuture<TurnOutcome> turn;
        synchronized (lock) {
            if (activeCancelRequested) {
                return Result.err(SdkError.cancelled("Turn cancelled before start"));
            }
            turn = orchestrator.send(TurnRequest.builder()
                    .prompt(entry.getPrompt())
                    .attachments(entry.getAttachments())
                    .timeout(turnTimeout)
                    .build());
        }

        try {
            return Result.ok(turn.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            orchestrator.abort(CancellationReason.CLOSE);
            return Result.err(SdkError.cancelled("Interrupted while running the turn"));
        } catch (ExecutionException e) {
            return Result.err(ErrorClassifier.classify(e.getCause()));
        }
    }

    private void onEntryFinished(PromptQueueEntry entry) {
        synchronized (lock) {
            if (activeEntry == entry) {
                activeEntry = null;
            }
            if (!closed && activeEntry == null) {
                startNextLocked();
            }
        }
    }

    private void deliverHookMessage(HookMessage message) {
        try {
            hookMessageSink.onHookMessage(message);
        } catch (RuntimeException e) { // NOSONAR - sinks are external and must not break the session
            log.warn("[Session] {} hook message sink failed: {}", sessionId, e.getMessage());
        }
    }

    private void emitInstrumentation(String type, Map<String, Object> attributes) {
        emitInstrumentation(InstrumentationEvent.builder()
                .type(type)
                .sessionId(sessionId)
                .timestamp(Instant.now(clock))
                .attributes(attributes)
                .build());
    }

    private void emitInstrumentation(InstrumentationEvent event) {
        InstrumentationEvent stamped = event.getSessionId() != null ? event
                : InstrumentationEvent.builder()
                        .type(event.getType())
                        .sessionId(sessionId)
                        .timestamp(event.getTimestamp() != null ? event.getTimestamp() : Instant.now(clock))
                        .attributes(event.getAttributes())
                        .build();
        try {
            instrumentationSink.onEvent(stamped);
        } catch (RuntimeException e) { // NOSONAR - sinks are external and must not break the session
            log.warn("[Session] {} instrumentation sink failed on {}: {}", sessionId, event.getType(),
                    e.getMessage());
        }
    }

    private Map<String, Object> attributes(PromptQueueEntry entry, SdkError error) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("sequence", entry.getSequence());
        attrs.put("mode", entry.getMode().name());
        if (error != null) {
            attrs.put("code", error.getCode().name());
            attrs.put("retryable", error.isRetryable());
            attrs.put("message", error.getMessage());
        }
        return attrs;
    }
}
