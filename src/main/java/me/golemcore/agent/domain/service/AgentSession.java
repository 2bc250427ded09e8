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
import me.golemcore.agent.domain.loop.Subscription;
import me.golemcore.agent.domain.loop.TurnEventListener;
import me.golemcore.agent.domain.model.AgentBusyException;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.CycleDirection;
import me.golemcore.agent.domain.model.CycleState;
import me.golemcore.agent.domain.model.DeliveryMode;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.Result;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SessionSnapshot;
import me.golemcore.agent.domain.model.SubmitOptions;
import me.golemcore.agent.domain.model.TurnOutcome;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * Conversational handle returned by {@link AgentRunner#openSession}. Every
 * operation returns a {@link Result}; the session is closed with
 * {@link #close()} (or try-with-resources).
 */
@Slf4j
public class AgentSession implements AutoCloseable {

    private final SessionRuntime runtime;
    private CycleState cycle;

    public AgentSession(SessionRuntime runtime, CycleState cycle) {
        this.runtime = runtime;
        this.cycle = cycle;
    }

    public String getSessionId() {
        return runtime.getSessionId();
    }

    public Result<TurnOutcome> chat(String prompt) {
        return runtime.submitPromptAndWait(prompt, SubmitOptions.DEFAULT);
    }

    public Result<TurnOutcome> chat(String prompt, SubmitOptions options) {
        return runtime.submitPromptAndWait(prompt, options);
    }

    public CompletableFuture<Result<TurnOutcome>> submit(String prompt, SubmitOptions options) {
        return runtime.submit(prompt, options);
    }

    public Subscription subscribe(TurnEventListener listener) {
        return runtime.subscribe(listener);
    }

    /**
     * Cancels the running turn and releases resources registered with
     * {@link #registerUntilAbort}. Queued prompts keep running.
     */
    public boolean abort() {
        return runtime.abort();
    }

    public <T extends AutoCloseable> T registerUntilAbort(T resource) {
        return runtime.registerUntilAbort(resource);
    }

    public List<String> drainQueue() {
        return runtime.drainQueue();
    }

    public ConversationState exportConversation() {
        return runtime.getOrchestrator().getState();
    }

    public SessionSnapshot snapshot() {
        ConversationState state = runtime.getOrchestrator().getState();
        PromptQueue queue = runtime.getQueue();
        return SessionSnapshot.builder()
                .sessionId(runtime.getSessionId())
                .status(state.getStatus())
                .selection(state.getSelection())
                .turnCount(state.getTurnCount())
                .queuedInterrupts(queue.count(DeliveryMode.INTERRUPT))
                .queuedPrompts(queue.count(DeliveryMode.QUEUE))
                .usage(state.getUsage())
                .closed(runtime.isClosed())
                .build();
    }

    /**
     * Moves to the next or previous model candidate and applies it to later
     * turns. Rejected while a turn is running.
     */
    public Result<ModelSelection> cycleModel(CycleDirection direction) {
        return applyCycle(state -> ModelCycler.cycleModel(state, direction));
    }

    public Result<ModelSelection> cycleReasoning(CycleDirection direction) {
        return applyCycle(state -> ModelCycler.cycleReasoning(state, direction));
    }

    private synchronized Result<ModelSelection> applyCycle(UnaryOperator<CycleState> step) {
        if (runtime.isClosed()) {
            return Result.err(SdkError.config(ErrorCode.CONFIG_INVALID, "Session is closed"));
        }
        if (cycle == null) {
            return Result.err(SdkError.config(ErrorCode.CONFIG_MISSING, "No model candidates configured"));
        }
        CycleState next = step.apply(cycle);
        ModelSelection selection = ModelCycler.selection(next);
        try {
            runtime.getOrchestrator().setSelection(selection);
        } catch (AgentBusyException e) {
            return Result.err(SdkError.request(ErrorCode.INVALID_INPUT,
                    "Cannot change model while a turn is running"));
        }
        cycle = next;
        log.info("[Session] {} selection -> {}", runtime.getSessionId(), selection.qualifiedName());
        return Result.ok(selection);
    }

    @Override
    public void close() {
        runtime.close();
    }
}
