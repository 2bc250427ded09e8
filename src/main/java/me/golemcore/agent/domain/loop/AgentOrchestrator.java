package me.golemcore.agent.domain.loop;

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
import me.golemcore.agent.domain.model.AgentBusyException;
import me.golemcore.agent.domain.model.AgentStatus;
import me.golemcore.agent.domain.model.CancellationReason;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.TurnCancelledException;
import me.golemcore.agent.domain.model.TurnEvent;
import me.golemcore.agent.domain.model.TurnEventType;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.model.TurnOutcome;
import me.golemcore.agent.domain.model.TurnRequest;
import me.golemcore.agent.domain.model.UsageTotals;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.domain.system.CancellationToken;
import me.golemcore.agent.domain.system.ErrorClassifier;
import me.golemcore.agent.port.outbound.InstrumentationSink;
import me.golemcore.agent.port.outbound.Transport;
import reactor.core.Disposable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives conversation turns through a {@link Transport} and broadcasts their
 * events.
 *
 * <p>
 * One turn runs at a time. A turn reads chunks from the transport, executes
 * requested tools between rounds (up to {@code maxToolRounds}) and ends with
 * exactly one terminal {@link TurnEventType#TURN_COMPLETE}. A failed or
 * cancelled turn emits {@link TurnEventType#ERROR} first and rolls the
 * conversation back to its pre-turn snapshot.
 *
 * <p>
 * Listeners are kept in a copy-on-write list, so every dispatch iterates a
 * snapshot and a listener may unsubscribe itself or others mid-dispatch.
 */
@Slf4j
public class AgentOrchestrator {

    private static final Duration ABORT_WAIT = Duration.ofSeconds(5);
    private static final String DEFAULT_STOP_REASON = "stop";

    private final Transport transport;
    private final ToolRegistry toolRegistry;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final int maxToolRounds;

    private final Object lock = new Object();
    private final List<TurnEventListener> listeners = new CopyOnWriteArrayList<>();
    private volatile ConversationState state;
    private volatile InstrumentationSink instrumentation = InstrumentationSink.NOOP;
    private ActiveTurn activeTurn;

    public AgentOrchestrator(Transport transport, ToolRegistry toolRegistry, ConversationState initialState,
            ScheduledExecutorService scheduler, Clock clock, int maxToolRounds) {
        this.transport = transport;
        this.toolRegistry = toolRegistry;
        this.state = initialState;
        this.scheduler = scheduler;
        this.clock = clock;
        this.maxToolRounds = maxToolRounds;
    }

    public ConversationState getState() {
        return state;
    }

    public boolean isRunning() {
        synchronized (lock) {
            return activeTurn != null;
        }
    }

    public void setInstrumentation(InstrumentationSink instrumentation) {
        this.instrumentation = instrumentation != null ? instrumentation : InstrumentationSink.NOOP;
    }

    public Subscription subscribe(TurnEventListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public CompletableFuture<TurnOutcome> send(String prompt) {
        return send(TurnRequest.of(prompt));
    }

    /**
     * Starts a turn. The returned future completes with the outcome, or
     * exceptionally with an {@link SdkException} carrying the classified error.
     *
     * @throws AgentBusyException
     *             if a turn is already running
     */
    public CompletableFuture<TurnOutcome> send(TurnRequest request) {
        ActiveTurn turn;
        synchronized (lock) {
            if (activeTurn != null) {
                throw new AgentBusyException();
            }
            CancellationToken root = CancellationToken.create();
            CancellationToken token = request.getTimeout() != null
                    ? root.withDeadline(request.getTimeout(), scheduler)
                    : root;
            Instant now = Instant.now(clock);
            ConversationState before = state;
            state = before
                    .withTurn(ConversationTurn.user(request.getPrompt(), request.getAttachments(), now))
                    .withStatus(AgentStatus.RUNNING);
            turn = new ActiveTurn(UUID.randomUUID().toString(), before, token, now);
            activeTurn = turn;
        }
        log.debug("[Agent] turn {} started: model={}", turn.id, state.getSelection().qualifiedName());
        turn.cancelRegistration = turn.token.onCancel(() -> finishCancelled(turn));
        startRound(turn);
        return turn.outcome;
    }

    /**
     * Cancels the running turn and returns once its terminal events were
     * dispatched and its transport resources released.
     *
     * @return true if a turn was running
     */
    public boolean abort() {
        return abort(CancellationReason.ABORT);
    }

    public boolean abort(CancellationReason reason) {
        ActiveTurn turn;
        synchronized (lock) {
            turn = activeTurn;
        }
        if (turn == null) {
            return false;
        }
        turn.token.cancel(reason);
        turn.awaitFinished(ABORT_WAIT);
        return true;
    }

    /**
     * Replaces the model selection used by subsequent turns.
     */
    public void setSelection(ModelSelection selection) {
        synchronized (lock) {
            if (activeTurn != null) {
                throw new AgentBusyException();
            }
            state = state.withSelection(selection);
        }
    }

    /**
     * Clears turns and usage, keeping the selection and system prompt.
     */
    public void reset() {
        synchronized (lock) {
            if (activeTurn != null) {
                throw new AgentBusyException();
            }
            state = ConversationState.initial(state.getSelection(), state.getSystemPrompt());
        }
    }

    private void startRound(ActiveTurn turn) {
        if (turn.isFinished()) {
            return;
        }
        TurnOptions options = TurnOptions.builder()
                .selection(state.getSelection())
                .tools(toolRegistry.definitions())
                .instrumentation(instrumentation)
                .build();
        ConversationState snapshot = state;
        int round = turn.beginRound();
        try {
            Disposable subscription = transport.run(snapshot, options, turn.token)
                    .subscribe(chunk -> onChunk(turn, chunk),
                            error -> onRoundError(turn, error),
                            () -> onRoundComplete(turn));
            turn.attach(round, subscription);
        } catch (RuntimeException e) {
            onRoundError(turn, e);
        }
    }

    private void onChunk(ActiveTurn turn, StreamChunk chunk) {
        synchronized (turn) {
            if (turn.finished) {
                return;
            }
            switch (chunk.getType()) {
            case TEXT -> {
                turn.text.append(chunk.getText());
                turn.roundText.append(chunk.getText());
                emit(turn, TurnEvent.builder().type(TurnEventType.TEXT_DELTA).text(chunk.getText()), false);
            }
            case THINKING -> {
                turn.thinking.append(chunk.getText());
                emit(turn, TurnEvent.builder().type(TurnEventType.THINKING_DELTA).text(chunk.getText()), false);
            }
            case TOOL_CALL -> turn.pendingToolCalls.add(chunk.getToolCall());
            case USAGE -> turn.usage = turn.usage.plus(chunk.getUsage());
            case DONE -> turn.stopReason = chunk.getStopReason();
            }
        }
    }

    private void onRoundError(ActiveTurn turn, Throwable error) {
        if (turn.token.isCancelled()) {
            finishCancelled(turn);
            return;
        }
        SdkError classified = ErrorClassifier.classify(error);
        log.warn("[Agent] turn {} failed: {}", turn.id, classified);
        finishWithError(turn, classified);
    }

    private void onRoundComplete(ActiveTurn turn) {
        List<ToolCall> calls;
        String roundText;
        synchronized (turn) {
            if (turn.finished) {
                return;
            }
            calls = new ArrayList<>(turn.pendingToolCalls);
            turn.pendingToolCalls.clear();
            roundText = turn.roundText.toString();
            turn.roundText.setLength(0);
        }

        if (calls.isEmpty()) {
            finishSucceeded(turn, roundText);
            return;
        }
        if (turn.toolRounds >= maxToolRounds) {
            finishWithError(turn, SdkError.request(ErrorCode.INVALID_INPUT,
                    "Tool round limit reached (" + maxToolRounds + ")"));
            return;
        }

        appendTurn(ConversationTurn.assistant(roundText, calls, Instant.now(clock)));
        try {
            for (ToolCall call : calls) {
                if (!emitIfActive(turn, TurnEvent.builder().type(TurnEventType.TOOL_EXECUTION_START).toolCall(call))) {
                    return;
                }
                ToolResult result = toolRegistry.execute(call, turn.token);
                synchronized (turn) {
                    if (turn.finished) {
                        return;
                    }
                    appendTurn(ConversationTurn.tool(call, result, Instant.now(clock)));
                    emit(turn, TurnEvent.builder()
                            .type(TurnEventType.TOOL_EXECUTION_END)
                            .toolCall(call)
                            .toolResult(result), false);
                }
            }
        } catch (TurnCancelledException e) {
            finishCancelled(turn);
            return;
        }
        turn.toolRounds++;
        startRound(turn);
    }

    private void finishSucceeded(ActiveTurn turn, String lastRoundText) {
        TurnOutcome outcome;
        synchronized (turn) {
            if (!turn.markFinished()) {
                return;
            }
            Instant now = Instant.now(clock);
            synchronized (lock) {
                state = state.withTurn(ConversationTurn.assistant(lastRoundText, List.of(), now))
                        .addUsage(turn.usage)
                        .withStatus(AgentStatus.IDLE);
                activeTurn = null;
            }
            release(turn);
            outcome = TurnOutcome.builder()
                    .text(turn.text.toString())
                    .thinking(turn.thinking.toString())
                    .usage(turn.usage)
                    .stopReason(turn.stopReason != null ? turn.stopReason : DEFAULT_STOP_REASON)
                    .selection(state.getSelection())
                    .toolRounds(turn.toolRounds)
                    .duration(Duration.between(turn.startedAt, now))
                    .build();
            emit(turn, TurnEvent.builder().type(TurnEventType.TURN_COMPLETE).outcome(outcome), true);
            turn.finishedLatch.countDown();
        }
        log.debug("[Agent] turn {} completed in {}ms", turn.id, outcome.getDuration().toMillis());
        turn.outcome.complete(outcome);
    }

    private void finishCancelled(ActiveTurn turn) {
        CancellationReason reason = turn.token.getReason() != null ? turn.token.getReason() : CancellationReason.ABORT;
        finishWithError(turn, SdkError.cancelled("Turn cancelled (" + reason.name().toLowerCase(Locale.ROOT) + ")"));
    }

    private void finishWithError(ActiveTurn turn, SdkError error) {
        synchronized (turn) {
            if (!turn.markFinished()) {
                return;
            }
            AgentStatus status = error.isCancellation() ? AgentStatus.ABORTED : AgentStatus.ERRORED;
            synchronized (lock) {
                state = turn.before.withStatus(status);
                activeTurn = null;
            }
            release(turn);
            emit(turn, TurnEvent.builder().type(TurnEventType.ERROR).error(error), true);
            emit(turn, TurnEvent.builder().type(TurnEventType.TURN_COMPLETE).error(error), true);
            turn.finishedLatch.countDown();
        }
        log.info("[Agent] turn {} ended with {}", turn.id, error);
        turn.outcome.completeExceptionally(new SdkException(error));
    }

    private void release(ActiveTurn turn) {
        turn.disposeSubscription();
        CancellationToken.Registration registration = turn.cancelRegistration;
        if (registration != null) {
            registration.close();
        }
        turn.token.release();
    }

    private void appendTurn(ConversationTurn conversationTurn) {
        synchronized (lock) {
            state = state.withTurn(conversationTurn);
        }
    }

    private boolean emitIfActive(ActiveTurn turn, TurnEvent.TurnEventBuilder builder) {
        synchronized (turn) {
            if (turn.finished) {
                return false;
            }
            emit(turn, builder, false);
            return true;
        }
    }

    // Caller holds the turn monitor.
    private void emit(ActiveTurn turn, TurnEvent.TurnEventBuilder builder, boolean terminal) {
        TurnEvent event = builder.turnId(turn.id).sequence(turn.nextSequence++).build();
        for (TurnEventListener listener : listeners) {
            if (!terminal && turn.finished) {
                return;
            }
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) { // NOSONAR - a faulty listener must not break the turn
                log.warn("[Agent] listener failed on {}: {}", event.getType(), e.getMessage(), e);
            }
        }
    }

    private static final class ActiveTurn {

        private final String id;
        private final ConversationState before;
        private final CancellationToken token;
        private final Instant startedAt;
        private final CompletableFuture<TurnOutcome> outcome = new CompletableFuture<>();
        private final CountDownLatch finishedLatch = new CountDownLatch(1);

        private final StringBuilder text = new StringBuilder();
        private final StringBuilder roundText = new StringBuilder();
        private final StringBuilder thinking = new StringBuilder();
        private final List<ToolCall> pendingToolCalls = new ArrayList<>();
        private UsageTotals usage = UsageTotals.EMPTY;
        private String stopReason;
        private int toolRounds;
        private long nextSequence;

        private boolean finished;
        private int currentRound;
        private Disposable subscription;
        private volatile CancellationToken.Registration cancelRegistration;

        private ActiveTurn(String id, ConversationState before, CancellationToken token, Instant startedAt) {
            this.id = id;
            this.before = before;
            this.token = token;
            this.startedAt = startedAt;
        }

        private synchronized boolean isFinished() {
            return finished;
        }

        private synchronized boolean markFinished() {
            if (finished) {
                return false;
            }
            finished = true;
            return true;
        }

        private synchronized int beginRound() {
            return ++currentRound;
        }

        // A round that already completed synchronously must not replace the next one.
        private void attach(int round, Disposable newSubscription) {
            boolean disposeNow;
            synchronized (this) {
                disposeNow = finished;
                if (!disposeNow && round == currentRound) {
                    subscription = newSubscription;
                }
            }
            if (disposeNow) {
                newSubscription.dispose();
            }
        }

        private synchronized void disposeSubscription() {
            if (subscription != null) {
                subscription.dispose();
                subscription = null;
            }
        }

        private void awaitFinished(Duration timeout) {
            try {
                if (!finishedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("[Agent] turn {} did not finish within {}ms after abort", id, timeout.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
