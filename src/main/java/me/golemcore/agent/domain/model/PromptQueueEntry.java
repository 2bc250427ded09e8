package me.golemcore.agent.domain.model;

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

import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A submitted prompt waiting for (or occupying) the turn loop. The submitter
 * observes the outcome through {@link #getCompletion()}.
 */
@Getter
public final class PromptQueueEntry {

    private final long sequence;
    private final String prompt;
    private final List<Attachment> attachments;
    private final DeliveryMode mode;
    private final Instant submittedAt;
    private final CompletableFuture<Result<TurnOutcome>> completion = new CompletableFuture<>();

    public PromptQueueEntry(long sequence, String prompt, List<Attachment> attachments, DeliveryMode mode,
            Instant submittedAt) {
        this.sequence = sequence;
        this.prompt = prompt;
        this.attachments = attachments != null ? List.copyOf(attachments) : List.of();
        this.mode = mode;
        this.submittedAt = submittedAt;
    }

    /**
     * Completes the entry once; later calls are ignored.
     */
    public boolean complete(Result<TurnOutcome> result) {
        return completion.complete(result);
    }

    public boolean isDone() {
        return completion.isDone();
    }

    @Override
    public String toString() {
        return "PromptQueueEntry{#" + sequence + ", mode=" + mode + "}";
    }
}
