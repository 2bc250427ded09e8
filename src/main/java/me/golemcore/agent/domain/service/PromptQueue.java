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
import me.golemcore.agent.domain.model.Attachment;
import me.golemcore.agent.domain.model.DeliveryMode;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.PromptQueueEntry;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;

/**
 * Bounded FIFO of prompts waiting for the turn loop. Many producers, one
 * consumer. Interrupting prompts go ahead of every QUEUE entry but behind
 * earlier interrupts, so both groups keep submission order.
 */
@Slf4j
public class PromptQueue {

    private final int capacity;
    private final Clock clock;
    private final LinkedList<PromptQueueEntry> entries = new LinkedList<>();
    private long nextSequence = 1;

    public PromptQueue(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    /**
     * Creates an entry and appends it (QUEUE) or places it after the last queued
     * interrupt (INTERRUPT).
     *
     * @throws SdkException
     *             with {@link ErrorCode#INVALID_INPUT} when the queue is full
     */
    public synchronized PromptQueueEntry submit(String prompt, List<Attachment> attachments, DeliveryMode mode) {
        if (entries.size() >= capacity) {
            log.warn("[PromptQueue] queue limit reached ({}), rejecting prompt", capacity);
            throw new SdkException(SdkError.request(ErrorCode.INVALID_INPUT,
                    "Prompt queue is full (" + capacity + " entries)"));
        }
        PromptQueueEntry entry = new PromptQueueEntry(nextSequence++, prompt, attachments, mode,
                Instant.now(clock));
        if (mode == DeliveryMode.INTERRUPT) {
            ListIterator<PromptQueueEntry> cursor = entries.listIterator();
            while (cursor.hasNext()) {
                if (cursor.next().getMode() != DeliveryMode.INTERRUPT) {
                    cursor.previous();
                    break;
                }
            }
            cursor.add(entry);
        } else {
            entries.addLast(entry);
        }
        return entry;
    }

    public synchronized PromptQueueEntry poll() {
        return entries.pollFirst();
    }

    /**
     * Removes and returns every queued entry in execution order.
     */
    public synchronized List<PromptQueueEntry> drain() {
        List<PromptQueueEntry> drained = new ArrayList<>(entries);
        entries.clear();
        return drained;
    }

    /**
     * Returns queued entries in execution order without removing them.
     */
    public synchronized List<PromptQueueEntry> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public synchronized int count(DeliveryMode mode) {
        int count = 0;
        for (PromptQueueEntry entry : entries) {
            if (entry.getMode() == mode) {
                count++;
            }
        }
        return count;
    }
}
