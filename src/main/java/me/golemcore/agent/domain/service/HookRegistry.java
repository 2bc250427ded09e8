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
import me.golemcore.agent.domain.component.TurnHookComponent;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ExtensionLoadIssue;
import me.golemcore.agent.domain.model.HookMessage;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, ordered set of turn hooks.
 */
@Slf4j
public class HookRegistry {

    private final Map<String, TurnHookComponent> hooks = new LinkedHashMap<>();
    private final List<ExtensionLoadIssue> issues = new ArrayList<>();
    private final Clock clock;

    public HookRegistry(List<TurnHookComponent> candidates, Clock clock) {
        this.clock = clock;
        if (candidates != null) {
            for (TurnHookComponent candidate : candidates) {
                register(candidate);
            }
        }
    }

    public static HookRegistry empty() {
        return new HookRegistry(List.of(), Clock.systemUTC());
    }

    public final synchronized boolean register(TurnHookComponent hook) {
        String id = hook != null ? hook.getComponentId() : null;
        String problem = null;
        if (hook == null) {
            problem = "hook is null";
        } else if (id == null || id.isBlank()) {
            problem = "missing hook id";
        } else if (hooks.containsKey(id)) {
            problem = "duplicate hook id '" + id + "'";
        }
        if (problem != null) {
            issues.add(new ExtensionLoadIssue("hook", id, problem));
            log.warn("[Hooks] skipping hook {}: {}", id, problem);
            return false;
        }
        hooks.put(id, hook);
        return true;
    }

    public synchronized List<ExtensionLoadIssue> getIssues() {
        return Collections.unmodifiableList(new ArrayList<>(issues));
    }

    public synchronized int size() {
        return hooks.size();
    }

    /**
     * Runs every enabled hook in registration order and collects the messages
     * they contribute.
     *
     * @throws SdkException
     *             carrying a hook error with the failing hook's id
     */
    public List<HookMessage> runBeforeTurn(String prompt, ConversationState conversation) {
        List<TurnHookComponent> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(hooks.values());
        }
        List<HookMessage> messages = new ArrayList<>();
        for (TurnHookComponent hook : snapshot) {
            if (!hook.isEnabled()) {
                continue;
            }
            Optional<HookMessage> message;
            try {
                message = hook.beforeTurn(prompt, conversation);
            } catch (RuntimeException e) {
                log.warn("[Hooks] hook {} failed: {}", hook.getComponentId(), e.getMessage());
                throw new SdkException(SdkError.hook(hook.getComponentId(),
                        "Hook " + hook.getComponentId() + " failed: " + e.getMessage()), e);
            }
            if (message != null && message.isPresent()) {
                messages.add(stamp(hook.getComponentId(), message.get()));
            }
        }
        return messages;
    }

    private HookMessage stamp(String hookId, HookMessage message) {
        if (message.getHookId() != null && message.getTimestamp() != null) {
            return message;
        }
        return HookMessage.builder()
                .hookId(message.getHookId() != null ? message.getHookId() : hookId)
                .customType(message.getCustomType())
                .content(message.getContent())
                .display(message.isDisplay())
                .details(message.getDetails())
                .timestamp(message.getTimestamp() != null ? message.getTimestamp() : Instant.now(clock))
                .build();
    }
}
