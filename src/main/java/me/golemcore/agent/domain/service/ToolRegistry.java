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
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.CancellationReason;
import me.golemcore.agent.domain.model.ExtensionLoadIssue;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.TurnCancelledException;
import me.golemcore.agent.domain.system.CancellationToken;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Validated set of tools available to the model. Tools with a malformed
 * contract are reported as {@link ExtensionLoadIssue}s and left out.
 */
@Slf4j
public class ToolRegistry {

    private static final Pattern TOOL_NAME = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();
    private final List<ExtensionLoadIssue> issues = new ArrayList<>();
    private final Duration executionTimeout;

    public ToolRegistry(List<ToolComponent> candidates, Duration executionTimeout) {
        this.executionTimeout = executionTimeout;
        if (candidates != null) {
            for (ToolComponent candidate : candidates) {
                register(candidate);
            }
        }
    }

    public static ToolRegistry empty() {
        return new ToolRegistry(List.of(), Duration.ofMinutes(2));
    }

    public final synchronized boolean register(ToolComponent tool) {
        String problem = validate(tool);
        if (problem != null) {
            String id = tool != null ? safeId(tool) : null;
            issues.add(new ExtensionLoadIssue("tool", id, problem));
            log.warn("[Tools] skipping tool {}: {}", id, problem);
            return false;
        }
        tools.put(tool.getDefinition().getName(), tool);
        log.debug("[Tools] registered {}", tool.getDefinition().getName());
        return true;
    }

    public synchronized List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : tools.values()) {
            if (tool.isEnabled()) {
                definitions.add(tool.getDefinition());
            }
        }
        return definitions;
    }

    public synchronized List<ExtensionLoadIssue> getIssues() {
        return Collections.unmodifiableList(new ArrayList<>(issues));
    }

    /**
     * Executes one tool call. Tool failures become failed {@link ToolResult}s
     * fed back to the model; only cancellation escapes as an exception.
     */
    public ToolResult execute(ToolCall call, CancellationToken token) {
        ToolComponent tool;
        synchronized (this) {
            tool = tools.get(call.getName());
        }
        if (tool == null || !tool.isEnabled()) {
            return ToolResult.failure("Unknown tool: " + call.getName());
        }

        token.throwIfCancelled();
        Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();
        CompletableFuture<ToolResult> future;
        try {
            future = tool.execute(arguments);
        } catch (RuntimeException e) {
            log.warn("[Tools] {} failed to start: {}", call.getName(), e.getMessage());
            return ToolResult.failure(e.getMessage());
        }

        try (CancellationToken.Registration ignored = token.onCancel(() -> future.cancel(true))) {
            ToolResult result = future.get(executionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : ToolResult.failure("Tool returned no result");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnCancelledException(token.isCancelled() ? token.getReason()
                    : CancellationReason.ABORT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Tools] {} failed: {}", call.getName(), cause.getMessage());
            return ToolResult.failure(cause.getMessage());
        } catch (TimeoutException e) {
            future.cancel(true);
            return ToolResult.failure("Tool timed out after " + executionTimeout.toSeconds() + "s");
        } catch (CancellationException e) {
            token.throwIfCancelled();
            return ToolResult.failure("Tool execution was cancelled");
        }
    }

    private String validate(ToolComponent tool) {
        if (tool == null) {
            return "tool is null";
        }
        ToolDefinition definition;
        try {
            definition = tool.getDefinition();
        } catch (RuntimeException e) {
            return "definition failed: " + e.getMessage();
        }
        if (definition == null) {
            return "missing definition";
        }
        if (definition.getName() == null || !TOOL_NAME.matcher(definition.getName()).matches()) {
            return "invalid tool name '" + definition.getName() + "'";
        }
        Map<String, Object> schema = definition.getInputSchema();
        if (schema == null || !"object".equals(schema.get("type"))) {
            return "input schema must be a JSON object schema";
        }
        if (tools.containsKey(definition.getName())) {
            return "duplicate tool name '" + definition.getName() + "'";
        }
        return null;
    }

    private String safeId(ToolComponent tool) {
        try {
            return tool.getComponentId();
        } catch (RuntimeException e) { // NOSONAR - id is only used for reporting
            return tool.getClass().getSimpleName();
        }
    }
}
