package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.CancellationReason;
import me.golemcore.agent.domain.model.ExtensionLoadIssue;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.TurnCancelledException;
import me.golemcore.agent.domain.system.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private static ToolComponent tool(ToolDefinition definition, CompletableFuture<ToolResult> result) {
        return tool(definition, result, true);
    }

    private static ToolComponent tool(ToolDefinition definition, CompletableFuture<ToolResult> result,
            boolean enabled) {
        return new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return definition;
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                return result;
            }

            @Override
            public boolean isEnabled() {
                return enabled;
            }
        };
    }

    private static ToolCall call(String name) {
        return ToolCall.builder().id("c1").name(name).arguments(Map.of()).build();
    }

    // ===== Registration =====

    @Test
    void shouldRecordInvalidToolsAndKeepValidOnes() {
        ToolDefinition badSchema = ToolDefinition.builder()
                .name("raw")
                .inputSchema(Map.of("type", "string"))
                .build();
        ToolRegistry registry = new ToolRegistry(List.of(
                tool(ToolDefinition.simple("echo", "Echo"), CompletableFuture.completedFuture(ToolResult.success(""))),
                tool(ToolDefinition.simple("bad name!", "x"), new CompletableFuture<>()),
                tool(badSchema, new CompletableFuture<>()),
                tool(ToolDefinition.simple("echo", "Again"), new CompletableFuture<>())), Duration.ofSeconds(1));

        assertEquals(1, registry.definitions().size());
        List<ExtensionLoadIssue> issues = registry.getIssues();
        assertEquals(3, issues.size());
        assertEquals("tool", issues.get(0).extensionType());
        assertTrue(issues.get(0).message().startsWith("invalid tool name"));
        assertEquals("input schema must be a JSON object schema", issues.get(1).message());
        assertEquals("raw", issues.get(1).extensionId());
        assertTrue(issues.get(2).message().startsWith("duplicate tool name"));
    }

    @Test
    void shouldRecordNullTool() {
        ToolRegistry registry = ToolRegistry.empty();

        assertFalse(registry.register(null));
        assertEquals("tool is null", registry.getIssues().get(0).message());
    }

    @Test
    void shouldHideDisabledTools() {
        ToolRegistry registry = new ToolRegistry(List.of(tool(ToolDefinition.simple("off", "Off"),
                CompletableFuture.completedFuture(ToolResult.success("x")), false)), Duration.ofSeconds(1));

        assertTrue(registry.definitions().isEmpty());
        assertEquals("Unknown tool: off", registry.execute(call("off"), CancellationToken.create()).getError());
    }

    // ===== Execution =====

    @Test
    void shouldReturnToolOutput() {
        ToolRegistry registry = new ToolRegistry(List.of(tool(ToolDefinition.simple("echo", "Echo"),
                CompletableFuture.completedFuture(ToolResult.success("pong")))), Duration.ofSeconds(1));

        ToolResult result = registry.execute(call("echo"), CancellationToken.create());

        assertTrue(result.isSuccess());
        assertEquals("pong", result.toModelText());
    }

    @Test
    void shouldReportUnknownTool() {
        ToolResult result = ToolRegistry.empty().execute(call("nope"), CancellationToken.create());

        assertFalse(result.isSuccess());
        assertEquals("Error: Unknown tool: nope", result.toModelText());
    }

    @Test
    void shouldTurnToolExceptionIntoFailure() {
        ToolRegistry registry = new ToolRegistry(List.of(tool(ToolDefinition.simple("bad", "Bad"),
                CompletableFuture.failedFuture(new IllegalStateException("disk full")))), Duration.ofSeconds(1));

        ToolResult result = registry.execute(call("bad"), CancellationToken.create());

        assertFalse(result.isSuccess());
        assertEquals("disk full", result.getError());
    }

    @Test
    void shouldTurnSynchronousThrowIntoFailure() {
        ToolComponent throwing = new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.simple("sync", "Sync");
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                throw new IllegalArgumentException("bad args");
            }
        };
        ToolRegistry registry = new ToolRegistry(List.of(throwing), Duration.ofSeconds(1));

        assertEquals("bad args", registry.execute(call("sync"), CancellationToken.create()).getError());
    }

    @Test
    void shouldTimeOutSlowTool() {
        CompletableFuture<ToolResult> never = new CompletableFuture<>();
        ToolRegistry registry = new ToolRegistry(List.of(tool(ToolDefinition.simple("slow", "Slow"), never)),
                Duration.ofMillis(100));

        ToolResult result = registry.execute(call("slow"), CancellationToken.create());

        assertFalse(result.isSuccess());
        assertEquals("Tool timed out after 0s", result.getError());
        assertTrue(never.isCancelled());
    }

    @Test
    void shouldThrowWhenAlreadyCancelled() {
        ToolRegistry registry = new ToolRegistry(List.of(tool(ToolDefinition.simple("echo", "Echo"),
                CompletableFuture.completedFuture(ToolResult.success("x")))), Duration.ofSeconds(1));
        CancellationToken token = CancellationToken.create();
        token.cancel(CancellationReason.ABORT);

        assertThrows(TurnCancelledException.class, () -> registry.execute(call("echo"), token));
    }

    @Test
    void shouldCancelRunningToolWithToken() throws Exception {
        CompletableFuture<ToolResult> never = new CompletableFuture<>();
        CountDownLatch started = new CountDownLatch(1);
        ToolComponent slow = new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.simple("slow", "Slow");
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                started.countDown();
                return never;
            }
        };
        ToolRegistry registry = new ToolRegistry(List.of(slow), Duration.ofMinutes(1));
        CancellationToken token = CancellationToken.create();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ToolResult> running = executor.submit(() -> registry.execute(call("slow"), token));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            token.cancel(CancellationReason.INTERRUPT);

            Exception thrown = assertThrows(Exception.class, () -> running.get(5, TimeUnit.SECONDS));
            assertInstanceOf(TurnCancelledException.class, thrown.getCause());
            assertTrue(never.isCancelled());
        } finally {
            executor.shutdownNow();
        }
    }
}
