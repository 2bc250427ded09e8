package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.component.TurnHookComponent;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.ErrorKind;
import me.golemcore.agent.domain.model.HookMessage;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.SdkException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

class HookRegistryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private static final ConversationState CONVERSATION = ConversationState.initial(
            new ModelSelection("openai", "gpt-5.1", null), "sys");

    private static TurnHookComponent hook(String id, boolean enabled,
            BiFunction<String, ConversationState, Optional<HookMessage>> body) {
        return new TurnHookComponent() {
            @Override
            public String getComponentId() {
                return id;
            }

            @Override
            public boolean isEnabled() {
                return enabled;
            }

            @Override
            public Optional<HookMessage> beforeTurn(String prompt, ConversationState conversation) {
                return body.apply(prompt, conversation);
            }
        };
    }

    @Test
    void shouldRunHooksInOrderAndStampMessages() {
        List<String> calls = new ArrayList<>();
        HookRegistry registry = new HookRegistry(List.of(
                hook("first", true, (prompt, conversation) -> {
                    calls.add("first");
                    return Optional.of(HookMessage.builder().customType("note").content("for " + prompt).build());
                }),
                hook("second", true, (prompt, conversation) -> {
                    calls.add("second");
                    return Optional.empty();
                })), CLOCK);

        List<HookMessage> messages = registry.runBeforeTurn("hello", CONVERSATION);

        assertEquals(List.of("first", "second"), calls);
        assertEquals(1, messages.size());
        HookMessage message = messages.get(0);
        assertEquals("first", message.getHookId());
        assertEquals("for hello", message.getContent());
        assertEquals("note", message.getCustomType());
        assertEquals(CLOCK.instant(), message.getTimestamp());
        assertTrue(message.isDisplay());
    }

    @Test
    void shouldSkipDisabledHooks() {
        HookRegistry registry = new HookRegistry(List.of(hook("off", false, (prompt, conversation) -> {
            throw new IllegalStateException("must not run");
        })), CLOCK);

        assertTrue(registry.runBeforeTurn("hello", CONVERSATION).isEmpty());
    }

    @Test
    void shouldReportFailingHookWithItsId() {
        List<String> calls = new ArrayList<>();
        HookRegistry registry = new HookRegistry(List.of(
                hook("audit", true, (prompt, conversation) -> {
                    throw new IllegalStateException("disk full");
                }),
                hook("later", true, (prompt, conversation) -> {
                    calls.add("later");
                    return Optional.empty();
                })), CLOCK);

        SdkException thrown = assertThrows(SdkException.class, () -> registry.runBeforeTurn("hi", CONVERSATION));

        assertEquals(ErrorKind.HOOK, thrown.getError().getKind());
        assertEquals(ErrorCode.HOOK_FAILED, thrown.getError().getCode());
        assertEquals("audit", thrown.getError().getHookId());
        assertEquals("Hook audit failed: disk full", thrown.getError().getMessage());
        assertTrue(calls.isEmpty());
    }

    @Test
    void shouldRecordInvalidHooks() {
        HookRegistry registry = new HookRegistry(List.of(
                hook("a", true, (prompt, conversation) -> Optional.empty()),
                hook("a", true, (prompt, conversation) -> Optional.empty()),
                hook(" ", true, (prompt, conversation) -> Optional.empty())), CLOCK);

        assertFalse(registry.register(null));
        assertEquals(1, registry.size());
        assertEquals(List.of("duplicate hook id 'a'", "missing hook id", "hook is null"),
                registry.getIssues().stream().map(issue -> issue.message()).toList());
        assertEquals("hook", registry.getIssues().get(0).extensionType());
    }
}
