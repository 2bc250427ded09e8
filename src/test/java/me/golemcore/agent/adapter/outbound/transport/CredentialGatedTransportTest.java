package me.golemcore.agent.adapter.outbound.transport;

import me.golemcore.agent.adapter.outbound.credentials.CredentialManager;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.Credentials;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.HttpStatusException;
import me.golemcore.agent.domain.model.InstrumentationEvent;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.system.CancellationToken;
import me.golemcore.agent.testsupport.transport.ScriptedTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CredentialGatedTransportTest {

    private static final ModelSelection CODEX = new ModelSelection("codex", "gpt-5.1-codex", null);
    private static final ConversationState CONVERSATION = ConversationState.initial(CODEX, null);

    private final Credentials stale = credentials("stale");
    private final Credentials fresh = credentials("fresh");
    private final List<Credentials> delegatedWith = new CopyOnWriteArrayList<>();
    private final List<InstrumentationEvent> events = new CopyOnWriteArrayList<>();

    private CredentialManager credentialManager;
    private ScriptedTransport delegate;
    private CredentialGatedTransport transport;
    private TurnOptions options;

    @BeforeEach
    void setUp() {
        credentialManager = mock(CredentialManager.class);
        delegate = new ScriptedTransport("codex", Set.of("codex"));
        transport = new CredentialGatedTransport("codex", Set.of("codex"), credentialManager, credentials -> {
            delegatedWith.add(credentials);
            return delegate;
        });
        options = TurnOptions.builder().selection(CODEX).instrumentation(events::add).build();
        when(credentialManager.getValidCredentials()).thenReturn(CompletableFuture.completedFuture(stale));
    }

    @Test
    void shouldRunWithValidCredentials() {
        delegate.replyText("hello");

        StepVerifier.create(transport.run(CONVERSATION, options, CancellationToken.create()))
                .expectNextCount(2)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(List.of(stale), delegatedWith);
        verify(credentialManager, never()).forceRefresh();
    }

    @Test
    void shouldRefreshOnceAndRetryAfterUnauthorized() {
        when(credentialManager.forceRefresh()).thenReturn(CompletableFuture.completedFuture(fresh));
        delegate.fail(new HttpStatusException(401, "token expired")).replyText("after refresh");

        StepVerifier.create(transport.run(CONVERSATION, options, CancellationToken.create()))
                .assertNext(chunk -> assertEquals("after refresh", chunk.getText()))
                .expectNextCount(1)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(List.of(stale, fresh), delegatedWith);
        assertEquals(1, events.size());
        assertEquals(InstrumentationEvent.CREDENTIALS_REFRESH, events.get(0).getType());
        assertEquals("unauthorized", events.get(0).getAttributes().get("reason"));
    }

    @Test
    void shouldReportAuthErrorWhenRefreshedTokenIsRejectedToo() {
        when(credentialManager.forceRefresh()).thenReturn(CompletableFuture.completedFuture(fresh));
        delegate.fail(new HttpStatusException(401, "")).fail(new HttpStatusException(401, ""));

        StepVerifier.create(transport.run(CONVERSATION, options, CancellationToken.create()))
                .expectErrorSatisfies(error -> {
                    SdkException sdk = assertInstanceOf(SdkException.class, error);
                    assertEquals(ErrorCode.AUTH, sdk.getError().getCode());
                    assertEquals("Credentials rejected after refresh", sdk.getMessage());
                })
                .verify(Duration.ofSeconds(5));

        assertEquals(2, delegate.getCallCount());
    }

    @Test
    void shouldLeavePendingRefreshRunningWhenTurnIsDisposed() {
        CompletableFuture<Credentials> pending = new CompletableFuture<>();
        when(credentialManager.getValidCredentials()).thenReturn(pending);

        Disposable turn = transport.run(CONVERSATION, options, CancellationToken.create()).subscribe();
        turn.dispose();

        assertFalse(pending.isCancelled());
        assertEquals(0, delegate.getCallCount());
    }

    @Test
    void shouldNotRefreshOnOtherFailures() {
        delegate.fail(new HttpStatusException(500, ""));

        StepVerifier.create(transport.run(CONVERSATION, options, CancellationToken.create()))
                .expectError(HttpStatusException.class)
                .verify(Duration.ofSeconds(5));

        verify(credentialManager, never()).forceRefresh();
    }

    @Test
    void shouldFailWithoutCallingBackendWhenNotAuthenticated() {
        when(credentialManager.getValidCredentials()).thenReturn(CompletableFuture.failedFuture(
                new SdkException(SdkError.provider(ErrorCode.AUTH, "Not authenticated"))));

        StepVerifier.create(transport.run(CONVERSATION, options, CancellationToken.create()))
                .expectErrorSatisfies(error -> assertEquals(ErrorCode.AUTH,
                        ((SdkException) error).getError().getCode()))
                .verify(Duration.ofSeconds(5));

        assertEquals(0, delegate.getCallCount());
    }

    @Test
    void shouldDetectUnauthorizedAnywhereInCauseChain() {
        assertTrue(CredentialGatedTransport.isUnauthorized(
                new RuntimeException("wrapped", new HttpStatusException(401, ""))));
        assertFalse(CredentialGatedTransport.isUnauthorized(new HttpStatusException(403, "")));
        assertFalse(CredentialGatedTransport.isUnauthorized(null));
    }

    private static Credentials credentials(String accessToken) {
        return Credentials.builder()
                .accessToken(accessToken)
                .refreshToken("refresh")
                .expiresAt(Instant.parse("2026-03-01T11:00:00Z"))
                .accountId("acct")
                .build();
    }
}
