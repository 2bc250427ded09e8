package me.golemcore.agent.adapter.outbound.transport;

import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.HttpStatusException;
import me.golemcore.agent.domain.model.InstrumentationEvent;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.system.CancellationToken;
import me.golemcore.agent.port.outbound.Transport;
import me.golemcore.agent.testsupport.transport.ScriptedTransport;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RouterTransportTest {

    private static final ModelSelection OPENAI = new ModelSelection("openai", "gpt-5.1", null);
    private static final ConversationState CONVERSATION = ConversationState.initial(OPENAI, null);

    private final List<InstrumentationEvent> events = new CopyOnWriteArrayList<>();
    private final TurnOptions options = TurnOptions.builder().selection(OPENAI).instrumentation(events::add).build();

    // ===== Candidate order =====

    @Test
    void shouldPreferCandidateNamedAfterProvider() {
        ScriptedTransport proxy = new ScriptedTransport("proxy", Set.of());
        ScriptedTransport openai = new ScriptedTransport("openai", Set.of("openai"));
        ScriptedTransport anthropic = new ScriptedTransport("anthropic", Set.of("anthropic"));
        RouterTransport router = new RouterTransport(List.of(proxy, anthropic, openai), FailoverPolicy.defaults());

        List<Transport> eligible = router.eligible(OPENAI);

        assertEquals(List.of(openai, proxy), eligible);
        assertTrue(router.supports(OPENAI));
        assertFalse(new RouterTransport(List.of(anthropic), FailoverPolicy.defaults()).supports(OPENAI));
    }

    @Test
    void shouldFailWithConfigMissingWhenNoCandidateServesProvider() {
        RouterTransport router = new RouterTransport(
                List.of(new ScriptedTransport("anthropic", Set.of("anthropic"))), FailoverPolicy.defaults());

        StepVerifier.create(router.run(CONVERSATION, options, CancellationToken.create()))
                .expectErrorSatisfies(error -> {
                    SdkException sdk = assertInstanceOf(SdkException.class, error);
                    assertEquals(ErrorCode.CONFIG_MISSING, sdk.getError().getCode());
                    assertTrue(sdk.getMessage().contains("openai"));
                })
                .verify(Duration.ofSeconds(5));
    }

    // ===== Failover =====

    @Test
    void shouldFailOverWithoutForwardingPartialOutput() {
        ScriptedTransport primary = new ScriptedTransport("openai", Set.of("openai"))
                .plan(token -> Flux.concat(Flux.just(StreamChunk.text("half an ans")),
                        Flux.error(new HttpStatusException(502, "bad gateway"))));
        ScriptedTransport backup = new ScriptedTransport("backup", Set.of()).replyText("full answer");
        RouterTransport router = new RouterTransport(List.of(primary, backup), FailoverPolicy.defaults());

        StepVerifier.create(router.run(CONVERSATION, options, CancellationToken.create()))
                .assertNext(chunk -> assertEquals("full answer", chunk.getText()))
                .assertNext(chunk -> assertEquals(StreamChunk.Type.DONE, chunk.getType()))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(1, primary.getCallCount());
        assertEquals(1, backup.getCallCount());
        assertEquals(1, events.size());
        InstrumentationEvent event = events.get(0);
        assertEquals(InstrumentationEvent.TRANSPORT_FAILOVER, event.getType());
        assertEquals("openai", event.getAttributes().get("from"));
        assertEquals("backup", event.getAttributes().get("to"));
        assertEquals("SERVER_ERROR", event.getAttributes().get("code"));
    }

    @Test
    void shouldChainFailoverAcrossSeveralCandidates() {
        ScriptedTransport first = new ScriptedTransport("a", Set.of()).fail(new IOException("Connection reset"));
        ScriptedTransport second = new ScriptedTransport("b", Set.of()).fail(new HttpStatusException(503, ""));
        ScriptedTransport third = new ScriptedTransport("c", Set.of()).replyText("ok");
        RouterTransport router = new RouterTransport(List.of(first, second, third), FailoverPolicy.defaults());

        StepVerifier.create(router.run(CONVERSATION, options, CancellationToken.create()))
                .expectNextCount(2)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(2, events.size());
    }

    @Test
    void shouldNotFailOverOnNonRetryableError() {
        ScriptedTransport primary = new ScriptedTransport("openai", Set.of())
                .fail(new HttpStatusException(401, "invalid api key"));
        ScriptedTransport backup = new ScriptedTransport("backup", Set.of()).replyText("unused");
        RouterTransport router = new RouterTransport(List.of(primary, backup), FailoverPolicy.defaults());

        StepVerifier.create(router.run(CONVERSATION, options, CancellationToken.create()))
                .expectError(HttpStatusException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(0, backup.getCallCount());
        assertTrue(events.isEmpty());
    }

    @Test
    void shouldSurfaceLastErrorWhenEveryCandidateFails() {
        ScriptedTransport first = new ScriptedTransport("a", Set.of()).fail(new HttpStatusException(500, ""));
        ScriptedTransport second = new ScriptedTransport("b", Set.of()).fail(new HttpStatusException(529, ""));
        RouterTransport router = new RouterTransport(List.of(first, second), FailoverPolicy.defaults());

        StepVerifier.create(router.run(CONVERSATION, options, CancellationToken.create()))
                .expectErrorSatisfies(error -> assertEquals(529, ((HttpStatusException) error).statusCode()))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldNeverFailOverAfterCancellation() {
        CancellationToken token = CancellationToken.create();
        ScriptedTransport primary = new ScriptedTransport("a", Set.of()).plan(t -> {
            t.cancel(null);
            return Flux.error(new IOException("socket closed"));
        });
        ScriptedTransport backup = new ScriptedTransport("b", Set.of()).replyText("unused");
        RouterTransport router = new RouterTransport(List.of(primary, backup), FailoverPolicy.defaults());

        StepVerifier.create(router.run(CONVERSATION, options, token))
                .expectError(IOException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(0, backup.getCallCount());
    }

    @Test
    void shouldRespectNeverPolicy() {
        ScriptedTransport first = new ScriptedTransport("a", Set.of()).fail(new HttpStatusException(500, ""));
        ScriptedTransport second = new ScriptedTransport("b", Set.of()).replyText("unused");
        RouterTransport router = new RouterTransport(List.of(first, second), FailoverPolicy.never());

        StepVerifier.create(router.run(CONVERSATION, options, CancellationToken.create()))
                .expectError(HttpStatusException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(0, second.getCallCount());
    }

    @Test
    void shouldKeepRoutingWhenInstrumentationSinkThrows() {
        ScriptedTransport first = new ScriptedTransport("a", Set.of()).fail(new HttpStatusException(500, ""));
        ScriptedTransport second = new ScriptedTransport("b", Set.of()).replyText("ok");
        RouterTransport router = new RouterTransport(List.of(first, second), FailoverPolicy.defaults());
        TurnOptions throwing = options.toBuilder().instrumentation(event -> {
            throw new IllegalStateException("sink down");
        }).build();

        StepVerifier.create(router.run(CONVERSATION, throwing, CancellationToken.create()))
                .expectNextCount(2)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }
}
