package me.golemcore.agent.adapter.outbound.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.adapter.outbound.transport.protocol.AnthropicMessagesProtocol;
import me.golemcore.agent.adapter.outbound.transport.protocol.Endpoint;
import me.golemcore.agent.adapter.outbound.transport.protocol.OpenAiChatProtocol;
import me.golemcore.agent.domain.model.CancellationReason;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.HttpStatusException;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.ReasoningEffort;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.TurnCancelledException;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.system.CancellationToken;
import me.golemcore.agent.domain.system.ErrorClassifier;
import me.golemcore.agent.testsupport.http.OkHttpMockEngine;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DirectProviderTransportTest {

    private static final String URL = "http://mock.local/v1/chat/completions";
    private static final ModelSelection SELECTION = new ModelSelection("openai", "gpt-5.1", ReasoningEffort.LOW);

    private OkHttpMockEngine httpEngine;
    private OkHttpClient client;
    private DirectProviderTransport transport;
    private ConversationState conversation;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        client = new OkHttpClient.Builder()
                .connectTimeout(1, TimeUnit.SECONDS)
                .readTimeout(1, TimeUnit.SECONDS)
                .addInterceptor(httpEngine)
                .build();
        transport = new DirectProviderTransport("openai", Set.of("openai"),
                Endpoint.builder().url(URL).header("Authorization", "Bearer test-key").build(),
                new OpenAiChatProtocol(new ObjectMapper()), client);
        conversation = ConversationState.initial(SELECTION, null)
                .withTurn(ConversationTurn.user("hello", List.of(), Instant.parse("2026-03-01T10:00:00Z")));
    }

    @Test
    void shouldStreamDecodedChunksAndSendAuthorizedRequest() {
        httpEngine.enqueueSse(
                "data: {\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}",
                ": keep-alive",
                "data: {\"choices\":[{\"delta\":{\"content\":\" there\"},\"finish_reason\":\"stop\"}]}",
                "data: {\"choices\":[],\"usage\":{\"prompt_tokens\":4,\"completion_tokens\":2}}",
                "data: [DONE]");

        StepVerifier.create(transport.run(conversation, TurnOptions.of(SELECTION), CancellationToken.create()))
                .assertNext(chunk -> assertEquals("Hi", chunk.getText()))
                .assertNext(chunk -> assertEquals(" there", chunk.getText()))
                .assertNext(chunk -> assertEquals(6, chunk.getUsage().getTotalTokens()))
                .assertNext(chunk -> assertEquals(StreamChunk.Type.DONE, chunk.getType()))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals(URL, request.url());
        assertEquals("Bearer test-key", request.header("Authorization"));
        assertTrue(request.body().contains("\"reasoning_effort\":\"low\""));
    }

    @Test
    void shouldSurfaceHttpStatusForClassification() {
        httpEngine.enqueueJson(429, "{\"error\":{\"message\":\"slow down\"}}");

        StepVerifier.create(transport.run(conversation, TurnOptions.of(SELECTION), CancellationToken.create()))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(HttpStatusException.class, error);
                    assertEquals(429, ((HttpStatusException) error).statusCode());
                    assertEquals(ErrorCode.RATE_LIMITED, ErrorClassifier.classify(error).getCode());
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldReportTruncatedStreamAsNetworkError() {
        httpEngine.enqueueSse("data: {\"choices\":[{\"delta\":{\"content\":\"part\"}}]}");

        StepVerifier.create(transport.run(conversation, TurnOptions.of(SELECTION), CancellationToken.create()))
                .expectNextCount(1)
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(SdkException.class, error);
                    assertEquals(ErrorCode.NETWORK, ((SdkException) error).getError().getCode());
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldPropagateIoFailureAsNetworkError() {
        httpEngine.enqueueFailure(new IOException("Connection reset"));

        StepVerifier.create(transport.run(conversation, TurnOptions.of(SELECTION), CancellationToken.create()))
                .expectErrorSatisfies(error -> assertEquals(ErrorCode.NETWORK,
                        ErrorClassifier.classify(error).getCode()))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldNotCallBackendWhenTokenAlreadyCancelled() {
        CancellationToken token = CancellationToken.create();
        token.cancel(null);

        StepVerifier.create(transport.run(conversation, TurnOptions.of(SELECTION), token))
                .expectError(TurnCancelledException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(0, httpEngine.getRequestCount());
    }

    @Test
    void shouldCancelInFlightCallWhenTokenIsCancelled() throws Exception {
        AtomicReference<Call> inFlight = new AtomicReference<>();
        CountDownLatch entered = new CountDownLatch(1);
        OkHttpClient blockingClient = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    inFlight.set(chain.call());
                    entered.countDown();
                    long deadline = System.currentTimeMillis() + 5000;
                    while (!chain.call().isCanceled() && System.currentTimeMillis() < deadline) {
                        try {
                            Thread.sleep(5);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            break;
                        }
                    }
                    throw new IOException("Canceled");
                })
                .build();
        DirectProviderTransport blocking = new DirectProviderTransport("openai", Set.of("openai"),
                Endpoint.builder().url(URL).build(), new OpenAiChatProtocol(new ObjectMapper()), blockingClient);
        CancellationToken token = CancellationToken.create();

        StepVerifier.create(blocking.run(conversation, TurnOptions.of(SELECTION), token))
                .then(() -> {
                    try {
                        assertTrue(entered.await(5, TimeUnit.SECONDS));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    token.cancel(CancellationReason.ABORT);
                })
                .expectErrorSatisfies(error -> {
                    TurnCancelledException cancelled = assertInstanceOf(TurnCancelledException.class, error);
                    assertEquals(CancellationReason.ABORT, cancelled.getReason());
                })
                .verify(Duration.ofSeconds(5));

        assertTrue(inFlight.get().isCanceled());
    }

    @Test
    void shouldStopReadingAtProtocolEndMarker() {
        AnthropicMessagesProtocol anthropic = new AnthropicMessagesProtocol(new ObjectMapper());
        DirectProviderTransport anthropicTransport = new DirectProviderTransport("anthropic", Set.of("anthropic"),
                Endpoint.builder().url("http://mock.local/v1/messages").build(), anthropic, client);
        httpEngine.enqueueSse(
                "event: content_block_delta\ndata: {\"type\":\"content_block_delta\",\"index\":0,"
                        + "\"delta\":{\"type\":\"text_delta\",\"text\":\"ok\"}}",
                "event: message_stop\ndata: {\"type\":\"message_stop\"}",
                "data: {not json after the end marker");
        ModelSelection selection = new ModelSelection("anthropic", "claude-sonnet-4-5", ReasoningEffort.OFF);

        StepVerifier.create(anthropicTransport.run(conversation.withSelection(selection),
                TurnOptions.of(selection), CancellationToken.create()))
                .assertNext(chunk -> assertEquals("ok", chunk.getText()))
                .assertNext(chunk -> assertEquals("end_turn", chunk.getStopReason()))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldServeOnlyConfiguredProviders() {
        assertTrue(transport.supports(SELECTION));
        assertFalse(transport.supports(new ModelSelection("anthropic", "claude", null)));

        DirectProviderTransport any = new DirectProviderTransport("proxy", Set.of(),
                Endpoint.builder().url(URL).build(), new OpenAiChatProtocol(new ObjectMapper()), client);
        assertTrue(any.supports(new ModelSelection("anything", "m", null)));
    }
}
