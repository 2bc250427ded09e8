package me.golemcore.agent.adapter.outbound.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.adapter.outbound.transport.protocol.Endpoint;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.ReasoningEffort;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.model.StreamChunk;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.system.CancellationToken;
import me.golemcore.agent.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AppRelayTransportTest {

    private static final ModelSelection SELECTION = new ModelSelection("anthropic", "claude-sonnet-4-5",
            ReasoningEffort.MEDIUM);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine httpEngine;
    private AppRelayTransport transport;
    private ConversationState conversation;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(httpEngine).build();
        transport = new AppRelayTransport("relay", Set.of(),
                Endpoint.builder().url("http://relay.local/v1/turn").header("Authorization", "Bearer relay-key")
                        .build(),
                client, objectMapper);
        conversation = ConversationState.initial(SELECTION, "sys")
                .withTurn(ConversationTurn.user("hi", List.of(), Instant.parse("2026-03-01T10:00:00Z")));
    }

    @Test
    void shouldSendCanonicalConversationAndDecodeCanonicalFrames() throws Exception {
        httpEngine.enqueueSse(
                "data: {\"type\":\"text\",\"text\":\"Hel\"}",
                "data: {\"type\":\"tool_call\",\"id\":\"c1\",\"name\":\"search\",\"arguments\":{\"q\":\"x\"}}",
                "data: {\"type\":\"usage\",\"inputTokens\":12,\"outputTokens\":3,\"cost\":0.5}",
                "data: {\"type\":\"done\",\"stopReason\":\"tool_use\"}");
        TurnOptions options = TurnOptions.builder().selection(SELECTION)
                .tool(ToolDefinition.simple("search", "web")).build();

        StepVerifier.create(transport.run(conversation, options, CancellationToken.create()))
                .assertNext(chunk -> assertEquals("Hel", chunk.getText()))
                .assertNext(chunk -> assertEquals(Map.of("q", "x"), chunk.getToolCall().getArguments()))
                .assertNext(chunk -> assertEquals(0.5, chunk.getUsage().getCost()))
                .assertNext(chunk -> {
                    assertEquals(StreamChunk.Type.DONE, chunk.getType());
                    assertEquals("tool_use", chunk.getStopReason());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("Bearer relay-key", request.header("Authorization"));
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("anthropic", body.path("provider").asText());
        assertEquals("medium", body.path("reasoning").asText());
        assertEquals("sys", body.path("systemPrompt").asText());
        assertEquals("user", body.path("turns").path(0).path("role").asText());
        assertEquals("search", body.path("tools").path(0).path("name").asText());
    }

    @Test
    void shouldMapRelayErrorCode() {
        httpEngine.enqueueSse("data: {\"type\":\"error\",\"code\":\"OVERLOADED\",\"message\":\"busy\"}");

        StepVerifier.create(transport.run(conversation, TurnOptions.of(SELECTION), CancellationToken.create()))
                .expectErrorSatisfies(error -> {
                    SdkException sdk = assertInstanceOf(SdkException.class, error);
                    assertEquals(ErrorCode.OVERLOADED, sdk.getError().getCode());
                    assertEquals("busy", sdk.getMessage());
                })
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldFallBackToMessageClassificationForUnknownRelayCode() {
        httpEngine.enqueueSse("data: {\"type\":\"error\",\"code\":\"SOMETHING_NEW\",\"message\":\"rate limit hit\"}");

        StepVerifier.create(transport.run(conversation, TurnOptions.of(SELECTION), CancellationToken.create()))
                .expectErrorSatisfies(error -> assertEquals(ErrorCode.RATE_LIMITED,
                        ((SdkException) error).getError().getCode()))
                .verify(Duration.ofSeconds(5));
    }
}
