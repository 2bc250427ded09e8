package me.golemcore.agent.adapter.outbound.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.adapter.outbound.credentials.CredentialManager;
import me.golemcore.agent.adapter.outbound.transport.protocol.AnthropicMessagesProtocol;
import me.golemcore.agent.adapter.outbound.transport.protocol.CodexResponsesProtocol;
import me.golemcore.agent.adapter.outbound.transport.protocol.OpenAiChatProtocol;
import me.golemcore.agent.adapter.outbound.transport.protocol.RelayFrameProtocol;
import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.ConversationTurn;
import me.golemcore.agent.domain.model.Credentials;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.ModelSelection;
import me.golemcore.agent.domain.model.SdkException;
import me.golemcore.agent.domain.model.TurnOptions;
import me.golemcore.agent.domain.system.CancellationToken;
import me.golemcore.agent.infrastructure.config.RuntimeProperties;
import me.golemcore.agent.port.outbound.Transport;
import me.golemcore.agent.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TransportFactoryTest {

    private RuntimeProperties properties;
    private OkHttpMockEngine httpEngine;
    private CredentialManager credentialManager;
    private TransportFactory factory;

    @BeforeEach
    void setUp() {
        properties = new RuntimeProperties();
        httpEngine = new OkHttpMockEngine();
        credentialManager = mock(CredentialManager.class);
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(httpEngine).build();
        factory = new TransportFactory(properties, client, new ObjectMapper(), credentialManager);
    }

    // ===== Router assembly =====

    @Test
    void shouldOrderCandidatesByRouterOrderThenDeclarationOrder() {
        properties.getProviders().put("openai", provider(RuntimeProperties.TransportType.DIRECT,
                OpenAiChatProtocol.ID, null));
        properties.getProviders().put("anthropic", provider(RuntimeProperties.TransportType.DIRECT,
                AnthropicMessagesProtocol.ID, null));
        properties.getProviders().put("relay", provider(RuntimeProperties.TransportType.RELAY, null,
                "http://relay.local/turn"));
        properties.getRouter().setOrder(List.of("relay"));

        RouterTransport router = factory.createRouter();

        assertEquals(List.of("relay", "openai", "anthropic"),
                router.getCandidates().stream().map(Transport::getId).toList());
        assertInstanceOf(AppRelayTransport.class, router.getCandidates().get(0));
    }

    @Test
    void shouldSkipDisabledProviders() {
        properties.getProviders().put("openai", provider(RuntimeProperties.TransportType.DIRECT,
                OpenAiChatProtocol.ID, null));
        RuntimeProperties.ProviderProperties codex = provider(RuntimeProperties.TransportType.CODEX, null, null);
        codex.setEnabled(false);
        properties.getProviders().put("codex", codex);

        RouterTransport router = factory.createRouter();

        assertEquals(1, router.getCandidates().size());
        assertFalse(router.supports(new ModelSelection("codex", "gpt-5.1-codex", null)));
    }

    @Test
    void shouldRejectUnknownProviderInRouterOrder() {
        properties.getRouter().setOrder(List.of("ghost"));

        SdkException ex = assertThrows(SdkException.class, () -> factory.createRouter());

        assertEquals(ErrorCode.CONFIG_INVALID, ex.getError().getCode());
    }

    @Test
    void shouldRejectUnknownFailoverCode() {
        properties.getRouter().setFailoverCodes(List.of("SOMETIMES"));

        SdkException ex = assertThrows(SdkException.class, () -> factory.createRouter());

        assertEquals(ErrorCode.CONFIG_INVALID, ex.getError().getCode());
    }

    // ===== Single transports =====

    @Test
    void shouldUseDefaultEndpointsForKnownProtocols() {
        RuntimeProperties.ProviderProperties openai = provider(RuntimeProperties.TransportType.DIRECT,
                OpenAiChatProtocol.ID, null);
        openai.setApiKey("sk-test");
        DirectProviderTransport transport = (DirectProviderTransport) factory.create("openai", openai);
        httpEngine.enqueueSse("data: {\"choices\":[{\"delta\":{},\"finish_reason\":\"stop\"}]}", "data: [DONE]");
        ModelSelection selection = new ModelSelection("openai", "gpt-4.1", null);

        StepVerifier.create(transport.run(conversation(selection), TurnOptions.of(selection),
                CancellationToken.create()))
                .expectNextCount(1)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("https://api.openai.com/v1/chat/completions", request.url());
        assertEquals("Bearer sk-test", request.header("Authorization"));
    }

    @Test
    void shouldSendAnthropicKeyHeaderAndTrimBaseUrl() {
        RuntimeProperties.ProviderProperties anthropic = provider(RuntimeProperties.TransportType.DIRECT,
                AnthropicMessagesProtocol.ID, "http://proxy.local/v1/");
        anthropic.setApiKey("ant-key");
        Transport transport = factory.create("anthropic", anthropic);
        httpEngine.enqueueSse("data: {\"type\":\"message_stop\"}");
        ModelSelection selection = new ModelSelection("anthropic", "claude-sonnet-4-5", null);

        StepVerifier.create(transport.run(conversation(selection), TurnOptions.of(selection),
                CancellationToken.create()))
                .expectNextCount(1)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("http://proxy.local/v1/messages", request.url());
        assertEquals("ant-key", request.header("x-api-key"));
        assertNull(request.header("Authorization"));
    }

    @Test
    void shouldServeAnyProviderWithWildcard() {
        RuntimeProperties.ProviderProperties gateway = provider(RuntimeProperties.TransportType.DIRECT,
                OpenAiChatProtocol.ID, "http://gateway.local/v1");
        gateway.setServes(List.of("*"));
        RuntimeProperties.ProviderProperties mirror = provider(RuntimeProperties.TransportType.DIRECT,
                OpenAiChatProtocol.ID, "http://mirror.local/v1");
        mirror.setServes(List.of("openai"));

        Transport any = factory.create("gateway", gateway);
        Transport openaiMirror = factory.create("mirror", mirror);

        assertTrue(any.supports(new ModelSelection("whatever", "m", null)));
        assertTrue(openaiMirror.supports(new ModelSelection("openai", "gpt-5.1", null)));
        assertTrue(openaiMirror.supports(new ModelSelection("mirror", "m", null)));
        assertFalse(openaiMirror.supports(new ModelSelection("anthropic", "m", null)));
    }

    @Test
    void shouldRequireBaseUrlForRelayAndCustomProtocols() {
        SdkException relay = assertThrows(SdkException.class,
                () -> factory.create("relay", provider(RuntimeProperties.TransportType.RELAY, null, null)));
        SdkException codexDirect = assertThrows(SdkException.class,
                () -> factory.create("custom", provider(RuntimeProperties.TransportType.DIRECT,
                        CodexResponsesProtocol.ID, null)));

        assertEquals(ErrorCode.CONFIG_MISSING, relay.getError().getCode());
        assertEquals(ErrorCode.CONFIG_MISSING, codexDirect.getError().getCode());
    }

    @Test
    void shouldRejectUnknownProtocol() {
        SdkException ex = assertThrows(SdkException.class,
                () -> factory.create("x", provider(RuntimeProperties.TransportType.DIRECT, "smoke-signals", null)));

        assertEquals(ErrorCode.CONFIG_INVALID, ex.getError().getCode());
        assertInstanceOf(RelayFrameProtocol.class, factory.protocol(RelayFrameProtocol.ID));
    }

    @Test
    void shouldAttachCodexCredentialsToEachCall() {
        properties.getCredentials().setCodexBaseUrl("http://codex.local/responses");
        when(credentialManager.getValidCredentials()).thenReturn(CompletableFuture.completedFuture(
                Credentials.builder().accessToken("oauth-access").refreshToken("r")
                        .expiresAt(Instant.parse("2030-01-01T00:00:00Z")).accountId("acct-7").build()));
        Transport codex = factory.create("codex", provider(RuntimeProperties.TransportType.CODEX, null, null));
        httpEngine.enqueueSse("data: {\"type\":\"response.completed\",\"response\":{\"status\":\"completed\"}}");
        ModelSelection selection = new ModelSelection("codex", "gpt-5.1-codex", null);

        StepVerifier.create(codex.run(conversation(selection), TurnOptions.of(selection), CancellationToken.create()))
                .expectNextCount(1)
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertInstanceOf(CredentialGatedTransport.class, codex);
        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("http://codex.local/responses", request.url());
        assertEquals("Bearer oauth-access", request.header("Authorization"));
        assertEquals("acct-7", request.header("chatgpt-account-id"));
    }

    @Test
    void shouldCreateLangchain4jTransport() {
        RuntimeProperties.ProviderProperties lc4j = provider(RuntimeProperties.TransportType.LANGCHAIN4J,
                OpenAiChatProtocol.ID, "http://compat.local/v1");
        lc4j.setApiKey("key");

        Transport transport = factory.create("compat", lc4j);

        assertInstanceOf(Langchain4jTransport.class, transport);
        assertEquals("compat", transport.getId());
    }

    private static RuntimeProperties.ProviderProperties provider(RuntimeProperties.TransportType type,
            String protocol, String baseUrl) {
        RuntimeProperties.ProviderProperties provider = new RuntimeProperties.ProviderProperties();
        provider.setType(type);
        if (protocol != null) {
            provider.setProtocol(protocol);
        }
        provider.setBaseUrl(baseUrl);
        return provider;
    }

    private static ConversationState conversation(ModelSelection selection) {
        return ConversationState.initial(selection, null)
                .withTurn(ConversationTurn.user("hi", List.of(), Instant.parse("2026-03-01T10:00:00Z")));
    }
}
