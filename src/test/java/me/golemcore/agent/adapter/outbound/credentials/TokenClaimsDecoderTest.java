package me.golemcore.agent.adapter.outbound.credentials;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.SdkException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class TokenClaimsDecoderTest {

    private final TokenClaimsDecoder decoder = new TokenClaimsDecoder(new ObjectMapper());

    @Test
    void shouldReadAccountIdFromAuthClaim() {
        String token = jwt("{\"sub\":\"user-1\",\"https://api.openai.com/auth\":{\"chatgpt_account_id\":\"acct-42\"}}");

        assertEquals("acct-42", decoder.accountId(token));
    }

    @Test
    void shouldFallBackToSubject() {
        assertEquals("user-1", decoder.accountId(jwt("{\"sub\":\"user-1\"}")));
    }

    @Test
    void shouldRejectTokenWithoutAccountId() {
        SdkException ex = assertThrows(SdkException.class, () -> decoder.accountId(jwt("{\"iss\":\"x\"}")));

        assertEquals(ErrorCode.CONFIG_INVALID, ex.getError().getCode());
        assertEquals("Token carries no account id", ex.getMessage());
    }

    @Test
    void shouldRejectMalformedTokens() {
        assertEquals("Token is missing", assertThrows(SdkException.class, () -> decoder.accountId(null)).getMessage());
        assertEquals("Token is not a JWT",
                assertThrows(SdkException.class, () -> decoder.accountId("opaque-token")).getMessage());
        assertEquals("Token payload cannot be decoded",
                assertThrows(SdkException.class, () -> decoder.accountId("a.%%%.c")).getMessage());
    }

    private static String jwt(String payloadJson) {
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        return encoder.encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8)) + "."
                + encoder.encodeToString(payloadJson.getBytes(StandardCharsets.UTF_8)) + ".sig";
    }
}
