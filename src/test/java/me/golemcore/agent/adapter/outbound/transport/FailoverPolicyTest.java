package me.golemcore.agent.adapter.outbound.transport;

import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.SdkError;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FailoverPolicyTest {

    @Test
    void shouldFailOverOnTransientCodesByDefault() {
        FailoverPolicy policy = FailoverPolicy.defaults();

        assertTrue(policy.shouldFailover(SdkError.of(ErrorCode.NETWORK, "reset")));
        assertTrue(policy.shouldFailover(SdkError.of(ErrorCode.OVERLOADED, "busy")));
        assertFalse(policy.shouldFailover(SdkError.of(ErrorCode.AUTH, "denied")));
        assertFalse(policy.shouldFailover(SdkError.of(ErrorCode.RATE_LIMITED, "slow down")));
        assertFalse(policy.shouldFailover(null));
    }

    @Test
    void shouldParseCodeNamesAndDropCancellation() {
        FailoverPolicy policy = FailoverPolicy.of(List.of(" rate_limited ", "CANCELLED"));

        assertEquals(Set.of(ErrorCode.RATE_LIMITED), policy.getCodes());
        assertFalse(policy.shouldFailover(SdkError.cancelled("abort")));
    }

    @Test
    void shouldRejectUnknownCodeName() {
        assertThrows(IllegalArgumentException.class, () -> FailoverPolicy.of(List.of("FLAKY")));
    }

    @Test
    void shouldExposeImmutableCodes() {
        Set<ErrorCode> codes = FailoverPolicy.never().getCodes();

        assertTrue(codes.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> codes.add(ErrorCode.NETWORK));
    }
}
