package me.golemcore.agent.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelCandidateTest {

    private static ModelCandidate candidate(ReasoningEffort... levels) {
        ModelCandidate.ModelCandidateBuilder builder = ModelCandidate.builder()
                .provider("openai")
                .model("gpt-5.1")
                .displayName("GPT-5.1")
                .contextWindow(400000);
        for (ReasoningEffort level : levels) {
            builder.reasoningLevel(level);
        }
        return builder.build();
    }

    @Test
    void shouldKeepSupportedLevel() {
        assertEquals(ReasoningEffort.MEDIUM,
                candidate(ReasoningEffort.LOW, ReasoningEffort.MEDIUM).clamp(ReasoningEffort.MEDIUM));
    }

    @Test
    void shouldClampToNearestLevel() {
        ModelCandidate model = candidate(ReasoningEffort.LOW, ReasoningEffort.MEDIUM);

        assertEquals(ReasoningEffort.MEDIUM, model.clamp(ReasoningEffort.XHIGH));
        assertEquals(ReasoningEffort.LOW, model.clamp(ReasoningEffort.MINIMAL));
    }

    @Test
    void shouldResolveTieToLowerLevel() {
        assertEquals(ReasoningEffort.LOW,
                candidate(ReasoningEffort.LOW, ReasoningEffort.HIGH).clamp(ReasoningEffort.MEDIUM));
        assertEquals(ReasoningEffort.LOW,
                candidate(ReasoningEffort.HIGH, ReasoningEffort.LOW).clamp(ReasoningEffort.MEDIUM));
    }

    @Test
    void shouldYieldOffWithoutReasoningSupport() {
        ModelCandidate model = candidate();

        assertFalse(model.supportsReasoning());
        assertEquals(ReasoningEffort.OFF, model.clamp(ReasoningEffort.HIGH));
        assertEquals(ReasoningEffort.OFF, candidate(ReasoningEffort.HIGH).clamp(null));
    }

    @Test
    void shouldHonourOffEvenWhenNotListed() {
        ModelCandidate model = candidate(ReasoningEffort.MINIMAL, ReasoningEffort.LOW, ReasoningEffort.HIGH);

        assertEquals(ReasoningEffort.OFF, model.clamp(ReasoningEffort.OFF));
        assertTrue(model.supportsReasoning());
    }

    @Test
    void shouldParseReasoningValues() {
        assertEquals(ReasoningEffort.XHIGH, ReasoningEffort.fromValue(" xhigh "));
        assertEquals(ReasoningEffort.OFF, ReasoningEffort.fromValue(null));
        assertEquals("medium", ReasoningEffort.MEDIUM.wireValue());
        assertThrows(IllegalArgumentException.class, () -> ReasoningEffort.fromValue("extreme"));
    }
}
