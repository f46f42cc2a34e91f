package me.golemcore.history.domain.service;

import me.golemcore.history.domain.model.MessageRole;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RoleNormalizationSupportTest {

    @ParameterizedTest
    @ValueSource(strings = { "user", "human", "customer", "you", "USER", " Human " })
    void shouldMapUserSynonyms(String label) {
        assertEquals(MessageRole.USER, RoleNormalizationSupport.normalizeRole(label));
    }

    @ParameterizedTest
    @ValueSource(strings = { "assistant", "ai", "bot", "claude", "gpt", "model", "GPT" })
    void shouldMapAssistantSynonyms(String label) {
        assertEquals(MessageRole.ASSISTANT, RoleNormalizationSupport.normalizeRole(label));
    }

    @ParameterizedTest
    @ValueSource(strings = { "system", "context" })
    void shouldMapSystemSynonyms(String label) {
        assertEquals(MessageRole.SYSTEM, RoleNormalizationSupport.normalizeRole(label));
    }

    @ParameterizedTest
    @ValueSource(strings = { "tool", "function", "action" })
    void shouldMapToolSynonyms(String label) {
        assertEquals(MessageRole.TOOL, RoleNormalizationSupport.normalizeRole(label));
    }

    @Test
    void shouldDefaultUnknownLabelsToUser() {
        assertEquals(MessageRole.USER, RoleNormalizationSupport.normalizeRole("banana"));
        assertEquals(MessageRole.USER, RoleNormalizationSupport.normalizeRole(""));
        assertEquals(MessageRole.USER, RoleNormalizationSupport.normalizeRole(null));
    }
}
