package me.golemcore.history.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HistorySourceTest {

    @Test
    void shouldResolveByTagOrName() {
        assertEquals(HistorySource.CURSOR_DB, HistorySource.fromTag("cursor-db"));
        assertEquals(HistorySource.CURSOR_DB, HistorySource.fromTag("CURSOR_DB"));
    }

    @Test
    void shouldRejectUnknownTag() {
        assertThrows(IllegalArgumentException.class, () -> HistorySource.fromTag("claude-code"));
    }

    @Test
    void shouldSerializeAsTag() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("\"antigravity-brain\"", mapper.writeValueAsString(HistorySource.ANTIGRAVITY_BRAIN));
        assertEquals("\"assistant\"", mapper.writeValueAsString(MessageRole.ASSISTANT));
    }
}
