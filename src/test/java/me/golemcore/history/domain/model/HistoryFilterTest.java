package me.golemcore.history.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HistoryFilterTest {

    private static final Instant T1 = Instant.parse("2026-01-15T10:00:00Z");
    private static final Instant T2 = Instant.parse("2026-01-15T11:00:00Z");

    @Test
    void shouldMatchEverythingWhenEmpty() {
        HistoryFilter filter = HistoryFilter.builder().build();

        assertTrue(filter.isEmpty());
        assertTrue(filter.matches(message(HistorySource.CURSOR_DB, MessageRole.SYSTEM, T1)));
        assertTrue(filter.includesSource(HistorySource.ANTIGRAVITY_BRAIN));
    }

    @Test
    void shouldFilterBySourceAndRole() {
        HistoryFilter filter = HistoryFilter.builder()
                .sources(Set.of(HistorySource.CURSOR_TRANSCRIPT))
                .roles(Set.of(MessageRole.USER))
                .build();

        assertFalse(filter.isEmpty());
        assertTrue(filter.matches(message(HistorySource.CURSOR_TRANSCRIPT, MessageRole.USER, T1)));
        assertFalse(filter.matches(message(HistorySource.CURSOR_TRANSCRIPT, MessageRole.ASSISTANT, T1)));
        assertFalse(filter.matches(message(HistorySource.CURSOR_JSON, MessageRole.USER, T1)));
        assertFalse(filter.includesSource(HistorySource.CURSOR_JSON));
    }

    @Test
    void shouldTreatWindowBoundsAsInclusive() {
        HistoryFilter filter = HistoryFilter.builder().after(T1).before(T2).build();

        assertTrue(filter.matches(message(HistorySource.CURSOR_JSON, MessageRole.USER, T1)));
        assertTrue(filter.matches(message(HistorySource.CURSOR_JSON, MessageRole.USER, T2)));
        assertFalse(filter.matches(message(HistorySource.CURSOR_JSON, MessageRole.USER, T1.minusSeconds(1))));
        assertFalse(filter.matches(message(HistorySource.CURSOR_JSON, MessageRole.USER, T2.plusSeconds(1))));
    }

    private static HistoryMessage message(HistorySource source, MessageRole role, Instant timestamp) {
        return HistoryMessage.builder()
                .id("m")
                .source(source)
                .role(role)
                .content("text")
                .timestamp(timestamp)
                .build();
    }
}
