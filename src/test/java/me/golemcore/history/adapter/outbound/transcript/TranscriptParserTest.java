package me.golemcore.history.adapter.outbound.transcript;

import me.golemcore.history.domain.model.HistoryMessage;
import me.golemcore.history.domain.model.HistorySource;
import me.golemcore.history.domain.model.MessageRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranscriptParserTest {

    private static final Instant BASE = Instant.parse("2026-01-15T09:00:00Z");

    private TranscriptParser parser;

    @BeforeEach
    void setUp() {
        parser = new TranscriptParser(1000);
    }

    @Test
    void shouldParseUserQueryAndAssistantAnswer() {
        String transcript = """
                user:
                <user_query>Fix bug</user_query>

                A:
                [Thinking] consider x
                [Tool call] read_file path: a.ts
                Done, fixed.
                """;

        List<HistoryMessage> messages = parser.parse(transcript, "t1", BASE, "/home/me/app");

        assertEquals(2, messages.size());
        HistoryMessage user = messages.get(0);
        assertEquals("t1-user-0", user.getId());
        assertEquals(MessageRole.USER, user.getRole());
        assertEquals("Fix bug", user.getContent());
        assertEquals(BASE, user.getTimestamp());
        assertEquals(HistorySource.CURSOR_TRANSCRIPT, user.getSource());
        assertEquals("t1", user.getConversationId());

        HistoryMessage assistant = messages.get(1);
        assertEquals("t1-assistant-1", assistant.getId());
        assertEquals(MessageRole.ASSISTANT, assistant.getRole());
        assertEquals("Done, fixed.", assistant.getContent());
        assertEquals("consider x", assistant.getThinking());
        assertEquals(BASE.plusSeconds(60), assistant.getTimestamp());
        assertEquals(1, assistant.getToolCalls().size());
        assertEquals("read_file", assistant.getToolCalls().get(0).getName());
        assertEquals(Map.of("path", "a.ts"), assistant.getToolCalls().get(0).getArguments());
    }

    @Test
    void shouldUsePlaceholderWhenAnswerHasOnlyToolActivity() {
        String transcript = """
                A:
                [Tool call] run_terminal_cmd
                [Tool result] ok
                """;

        List<HistoryMessage> messages = parser.parse(transcript, "t2", BASE, null);

        assertEquals(1, messages.size());
        assertEquals(TranscriptParser.TOOL_PLACEHOLDER, messages.get(0).getContent());
        assertEquals("run_terminal_cmd", messages.get(0).getToolCalls().get(0).getName());
        assertNull(messages.get(0).getToolCalls().get(0).getArguments());
        assertNull(messages.get(0).getThinking());
    }

    @Test
    void shouldCollectArgumentLinesAfterToolCall() {
        String transcript = """
                assistant:
                [Tool call] edit_file
                  path: src/a.ts
                  mode: replace
                Updated the handler.
                """;

        HistoryMessage message = parser.parse(transcript, "t3", BASE, null).get(0);

        assertEquals("path: src/a.ts mode: replace Updated the handler.", message.getContent());
        assertEquals(Map.of("path", "src/a.ts", "mode", "replace"), message.getToolCalls().get(0).getArguments());
    }

    @Test
    void shouldKeepArgumentLinesInVisibleAnswer() {
        String transcript = """
                A:
                [Tool call] run_tests
                Result: all green
                Shipped the fix.
                """;

        HistoryMessage message = parser.parse(transcript, "t8", BASE, null).get(0);

        assertEquals("Result: all green Shipped the fix.", message.getContent());
        assertEquals("run_tests", message.getToolCalls().get(0).getName());
        assertEquals(Map.of("Result", "all green"), message.getToolCalls().get(0).getArguments());
    }

    @Test
    void shouldReturnToContentAfterToolSection() {
        String transcript = """
                A:
                First part.
                [Tool result] listing
                Second part.
                """;

        HistoryMessage message = parser.parse(transcript, "t4", BASE, null).get(0);

        assertEquals("First part. Second part.", message.getContent());
        assertNull(message.getToolCalls());
    }

    @Test
    void shouldJoinAtMostTenContentLines() {
        StringBuilder transcript = new StringBuilder("A:\n");
        for (int i = 1; i <= 12; i++) {
            transcript.append("line").append(i).append('\n');
        }

        HistoryMessage message = parser.parse(transcript.toString(), "t5", BASE, null).get(0);

        assertEquals("line1 line2 line3 line4 line5 line6 line7 line8 line9 line10", message.getContent());
    }

    @Test
    void shouldFallBackToTrimmedUserTextWithoutQueryTags() {
        String transcript = """
                user:
                  please check `src/index.ts`
                """;

        HistoryMessage message = parser.parse(transcript, "t6", BASE, null).get(0);

        assertEquals("please check `src/index.ts`", message.getContent());
        assertTrue(message.getRelatedFiles().contains("/src/index.ts"));
    }

    @Test
    void shouldIgnoreTextBeforeFirstMarkerAndEmptyUserBlocks() {
        String transcript = """
                preamble without role
                user:

                A:
                Hello there.
                """;

        List<HistoryMessage> messages = parser.parse(transcript, "t7", BASE, null);

        assertEquals(1, messages.size());
        assertEquals(MessageRole.ASSISTANT, messages.get(0).getRole());
        assertEquals("t7-assistant-0", messages.get(0).getId());
    }

    @Test
    void shouldTruncateLongContent() {
        TranscriptParser shortParser = new TranscriptParser(10);

        HistoryMessage message = shortParser.parse("user:\nabcdefghijklmnop", "t8", BASE, null).get(0);

        assertEquals("abcdefghij...", message.getContent());
    }

    @Test
    void extractThinking_stopsAtUpperCaseLine() {
        List<String> lines = List.of("[Thinking] step one", "step two", "Now the answer");

        assertEquals("step one\nstep two", TranscriptParser.extractThinking(lines));
    }
}
