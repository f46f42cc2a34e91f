/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.history.adapter.outbound.transcript;

import me.golemcore.history.domain.model.HistoryMessage;
import me.golemcore.history.domain.model.HistorySource;
import me.golemcore.history.domain.model.MessageRole;
import me.golemcore.history.domain.service.ContentSupport;
import me.golemcore.history.domain.service.FileReferenceSupport;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses agent transcript text into messages.
 *
 * <p>
 * Transcript format:
 *
 * <pre>
 * user:
 * &lt;user_query&gt;...&lt;/user_query&gt;
 *
 * A:
 * [Thinking] ...
 * [Tool call] read_file path: a.ts
 * [Tool result] ...
 * visible answer
 * </pre>
 *
 * <p>
 * Lines are classified by a small state machine. Role marker lines switch
 * between {@link BlockState#IDLE}, {@link BlockState#USER} and
 * {@link BlockState#ASSISTANT}. Inside an assistant block, bracketed marker
 * lines enter {@link Section#TOOL} and the next non-bracketed line returns to
 * {@link Section#CONTENT}; only content lines make up the visible answer.
 * {@code key: value} lines right after a {@code [Tool call]} are recorded as
 * that call's arguments and still count as content.
 *
 * <p>
 * The format carries no wall-clock time, so message {@code i} of a file is
 * stamped {@code baseTime + i minutes}.
 */
public class TranscriptParser {

    static final String USER_MARKER = "user:";
    static final List<String> ASSISTANT_MARKERS = List.of("A:", "assistant:");
    static final String THINKING_MARKER = "[Thinking]";
    static final String TOOL_CALL_MARKER = "[Tool call]";
    static final String TOOL_RESULT_MARKER = "[Tool result]";
    static final String TOOL_PLACEHOLDER = "[Tool operations]";

    private static final int MAX_CONTENT_LINES = 10;
    private static final int MAX_QUERY_LENGTH = 1000;
    private static final int MAX_THINKING_LENGTH = 500;
    private static final Duration MESSAGE_STEP = Duration.ofMinutes(1);

    private static final Pattern USER_QUERY = Pattern.compile("<user_query>([\\s\\S]*?)</user_query>");
    private static final Pattern TOOL_NAME = Pattern.compile("^(\\w+)(.*)$");
    private static final Pattern KEY_VALUE = Pattern.compile("^\\s*(\\w+):\\s*(.+)$");
    private static final Pattern UPPERCASE_START = Pattern.compile("^[A-Z]");

    private final int maxContentLength;

    public TranscriptParser(int maxContentLength) {
        this.maxContentLength = maxContentLength;
    }

    enum BlockState {
        IDLE, USER, ASSISTANT
    }

    enum Section {
        CONTENT, TOOL
    }

    /**
     * @param conversationId
     *            file name without extension, used as id prefix
     * @param projectPath
     *            project the transcript belongs to, may be {@code null}
     */
    public List<HistoryMessage> parse(String text, String conversationId, Instant baseTime, String projectPath) {
        MessageSink sink = new MessageSink(conversationId, baseTime, projectPath);
        BlockState state = BlockState.IDLE;
        List<String> block = new ArrayList<>();

        for (String line : text.split("\\R", -1)) {
            BlockState next = markerState(line);
            if (next != null) {
                flush(state, block, sink);
                block = new ArrayList<>();
                String remainder = stripMarker(line, next);
                if (!remainder.isBlank()) {
                    block.add(remainder);
                }
                state = next;
                continue;
            }
            if (state != BlockState.IDLE) {
                block.add(line);
            }
        }
        flush(state, block, sink);
        return sink.messages;
    }

    private void flush(BlockState state, List<String> block, MessageSink sink) {
        if (state == BlockState.USER) {
            String query = extractUserQuery(String.join("\n", block));
            if (!query.isEmpty()) {
                sink.add(MessageRole.USER, ContentSupport.truncate(query, maxContentLength), null, null);
            }
        } else if (state == BlockState.ASSISTANT) {
            AssistantBlock assistant = parseAssistantBlock(block);
            sink.add(MessageRole.ASSISTANT, assistant.content(), assistant.thinking(), assistant.toolCalls());
        }
    }

    static String extractUserQuery(String block) {
        Matcher matcher = USER_QUERY.matcher(block);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return ContentSupport.cap(block.trim(), MAX_QUERY_LENGTH);
    }

    AssistantBlock parseAssistantBlock(List<String> lines) {
        List<String> contentLines = new ArrayList<>();
        List<HistoryMessage.ToolCall> toolCalls = new ArrayList<>();
        String fallback = null;
        Section section = Section.CONTENT;
        ToolCallDraft pending = null;

        for (String line : lines) {
            String trimmed = line.trim();
            if (fallback == null && !trimmed.isEmpty() && !trimmed.startsWith("[")) {
                fallback = trimmed;
            }

            if (isSectionMarker(trimmed)) {
                pending = closeDraft(pending, toolCalls);
                section = Section.TOOL;
                if (trimmed.startsWith(TOOL_CALL_MARKER)) {
                    pending = openDraft(trimmed.substring(TOOL_CALL_MARKER.length()).trim());
                }
                continue;
            }

            if (pending != null) {
                // argument lines are also visible text
                Matcher keyValue = KEY_VALUE.matcher(line);
                if (!trimmed.isEmpty() && keyValue.matches()) {
                    pending.arguments.put(keyValue.group(1), keyValue.group(2).trim());
                } else {
                    pending = closeDraft(pending, toolCalls);
                }
            }

            if (section == Section.TOOL && !trimmed.isEmpty() && !trimmed.startsWith("[")) {
                section = Section.CONTENT;
            }
            if (section == Section.CONTENT && !trimmed.isEmpty() && !trimmed.startsWith("[")) {
                contentLines.add(trimmed);
            }
        }
        closeDraft(pending, toolCalls);

        String content = String.join(" ", contentLines.subList(0, Math.min(MAX_CONTENT_LINES, contentLines.size())))
                .trim();
        if (content.isEmpty()) {
            content = fallback != null ? fallback : TOOL_PLACEHOLDER;
        }
        return new AssistantBlock(
                ContentSupport.truncate(content, maxContentLength),
                extractThinking(lines),
                toolCalls);
    }

    /**
     * Text after the first thinking marker up to the next section marker or
     * the next line starting with an upper-case letter.
     */
    static String extractThinking(List<String> lines) {
        StringBuilder excerpt = null;
        for (String line : lines) {
            String trimmed = line.trim();
            if (excerpt == null) {
                if (trimmed.startsWith(THINKING_MARKER)) {
                    excerpt = new StringBuilder(trimmed.substring(THINKING_MARKER.length()));
                }
                continue;
            }
            if (isSectionMarker(trimmed) || UPPERCASE_START.matcher(line).find()) {
                break;
            }
            excerpt.append('\n').append(line);
        }
        if (excerpt == null) {
            return null;
        }
        String thinking = ContentSupport.cap(excerpt.toString().trim(), MAX_THINKING_LENGTH);
        return thinking.isEmpty() ? null : thinking;
    }

    private static ToolCallDraft openDraft(String rest) {
        Matcher matcher = TOOL_NAME.matcher(rest);
        if (!matcher.matches()) {
            return null;
        }
        ToolCallDraft draft = new ToolCallDraft(matcher.group(1));
        Matcher inline = KEY_VALUE.matcher(matcher.group(2));
        if (inline.matches()) {
            draft.arguments.put(inline.group(1), inline.group(2).trim());
        }
        return draft;
    }

    private static ToolCallDraft closeDraft(ToolCallDraft draft, List<HistoryMessage.ToolCall> sink) {
        if (draft != null) {
            sink.add(HistoryMessage.ToolCall.builder()
                    .name(draft.name)
                    .arguments(draft.arguments.isEmpty() ? null : Map.copyOf(draft.arguments))
                    .build());
        }
        return null;
    }

    private static boolean isSectionMarker(String trimmed) {
        return trimmed.startsWith(THINKING_MARKER)
                || trimmed.startsWith(TOOL_CALL_MARKER)
                || trimmed.startsWith(TOOL_RESULT_MARKER);
    }

    private static BlockState markerState(String line) {
        if (line.startsWith(USER_MARKER)) {
            return BlockState.USER;
        }
        for (String marker : ASSISTANT_MARKERS) {
            if (line.startsWith(marker)) {
                return BlockState.ASSISTANT;
            }
        }
        return null;
    }

    private static String stripMarker(String line, BlockState state) {
        if (state == BlockState.USER) {
            return line.substring(USER_MARKER.length());
        }
        for (String marker : ASSISTANT_MARKERS) {
            if (line.startsWith(marker)) {
                return line.substring(marker.length());
            }
        }
        return line;
    }

    record AssistantBlock(String content, String thinking, List<HistoryMessage.ToolCall> toolCalls) {
    }

    private static final class ToolCallDraft {
        private final String name;
        private final Map<String, Object> arguments = new LinkedHashMap<>();

        private ToolCallDraft(String name) {
            this.name = name;
        }
    }

    private static final class MessageSink {
        private final String conversationId;
        private final Instant baseTime;
        private final String projectPath;
        private final List<HistoryMessage> messages = new ArrayList<>();

        private MessageSink(String conversationId, Instant baseTime, String projectPath) {
            this.conversationId = conversationId;
            this.baseTime = baseTime;
            this.projectPath = projectPath;
        }

        private void add(MessageRole role, String content, String thinking, List<HistoryMessage.ToolCall> toolCalls) {
            int index = messages.size();
            messages.add(HistoryMessage.builder()
                    .id(conversationId + "-" + role.getValue() + "-" + index)
                    .timestamp(baseTime.plus(MESSAGE_STEP.multipliedBy(index)))
                    .role(role)
                    .content(content)
                    .source(HistorySource.CURSOR_TRANSCRIPT)
                    .projectPath(projectPath)
                    .conversationId(conversationId)
                    .thinking(thinking)
                    .toolCalls(toolCalls == null || toolCalls.isEmpty() ? null : List.copyOf(toolCalls))
                    .relatedFiles(FileReferenceSupport.extractFileReferences(content))
                    .build());
        }
    }
}
