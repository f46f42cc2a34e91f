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

package me.golemcore.history.adapter.outbound.export;

import me.golemcore.history.domain.model.HistoryMessage;
import me.golemcore.history.domain.model.HistorySource;
import me.golemcore.history.domain.model.MessageRole;
import me.golemcore.history.domain.service.ContentSupport;
import me.golemcore.history.domain.service.FileReferenceSupport;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses conversation exports written as Markdown with {@code ### User Input}
 * and {@code ### Planner Response} section headers.
 *
 * <p>
 * Lines wrapped in single asterisks are agent actions and become tool calls;
 * everything else is message text. A section shorter than
 * {@value #MIN_MESSAGE_LENGTH} characters after trimming is dropped.
 */
public class ExportMarkdownParser {

    public static final String USER_HEADER = "### User Input";
    public static final String PLANNER_HEADER = "### Planner Response";

    static final int MIN_MESSAGE_LENGTH = 10;

    private static final Duration MESSAGE_STEP = Duration.ofSeconds(1);

    private static final Pattern USER_HEADER_LINE = Pattern.compile("^### User Input\\s*$");
    private static final Pattern PLANNER_HEADER_LINE = Pattern.compile("^### Planner Response\\s*$");
    private static final Pattern ACTION_LINE = Pattern.compile("^\\*(?!\\*)(.+?)(?<!\\*)\\*\\s*$");

    private static final Pattern ACCEPTED_COMMAND = Pattern.compile("User accepted the command `(.+)`");
    private static final Pattern BRACKETED = Pattern.compile("\\[([^\\]]+)\\]");
    private static final Pattern WEB_SEARCH = Pattern.compile("Searched web for (.+)");

    private final int maxContentLength;

    public ExportMarkdownParser(int maxContentLength) {
        this.maxContentLength = maxContentLength;
    }

    public static boolean isExport(String text) {
        return text.contains(USER_HEADER) && text.contains(PLANNER_HEADER);
    }

    public List<HistoryMessage> parse(String text, String conversationId, Instant startTime, String projectPath) {
        List<HistoryMessage> messages = new ArrayList<>();
        MessageRole role = MessageRole.USER;
        List<String> contentLines = new ArrayList<>();
        List<String> actions = new ArrayList<>();

        for (String line : text.split("\\R", -1)) {
            MessageRole next = headerRole(line);
            if (next != null) {
                flush(role, contentLines, actions, conversationId, startTime, projectPath, messages);
                role = next;
                contentLines = new ArrayList<>();
                actions = new ArrayList<>();
                continue;
            }
            Matcher action = ACTION_LINE.matcher(line);
            if (action.matches()) {
                actions.add(action.group(1));
                continue;
            }
            contentLines.add(line);
        }
        flush(role, contentLines, actions, conversationId, startTime, projectPath, messages);
        return messages;
    }

    private void flush(MessageRole role, List<String> contentLines, List<String> actions, String conversationId,
            Instant startTime, String projectPath, List<HistoryMessage> sink) {
        String text = String.join("\n", contentLines).trim();
        if (text.length() <= MIN_MESSAGE_LENGTH) {
            return;
        }
        int index = sink.size();
        List<HistoryMessage.ToolCall> toolCalls = toToolCalls(actions);
        String content = ContentSupport.truncate(text, maxContentLength);
        sink.add(HistoryMessage.builder()
                .id(conversationId + "-" + index)
                .timestamp(startTime.plus(MESSAGE_STEP.multipliedBy(index)))
                .role(role)
                .content(content)
                .source(HistorySource.ANTIGRAVITY_EXPORT)
                .projectPath(projectPath)
                .conversationId(conversationId)
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .relatedFiles(FileReferenceSupport.extractFileReferences(content))
                .build());
    }

    static List<HistoryMessage.ToolCall> toToolCalls(List<String> actions) {
        List<HistoryMessage.ToolCall> toolCalls = new ArrayList<>();
        for (String action : actions) {
            Matcher command = ACCEPTED_COMMAND.matcher(action);
            if (command.find()) {
                toolCalls.add(toolCall("run_command", "command", command.group(1)));
            }
            if (action.contains("Edited")) {
                Matcher file = BRACKETED.matcher(action);
                if (file.find()) {
                    toolCalls.add(toolCall("edit_file", "file", file.group(1)));
                }
            }
            if (action.contains("Listed directory")) {
                Matcher directory = BRACKETED.matcher(action);
                if (directory.find()) {
                    toolCalls.add(toolCall("list_dir", "path", directory.group(1)));
                }
            }
            Matcher search = WEB_SEARCH.matcher(action);
            if (search.find()) {
                toolCalls.add(toolCall("search_web", "query", search.group(1)));
            }
        }
        return toolCalls;
    }

    private static HistoryMessage.ToolCall toolCall(String name, String argument, String value) {
        return HistoryMessage.ToolCall.builder()
                .name(name)
                .arguments(Map.of(argument, value))
                .build();
    }

    private static MessageRole headerRole(String line) {
        if (USER_HEADER_LINE.matcher(line).matches()) {
            return MessageRole.USER;
        }
        if (PLANNER_HEADER_LINE.matcher(line).matches()) {
            return MessageRole.ASSISTANT;
        }
        return null;
    }
}
