package me.golemcore.history.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Summary of one conversation contributed by a source adapter.
 * {@code startTime <= endTime} and {@code messageCount} equals the number of
 * messages the adapter emitted for this conversation.
 */
@Value
@Builder
public class Conversation {

    public static final String DEFAULT_TITLE = "Conversation";
    private static final int TITLE_MAX_LEN = 80;

    String id;
    String title;
    int messageCount;
    Instant startTime;
    Instant endTime;
    HistorySource source;

    /**
     * Builds a summary from the messages of one conversation. The title is the
     * first user message flattened to one line, otherwise
     * {@link #DEFAULT_TITLE}.
     *
     * @param messages
     *            non-empty list of messages belonging to the conversation
     */
    public static Conversation summarize(String id, List<HistoryMessage> messages, HistorySource source) {
        return summarize(id, deriveTitle(messages), messages, source);
    }

    /**
     * Same as {@link #summarize(String, List, HistorySource)} with an explicit
     * title.
     */
    public static Conversation summarize(String id, String title, List<HistoryMessage> messages,
            HistorySource source) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("Conversation " + id + " has no messages");
        }
        Instant start = messages.stream()
                .map(HistoryMessage::getTimestamp)
                .min(Comparator.naturalOrder())
                .orElseThrow();
        Instant end = messages.stream()
                .map(HistoryMessage::getTimestamp)
                .max(Comparator.naturalOrder())
                .orElseThrow();
        return Conversation.builder()
                .id(id)
                .title(title)
                .messageCount(messages.size())
                .startTime(start)
                .endTime(end)
                .source(source)
                .build();
    }

    static String deriveTitle(List<HistoryMessage> messages) {
        for (HistoryMessage message : messages) {
            if (message.getRole() == MessageRole.USER && message.getContent() != null) {
                String content = message.getContent();
                String head = content.length() > TITLE_MAX_LEN ? content.substring(0, TITLE_MAX_LEN) : content;
                String title = head.replace('\n', ' ').trim();
                return content.length() > TITLE_MAX_LEN ? title + "..." : title;
            }
        }
        return DEFAULT_TITLE;
    }
}
