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

import java.util.ArrayList;
import java.util.List;

/**
 * Messages and conversation summaries contributed by a single adapter call.
 */
public record SourceBatch(List<HistoryMessage> messages, List<Conversation> conversations) {

    public SourceBatch {
        messages = messages == null ? List.of() : List.copyOf(messages);
        conversations = conversations == null ? List.of() : List.copyOf(conversations);
    }

    public static SourceBatch empty() {
        return new SourceBatch(List.of(), List.of());
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    /**
     * Mutable accumulator used while an adapter walks its files.
     */
    public static final class Collector {

        private final List<HistoryMessage> messages = new ArrayList<>();
        private final List<Conversation> conversations = new ArrayList<>();

        public void add(List<HistoryMessage> fileMessages, Conversation conversation) {
            messages.addAll(fileMessages);
            if (conversation != null) {
                conversations.add(conversation);
            }
        }

        public void addMessage(HistoryMessage message) {
            messages.add(message);
        }

        public SourceBatch build() {
            return new SourceBatch(messages, conversations);
        }
    }
}
