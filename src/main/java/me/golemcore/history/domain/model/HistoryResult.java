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
import java.util.List;

/**
 * Aggregated history of one project across all sources. Messages are sorted
 * ascending by timestamp; {@code dateRange} is {@code null} when there are no
 * messages.
 */
@Value
@Builder
public class HistoryResult {

    List<HistoryMessage> messages;
    List<Conversation> conversations;
    int totalMessages;
    List<HistorySource> sources;
    DateRange dateRange;

    public record DateRange(Instant start, Instant end) {
    }
}
