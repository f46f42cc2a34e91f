package me.golemcore.history.domain.service;

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

import me.golemcore.history.domain.model.Conversation;
import me.golemcore.history.domain.model.HistoryFilter;
import me.golemcore.history.domain.model.HistoryMessage;
import me.golemcore.history.domain.model.HistoryResult;
import me.golemcore.history.domain.model.HistorySource;
import me.golemcore.history.domain.model.SourceBatch;
import me.golemcore.history.port.outbound.HistorySourcePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges the contributions of every history source into one timeline.
 *
 * <p>
 * Sources are read one after another in their registration order. A source
 * that throws is logged and treated as empty, so {@link #getHistory(Path)}
 * never fails for a valid path. Messages are sorted by timestamp with a
 * stable sort; ties keep the order in which sources emitted them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistoryAggregationService {

    private final List<HistorySourcePort> sources;

    public HistoryResult getHistory(Path projectPath) {
        List<HistoryMessage> messages = new ArrayList<>();
        List<Conversation> conversations = new ArrayList<>();
        Set<HistorySource> contributing = new LinkedHashSet<>();

        for (HistorySourcePort source : sources) {
            if (!source.isApplicable(projectPath)) {
                log.debug("[History] Source {} not applicable for {}", source.getSource().getTag(), projectPath);
                continue;
            }
            SourceBatch batch = readSafely(source, projectPath);
            if (batch.isEmpty()) {
                continue;
            }
            messages.addAll(batch.messages());
            conversations.addAll(batch.conversations());
            contributing.add(source.getSource());
        }

        HistoryResult result = assemble(messages, conversations, List.copyOf(contributing));
        log.info("[History] {} messages from {} for {}", result.getTotalMessages(),
                result.getSources().stream().map(HistorySource::getTag).toList(), projectPath);
        return result;
    }

    /**
     * Same as {@link #getHistory(Path)} with the filter applied to the merged
     * timeline. Totals, sources and date range describe the retained
     * messages.
     */
    public HistoryResult getHistory(Path projectPath, HistoryFilter filter) {
        HistoryResult full = getHistory(projectPath);
        if (filter == null || filter.isEmpty()) {
            return full;
        }

        List<HistoryMessage> retained = full.getMessages().stream()
                .filter(filter::matches)
                .limit(filter.getLimit() != null ? filter.getLimit() : Long.MAX_VALUE)
                .toList();
        Set<HistorySource> retainedSources = new LinkedHashSet<>();
        for (HistorySource source : full.getSources()) {
            if (retained.stream().anyMatch(message -> message.getSource() == source)) {
                retainedSources.add(source);
            }
        }
        List<Conversation> conversations = full.getConversations().stream()
                .filter(conversation -> filter.includesSource(conversation.getSource()))
                .toList();
        return assemble(retained, conversations, List.copyOf(retainedSources));
    }

    private SourceBatch readSafely(HistorySourcePort source, Path projectPath) {
        try {
            SourceBatch batch = source.read(projectPath);
            return batch != null ? batch : SourceBatch.empty();
        } catch (RuntimeException e) {
            log.warn("[History] Source {} failed for {}: {}", source.getSource().getTag(), projectPath,
                    e.getMessage(), e);
            return SourceBatch.empty();
        }
    }

    private static HistoryResult assemble(List<HistoryMessage> messages, List<Conversation> conversations,
            List<HistorySource> sources) {
        List<HistoryMessage> sorted = new ArrayList<>(messages);
        sorted.sort(Comparator.comparing(HistoryMessage::getTimestamp));

        HistoryResult.DateRange dateRange = sorted.isEmpty()
                ? null
                : new HistoryResult.DateRange(sorted.get(0).getTimestamp(),
                        sorted.get(sorted.size() - 1).getTimestamp());
        return HistoryResult.builder()
                .messages(List.copyOf(sorted))
                .conversations(List.copyOf(conversations))
                .totalMessages(sorted.size())
                .sources(sources)
                .dateRange(dateRange)
                .build();
    }
}
