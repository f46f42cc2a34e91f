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

import me.golemcore.history.domain.model.Conversation;
import me.golemcore.history.domain.model.HistoryMessage;
import me.golemcore.history.domain.model.HistorySource;
import me.golemcore.history.domain.model.SourceBatch;
import me.golemcore.history.domain.service.StorageLocationResolver;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.infrastructure.fs.BudgetedFileWalker;
import me.golemcore.history.port.outbound.HistorySourcePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Reads plain-text agent transcripts kept per project under
 * {@code ~/.cursor/projects/<folder>/agent-transcripts/*.txt}.
 *
 * <p>
 * Every transcript file becomes one conversation named after the file. The
 * project folder is found through {@link StorageLocationResolver}, so a
 * renamed or relocated project still matches by its trailing path segments.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class TranscriptHistoryAdapter implements HistorySourcePort {

    private static final Duration BASE_OFFSET = Duration.ofHours(1);

    private final HistoryProperties properties;
    private final StorageLocationResolver locationResolver;
    private final BudgetedFileWalker fileWalker;
    private final Clock clock;

    @Override
    public HistorySource getSource() {
        return HistorySource.CURSOR_TRANSCRIPT;
    }

    @Override
    public SourceBatch read(Path projectPath) {
        HistoryProperties.TranscriptProperties settings = properties.getTranscripts();
        Path baseDirectory = properties.resolvePath(settings.getProjectsDir());
        List<Path> candidates = locationResolver.resolve(baseDirectory, projectPath);
        if (candidates.isEmpty()) {
            log.debug("[Transcripts] No project folder for {} under {}", projectPath, baseDirectory);
            return SourceBatch.empty();
        }

        TranscriptParser parser = new TranscriptParser(properties.getContent().getMaxLength());
        Instant baseTime = clock.instant().minus(BASE_OFFSET);
        SourceBatch.Collector collector = new SourceBatch.Collector();

        for (Path candidate : candidates) {
            Path transcriptsDir = candidate.resolve(settings.getSubdirectory());
            List<Path> files = fileWalker.listChildren(transcriptsDir,
                    file -> Files.isRegularFile(file)
                            && file.getFileName().toString().endsWith(settings.getExtension()));
            for (Path file : files) {
                readTranscript(file, settings.getExtension(), parser, baseTime, projectPath, collector);
            }
        }

        SourceBatch batch = collector.build();
        log.debug("[Transcripts] {} messages in {} transcripts for {}", batch.messages().size(),
                batch.conversations().size(), projectPath);
        return batch;
    }

    private void readTranscript(Path file, String extension, TranscriptParser parser, Instant baseTime,
            Path projectPath, SourceBatch.Collector collector) {
        String fileName = file.getFileName().toString();
        String conversationId = fileName.substring(0, fileName.length() - extension.length());
        String text;
        try {
            text = fileWalker.readText(file);
        } catch (IOException e) {
            log.warn("[Transcripts] Failed to read {}: {}", file, e.getMessage());
            return;
        }

        List<HistoryMessage> messages = parser.parse(text, conversationId, baseTime, projectPath.toString());
        if (messages.isEmpty()) {
            return;
        }
        collector.add(messages, Conversation.summarize(conversationId, messages, getSource()));
    }
}
