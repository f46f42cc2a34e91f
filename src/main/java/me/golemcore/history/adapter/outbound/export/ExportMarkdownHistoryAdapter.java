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

import me.golemcore.history.domain.model.Conversation;
import me.golemcore.history.domain.model.HistoryMessage;
import me.golemcore.history.domain.model.HistorySource;
import me.golemcore.history.domain.model.SourceBatch;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.infrastructure.fs.BudgetedFileWalker;
import me.golemcore.history.port.outbound.HistorySourcePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Reads conversation exports saved as Markdown somewhere in the project
 * tree.
 *
 * <p>
 * Candidate files are picked by name ({@code history.export.file-name-patterns})
 * and confirmed by content: both section headers must be present.
 */
@Component
@Order(4)
@RequiredArgsConstructor
@Slf4j
public class ExportMarkdownHistoryAdapter implements HistorySourcePort {

    private static final String MARKDOWN_EXTENSION = ".md";

    private final HistoryProperties properties;
    private final BudgetedFileWalker fileWalker;
    private final Clock clock;

    @Override
    public HistorySource getSource() {
        return HistorySource.ANTIGRAVITY_EXPORT;
    }

    @Override
    public boolean isApplicable(Path projectPath) {
        return Files.isDirectory(projectPath);
    }

    @Override
    public SourceBatch read(Path projectPath) {
        HistoryProperties.ExportProperties settings = properties.getExport();
        List<PathMatcher> matchers = settings.getFileNamePatterns().stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();

        ExportMarkdownParser parser = new ExportMarkdownParser(settings.getMaxContentLength());
        Instant startTime = clock.instant();
        SourceBatch.Collector collector = new SourceBatch.Collector();
        for (Path file : fileWalker.findFiles(projectPath, file -> matchesName(file, matchers))) {
            readExport(file, parser, startTime, projectPath, collector);
        }

        SourceBatch batch = collector.build();
        log.debug("[Export] {} messages in {} exports for {}", batch.messages().size(),
                batch.conversations().size(), projectPath);
        return batch;
    }

    private void readExport(Path file, ExportMarkdownParser parser, Instant startTime, Path projectPath,
            SourceBatch.Collector collector) {
        String text;
        try {
            text = fileWalker.readText(file);
        } catch (IOException e) {
            log.debug("[Export] Failed to read {}: {}", file, e.getMessage());
            return;
        }
        if (!ExportMarkdownParser.isExport(text)) {
            return;
        }

        String conversationId = conversationId(file);
        List<HistoryMessage> messages = parser.parse(text, conversationId, startTime, projectPath.toString());
        if (!messages.isEmpty()) {
            collector.add(messages, Conversation.summarize(conversationId, messages, getSource()));
        }
    }

    static String conversationId(Path file) {
        String name = file.getFileName().toString();
        if (name.endsWith(MARKDOWN_EXTENSION)) {
            name = name.substring(0, name.length() - MARKDOWN_EXTENSION.length());
        }
        return name.replaceAll("\\s+", "-").toLowerCase(Locale.ROOT);
    }

    private static boolean matchesName(Path file, List<PathMatcher> matchers) {
        Path name = file.getFileName();
        return name != null && matchers.stream().anyMatch(matcher -> matcher.matches(name));
    }
}
