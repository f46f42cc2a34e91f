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

package me.golemcore.history.adapter.outbound.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.history.domain.model.Conversation;
import me.golemcore.history.domain.model.HistoryMessage;
import me.golemcore.history.domain.model.HistorySource;
import me.golemcore.history.domain.model.SourceBatch;
import me.golemcore.history.domain.service.ContentSupport;
import me.golemcore.history.domain.service.FileReferenceSupport;
import me.golemcore.history.domain.service.TimestampSupport;
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
import java.util.ArrayList;
import java.util.List;

/**
 * Reads chat exports and state files kept as JSON inside the project's
 * {@code .cursor} directory.
 *
 * <p>
 * Each file is one conversation. Message ids encode the path the message
 * list was found at, for example {@code chat-conversations[0].messages-3}.
 */
@Component
@Order(3)
@RequiredArgsConstructor
@Slf4j
public class JsonHistoryAdapter implements HistorySourcePort {

    static final String JSON_EXTENSION = ".json";

    private final HistoryProperties properties;
    private final BudgetedFileWalker fileWalker;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public HistorySource getSource() {
        return HistorySource.CURSOR_JSON;
    }

    @Override
    public SourceBatch read(Path projectPath) {
        HistoryProperties.JsonProperties settings = properties.getJson();
        Path directory = projectPath.resolve(settings.getDirectory());
        if (!Files.isDirectory(directory)) {
            log.debug("[JsonHistory] No {} directory in {}", settings.getDirectory(), projectPath);
            return SourceBatch.empty();
        }

        MessageListLocator locator = new MessageListLocator(settings.getMaxDepth());
        SourceBatch.Collector collector = new SourceBatch.Collector();
        for (Path file : fileWalker.findFiles(directory, file -> isCandidate(file, settings))) {
            readDocument(file, locator, projectPath, collector);
        }

        SourceBatch batch = collector.build();
        log.debug("[JsonHistory] {} messages in {} documents for {}", batch.messages().size(),
                batch.conversations().size(), projectPath);
        return batch;
    }

    private void readDocument(Path file, MessageListLocator locator, Path projectPath,
            SourceBatch.Collector collector) {
        JsonNode document;
        try {
            document = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            log.debug("[JsonHistory] Skipping unparseable {}: {}", file, e.getMessage());
            return;
        }

        String conversationId = baseName(file);
        List<HistoryMessage> messages = new ArrayList<>();
        for (MessageListLocator.MessageList list : locator.locate(document)) {
            for (int i = 0; i < list.elements().size(); i++) {
                JsonNode element = list.elements().get(i);
                if (JsonMessageFields.isMessage(element)) {
                    messages.add(toMessage(element, conversationId + "-" + list.path() + "-" + i,
                            conversationId, projectPath));
                }
            }
        }
        if (!messages.isEmpty()) {
            collector.add(messages, Conversation.summarize(conversationId, messages, getSource()));
        }
    }

    private HistoryMessage toMessage(JsonNode element, String id, String conversationId, Path projectPath) {
        String content = ContentSupport.truncate(JsonMessageFields.content(element).orElse(""),
                properties.getContent().getMaxLength());
        return HistoryMessage.builder()
                .id(id)
                .timestamp(TimestampSupport.resolve(JsonMessageFields.rawTimestamp(element), clock))
                .role(JsonMessageFields.role(element))
                .content(content)
                .source(getSource())
                .projectPath(projectPath.toString())
                .conversationId(conversationId)
                .model(JsonMessageFields.model(element))
                .relatedFiles(FileReferenceSupport.extractFileReferences(content))
                .build();
    }

    private static boolean isCandidate(Path file, HistoryProperties.JsonProperties settings) {
        String name = file.getFileName().toString();
        return name.endsWith(JSON_EXTENSION) && !settings.getExcludedFiles().contains(name);
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(JSON_EXTENSION) ? name.substring(0, name.length() - JSON_EXTENSION.length()) : name;
    }
}
