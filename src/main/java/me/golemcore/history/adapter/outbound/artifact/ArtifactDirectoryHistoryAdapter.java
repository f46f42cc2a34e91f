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

package me.golemcore.history.adapter.outbound.artifact;

import me.golemcore.history.domain.model.Conversation;
import me.golemcore.history.domain.model.HistoryMessage;
import me.golemcore.history.domain.model.HistorySource;
import me.golemcore.history.domain.model.MessageRole;
import me.golemcore.history.domain.model.SourceBatch;
import me.golemcore.history.domain.service.ContentSupport;
import me.golemcore.history.domain.service.FileReferenceSupport;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads agent "brain" directories: one subdirectory per conversation holding
 * Markdown artifacts (plans, task lists, walkthroughs) and screenshots.
 *
 * <p>
 * Every artifact becomes an assistant message tagged with its type, taken
 * from the file name. All messages of a conversation share the last-viewed
 * time recorded in {@code <annotations>/<id>.pbtxt}.
 */
@Component
@Order(5)
@RequiredArgsConstructor
@Slf4j
public class ArtifactDirectoryHistoryAdapter implements HistorySourcePort {

    static final String DEFAULT_TITLE = "Antigravity Session";

    private static final String MARKDOWN_EXTENSION = ".md";
    private static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "webp");
    private static final Pattern SECONDS = Pattern.compile("seconds:\\s*(\\d+)");

    private final HistoryProperties properties;
    private final BudgetedFileWalker fileWalker;
    private final Clock clock;

    @Override
    public HistorySource getSource() {
        return HistorySource.ANTIGRAVITY_BRAIN;
    }

    @Override
    public boolean isApplicable(Path projectPath) {
        return Files.isDirectory(brainDir());
    }

    @Override
    public SourceBatch read(Path projectPath) {
        Path brainDir = brainDir();
        if (!Files.isDirectory(brainDir)) {
            log.debug("[Artifacts] No brain directory at {}", brainDir);
            return SourceBatch.empty();
        }

        Path annotationsDir = properties.resolvePath(properties.getAntigravity().getAnnotationsDir());
        SourceBatch.Collector collector = new SourceBatch.Collector();
        List<Path> conversationDirs = fileWalker.listChildren(brainDir,
                dir -> Files.isDirectory(dir) && !dir.getFileName().toString().startsWith("."));
        for (Path conversationDir : conversationDirs) {
            readConversation(conversationDir, annotationsDir, projectPath, collector);
        }

        SourceBatch batch = collector.build();
        log.debug("[Artifacts] {} messages in {} conversations", batch.messages().size(),
                batch.conversations().size());
        return batch;
    }

    private void readConversation(Path conversationDir, Path annotationsDir, Path projectPath,
            SourceBatch.Collector collector) {
        HistoryProperties.AntigravityProperties settings = properties.getAntigravity();
        String conversationId = conversationDir.getFileName().toString();
        Instant lastViewed = lastViewed(annotationsDir.resolve(conversationId + ".pbtxt"));

        List<HistoryMessage> messages = new ArrayList<>();
        String firstArtifactType = null;

        List<Path> artifacts = fileWalker.listChildren(conversationDir, ArtifactDirectoryHistoryAdapter::isArtifact);
        for (Path artifact : artifacts) {
            String body;
            try {
                body = fileWalker.readText(artifact);
            } catch (IOException e) {
                log.debug("[Artifacts] Failed to read {}: {}", artifact, e.getMessage());
                continue;
            }
            String fileName = artifact.getFileName().toString();
            String artifactType = fileName.substring(0, fileName.length() - MARKDOWN_EXTENSION.length());
            if (firstArtifactType == null) {
                firstArtifactType = artifactType;
            }
            messages.add(message(conversationId + "-artifact-" + artifactType,
                    "[Artifact: " + artifactType + "]\n\n"
                            + ContentSupport.truncate(body, settings.getMaxArtifactLength()),
                    FileReferenceSupport.extractFileReferences(body),
                    conversationId, lastViewed, projectPath));
        }

        List<String> images = fileWalker.listChildren(conversationDir, ArtifactDirectoryHistoryAdapter::isImage)
                .stream()
                .map(image -> image.getFileName().toString())
                .toList();
        if (!images.isEmpty()) {
            int listed = Math.min(images.size(), settings.getMaxListedImages());
            String content = "[Screenshots: " + images.size() + " images captured]\n"
                    + String.join(", ", images.subList(0, listed))
                    + (images.size() > listed ? ContentSupport.ELLIPSIS : "");
            messages.add(message(conversationId + "-screenshots", content, Set.of(),
                    conversationId, lastViewed, projectPath));
        }

        if (messages.isEmpty()) {
            return;
        }
        String title = firstArtifactType != null ? firstArtifactType : DEFAULT_TITLE;
        collector.add(messages, Conversation.summarize(conversationId, title, messages, getSource()));
    }

    private HistoryMessage message(String id, String content, Set<String> relatedFiles, String conversationId,
            Instant timestamp, Path projectPath) {
        return HistoryMessage.builder()
                .id(id)
                .timestamp(timestamp)
                .role(MessageRole.ASSISTANT)
                .content(content)
                .source(getSource())
                .projectPath(projectPath.toString())
                .conversationId(conversationId)
                .relatedFiles(relatedFiles)
                .build();
    }

    private Instant lastViewed(Path annotation) {
        if (!Files.isRegularFile(annotation)) {
            return clock.instant();
        }
        try {
            Matcher matcher = SECONDS.matcher(fileWalker.readText(annotation));
            if (matcher.find()) {
                return Instant.ofEpochSecond(Long.parseLong(matcher.group(1)));
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("[Artifacts] Unreadable annotation {}: {}", annotation, e.getMessage());
        }
        return clock.instant();
    }

    private static boolean isArtifact(Path file) {
        String name = file.getFileName().toString();
        return Files.isRegularFile(file)
                && name.endsWith(MARKDOWN_EXTENSION)
                && !name.contains(".resolved")
                && !name.contains(".metadata");
    }

    private static boolean isImage(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return Files.isRegularFile(file) && dot > 0
                && IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private Path brainDir() {
        return properties.resolvePath(properties.getAntigravity().getBrainDir());
    }
}
