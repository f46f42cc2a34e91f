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
import me.golemcore.history.domain.model.SessionSummary;
import me.golemcore.history.domain.service.ContentSupport;
import me.golemcore.history.domain.service.TimestampSupport;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.infrastructure.fs.BudgetedFileWalker;
import me.golemcore.history.port.outbound.SessionDiscoveryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Classifies the JSON session files under a project's {@code .cursor}
 * directory without extracting their messages.
 *
 * <p>
 * A top-level {@code messages} array marks a chat, a {@code tabs} array a
 * composer session. An {@code agentMode}/{@code isAgent} flag or a file name
 * containing {@code agent} overrides either as an agent session.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CursorSessionDiscoveryAdapter implements SessionDiscoveryPort {

    private static final int TITLE_MAX_LEN = 60;
    private static final String AGENT_MARKER = "agent";

    private final HistoryProperties properties;
    private final BudgetedFileWalker fileWalker;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public List<SessionSummary> discover(Path projectPath) {
        Path directory = projectPath.resolve(properties.getJson().getDirectory());
        if (!Files.isDirectory(directory)) {
            return List.of();
        }

        List<SessionSummary> sessions = new ArrayList<>();
        List<Path> files = fileWalker.findFiles(directory,
                file -> file.getFileName().toString().endsWith(JsonHistoryAdapter.JSON_EXTENSION));
        for (Path file : files) {
            readSession(file).ifPresent(sessions::add);
        }
        sessions.sort(Comparator.comparing(SessionSummary::getTimestamp).reversed());
        log.debug("[Discovery] {} sessions in {}", sessions.size(), directory);
        return sessions;
    }

    private Optional<SessionSummary> readSession(Path file) {
        JsonNode document;
        try {
            document = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            log.debug("[Discovery] Skipping unparseable {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        if (document == null || !document.isObject()) {
            return Optional.empty();
        }
        return classify(document, JsonHistoryAdapter.baseName(file));
    }

    Optional<SessionSummary> classify(JsonNode document, String id) {
        SessionSummary.SessionType type = SessionSummary.SessionType.UNKNOWN;
        int messageCount = 0;
        String title = null;
        String model = null;
        Instant timestamp = clock.instant();

        JsonNode messages = document.path("messages");
        if (messages.isArray()) {
            type = SessionSummary.SessionType.CHAT;
            messageCount = messages.size();
            JsonNode first = messages.path(0);
            if (first.isObject()) {
                model = first.path("model").isValueNode() ? first.path("model").asText() : null;
                timestamp = firstTimestamp(first).orElse(timestamp);
            }
            title = chatTitle(messages);
        }

        JsonNode tabs = document.path("tabs");
        if (tabs.isArray()) {
            type = SessionSummary.SessionType.COMPOSER;
            messageCount = 0;
            for (JsonNode tab : tabs) {
                JsonNode tabMessages = tab.path("messages");
                if (tabMessages.isArray()) {
                    messageCount += tabMessages.size();
                }
            }
        }

        if (isTruthy(document.path("agentMode")) || isTruthy(document.path("isAgent"))
                || id.contains(AGENT_MARKER)) {
            type = SessionSummary.SessionType.AGENT;
        }

        if (messageCount == 0) {
            return Optional.empty();
        }
        return Optional.of(SessionSummary.builder()
                .id(id)
                .type(type)
                .timestamp(timestamp)
                .messageCount(messageCount)
                .title(title)
                .model(model)
                .build());
    }

    private static Optional<Instant> firstTimestamp(JsonNode message) {
        for (String key : List.of("timestamp", "created_at")) {
            JsonNode value = message.path(key);
            if (value.isNumber()) {
                return TimestampSupport.parse(value.numberValue());
            }
            if (value.isTextual()) {
                return TimestampSupport.parse(value.asText());
            }
        }
        return Optional.empty();
    }

    private static String chatTitle(JsonNode messages) {
        for (JsonNode message : messages) {
            if ("user".equals(message.path("role").asText(null))) {
                return JsonMessageFields.content(message)
                        .map(content -> ContentSupport.truncate(content, TITLE_MAX_LEN))
                        .orElse(null);
            }
        }
        return null;
    }

    private static boolean isTruthy(JsonNode value) {
        if (value.isMissingNode() || value.isNull()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            return value.asDouble() != 0d;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        return true;
    }
}
