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

package me.golemcore.history.adapter.outbound.trackingstore;

import me.golemcore.history.domain.model.HistoryMessage;
import me.golemcore.history.domain.model.HistorySource;
import me.golemcore.history.domain.model.MessageRole;
import me.golemcore.history.domain.model.SourceBatch;
import me.golemcore.history.domain.service.ContentSupport;
import me.golemcore.history.domain.service.FileReferenceSupport;
import me.golemcore.history.domain.service.TimestampSupport;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.port.outbound.HistorySourcePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Clock;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the AI code-tracking SQLite store.
 *
 * <p>
 * The store is opened read-only and only two tables are consulted:
 * {@code conversation_summaries} (one assistant message per summary) and
 * {@code scored_commits} (one system message per commit whose workspace path
 * mentions the project directory name). Each table is optional and queried
 * independently, so a schema drift in one table does not hide the other.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class TrackingStoreHistoryAdapter implements HistorySourcePort {

    static final String SUMMARIES_TABLE = "conversation_summaries";
    static final String COMMITS_TABLE = "scored_commits";

    private static final String ROW_ID = "row_id";
    private static final String TIMESTAMP_COLUMN = "timestamp";

    private final HistoryProperties properties;
    private final Clock clock;

    @Override
    public HistorySource getSource() {
        return HistorySource.CURSOR_DB;
    }

    @Override
    public boolean isApplicable(Path projectPath) {
        return Files.isRegularFile(storePath());
    }

    @Override
    public SourceBatch read(Path projectPath) {
        Path store = storePath();
        if (!Files.isRegularFile(store)) {
            log.debug("[TrackingStore] No store at {}", store);
            return SourceBatch.empty();
        }

        SourceBatch.Collector collector = new SourceBatch.Collector();
        try (Connection connection = openReadOnly(store)) {
            Set<String> tables = listTables(connection);
            if (tables.contains(SUMMARIES_TABLE)) {
                readSummaries(connection, projectPath, collector);
            }
            if (tables.contains(COMMITS_TABLE)) {
                readCommits(connection, projectPath, collector);
            }
        } catch (SQLException e) {
            log.warn("[TrackingStore] Failed to open {}: {}", store, e.getMessage());
            return SourceBatch.empty();
        }

        SourceBatch batch = collector.build();
        log.debug("[TrackingStore] {} messages for {}", batch.messages().size(), projectPath);
        return batch;
    }

    private void readSummaries(Connection connection, Path projectPath, SourceBatch.Collector collector) {
        String sql = "SELECT rowid AS " + ROW_ID + ", * FROM " + SUMMARIES_TABLE
                + " ORDER BY rowid DESC LIMIT ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, properties.getTrackingStore().getSummaryLimit());
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    Map<String, Object> row = readRow(resultSet);
                    if (!(row.get("summary") instanceof String summary) || summary.isBlank()) {
                        log.debug("[TrackingStore] Skipping summary row {} without text", row.get(ROW_ID));
                        continue;
                    }
                    Object conversationId = row.get("conversation_id");
                    collector.addMessage(message(
                            "db-summary-" + row.get(ROW_ID),
                            MessageRole.ASSISTANT,
                            summary,
                            row.get(TIMESTAMP_COLUMN),
                            conversationId != null ? String.valueOf(conversationId) : null,
                            projectPath));
                }
            }
        } catch (SQLException e) {
            log.warn("[TrackingStore] Failed to query {}: {}", SUMMARIES_TABLE, e.getMessage());
        }
    }

    private void readCommits(Connection connection, Path projectPath, SourceBatch.Collector collector) {
        Path fileName = projectPath.getFileName();
        String projectName = fileName != null ? fileName.toString() : projectPath.toString();
        try {
            String orderColumn = listColumns(connection, COMMITS_TABLE).contains(TIMESTAMP_COLUMN)
                    ? TIMESTAMP_COLUMN
                    : "rowid";
            queryCommits(connection, orderColumn, projectName, projectPath, collector);
        } catch (SQLException e) {
            log.warn("[TrackingStore] Failed to query {}: {}", COMMITS_TABLE, e.getMessage());
        }
    }

    private void queryCommits(Connection connection, String orderColumn, String projectName, Path projectPath,
            SourceBatch.Collector collector) throws SQLException {
        String sql = "SELECT rowid AS " + ROW_ID + ", * FROM " + COMMITS_TABLE
                + " WHERE workspace_path LIKE ? ORDER BY " + orderColumn + " DESC LIMIT ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, "%" + projectName + "%");
            statement.setInt(2, properties.getTrackingStore().getCommitLimit());
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    Map<String, Object> row = readRow(resultSet);
                    Object commitMessage = row.get("commit_message");
                    if (commitMessage == null) {
                        log.debug("[TrackingStore] Skipping commit row {} without message", row.get(ROW_ID));
                        continue;
                    }
                    Object score = row.get("score");
                    String content = "Commit: " + commitMessage + " (Score: "
                            + (score != null ? score : "N/A") + ")";
                    collector.addMessage(message(
                            "db-commit-" + row.get(ROW_ID),
                            MessageRole.SYSTEM,
                            content,
                            row.get(TIMESTAMP_COLUMN),
                            null,
                            projectPath));
                }
            }
        }
    }

    private HistoryMessage message(String id, MessageRole role, String text, Object rawTimestamp,
            String conversationId, Path projectPath) {
        String content = ContentSupport.truncate(text, properties.getContent().getMaxLength());
        return HistoryMessage.builder()
                .id(id)
                .timestamp(TimestampSupport.resolve(rawTimestamp, clock))
                .role(role)
                .content(content)
                .source(getSource())
                .projectPath(projectPath.toString())
                .conversationId(conversationId)
                .relatedFiles(FileReferenceSupport.extractFileReferences(content))
                .build();
    }

    private static Set<String> listTables(Connection connection) throws SQLException {
        Set<String> tables = new HashSet<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT name FROM sqlite_master WHERE type = 'table'");
                ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                tables.add(resultSet.getString(1));
            }
        }
        return tables;
    }

    private static Set<String> listColumns(Connection connection, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (PreparedStatement statement = connection.prepareStatement("PRAGMA table_info(" + table + ")");
                ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                columns.add(resultSet.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }

    private static Map<String, Object> readRow(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        Map<String, Object> row = new HashMap<>();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            String column = metaData.getColumnLabel(i).toLowerCase(Locale.ROOT);
            row.putIfAbsent(column, resultSet.getObject(i));
        }
        return row;
    }

    private static Connection openReadOnly(Path store) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        return DriverManager.getConnection("jdbc:sqlite:" + store, config.toProperties());
    }

    private Path storePath() {
        return properties.resolvePath(properties.getTrackingStore().getPath());
    }
}
