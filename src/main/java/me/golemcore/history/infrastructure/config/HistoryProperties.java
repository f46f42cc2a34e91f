package me.golemcore.history.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration for history ingestion, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code history.*} prefix, one nested class per
 * source family:
 * <ul>
 * <li>{@link TranscriptProperties} - agent transcript folders</li>
 * <li>{@link TrackingStoreProperties} - the SQLite tracking database</li>
 * <li>{@link JsonProperties} - per-project JSON session files</li>
 * <li>{@link ExportProperties} - exported Markdown dialogues</li>
 * <li>{@link AntigravityProperties} - artifact ("brain") directories</li>
 * <li>{@link ScanProperties} - limits for directory walks</li>
 * </ul>
 *
 * <p>
 * Path values may contain a {@code ${user.home}} placeholder which is expanded
 * against {@link #getHomeDir()} when resolved, so tests can point every source
 * at a fixture directory by overriding a single property.
 */
@Component
@ConfigurationProperties(prefix = "history")
@Data
public class HistoryProperties {

    private static final String HOME_PLACEHOLDER = "${user.home}";

    private String homeDir = System.getProperty("user.home");
    private TranscriptProperties transcripts = new TranscriptProperties();
    private TrackingStoreProperties trackingStore = new TrackingStoreProperties();
    private JsonProperties json = new JsonProperties();
    private ExportProperties export = new ExportProperties();
    private AntigravityProperties antigravity = new AntigravityProperties();
    private ScanProperties scan = new ScanProperties();
    private ContentProperties content = new ContentProperties();

    /**
     * Expands the home placeholder and normalizes the result to an absolute
     * path.
     */
    public Path resolvePath(String configured) {
        String home = homeDir != null ? homeDir : System.getProperty("user.home");
        return Paths.get(configured.replace(HOME_PLACEHOLDER, home)).toAbsolutePath().normalize();
    }

    @Data
    public static class TranscriptProperties {
        private String projectsDir = "${user.home}/.cursor/projects";
        private String subdirectory = "agent-transcripts";
        private String extension = ".txt";
    }

    @Data
    public static class TrackingStoreProperties {
        private String path = "${user.home}/.cursor/ai-tracking/ai-code-tracking.db";
        private int summaryLimit = 100;
        private int commitLimit = 50;
    }

    @Data
    public static class JsonProperties {
        private String directory = ".cursor";
        private int maxDepth = 6;
        private List<String> excludedFiles = new ArrayList<>(List.of("mcp.json"));
    }

    @Data
    public static class ExportProperties {
        private List<String> fileNamePatterns = new ArrayList<>(List.of(
                "Antigravity*.md",
                "*Log Access*.md",
                "*Chat Conversation*.md",
                "*export*.md"));
        private int maxContentLength = 2000;
    }

    @Data
    public static class AntigravityProperties {
        private String brainDir = "${user.home}/.gemini/antigravity/brain";
        private String annotationsDir = "${user.home}/.gemini/antigravity/annotations";
        private int maxArtifactLength = 1500;
        private int maxListedImages = 5;
    }

    @Data
    public static class ScanProperties {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxDepth = 12;
        private List<String> ignoredDirectories = new ArrayList<>(List.of(
                "node_modules", ".git", "dist", "build", "venv", "__pycache__", "target"));
    }

    @Data
    public static class ContentProperties {
        private int maxLength = 1000;
    }
}
