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

import me.golemcore.history.infrastructure.fs.BudgetedFileWalker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Maps a project directory to the storage folders a source family keeps for
 * it.
 *
 * <p>
 * Source families name their per-project folders after the project path with
 * separators replaced by {@code -} (for example {@code /home/me/app} becomes
 * {@code home-me-app}). When that exact folder is missing, the base directory's
 * children are matched by containment of the last two path segments or of any
 * single segment, the former ranked first. Resolution never fails: a missing
 * base directory simply yields no candidates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StorageLocationResolver {

    private static final String DELIMITER = "-";
    private static final int SCORE_LAST_SEGMENTS = 2;
    private static final int SCORE_ANY_SEGMENT = 1;

    private final BudgetedFileWalker fileWalker;

    public List<Path> resolve(Path baseDirectory, Path projectPath) {
        if (baseDirectory == null || projectPath == null || !Files.isDirectory(baseDirectory)) {
            return List.of();
        }

        String folderName = toFolderName(projectPath.toString());
        if (!folderName.isEmpty()) {
            Path exact = baseDirectory.resolve(folderName);
            if (Files.isDirectory(exact)) {
                log.debug("[Resolver] Exact match {}", exact);
                return List.of(exact);
            }
        }

        List<String> segments = segments(projectPath.toString());
        if (segments.isEmpty()) {
            return List.of();
        }
        String lastTwo = String.join(DELIMITER,
                segments.subList(Math.max(0, segments.size() - 2), segments.size()));

        List<ScoredCandidate> scored = new ArrayList<>();
        for (Path child : fileWalker.listChildren(baseDirectory, Files::isDirectory)) {
            String name = child.getFileName().toString().toLowerCase(Locale.ROOT);
            int score = 0;
            if (name.contains(lastTwo)) {
                score = SCORE_LAST_SEGMENTS;
            } else if (segments.stream().anyMatch(name::contains)) {
                score = SCORE_ANY_SEGMENT;
            }
            if (score > 0) {
                scored.add(new ScoredCandidate(child, score));
            }
        }

        List<Path> matches = scored.stream()
                .sorted(Comparator.comparingInt(ScoredCandidate::score).reversed()
                        .thenComparing(candidate -> candidate.path().getFileName().toString()))
                .map(ScoredCandidate::path)
                .toList();
        log.debug("[Resolver] Fuzzy matches for {} under {}: {}", projectPath, baseDirectory, matches);
        return matches;
    }

    /**
     * Folder name a source family uses for the project path.
     */
    public static String toFolderName(String projectPath) {
        String unified = projectPath.replace('\\', '/');
        String stripped = unified.startsWith("/") ? unified.substring(1) : unified;
        if (stripped.endsWith("/")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped.replace("/", DELIMITER);
    }

    private static List<String> segments(String projectPath) {
        return Arrays.stream(projectPath.replace('\\', '/').split("/"))
                .filter(segment -> !segment.isEmpty())
                .map(segment -> segment.toLowerCase(Locale.ROOT))
                .toList();
    }

    private record ScoredCandidate(Path path, int score) {
    }
}
