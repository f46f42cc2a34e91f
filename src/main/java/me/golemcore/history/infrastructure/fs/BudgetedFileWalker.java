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

package me.golemcore.history.infrastructure.fs;

import me.golemcore.history.infrastructure.config.HistoryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Directory tree walker bounded by a wall-clock budget and a depth limit.
 *
 * <p>
 * Build-output and dependency directories listed in
 * {@code history.scan.ignored-directories} are never entered. A walk that
 * runs past {@code history.scan.timeout} is abandoned and reported as an empty
 * result, so a huge tree looks the same to callers as an absent source.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BudgetedFileWalker {

    private final HistoryProperties properties;
    private final Clock clock;

    /**
     * Find regular files under {@code root} accepted by the filter, sorted by
     * path.
     *
     * @return matching files, or an empty list when the root is missing,
     *         unreadable or the budget ran out
     */
    public List<Path> findFiles(Path root, Predicate<Path> filter) {
        return findFiles(root, properties.getScan().getMaxDepth(), filter);
    }

    public List<Path> findFiles(Path root, int maxDepth, Predicate<Path> filter) {
        if (root == null || !Files.isDirectory(root)) {
            return Collections.emptyList();
        }
        Instant deadline = clock.instant().plus(properties.getScan().getTimeout());
        Set<String> ignored = new HashSet<>(properties.getScan().getIgnoredDirectories());
        CollectingVisitor visitor = new CollectingVisitor(root, ignored, filter, deadline);
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), maxDepth, visitor);
        } catch (IOException e) {
            log.warn("[Walker] Failed to walk {}: {}", root, e.getMessage());
            return Collections.emptyList();
        }
        if (visitor.timedOut) {
            log.warn("[Walker] Scan budget of {} exceeded under {}, treating as unavailable",
                    properties.getScan().getTimeout(), root);
            return Collections.emptyList();
        }
        List<Path> result = new ArrayList<>(visitor.matches);
        Collections.sort(result);
        return result;
    }

    /**
     * List the immediate children of a directory accepted by the filter,
     * sorted by name. Missing or unreadable directories yield an empty list.
     */
    public List<Path> listChildren(Path directory, Predicate<Path> filter) {
        if (directory == null || !Files.isDirectory(directory)) {
            return Collections.emptyList();
        }
        try (Stream<Path> children = Files.list(directory)) {
            return children
                    .filter(filter)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("[Walker] Failed to list {}: {}", directory, e.getMessage());
            return Collections.emptyList();
        }
    }

    /**
     * Read a file as UTF-8, replacing malformed bytes with U+FFFD instead of
     * failing.
     */
    public String readText(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private final class CollectingVisitor extends SimpleFileVisitor<Path> {

        private final Path root;
        private final Set<String> ignored;
        private final Predicate<Path> filter;
        private final Instant deadline;
        private final List<Path> matches = new ArrayList<>();
        private boolean timedOut;

        private CollectingVisitor(Path root, Set<String> ignored, Predicate<Path> filter, Instant deadline) {
            this.root = root;
            this.ignored = ignored;
            this.filter = filter;
            this.deadline = deadline;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (budgetExhausted()) {
                return FileVisitResult.TERMINATE;
            }
            if (!dir.equals(root) && dir.getFileName() != null
                    && ignored.contains(dir.getFileName().toString())) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (budgetExhausted()) {
                return FileVisitResult.TERMINATE;
            }
            if (attrs.isRegularFile() && filter.test(file)) {
                matches.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.debug("[Walker] Skipping unreadable entry {}: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }

        private boolean budgetExhausted() {
            if (clock.instant().isAfter(deadline)) {
                timedOut = true;
            }
            return timedOut;
        }
    }
}
