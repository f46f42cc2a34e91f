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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts project file references mentioned in message text.
 *
 * <p>
 * Three independent passes run over the text: backtick spans, {@code @}
 * mentions and bare path-like tokens. A candidate is kept only when its
 * extension is a known source, doc or config extension, it is at most
 * {@value #MAX_PATH_LENGTH} characters long and it contains none of
 * {@code <>"|?*}. Kept paths are normalized to a leading slash.
 */
public final class FileReferenceSupport {

    public static final int MAX_PATH_LENGTH = 150;

    private static final Set<String> EXTENSIONS = Set.of(
            "ts", "tsx", "js", "jsx", "mjs", "cjs",
            "css", "scss", "sass", "less", "html", "vue", "svelte",
            "json", "yaml", "yml", "toml", "md", "mdx",
            "py", "rb", "go", "rs", "java", "kt", "swift",
            "sh", "bash", "zsh", "sql", "graphql");

    private static final Pattern FORBIDDEN_CHARS = Pattern.compile("[<>\"|?*]");

    private static final Pattern BACKTICK_PATTERN = Pattern.compile(
            "`([^`]+\\.[a-z]{1,10})`", Pattern.CASE_INSENSITIVE);
    private static final Pattern MENTION_PATTERN = Pattern.compile(
            "@([\\w\\-./]+\\.[a-z]{1,10})", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE_PATH_PATTERN = Pattern.compile(
            "(?:^|(?<=[\\s\"']))((?:\\./|/|src/|lib/|app/)?[\\w\\-./]+\\.[a-z]{1,10})(?=\\s|$|[,.:;)\"'])",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private FileReferenceSupport() {
    }

    public static Set<String> extractFileReferences(String text) {
        if (text == null || text.isEmpty()) {
            return Set.of();
        }
        Set<String> paths = new LinkedHashSet<>();
        collect(BACKTICK_PATTERN, text, paths);
        collect(MENTION_PATTERN, text, paths);
        collect(BARE_PATH_PATTERN, text, paths);
        return Collections.unmodifiableSet(paths);
    }

    public static boolean isLikelyPath(String candidate) {
        if (candidate == null || candidate.length() > MAX_PATH_LENGTH) {
            return false;
        }
        int dot = candidate.lastIndexOf('.');
        if (dot < 0 || dot == candidate.length() - 1) {
            return false;
        }
        String extension = candidate.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!EXTENSIONS.contains(extension)) {
            return false;
        }
        return !FORBIDDEN_CHARS.matcher(candidate).find();
    }

    public static String normalizePath(String path) {
        if (path.startsWith("./")) {
            return "/" + path.substring(2);
        }
        return path.startsWith("/") ? path : "/" + path;
    }

    private static void collect(Pattern pattern, String text, Set<String> sink) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group(1).trim();
            if (isLikelyPath(candidate)) {
                sink.add(normalizePath(candidate));
            }
        }
    }
}
