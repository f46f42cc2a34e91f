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

import me.golemcore.history.domain.model.MessageRole;

import java.util.Locale;
import java.util.Map;

/**
 * Maps free-form speaker labels found in third-party formats onto
 * {@link MessageRole}. Unknown or missing labels become {@link MessageRole#USER}.
 */
public final class RoleNormalizationSupport {

    private static final Map<String, MessageRole> SYNONYMS = Map.ofEntries(
            Map.entry("user", MessageRole.USER),
            Map.entry("human", MessageRole.USER),
            Map.entry("customer", MessageRole.USER),
            Map.entry("you", MessageRole.USER),
            Map.entry("assistant", MessageRole.ASSISTANT),
            Map.entry("ai", MessageRole.ASSISTANT),
            Map.entry("bot", MessageRole.ASSISTANT),
            Map.entry("claude", MessageRole.ASSISTANT),
            Map.entry("gpt", MessageRole.ASSISTANT),
            Map.entry("model", MessageRole.ASSISTANT),
            Map.entry("system", MessageRole.SYSTEM),
            Map.entry("context", MessageRole.SYSTEM),
            Map.entry("tool", MessageRole.TOOL),
            Map.entry("function", MessageRole.TOOL),
            Map.entry("action", MessageRole.TOOL));

    private RoleNormalizationSupport() {
    }

    public static MessageRole normalizeRole(Object value) {
        if (value == null) {
            return MessageRole.USER;
        }
        String key = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        return SYNONYMS.getOrDefault(key, MessageRole.USER);
    }
}
