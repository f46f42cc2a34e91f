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
import me.golemcore.history.domain.model.MessageRole;
import me.golemcore.history.domain.service.RoleNormalizationSupport;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Aliased field access for message-like JSON objects.
 */
final class JsonMessageFields {

    static final List<String> CONTENT_KEYS = List.of("content", "text", "message", "body");
    static final List<String> ROLE_KEYS = List.of("role", "type", "author", "sender");
    static final List<String> TIMESTAMP_KEYS = List.of("timestamp", "created_at", "createdAt", "time", "date",
            "ts");

    private JsonMessageFields() {
    }

    static boolean isMessage(JsonNode node) {
        return node != null && node.isObject() && content(node).isPresent();
    }

    /**
     * First non-blank content alias. A {@code content} array of parts is
     * flattened by joining the {@code text} of each part.
     */
    static Optional<String> content(JsonNode node) {
        for (String key : CONTENT_KEYS) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                continue;
            }
            String text = value.isArray() ? joinParts(value) : scalarText(value);
            if (text != null && !text.isBlank()) {
                return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    static MessageRole role(JsonNode node) {
        for (String key : ROLE_KEYS) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isTextual()) {
                return RoleNormalizationSupport.normalizeRole(value.asText());
            }
            if (value.isObject() && value.path("role").isTextual()) {
                return RoleNormalizationSupport.normalizeRole(value.path("role").asText());
            }
        }
        return MessageRole.USER;
    }

    /**
     * Raw timestamp value as a {@link Number} or {@link String}, or
     * {@code null} when no alias is present.
     */
    static Object rawTimestamp(JsonNode node) {
        for (String key : TIMESTAMP_KEYS) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isNumber()) {
                return value.numberValue();
            }
            if (value.isTextual()) {
                return value.asText();
            }
        }
        return null;
    }

    static String model(JsonNode node) {
        JsonNode model = node.get("model");
        return model != null && model.isTextual() ? model.asText() : null;
    }

    private static String joinParts(JsonNode parts) {
        List<String> texts = new ArrayList<>();
        for (JsonNode part : parts) {
            if (part.isTextual()) {
                texts.add(part.asText());
            } else if (part.path("text").isTextual()) {
                texts.add(part.path("text").asText());
            }
        }
        return String.join("\n", texts);
    }

    private static String scalarText(JsonNode value) {
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isNumber() || value.isBoolean()) {
            return value.asText();
        }
        return null;
    }
}
