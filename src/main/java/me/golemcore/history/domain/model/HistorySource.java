package me.golemcore.history.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tag identifying which adapter produced a message or conversation.
 */
public enum HistorySource {

    CURSOR_TRANSCRIPT("cursor-transcript"),
    CURSOR_DB("cursor-db"),
    CURSOR_JSON("cursor-json"),
    ANTIGRAVITY_EXPORT("antigravity-export"),
    ANTIGRAVITY_BRAIN("antigravity-brain");

    private final String tag;

    HistorySource(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static HistorySource fromTag(String tag) {
        for (HistorySource source : values()) {
            if (source.tag.equalsIgnoreCase(tag) || source.name().equalsIgnoreCase(tag)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown history source: " + tag);
    }
}
