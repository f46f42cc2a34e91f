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

import java.util.Locale;

/**
 * Canonical speaker of a history message. Every source-specific role label is
 * mapped onto one of these four values.
 */
public enum MessageRole {

    USER("user"), ASSISTANT("assistant"), SYSTEM("system"), TOOL("tool");

    private final String value;

    MessageRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Strict lookup by wire value. Use
     * {@link me.golemcore.history.domain.service.RoleNormalizationSupport} for
     * free-form labels.
     */
    @JsonCreator
    public static MessageRole fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Role must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (MessageRole role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
