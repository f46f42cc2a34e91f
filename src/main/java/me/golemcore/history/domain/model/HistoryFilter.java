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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Optional narrowing applied to an aggregated history. Absent criteria match
 * everything; {@code after} and {@code before} are inclusive.
 */
@Value
@Builder
public class HistoryFilter {

    Set<HistorySource> sources;
    Set<MessageRole> roles;
    Instant after;
    Instant before;
    Integer limit;

    public boolean isEmpty() {
        return (sources == null || sources.isEmpty())
                && (roles == null || roles.isEmpty())
                && after == null
                && before == null
                && limit == null;
    }

    public boolean matches(HistoryMessage message) {
        if (sources != null && !sources.isEmpty() && !sources.contains(message.getSource())) {
            return false;
        }
        if (roles != null && !roles.isEmpty() && !roles.contains(message.getRole())) {
            return false;
        }
        Instant timestamp = message.getTimestamp();
        if (after != null && timestamp.isBefore(after)) {
            return false;
        }
        return before == null || !timestamp.isAfter(before);
    }

    public boolean includesSource(HistorySource source) {
        return sources == null || sources.isEmpty() || sources.contains(source);
    }
}
