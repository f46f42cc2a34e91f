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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonical history record produced by every source adapter. A message is
 * immutable once built; adapters are responsible for truncating
 * {@code content} and for filling {@code relatedFiles} through
 * {@link me.golemcore.history.domain.service.FileReferenceSupport}.
 *
 * <p>
 * The timestamp may be synthetic for sources that do not record wall-clock
 * time (transcripts, Markdown exports). Synthetic timestamps only preserve the
 * order of messages within a single file.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HistoryMessage {

    String id;
    Instant timestamp;
    MessageRole role;
    String content;
    HistorySource source;
    String projectPath;
    String conversationId;
    String model;
    String thinking; // reasoning excerpt, transcripts only

    List<ToolCall> toolCalls;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    @Builder.Default
    Set<String> relatedFiles = Set.of();

    /**
     * A tool invocation recovered from free text. Arguments are parsed
     * opportunistically and may be absent even when a tool ran.
     */
    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ToolCall {
        String name;
        Map<String, Object> arguments;
    }
}
