package me.golemcore.history.port.outbound;

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

import me.golemcore.history.domain.model.HistorySource;
import me.golemcore.history.domain.model.SourceBatch;

import java.nio.file.Path;

/**
 * Port for one physical history format. Each adapter reads its own storage
 * and returns messages already normalized to the canonical schema.
 *
 * <p>
 * Implementations must treat a missing location, an unreadable file or a
 * malformed record as "no data" and return {@link SourceBatch#empty()} or a
 * partial batch rather than throwing. Execution order in the aggregator is
 * determined by the {@code @Order} annotation of the implementation.
 */
public interface HistorySourcePort {

    /**
     * Tag stamped on every message this adapter produces.
     */
    HistorySource getSource();

    /**
     * Whether the adapter's well-known location exists for this project.
     * Adapters that are always attempted keep the default.
     */
    default boolean isApplicable(Path projectPath) {
        return true;
    }

    /**
     * Read and normalize all history available for the project.
     *
     * @param projectPath
     *            absolute, normalized project directory
     */
    SourceBatch read(Path projectPath);
}
