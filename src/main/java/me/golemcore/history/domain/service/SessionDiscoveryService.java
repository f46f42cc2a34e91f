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

import me.golemcore.history.domain.model.ConversationDiscovery;
import me.golemcore.history.domain.model.SessionSummary;
import me.golemcore.history.port.outbound.SessionDiscoveryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Lists the chat, composer and agent sessions stored for a project.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionDiscoveryService {

    private final SessionDiscoveryPort discoveryPort;

    public ConversationDiscovery discoverSessions(Path projectPath) {
        List<SessionSummary> sessions;
        try {
            sessions = discoveryPort.discover(projectPath);
        } catch (RuntimeException e) {
            log.warn("[Discovery] Failed to discover sessions in {}: {}", projectPath, e.getMessage(), e);
            return ConversationDiscovery.empty(projectPath.toString());
        }
        int totalMessages = sessions.stream().mapToInt(SessionSummary::getMessageCount).sum();
        return ConversationDiscovery.builder()
                .projectPath(projectPath.toString())
                .conversations(List.copyOf(sessions))
                .totalMessages(totalMessages)
                .build();
    }
}
