package me.golemcore.history.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.history.adapter.inbound.web.dto.ConversationsRequest;
import me.golemcore.history.adapter.inbound.web.dto.ConversationsResponse;
import me.golemcore.history.adapter.inbound.web.dto.HistoryRequest;
import me.golemcore.history.adapter.inbound.web.dto.HistoryResponse;
import me.golemcore.history.domain.model.ConversationDiscovery;
import me.golemcore.history.domain.model.HistoryFilter;
import me.golemcore.history.domain.model.HistoryResult;
import me.golemcore.history.domain.model.HistorySource;
import me.golemcore.history.domain.model.MessageRole;
import me.golemcore.history.domain.service.HistoryAggregationService;
import me.golemcore.history.domain.service.SessionDiscoveryService;
import me.golemcore.history.domain.service.TimestampSupport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Conversation history endpoints.
 *
 * <p>
 * Aggregation walks the filesystem and reads SQLite, so the work runs on the
 * bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class HistoryController {

    private final HistoryAggregationService aggregationService;
    private final SessionDiscoveryService discoveryService;

    @PostMapping("/history")
    public Mono<ResponseEntity<HistoryResponse>> getHistory(@RequestBody HistoryRequest request) {
        return Mono.fromCallable(() -> {
            Path projectPath = requireProjectPath(request != null ? request.getProjectPath() : null);
            if (!Files.exists(projectPath)) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Project path not found: " + projectPath);
            }
            HistoryFilter filter = toFilter(request);
            HistoryResult history = aggregationService.getHistory(projectPath, filter);
            log.info("[API] History for {}: {} messages", projectPath, history.getTotalMessages());
            return ResponseEntity.ok(HistoryResponse.builder()
                    .success(true)
                    .history(history)
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/conversations")
    public Mono<ResponseEntity<ConversationsResponse>> getConversations(
            @RequestBody ConversationsRequest request) {
        return Mono.fromCallable(() -> {
            Path projectPath = requireProjectPath(request != null ? request.getProjectPath() : null);
            if (!Files.isDirectory(projectPath)) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Project path is not a directory: " + projectPath);
            }
            ConversationDiscovery discovery = discoveryService.discoverSessions(projectPath);
            return ResponseEntity.ok(ConversationsResponse.builder()
                    .success(true)
                    .projectPath(discovery.getProjectPath())
                    .conversations(discovery.getConversations())
                    .totalMessages(discovery.getTotalMessages())
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static Path requireProjectPath(String projectPath) {
        if (projectPath == null || projectPath.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "projectPath is required");
        }
        try {
            return Paths.get(projectPath.trim()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid projectPath: " + e.getMessage());
        }
    }

    private static HistoryFilter toFilter(HistoryRequest request) {
        if (request.getLimit() != null && request.getLimit() <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be positive");
        }
        return HistoryFilter.builder()
                .sources(toSources(request.getSources()))
                .roles(toRoles(request.getRoles()))
                .after(toInstant("after", request.getAfter()))
                .before(toInstant("before", request.getBefore()))
                .limit(request.getLimit())
                .build();
    }

    private static Set<HistorySource> toSources(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Set.of();
        }
        Set<HistorySource> sources = EnumSet.noneOf(HistorySource.class);
        for (String tag : tags) {
            sources.add(HistorySource.fromTag(tag));
        }
        return sources;
    }

    private static Set<MessageRole> toRoles(List<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        Set<MessageRole> roles = EnumSet.noneOf(MessageRole.class);
        for (String value : values) {
            roles.add(MessageRole.fromValue(value));
        }
        return roles;
    }

    private static Instant toInstant(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return TimestampSupport.parse(value)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Invalid '" + field + "' timestamp: " + value));
    }
}
