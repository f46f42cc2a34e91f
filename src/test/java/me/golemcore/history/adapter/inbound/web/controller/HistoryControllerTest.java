package me.golemcore.history.adapter.inbound.web.controller;

import me.golemcore.history.adapter.inbound.web.dto.ConversationsRequest;
import me.golemcore.history.adapter.inbound.web.dto.ConversationsResponse;
import me.golemcore.history.adapter.inbound.web.dto.HistoryRequest;
import me.golemcore.history.adapter.inbound.web.dto.HistoryResponse;
import me.golemcore.history.domain.model.ConversationDiscovery;
import me.golemcore.history.domain.model.HistoryFilter;
import me.golemcore.history.domain.model.HistoryResult;
import me.golemcore.history.domain.model.HistorySource;
import me.golemcore.history.domain.model.MessageRole;
import me.golemcore.history.domain.model.SessionSummary;
import me.golemcore.history.domain.service.HistoryAggregationService;
import me.golemcore.history.domain.service.SessionDiscoveryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HistoryControllerTest {

    @TempDir
    Path tempDir;

    private HistoryAggregationService aggregationService;
    private SessionDiscoveryService discoveryService;
    private HistoryController controller;

    @BeforeEach
    void setUp() {
        aggregationService = mock(HistoryAggregationService.class);
        discoveryService = mock(SessionDiscoveryService.class);
        controller = new HistoryController(aggregationService, discoveryService);
    }

    @Test
    void shouldReturnHistoryForExistingProject() {
        when(aggregationService.getHistory(eq(tempDir.toAbsolutePath().normalize()), any(HistoryFilter.class)))
                .thenReturn(emptyResult());

        StepVerifier.create(controller.getHistory(HistoryRequest.builder()
                .projectPath(tempDir.toString())
                .build()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    HistoryResponse body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.isSuccess());
                    assertEquals(0, body.getHistory().getTotalMessages());
                })
                .verifyComplete();
    }

    @Test
    void shouldTranslateRequestIntoFilter() {
        when(aggregationService.getHistory(any(Path.class), any(HistoryFilter.class)))
                .thenReturn(emptyResult());

        StepVerifier.create(controller.getHistory(HistoryRequest.builder()
                .projectPath(tempDir.toString())
                .sources(List.of("cursor-transcript", "ANTIGRAVITY_BRAIN"))
                .roles(List.of("assistant"))
                .after("2026-01-01T00:00:00Z")
                .before("1767312000")
                .limit(25)
                .build()))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<HistoryFilter> captor = ArgumentCaptor.forClass(HistoryFilter.class);
        verify(aggregationService).getHistory(any(Path.class), captor.capture());
        HistoryFilter filter = captor.getValue();
        assertEquals(Set.of(HistorySource.CURSOR_TRANSCRIPT, HistorySource.ANTIGRAVITY_BRAIN), filter.getSources());
        assertEquals(Set.of(MessageRole.ASSISTANT), filter.getRoles());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), filter.getAfter());
        assertEquals(Instant.ofEpochSecond(1_767_312_000L), filter.getBefore());
        assertEquals(25, filter.getLimit());
    }

    @Test
    void shouldRejectMissingProjectPath() {
        StepVerifier.create(controller.getHistory(HistoryRequest.builder().projectPath("  ").build()))
                .expectErrorMatches(error -> isStatus(error, HttpStatus.BAD_REQUEST))
                .verify();
        verify(aggregationService, never()).getHistory(any(Path.class), any(HistoryFilter.class));
    }

    @Test
    void shouldReturnNotFoundForUnknownProject() {
        StepVerifier.create(controller.getHistory(HistoryRequest.builder()
                .projectPath(tempDir.resolve("missing").toString())
                .build()))
                .expectErrorMatches(error -> isStatus(error, HttpStatus.NOT_FOUND))
                .verify();
    }

    @Test
    void shouldRejectInvalidFilterValues() {
        StepVerifier.create(controller.getHistory(HistoryRequest.builder()
                .projectPath(tempDir.toString())
                .limit(0)
                .build()))
                .expectErrorMatches(error -> isStatus(error, HttpStatus.BAD_REQUEST))
                .verify();

        StepVerifier.create(controller.getHistory(HistoryRequest.builder()
                .projectPath(tempDir.toString())
                .after("last tuesday")
                .build()))
                .expectErrorMatches(error -> isStatus(error, HttpStatus.BAD_REQUEST))
                .verify();

        StepVerifier.create(controller.getHistory(HistoryRequest.builder()
                .projectPath(tempDir.toString())
                .sources(List.of("clipboard"))
                .build()))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void shouldListConversations() {
        SessionSummary chat = SessionSummary.builder()
                .id("chat")
                .type(SessionSummary.SessionType.CHAT)
                .timestamp(Instant.parse("2026-01-15T10:00:00Z"))
                .messageCount(3)
                .build();
        when(discoveryService.discoverSessions(any(Path.class))).thenReturn(ConversationDiscovery.builder()
                .projectPath(tempDir.toString())
                .conversations(List.of(chat))
                .totalMessages(3)
                .build());

        StepVerifier.create(controller.getConversations(new ConversationsRequest(tempDir.toString())))
                .assertNext(response -> {
                    ConversationsResponse body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.isSuccess());
                    assertEquals(1, body.getConversations().size());
                    assertEquals(3, body.getTotalMessages());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectConversationsForRegularFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("notes.txt"), "x");

        StepVerifier.create(controller.getConversations(new ConversationsRequest(file.toString())))
                .expectErrorMatches(error -> isStatus(error, HttpStatus.BAD_REQUEST))
                .verify();
    }

    private static HistoryResult emptyResult() {
        return HistoryResult.builder()
                .messages(List.of())
                .conversations(List.of())
                .totalMessages(0)
                .sources(List.of())
                .build();
    }

    private static boolean isStatus(Throwable error, HttpStatus status) {
        return error instanceof ResponseStatusException exception
                && exception.getStatusCode().value() == status.value();
    }
}
