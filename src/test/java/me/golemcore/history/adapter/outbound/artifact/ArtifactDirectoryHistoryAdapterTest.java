package me.golemcore.history.adapter.outbound.artifact;

import me.golemcore.history.domain.model.Conversation;
import me.golemcore.history.domain.model.HistoryMessage;
import me.golemcore.history.domain.model.MessageRole;
import me.golemcore.history.domain.model.SourceBatch;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.infrastructure.fs.BudgetedFileWalker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactDirectoryHistoryAdapterTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private Path brainDir;
    private Path annotationsDir;
    private ArtifactDirectoryHistoryAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        brainDir = Files.createDirectories(tempDir.resolve("brain"));
        annotationsDir = Files.createDirectories(tempDir.resolve("annotations"));
        HistoryProperties properties = new HistoryProperties();
        properties.getAntigravity().setBrainDir(brainDir.toString());
        properties.getAntigravity().setAnnotationsDir(annotationsDir.toString());
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        adapter = new ArtifactDirectoryHistoryAdapter(properties, new BudgetedFileWalker(properties, clock), clock);
    }

    @Test
    void shouldTurnArtifactsAndScreenshotsIntoMessages() throws IOException {
        Path conversation = Files.createDirectories(brainDir.resolve("abc"));
        Files.writeString(conversation.resolve("task.md"), "- [x] update `src/app.ts`");
        Files.writeString(conversation.resolve("implementation_plan.md"), "Plan body");
        Files.writeString(conversation.resolve("plan.resolved.md"), "resolved copy");
        Files.writeString(conversation.resolve("task.metadata.md"), "metadata");
        for (int i = 1; i <= 6; i++) {
            Files.writeString(conversation.resolve("shot" + i + ".png"), "png");
        }
        Files.writeString(annotationsDir.resolve("abc.pbtxt"), "last_user_view_time {\n  seconds: 1700000000\n}\n");

        SourceBatch batch = adapter.read(tempDir);

        assertEquals(3, batch.messages().size());
        Map<String, HistoryMessage> byId = batch.messages().stream()
                .collect(Collectors.toMap(HistoryMessage::getId, Function.identity()));
        Instant lastViewed = Instant.ofEpochSecond(1_700_000_000L);

        HistoryMessage plan = byId.get("abc-artifact-implementation_plan");
        assertEquals("[Artifact: implementation_plan]\n\nPlan body", plan.getContent());
        assertEquals(MessageRole.ASSISTANT, plan.getRole());
        assertEquals(lastViewed, plan.getTimestamp());

        HistoryMessage task = byId.get("abc-artifact-task");
        assertTrue(task.getRelatedFiles().contains("/src/app.ts"));

        HistoryMessage screenshots = byId.get("abc-screenshots");
        assertEquals("[Screenshots: 6 images captured]\nshot1.png, shot2.png, shot3.png, shot4.png, shot5.png...",
                screenshots.getContent());
        assertTrue(screenshots.getRelatedFiles().isEmpty());

        Conversation summary = batch.conversations().get(0);
        assertEquals("abc", summary.getId());
        assertEquals("implementation_plan", summary.getTitle());
        assertEquals(3, summary.getMessageCount());
    }

    @Test
    void shouldFallBackToDefaultTitleAndCurrentTime() throws IOException {
        Path conversation = Files.createDirectories(brainDir.resolve("images-only"));
        Files.writeString(conversation.resolve("screen.JPG"), "jpg");
        Files.createDirectories(brainDir.resolve("empty"));
        Path hidden = Files.createDirectories(brainDir.resolve(".tmp"));
        Files.writeString(hidden.resolve("task.md"), "hidden");

        SourceBatch batch = adapter.read(tempDir);

        assertEquals(1, batch.messages().size());
        assertEquals("[Screenshots: 1 images captured]\nscreen.JPG", batch.messages().get(0).getContent());
        assertEquals(NOW, batch.messages().get(0).getTimestamp());
        assertEquals(ArtifactDirectoryHistoryAdapter.DEFAULT_TITLE, batch.conversations().get(0).getTitle());
    }

    @Test
    void shouldTruncateLongArtifacts() throws IOException {
        Path conversation = Files.createDirectories(brainDir.resolve("long"));
        Files.writeString(conversation.resolve("walkthrough.md"), "y".repeat(2000));

        HistoryMessage message = adapter.read(tempDir).messages().get(0);

        assertEquals("[Artifact: walkthrough]\n\n" + "y".repeat(1500) + "...", message.getContent());
    }

    @Test
    void shouldNotApplyWithoutBrainDirectory() throws IOException {
        Files.delete(brainDir);

        assertFalse(adapter.isApplicable(tempDir));
        assertTrue(adapter.read(tempDir).isEmpty());
    }
}
