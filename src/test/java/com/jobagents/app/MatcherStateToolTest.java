package com.jobagents.app;

import com.google.gson.JsonObject;
import com.jobagents.core.AgentConfig;
import com.jobagents.matching.MatcherSettings;
import com.jobagents.matching.MatchingEngine;
import com.jobagents.matching.SkipList;
import com.jobagents.queue.JsonFileWorkQueue;
import com.jobagents.queue.WorkQueue;
import com.jobagents.state.TaskState;
import com.jobagents.support.FakeBackend;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MatcherStateToolTest {

    @TempDir
    Path tempDir;

    private Path statePath;

    @BeforeEach
    public void setUp() {
        statePath = tempDir.resolve("state_job_matcher.json");
        TaskState state = TaskState.empty(statePath);
        for (long id = 1; id <= 3; id++) {
            JsonObject entry = new JsonObject();
            entry.addProperty("score", 0.5);
            state.section(MatchingEngine.PROCESSED).add(String.valueOf(id), entry);
        }
        state.section(MatchingEngine.QUEUED).add("1", new JsonObject());
        state.section(MatchingEngine.SKIPPED).add("2", new JsonObject());
        state.put("last_run", "2026-01-01T00:00:00Z");
        state.flush();
    }

    @Test
    public void testPruneRemovesFromEverySection() {
        Map<String, Integer> removed = MatcherStateTool.pruneFile(statePath, List.of(1L, 2L, 99L), false);

        assertEquals(List.of(MatchingEngine.PROCESSED, MatchingEngine.QUEUED, MatchingEngine.SKIPPED),
                List.copyOf(removed.keySet()));
        assertEquals(2, removed.get(MatchingEngine.PROCESSED));
        assertEquals(1, removed.get(MatchingEngine.QUEUED));
        assertEquals(1, removed.get(MatchingEngine.SKIPPED));

        TaskState reloaded = TaskState.load(statePath);
        assertEquals(1, reloaded.section(MatchingEngine.PROCESSED).size());
        assertTrue(reloaded.section(MatchingEngine.PROCESSED).has("3"));
        assertEquals(0, reloaded.section(MatchingEngine.QUEUED).size());
        assertEquals("2026-01-01T00:00:00Z", reloaded.getString("last_run", null), "Other keys are kept");
    }

    @Test
    public void testDryRunLeavesFileUntouched() throws Exception {
        String before = Files.readString(statePath, StandardCharsets.UTF_8);

        Map<String, Integer> removed = MatcherStateTool.pruneFile(statePath, List.of(1L), true);

        assertEquals(1, removed.get(MatchingEngine.PROCESSED));
        assertEquals(before, Files.readString(statePath, StandardCharsets.UTF_8));
    }

    @Test
    public void testMissingSectionsCountZero() {
        Map<String, Integer> removed = MatcherStateTool.prune(TaskState.empty(tempDir.resolve("other.json")),
                List.of(1L));
        assertEquals(0, removed.get(MatchingEngine.PROCESSED));
        assertEquals(0, removed.get(MatchingEngine.SKIPPED));
    }

    @Test
    public void testMissingFileRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> MatcherStateTool.pruneFile(tempDir.resolve("absent.json"), List.of(1L), false));
    }

    /**
     * A pruned candidate is scored again by the next matching step.
     */
    @Test
    public void testPrunedCandidateIsRescored() {
        FakeBackend backend = new FakeBackend();
        backend.withCandidate(FakeBackend.candidate(1, "Data Engineer", "Acme"), 0.9);
        WorkQueue queue = new JsonFileWorkQueue("resume_queue", tempDir.resolve("resume_queue.json"));

        MatcherStateTool.pruneFile(statePath, List.of(1L), false);
        MatchingEngine matcher = new MatchingEngine(
                new AgentConfig("job_matcher", statePath, Duration.ofMinutes(5)),
                backend, backend, queue, SkipList.empty(), MatcherSettings.defaults());
        matcher.runOnce();

        assertEquals(1, backend.scoreCallsFor(1));
        assertEquals(1, queue.size());
    }
}
