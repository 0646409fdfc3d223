package com.jobagents.state;

import com.google.gson.JsonObject;
import com.google.gson.reflect.TypeToken;
import com.jobagents.core.StateStoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TaskStateTest {

    @TempDir
    Path tempDir;

    @Test
    public void testMissingFileLoadsEmpty() {
        TaskState state = TaskState.load(tempDir.resolve("state_job_matcher.json"));
        assertTrue(state.isEmpty());
    }

    @Test
    public void testCorruptFileLoadsEmpty() throws Exception {
        Path path = tempDir.resolve("state.json");
        Files.writeString(path, "[1, 2, 3", StandardCharsets.UTF_8);
        assertTrue(TaskState.load(path).isEmpty());

        Files.writeString(path, "[1, 2, 3]", StandardCharsets.UTF_8);
        assertTrue(TaskState.load(path).isEmpty(), "A non-object document is not usable state");
    }

    @Test
    public void testFlushAndReload() {
        Path path = tempDir.resolve("nested/dir/state.json");
        TaskState state = TaskState.load(path);
        state.put("cursor", 17L);
        state.put("label", "matcher");
        state.putStringList("seen_job_hashes", List.of("a", "b"));
        JsonObject processed = state.section("processed_jobs");
        processed.addProperty("5", 0.5);
        state.flush();

        TaskState reloaded = TaskState.load(path);
        assertEquals(17L, reloaded.getLong("cursor", -1));
        assertEquals("matcher", reloaded.getString("label", null));
        assertEquals(List.of("a", "b"), reloaded.getStringList("seen_job_hashes"));
        assertEquals(0.5, reloaded.section("processed_jobs").get("5").getAsDouble(), 1e-9);
    }

    @Test
    public void testTypedGet() {
        TaskState state = TaskState.empty(tempDir.resolve("state.json"));
        state.put("limits", Map.of("max", 3));

        Map<String, Integer> limits = state.get("limits", new TypeToken<Map<String, Integer>>() {}.getType());
        assertEquals(3, limits.get("max"));
        assertNull(state.get("missing", String.class));
        assertNull(state.get("limits", Integer.class), "Wrong shape reads as null");
    }

    @Test
    public void testPutNullRemoves() {
        TaskState state = TaskState.empty(tempDir.resolve("state.json"));
        state.put("key", "value");
        state.put("key", null);
        assertFalse(state.contains("key"));
    }

    @Test
    public void testSectionReplacesNonObject() {
        TaskState state = TaskState.empty(tempDir.resolve("state.json"));
        state.put("processed_jobs", "broken");

        JsonObject section = state.section("processed_jobs");
        section.addProperty("1", true);
        assertTrue(state.snapshot().getAsJsonObject("processed_jobs").has("1"));
    }

    @Test
    public void testSnapshotIsDetached() {
        TaskState state = TaskState.empty(tempDir.resolve("state.json"));
        state.put("a", 1);
        state.snapshot().addProperty("b", 2);
        assertFalse(state.contains("b"));
    }

    @Test
    public void testFlushFailureThrows() throws Exception {
        Path blocker = tempDir.resolve("not-a-directory");
        Files.writeString(blocker, "file", StandardCharsets.UTF_8);

        TaskState state = TaskState.empty(blocker.resolve("state.json"));
        state.put("a", 1);
        assertThrows(StateStoreException.class, state::flush);
    }
}
