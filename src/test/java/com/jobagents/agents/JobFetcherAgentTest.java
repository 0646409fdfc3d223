package com.jobagents.agents;

import com.jobagents.core.AgentConfig;
import com.jobagents.core.StepOutcome;
import com.jobagents.model.Candidate;
import com.jobagents.state.TaskState;
import com.jobagents.support.FakeBackend;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JobFetcherAgentTest {

    @TempDir
    Path tempDir;

    private FakeBackend backend;
    private AgentConfig config;

    @BeforeEach
    public void setUp() {
        backend = new FakeBackend();
        config = AgentConfig.inDirectory("job_fetcher", tempDir, Duration.ofHours(1));
    }

    private static Candidate listing(String title, String url) {
        return new Candidate(null, title, "Acme", "New York", "Build and run data pipelines.", url);
    }

    /**
     * The same posting fetched again with a new redirect URL is not submitted twice.
     */
    @Test
    public void testDedupSurvivesUrlChange() {
        backend.listings.add(listing("Data Engineer", "https://adzuna.example/r/1?t=aaa"));
        JobFetcherAgent fetcher = new JobFetcherAgent(config, backend, backend);
        assertEquals(StepOutcome.COMPLETED, fetcher.runOnce());
        assertEquals(1, backend.submitted.size());

        backend.listings.clear();
        backend.listings.add(listing("Data Engineer", "https://adzuna.example/r/1?t=bbb"));

        // New instance: the seen list comes back from the state file
        JobFetcherAgent restarted = new JobFetcherAgent(config, backend, backend);
        restarted.runOnce();
        assertEquals(1, backend.submitted.size());
    }

    @Test
    public void testFailedSubmitIsRetried() {
        backend.listings.add(listing("Data Engineer", "u1"));
        backend.failSubmit = true;

        JobFetcherAgent fetcher = new JobFetcherAgent(config, backend, backend);
        assertEquals(StepOutcome.FAILED, fetcher.step());
        assertEquals(0, fetcher.seenCount());

        backend.failSubmit = false;
        assertEquals(StepOutcome.COMPLETED, fetcher.step());
        assertEquals(1, backend.submitted.size());
        assertTrue(fetcher.hasSeen(backend.listings.get(0)));
    }

    @Test
    public void testBackendDuplicateIsRemembered() {
        backend.listings.add(listing("Data Engineer", "u1"));
        backend.duplicateTitles.add("Data Engineer");

        JobFetcherAgent fetcher = new JobFetcherAgent(config, backend, backend);
        fetcher.step();
        fetcher.step();

        assertEquals(1, backend.submitted.size(), "A duplicate answer still marks the listing as seen");
    }

    @Test
    public void testDescriptionTruncated() {
        String longText = "x".repeat(JobFetcherAgent.MAX_DESCRIPTION_LENGTH + 500);
        backend.listings.add(new Candidate(null, "Data Engineer", "Acme", "NYC", longText, "u"));

        new JobFetcherAgent(config, backend, backend).step();

        assertEquals(JobFetcherAgent.MAX_DESCRIPTION_LENGTH, backend.submitted.get(0).getDescription().length());
    }

    @Test
    public void testSeenListIsCapped() {
        for (int i = 0; i <= JobFetcherAgent.MAX_SEEN; i++) {
            backend.listings.add(listing("Engineer " + i, "u" + i));
        }

        JobFetcherAgent fetcher = new JobFetcherAgent(config, backend, backend);
        fetcher.step();

        assertEquals(JobFetcherAgent.KEEP_SEEN, fetcher.seenCount());
        List<String> persisted = TaskState.load(config.getStatePath()).getStringList(JobFetcherAgent.SEEN);
        assertEquals(JobFetcherAgent.KEEP_SEEN, persisted.size());
        assertTrue(fetcher.hasSeen(backend.listings.get(JobFetcherAgent.MAX_SEEN)), "Newest entries are kept");
        assertFalse(fetcher.hasSeen(backend.listings.get(0)), "Oldest entries are dropped");
    }

    @Test
    public void testNothingFetchedIsSkipped() {
        JobFetcherAgent fetcher = new JobFetcherAgent(config, backend, backend);
        assertEquals(StepOutcome.SKIPPED, fetcher.step());

        backend.failFetch = true;
        assertEquals(StepOutcome.SKIPPED, fetcher.step());
    }
}
