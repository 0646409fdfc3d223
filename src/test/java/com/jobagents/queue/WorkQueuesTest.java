package com.jobagents.queue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class WorkQueuesTest {

    @TempDir
    Path tempDir;

    @Test
    public void testOneInstancePerName() {
        WorkQueues queues = new WorkQueues(tempDir);

        WorkQueue first = queues.get(WorkQueues.RESUME_QUEUE);
        WorkQueue second = queues.get(WorkQueues.RESUME_QUEUE);

        assertSame(first, second, "The per-queue lock only works with a single instance");
        assertTrue(Files.exists(tempDir.resolve("resume_queue.json")));
    }

    @Test
    public void testSizes() {
        WorkQueues queues = new WorkQueues(tempDir);
        queues.get(WorkQueues.RESUME_QUEUE).push(WorkItem.of(1, 0.5));
        queues.get(WorkQueues.COVER_LETTER_QUEUE);

        Map<String, Integer> sizes = queues.sizes();
        assertEquals(1, sizes.get(WorkQueues.RESUME_QUEUE));
        assertEquals(0, sizes.get(WorkQueues.COVER_LETTER_QUEUE));
    }
}
