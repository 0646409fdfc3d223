package com.jobagents.queue;

import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide registry of named queues.
 *
 * <p>Hands out exactly one {@link WorkQueue} instance per name, so every producer,
 * consumer and scheduler readiness check for a queue goes through the same lock.</p>
 */
public class WorkQueues {
    public static final String RESUME_QUEUE = "resume_queue";
    public static final String COVER_LETTER_QUEUE = "cover_letter_queue";

    private final Path directory;
    private final Map<String, WorkQueue> queues = new ConcurrentHashMap<>();

    /**
     * @param directory where queue files live; each queue is {@code <name>.json}
     */
    public WorkQueues(Path directory) {
        this.directory = directory;
    }

    /**
     * Get or open the queue with the given name.
     */
    public WorkQueue get(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Queue name is required");
        }
        return queues.computeIfAbsent(name, n -> new JsonFileWorkQueue(n, directory.resolve(n + ".json")));
    }

    /**
     * Register an existing queue under its name, e.g. an in-memory or broker-backed one.
     *
     * @throws IllegalStateException if a different queue is already registered under that name
     */
    public void register(WorkQueue queue) {
        WorkQueue existing = queues.putIfAbsent(queue.getName(), queue);
        if (existing != null && existing != queue) {
            throw new IllegalStateException("Queue already registered: " + queue.getName());
        }
    }

    /**
     * @return current depth of every opened queue, by name
     */
    public Map<String, Integer> sizes() {
        Map<String, Integer> sizes = new TreeMap<>();
        queues.forEach((name, queue) -> sizes.put(name, queue.size()));
        return sizes;
    }

    public Path getDirectory() {
        return directory;
    }
}
