package com.jobagents.core;

import java.nio.file.Path;

/**
 * Thrown when a durable store (task state file, queue file) cannot be written.
 *
 * <p>Reads never throw this: a missing or corrupt document is treated as empty.
 * Writes do, because silently losing a flush would let an agent re-process work it
 * already handed downstream. Agents catch it at the step boundary and log it.</p>
 *
 * @see com.jobagents.state.TaskState#flush()
 * @see com.jobagents.queue.JsonFileWorkQueue
 */
public class StateStoreException extends RuntimeException {

    private final Path path;

    /**
     * @param message the error message
     * @param path the file that could not be written
     * @param cause the underlying I/O failure
     */
    public StateStoreException(String message, Path path, Throwable cause) {
        super(message + " (" + path + ")", cause);
        this.path = path;
    }

    /**
     * @param message the error message
     */
    public StateStoreException(String message) {
        super(message);
        this.path = null;
    }

    /**
     * @return the file involved, or null if not applicable
     */
    public Path getPath() {
        return path;
    }
}
