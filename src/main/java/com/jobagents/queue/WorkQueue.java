package com.jobagents.queue;

/**
 * Ordered hand-off channel between two pipeline stages.
 *
 * <p>Implementations are strict FIFO, safe to call from any number of threads and
 * durable: once {@link #push(WorkItem)} returns, the item survives a process restart.
 * Delivery is at most once. An item returned by {@link #pop()} is gone from the queue,
 * so a consumer that crashes before finishing it loses it.</p>
 *
 * <p>Queues impose no dedup, priority or size bound. Producers decide what to push.</p>
 */
public interface WorkQueue {

    /**
     * @return the queue name, used in logs and scheduler readiness checks
     */
    String getName();

    /**
     * Append an item at the tail.
     */
    void push(WorkItem item);

    /**
     * Remove and return the head (oldest) item.
     *
     * @return the head item, or null if the queue is empty
     */
    WorkItem pop();

    /**
     * Return the head item without removing it.
     *
     * @return the head item, or null if the queue is empty
     */
    WorkItem peek();

    int size();

    /**
     * Remove every item.
     */
    void clear();
}
