package com.jobagents.engine;

import com.jobagents.queue.WorkQueue;

/**
 * Extra condition a due task must meet before the scheduler launches it.
 */
@FunctionalInterface
public interface ReadinessCheck {

    /**
     * @return true if the task has work to do right now
     */
    boolean isReady();

    static ReadinessCheck always() {
        return () -> true;
    }

    /**
     * Ready while the queue holds at least one item.
     */
    static ReadinessCheck queueNotEmpty(WorkQueue queue) {
        return () -> queue.size() > 0;
    }
}
