package com.jobagents.engine;

import com.jobagents.core.BaseAgent;
import com.jobagents.core.TaskPhase;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A named unit of work the {@link Scheduler} launches periodically.
 *
 * <p>The phase moves IDLE → DUE → RUNNING → IDLE and every change is validated with
 * {@link TaskPhase#canTransitionTo(TaskPhase)}. The phase is changed by the scheduler
 * thread and, when a launch finishes, by the task's own thread, so it is held in an
 * {@link AtomicReference} and changed with compare-and-set.</p>
 */
public class ScheduledTask {

    private final String name;
    private final Duration interval;
    private final ReadinessCheck readiness;
    private final Runnable action;

    private final AtomicReference<TaskPhase> phase = new AtomicReference<>(TaskPhase.IDLE);
    private final AtomicInteger launchCount = new AtomicInteger();
    private volatile Instant lastRun;

    /**
     * @param name task name, used in log lines and thread names
     * @param interval minimum time between two launches
     * @param readiness gate checked when the task is due
     * @param action the work; exceptions are caught and logged by the scheduler
     */
    public ScheduledTask(String name, Duration interval, ReadinessCheck readiness, Runnable action) {
        this.name = Objects.requireNonNull(name, "name");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.readiness = readiness == null ? ReadinessCheck.always() : readiness;
        this.action = Objects.requireNonNull(action, "action");
    }

    /**
     * Schedule one step of an agent per launch.
     */
    public static ScheduledTask forAgent(BaseAgent agent, Duration interval, ReadinessCheck readiness) {
        return new ScheduledTask(agent.getName(), interval, readiness, agent::runOnce);
    }

    /**
     * @return true if never launched or the interval has elapsed since the last launch
     */
    boolean isDue(Instant now) {
        Instant last = lastRun;
        return last == null || Duration.between(last, now).compareTo(interval) >= 0;
    }

    boolean isReady() {
        return readiness.isReady();
    }

    /**
     * Move to the next phase if the current one allows it.
     *
     * @return false if the task was not in {@code from} or the change is illegal
     */
    boolean transition(TaskPhase from, TaskPhase to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal phase change " + from + " -> " + to + " for " + name);
        }
        return phase.compareAndSet(from, to);
    }

    void markLaunched(Instant now) {
        lastRun = now;
        launchCount.incrementAndGet();
    }

    Runnable getAction() {
        return action;
    }

    public String getName() {
        return name;
    }

    public Duration getInterval() {
        return interval;
    }

    public TaskPhase getPhase() {
        return phase.get();
    }

    /**
     * @return time of the last launch, null if never launched
     */
    public Instant getLastRun() {
        return lastRun;
    }

    public int getLaunchCount() {
        return launchCount.get();
    }

    @Override
    public String toString() {
        return "ScheduledTask{name=" + name + ", interval=" + interval + ", phase=" + phase.get()
                + ", lastRun=" + lastRun + "}";
    }
}
