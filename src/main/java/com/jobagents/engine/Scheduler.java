package com.jobagents.engine;

import com.jobagents.core.TaskPhase;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Supervises the pipeline's agents: launches each registered task whenever its
 * interval has elapsed and it has work to do.
 *
 * <p><b>Main Loop:</b> every tick (default 5 seconds) all tasks are scanned. A task is</p>
 * <ul>
 *   <li>skipped while a previous launch is still running, so it simply misses ticks</li>
 *   <li>due when it was never launched or {@code now - lastRun >= interval}</li>
 *   <li>launched when due and its {@link ReadinessCheck} passes; a due task that is not
 *       ready goes back to idle and keeps its last launch time, so it is checked again
 *       on the next tick</li>
 * </ul>
 *
 * <p>The launch time is recorded when the task is launched, not when it finishes.</p>
 *
 * <p><b>Crash Isolation:</b> each launch runs on its own thread. Anything the task throws
 * is caught at the launch boundary and logged with the task name; other tasks and the
 * loop itself are unaffected.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Scheduler scheduler = new Scheduler(Duration.ofSeconds(5));
 * scheduler.register(ScheduledTask.forAgent(matcher, Duration.ofSeconds(60), ReadinessCheck.always()));
 *
 * Thread thread = new Thread(scheduler::start, "scheduler");
 * thread.start();
 * ...
 * scheduler.shutdown();
 * }</pre>
 *
 * @see ScheduledTask
 * @see TaskPhase
 */
public class Scheduler {
    private static final Logger logger = Logger.getLogger(Scheduler.class.getName());

    public static final Duration DEFAULT_TICK = Duration.ofSeconds(5);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final Duration tickPeriod;
    private final Clock clock;
    private final Map<String, ScheduledTask> tasks = new LinkedHashMap<>();
    private final ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public Scheduler(Duration tickPeriod) {
        this(tickPeriod, Clock.systemUTC());
    }

    /**
     * @param tickPeriod pause between two scans
     * @param clock time source for due checks
     */
    public Scheduler(Duration tickPeriod, Clock clock) {
        if (tickPeriod.isNegative() || tickPeriod.isZero()) {
            throw new IllegalArgumentException("Tick period must be positive: " + tickPeriod);
        }
        this.tickPeriod = tickPeriod;
        this.clock = clock;
        this.executorService = Executors.newCachedThreadPool(new TaskThreadFactory());
        logger.info("Scheduler initialized with tick " + tickPeriod);
    }

    /**
     * Add a task. Names must be unique.
     *
     * @throws IllegalArgumentException if a task with the same name is registered
     */
    public synchronized void register(ScheduledTask task) {
        if (tasks.containsKey(task.getName())) {
            throw new IllegalArgumentException("Task already registered: " + task.getName());
        }
        tasks.put(task.getName(), task);
        logger.info("Registered task " + task.getName() + " (interval " + task.getInterval() + ")");
    }

    /**
     * Run the scheduling loop until {@link #shutdown()} is called.
     *
     * <p><b>BLOCKING METHOD:</b> call it from a dedicated thread.</p>
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("Scheduler is already running");
            return;
        }
        logger.info("Scheduler started with " + tasks.size() + " tasks");

        while (running.get()) {
            try {
                tick();
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Unexpected error in scheduling loop", e);
            }

            // A failed tick still waits a full period
            try {
                Thread.sleep(tickPeriod.toMillis());
            } catch (InterruptedException e) {
                logger.info("Scheduler interrupted, shutting down gracefully");
                Thread.currentThread().interrupt();
                break;
            }
        }

        logger.info("Scheduler loop exited");
    }

    /**
     * Scan all tasks once and launch the due and ready ones without waiting for them.
     *
     * @return number of tasks launched
     */
    public synchronized int tick() {
        Instant now = clock.instant();
        int launched = 0;

        for (ScheduledTask task : tasks.values()) {
            if (task.getPhase() != TaskPhase.IDLE) {
                logger.fine("Task " + task.getName() + " still running, skipping tick");
                continue;
            }
            if (!task.isDue(now)) {
                continue;
            }
            if (!task.transition(TaskPhase.IDLE, TaskPhase.DUE)) {
                continue;
            }

            if (!checkReady(task)) {
                task.transition(TaskPhase.DUE, TaskPhase.IDLE);
                continue;
            }

            task.transition(TaskPhase.DUE, TaskPhase.RUNNING);
            task.markLaunched(now);
            if (launch(task)) {
                launched++;
            }
        }
        return launched;
    }

    private boolean checkReady(ScheduledTask task) {
        try {
            boolean ready = task.isReady();
            if (!ready) {
                logger.fine("Task " + task.getName() + " is due but not ready");
            }
            return ready;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Readiness check failed for task " + task.getName(), e);
            return false;
        }
    }

    private boolean launch(ScheduledTask task) {
        try {
            executorService.execute(() -> runTask(task));
            logger.info("Launched task " + task.getName());
            return true;
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Could not launch task " + task.getName(), e);
            task.transition(TaskPhase.RUNNING, TaskPhase.IDLE);
            return false;
        }
    }

    // Launch boundary: nothing a task throws gets past here
    private void runTask(ScheduledTask task) {
        try {
            task.getAction().run();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Task " + task.getName() + " crashed", e);
        } finally {
            task.transition(TaskPhase.RUNNING, TaskPhase.IDLE);
        }
    }

    /**
     * Stop the loop and wait for running tasks to finish.
     */
    public void shutdown() {
        running.set(false);
        logger.info("Initiating graceful shutdown...");

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warning("Forcing shutdown of remaining tasks");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Scheduler shutdown complete");
    }

    /**
     * @return current phase per task, in registration order
     */
    public synchronized Map<String, TaskPhase> getPhases() {
        Map<String, TaskPhase> phases = new LinkedHashMap<>();
        for (ScheduledTask task : tasks.values()) {
            phases.put(task.getName(), task.getPhase());
        }
        return phases;
    }

    public synchronized List<ScheduledTask> getTasks() {
        return new ArrayList<>(tasks.values());
    }

    public boolean isRunning() {
        return running.get();
    }

    public Duration getTickPeriod() {
        return tickPeriod;
    }

    private static final class TaskThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "task-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
