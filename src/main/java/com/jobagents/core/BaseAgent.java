package com.jobagents.core;

import com.jobagents.state.TaskState;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Abstract base class for agents providing the step/persist/sleep lifecycle.
 *
 * <p>This class handles:</p>
 * <ul>
 *   <li>Loading the agent's {@link TaskState} once, at construction</li>
 *   <li>Running one step and flushing the state afterwards ({@link #runOnce()})</li>
 *   <li>The standalone loop: step, persist, sleep, until {@link #stop()} ({@link #run()})</li>
 * </ul>
 *
 * <p><b>Error Handling:</b> an exception escaping {@link #step()} is logged and reported
 * as {@link StepOutcome#FAILED}; it never leaves {@link #runOnce()}. The state is not
 * flushed after such a step because it may be half-updated. A state file that cannot be
 * written is logged as well and retried on the next step.</p>
 *
 * <p><b>Thread Safety:</b> one agent instance runs at most one step at a time. The
 * scheduler guarantees this for scheduled agents; {@link #run()} is sequential.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * public class MyAgent extends BaseAgent {
 *     public StepOutcome step() {
 *         if (nothingToDo()) {
 *             return StepOutcome.SKIPPED;
 *         }
 *         getState().section("done").addProperty(id, true);
 *         return StepOutcome.COMPLETED;
 *     }
 * }
 * }</pre>
 *
 * @see Agent
 * @see TaskState
 */
public abstract class BaseAgent implements Agent, Runnable {
    private static final Logger logger = Logger.getLogger(BaseAgent.class.getName());

    private final AgentConfig config;
    private final TaskState state;
    private final AtomicBoolean running = new AtomicBoolean(false);

    protected BaseAgent(AgentConfig config) {
        this.config = config;
        this.state = TaskState.load(config.getStatePath());
        logger.info("Agent " + config.getName() + " loaded state from " + config.getStatePath());
    }

    @Override
    public String getName() {
        return config.getName();
    }

    public AgentConfig getConfig() {
        return config;
    }

    protected TaskState getState() {
        return state;
    }

    /**
     * Run a single step and persist the state if the step asks for it.
     *
     * @return the step's outcome, FAILED if it threw
     */
    public StepOutcome runOnce() {
        StepOutcome outcome;
        try {
            outcome = step();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Agent " + getName() + " step failed", e);
            return StepOutcome.FAILED;
        }

        if (outcome == null) {
            logger.warning("Agent " + getName() + " returned no outcome, treating as completed");
            outcome = StepOutcome.COMPLETED;
        }

        if (outcome.requiresFlush()) {
            try {
                state.flush();
            } catch (StateStoreException e) {
                logger.log(Level.SEVERE, "Agent " + getName() + " could not persist its state", e);
            }
        }
        return outcome;
    }

    /**
     * Loop step, persist, sleep until {@link #stop()} is called or the thread is interrupted.
     *
     * <p><b>BLOCKING METHOD:</b> call it from a dedicated thread.</p>
     */
    @Override
    public void run() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("Agent " + getName() + " is already running");
            return;
        }
        logger.info("Agent " + getName() + " started, interval " + config.getInterval());

        while (running.get()) {
            StepOutcome outcome = runOnce();
            logger.fine("Agent " + getName() + " step finished: " + outcome);

            try {
                Thread.sleep(config.getInterval().toMillis());
            } catch (InterruptedException e) {
                logger.info("Agent " + getName() + " interrupted, stopping");
                Thread.currentThread().interrupt();
                break;
            }
        }

        running.set(false);
        logger.info("Agent " + getName() + " stopped");
    }

    /**
     * Ask {@link #run()} to exit after the current step.
     */
    public void stop() {
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }
}
