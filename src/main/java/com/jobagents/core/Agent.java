package com.jobagents.core;

/**
 * A named long-running worker in the pipeline.
 * Each call to {@link #step()} performs one bounded unit of work and returns.
 */
public interface Agent {

    /**
     * Get the agent's name, used as its task name in the scheduler and in log lines.
     *
     * @return the agent name, e.g. "job_matcher"
     */
    String getName();

    /**
     * Perform one unit of work.
     *
     * <p>Implementations handle collaborator failures themselves and report them as
     * {@link StepOutcome#FAILED}. A step that finds nothing to do returns
     * {@link StepOutcome#SKIPPED} before touching its state.</p>
     *
     * @return what the step did
     */
    StepOutcome step();
}
