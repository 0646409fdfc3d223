package com.jobagents.core;

/**
 * What a single {@link Agent#step()} invocation reports back to its caller.
 *
 * <p>The outcome decides whether the agent's state is flushed afterwards:</p>
 * <ul>
 *   <li>COMPLETED: the step did its unit of work, state is flushed</li>
 *   <li>FAILED: a collaborator or an item failed, state is still flushed so partial progress survives</li>
 *   <li>SKIPPED: the step returned before touching state (nothing to do), no flush</li>
 * </ul>
 */
public enum StepOutcome {
    COMPLETED("Completed"),
    FAILED("Failed"),
    SKIPPED("Skipped");

    private final String displayName;

    StepOutcome(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return true if the agent should persist its state after this outcome
     */
    public boolean requiresFlush() {
        return this != SKIPPED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
