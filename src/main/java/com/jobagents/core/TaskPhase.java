package com.jobagents.core;

/**
 * Scheduling phase of a named task inside the {@link com.jobagents.engine.Scheduler}.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>IDLE → DUE: the task's interval has elapsed since its last launch</li>
 *   <li>DUE → RUNNING: the readiness check passed and the step was launched</li>
 *   <li>DUE → IDLE: the task is due but not ready (e.g. its input queue is empty); last launch time is kept</li>
 *   <li>RUNNING → IDLE: the step returned or threw</li>
 * </ul>
 *
 * <p>There is no terminal phase. A task cycles for as long as the scheduler runs.</p>
 *
 * @see #canTransitionTo(TaskPhase)
 */
public enum TaskPhase {
    IDLE("Idle"),
    DUE("Due"),
    RUNNING("Running");

    private final String displayName;

    TaskPhase(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Validate a phase change.
     *
     * <p>RUNNING can only be entered from DUE, which is what guarantees that a task never
     * has two steps in flight: a running task is never re-evaluated as due.</p>
     *
     * @param next the target phase
     * @return true if the transition is legal
     */
    public boolean canTransitionTo(TaskPhase next) {
        return switch (this) {
            case IDLE -> next == DUE;
            case DUE -> next == RUNNING || next == IDLE;
            case RUNNING -> next == IDLE;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
