package com.nanik.agentbridge.execution;

/**
 * Lifecycle of one agent process.
 *
 * <pre>
 * SPAWNED -> WRITING_INPUT -> AWAITING_OUTPUT -> COMPLETED
 *                          |                  -> TIMED_OUT -> KILLED
 *                          +-----------------------> TIMED_OUT
 * </pre>
 * The deadline can expire while the input is still being written, when the
 * agent does not read its stdin.
 * A process can be force killed from any non-final state. TIMED_OUT is final
 * when graceful termination was enough.
 */
public enum ProcessState {
    SPAWNED,
    WRITING_INPUT,
    AWAITING_OUTPUT,
    COMPLETED,
    TIMED_OUT,
    KILLED;

    /**
     * Whether the process is known to have stopped running.
     */
    public boolean isFinished() {
        return this == COMPLETED || this == TIMED_OUT || this == KILLED;
    }

    /**
     * Whether moving from this state to {@code next} is legal.
     */
    public boolean canTransitionTo(ProcessState next) {
        switch (this) {
            case SPAWNED:
                return next == WRITING_INPUT || next == KILLED;
            case WRITING_INPUT:
                return next == AWAITING_OUTPUT || next == TIMED_OUT || next == KILLED;
            case AWAITING_OUTPUT:
                return next == COMPLETED || next == TIMED_OUT || next == KILLED;
            case TIMED_OUT:
                return next == KILLED;
            default:
                return false;
        }
    }
}
