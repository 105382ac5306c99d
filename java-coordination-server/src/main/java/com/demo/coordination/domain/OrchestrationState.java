package com.demo.coordination.domain;

/**
 * Lifecycle of one orchestration run.
 *
 * <pre>
 * INITIALIZING ──► STREAMING ──► COMPLETING ──► COMPLETE
 *      │               │              │
 *      └───────────────┴──────────────┴──────► FAILED
 * </pre>
 *
 * COMPLETE and FAILED are terminal. COMPLETING only exists in memory; the
 * persisted {@link StreamingRun.RunState} jumps straight to COMPLETE.
 */
public enum OrchestrationState {

    INITIALIZING,

    STREAMING,

    COMPLETING,

    COMPLETE,

    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    public boolean canTransitionTo(OrchestrationState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        switch (this) {
            case INITIALIZING:
                return next == STREAMING;
            case STREAMING:
                return next == COMPLETING;
            case COMPLETING:
                return next == COMPLETE;
            default:
                return false;
        }
    }
}
