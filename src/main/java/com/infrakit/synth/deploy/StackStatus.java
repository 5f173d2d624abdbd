package com.infrakit.synth.deploy;

/**
 * Lifecycle states reported for a deployed stack.
 */
public enum StackStatus {
    CREATE_IN_PROGRESS,
    CREATE_COMPLETE,
    CREATE_FAILED,
    ROLLBACK_IN_PROGRESS,
    ROLLBACK_COMPLETE,
    ROLLBACK_FAILED,
    UPDATE_IN_PROGRESS,
    UPDATE_COMPLETE_CLEANUP_IN_PROGRESS,
    UPDATE_COMPLETE,
    UPDATE_FAILED,
    UPDATE_ROLLBACK_IN_PROGRESS,
    UPDATE_ROLLBACK_COMPLETE_CLEANUP_IN_PROGRESS,
    UPDATE_ROLLBACK_COMPLETE,
    UPDATE_ROLLBACK_FAILED,
    DELETE_IN_PROGRESS,
    DELETE_COMPLETE,
    DELETE_FAILED,
    REVIEW_IN_PROGRESS;

    public enum Outcome {
        IN_PROGRESS,
        SUCCEEDED,
        FAILED
    }

    /**
     * How this status reads while waiting for a create or update to finish. A rollback
     * counts as failure even before it completes.
     */
    public Outcome deployOutcome() {
        return switch (this) {
            case CREATE_IN_PROGRESS, UPDATE_IN_PROGRESS, REVIEW_IN_PROGRESS -> Outcome.IN_PROGRESS;
            case CREATE_COMPLETE, UPDATE_COMPLETE, UPDATE_COMPLETE_CLEANUP_IN_PROGRESS -> Outcome.SUCCEEDED;
            default -> Outcome.FAILED;
        };
    }

    /**
     * How this status reads while waiting for a deletion to finish.
     */
    public Outcome destroyOutcome() {
        return switch (this) {
            case DELETE_IN_PROGRESS -> Outcome.IN_PROGRESS;
            case DELETE_COMPLETE -> Outcome.SUCCEEDED;
            default -> Outcome.FAILED;
        };
    }
}
