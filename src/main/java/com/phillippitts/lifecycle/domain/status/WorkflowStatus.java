package com.phillippitts.lifecycle.domain.status;

import com.phillippitts.lifecycle.domain.EntityKind;

/**
 * Workflow (team run) statuses.
 */
public enum WorkflowStatus implements StatusType {
    INITIAL,
    CREATED,
    INITIALIZED,
    RUNNING,
    PAUSED,
    STOPPING,
    STOPPED,
    BLOCKED,
    COMPLETED,
    FINISHED,
    FAILED,
    ERRORED,
    CANCELLED;

    @Override
    public EntityKind entityKind() {
        return EntityKind.WORKFLOW;
    }
}
