package com.phillippitts.lifecycle.domain.status;

import com.phillippitts.lifecycle.domain.EntityKind;

/**
 * Task statuses.
 */
public enum TaskStatus implements StatusType {
    PENDING,
    TODO,
    DOING,
    BLOCKED,
    REVISE,
    DONE,
    ERROR,
    AWAITING_VALIDATION,
    VALIDATED;

    @Override
    public EntityKind entityKind() {
        return EntityKind.TASK;
    }
}
