package com.phillippitts.lifecycle.domain.status;

import com.phillippitts.lifecycle.domain.EntityKind;

/**
 * Statuses of a message moving through the conversation store.
 */
public enum MessageStatus implements StatusType {
    INITIAL,
    QUEUED,
    PROCESSING,
    PROCESSED,
    RETRIEVING,
    RETRIEVED,
    CLEARING,
    CLEARED,
    ERROR;

    @Override
    public EntityKind entityKind() {
        return EntityKind.MESSAGE;
    }
}
