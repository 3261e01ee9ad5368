package com.phillippitts.lifecycle.domain.status;

import com.phillippitts.lifecycle.domain.EntityKind;

public enum FeedbackStatus implements StatusType {
    PENDING,
    PROCESSED,
    ERROR;

    @Override
    public EntityKind entityKind() {
        return EntityKind.FEEDBACK;
    }
}
