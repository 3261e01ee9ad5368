package com.phillippitts.lifecycle.domain.status;

import com.phillippitts.lifecycle.domain.EntityKind;

/**
 * Lifecycle of a model (LLM) session held by an agent.
 */
public enum ModelSessionStatus implements StatusType {
    INITIALIZING,
    READY,
    ACTIVE,
    CLEANING_UP,
    CLEANED_UP,
    ERROR,
    TERMINATED;

    @Override
    public EntityKind entityKind() {
        return EntityKind.MODEL_SESSION;
    }
}
