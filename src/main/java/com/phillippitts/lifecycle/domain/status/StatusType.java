package com.phillippitts.lifecycle.domain.status;

import com.phillippitts.lifecycle.domain.EntityKind;

/**
 * A status value belonging to exactly one {@link EntityKind}.
 *
 * <p>Implemented by the per-kind status enums. Comparisons use enum identity, so
 * {@code TaskStatus.ERROR} and {@code MessageStatus.ERROR} are distinct statuses.
 */
public interface StatusType {

    String name();

    EntityKind entityKind();
}
