package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.StatusChangeEvent;
import com.phillippitts.lifecycle.domain.TransitionContext;
import com.phillippitts.lifecycle.domain.status.StatusType;

import java.time.Instant;

/**
 * One recorded transition.
 *
 * @param eventId id of the published status change event
 * @param timestamp when the transition completed
 * @param entityKind kind of the entity
 * @param entityId id of the entity
 * @param from previous status
 * @param to new status
 * @param durationMs time from operation start to completion
 * @param error true if the transition moved the entity into its error status or carried an error context
 * @param cpuUsage CPU usage captured with the transition, or -1 when none was captured
 * @param memoryUsage memory usage captured with the transition, or -1 when none was captured
 */
public record StatusHistoryEntry(String eventId,
                                 Instant timestamp,
                                 EntityKind entityKind,
                                 String entityId,
                                 StatusType from,
                                 StatusType to,
                                 long durationMs,
                                 boolean error,
                                 double cpuUsage,
                                 double memoryUsage) {

    static StatusHistoryEntry from(StatusChangeEvent event, TransitionContext context) {
        long durationMs = context.duration() == null ? 0L : Math.max(0L, context.duration().toMillis());
        boolean error = context.errorContext() != null || event.to() == event.entityKind().errorStatus();
        double cpu = context.resourceSnapshot() == null ? -1 : context.resourceSnapshot().cpuUsage();
        double memory = context.resourceSnapshot() == null ? -1 : context.resourceSnapshot().memoryUsage();
        return new StatusHistoryEntry(event.id(), event.timestamp(), event.entityKind(), event.entityId(),
                event.from(), event.to(), durationMs, error, cpu, memory);
    }
}
