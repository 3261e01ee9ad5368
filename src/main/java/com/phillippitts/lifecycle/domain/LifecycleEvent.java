package com.phillippitts.lifecycle.domain;

import java.time.Instant;

/**
 * Anything that can be routed through the event dispatcher.
 */
public interface LifecycleEvent {

    /**
     * Routing key, for example {@code task.status.changed}.
     */
    String type();

    String id();

    Instant timestamp();
}
