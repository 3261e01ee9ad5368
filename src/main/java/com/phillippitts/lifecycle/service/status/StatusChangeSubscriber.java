package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.StatusChangeEvent;

/**
 * Callback notified after a transition of the entity kind it subscribed to.
 *
 * <p>Subscribers of one kind run concurrently. A subscriber that throws makes the
 * transition report failure, although the event has already been published.
 */
@FunctionalInterface
public interface StatusChangeSubscriber {

    void onStatusChange(StatusChangeEvent event);
}
