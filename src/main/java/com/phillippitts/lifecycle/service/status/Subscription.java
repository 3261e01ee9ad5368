package com.phillippitts.lifecycle.service.status;

/**
 * Handle returned by {@link StatusCoordinator#subscribe}. Unsubscribing more than once is a no-op.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
