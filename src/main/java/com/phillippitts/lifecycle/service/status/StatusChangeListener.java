package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.StatusChangeEvent;

/**
 * Single synchronous change hook, invoked last on every successful transition.
 */
@FunctionalInterface
public interface StatusChangeListener {

    StatusChangeListener NO_OP = event -> { };

    void onStatusChange(StatusChangeEvent event);
}
