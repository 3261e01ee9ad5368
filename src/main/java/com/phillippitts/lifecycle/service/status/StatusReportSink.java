package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.StatusChangeEvent;

/**
 * External destination for status change reports (log shipping, dashboards).
 *
 * <p>Reporting is best effort: the coordinator logs a failing sink and carries on.
 */
@FunctionalInterface
public interface StatusReportSink {

    void report(StatusChangeEvent event);
}
