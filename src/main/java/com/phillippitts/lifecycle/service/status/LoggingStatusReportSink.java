package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.StatusChangeEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Report sink writing one structured line per status change to a dedicated logger.
 *
 * <p>Route the {@code lifecycle.status.report} logger to its own appender to ship reports.
 */
public class LoggingStatusReportSink implements StatusReportSink {

    static final String LOGGER_NAME = "lifecycle.status.report";
    private static final Logger REPORT = LogManager.getLogger(LOGGER_NAME);

    @Override
    public void report(StatusChangeEvent event) {
        REPORT.info("status.changed kind={} entityId={} from={} to={} eventId={} at={}",
                event.entityKind().key(), event.entityId(), event.from(), event.to(),
                event.id(), event.timestamp());
    }
}
