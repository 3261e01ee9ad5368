package com.phillippitts.lifecycle.service.recovery;

import java.time.Duration;

/**
 * Waits between retry attempts. Replaced in tests to observe backoff without sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
