package com.phillippitts.lifecycle.service.coordination;

/**
 * Recovery counters of the error coordinator.
 *
 * @param attempts errors routed through recovery
 * @param successes recoveries that succeeded
 * @param failures recoveries that failed
 * @param recoverySuccessRate successes over attempts, 0 when nothing was attempted
 */
public record RecoveryStats(long attempts, long successes, long failures, double recoverySuccessRate) {

    static RecoveryStats of(long attempts, long successes, long failures) {
        double rate = attempts == 0 ? 0.0 : (double) successes / attempts;
        return new RecoveryStats(attempts, successes, failures, rate);
    }
}
