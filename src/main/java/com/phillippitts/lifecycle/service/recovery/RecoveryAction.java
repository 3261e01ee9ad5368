package com.phillippitts.lifecycle.service.recovery;

import com.phillippitts.lifecycle.exception.LifecycleException;

/**
 * Operation run by the recovery engine: the retried operation, or the configured fallback.
 */
@FunctionalInterface
public interface RecoveryAction {

    /**
     * @param error the error being recovered from
     * @throws Exception if this attempt failed
     */
    void recover(LifecycleException error) throws Exception;
}
