package com.phillippitts.lifecycle.service.recovery;

import java.time.Duration;

/**
 * Assessed impact of one error kind, refreshed on every occurrence.
 *
 * @param severity severity bucket
 * @param scope how far the impact reaches
 * @param cpuImpact CPU usage in percent when assessed
 * @param memoryImpact memory usage in percent when assessed
 * @param estimatedRecoveryTime rough time to recover (5 min high, 1 min medium, 5 s low)
 */
public record ErrorImpact(ImpactLevel severity,
                          ImpactScope scope,
                          double cpuImpact,
                          double memoryImpact,
                          Duration estimatedRecoveryTime) {

    static ErrorImpact assess(double frequencyPerMinute, double cpuUsage, double memoryUsage) {
        if (frequencyPerMinute > 10 || cpuUsage > 80) {
            return new ErrorImpact(ImpactLevel.HIGH, ImpactScope.SYSTEM, cpuUsage, memoryUsage,
                    Duration.ofMinutes(5));
        }
        if (frequencyPerMinute > 5 || cpuUsage > 50) {
            return new ErrorImpact(ImpactLevel.MEDIUM, ImpactScope.COMPONENT, cpuUsage, memoryUsage,
                    Duration.ofMinutes(1));
        }
        return new ErrorImpact(ImpactLevel.LOW, ImpactScope.ISOLATED, cpuUsage, memoryUsage,
                Duration.ofSeconds(5));
    }
}
