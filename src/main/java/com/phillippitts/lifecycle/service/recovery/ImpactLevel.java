package com.phillippitts.lifecycle.service.recovery;

/**
 * Severity bucket shared by error trends and impact assessments.
 */
public enum ImpactLevel {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Level of an error trend: HIGH above 10 errors/min or more than 3 affected components,
     * MEDIUM above 5 errors/min or more than 1 component.
     */
    public static ImpactLevel ofTrend(double frequencyPerMinute, int affectedComponents) {
        if (frequencyPerMinute > 10 || affectedComponents > 3) {
            return HIGH;
        }
        if (frequencyPerMinute > 5 || affectedComponents > 1) {
            return MEDIUM;
        }
        return LOW;
    }
}
