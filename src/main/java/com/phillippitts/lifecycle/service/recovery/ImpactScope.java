package com.phillippitts.lifecycle.service.recovery;

public enum ImpactScope {
    ISOLATED,
    COMPONENT,
    SYSTEM
}
