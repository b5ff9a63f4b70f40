package com.pricemonitor.engine.domain.snapshot;

public enum DataQuality {
    EXCELLENT,
    GOOD,
    FAIR
}
