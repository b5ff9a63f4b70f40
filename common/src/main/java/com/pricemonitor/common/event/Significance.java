package com.pricemonitor.common.event;

/**
 * Coarse size of a price movement, used for reporting and alert wording.
 */
public enum Significance {
    LOW,
    MEDIUM,
    HIGH
}
