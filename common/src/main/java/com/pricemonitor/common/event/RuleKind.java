package com.pricemonitor.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RuleKind {
    @JsonProperty("threshold_drop_pct")
    THRESHOLD_DROP_PCT,
    @JsonProperty("below_absolute_price")
    BELOW_ABSOLUTE_PRICE,
    @JsonProperty("anomaly_flag")
    ANOMALY_FLAG
}
