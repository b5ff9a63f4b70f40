package com.pricemonitor.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ChangeKind {
    @JsonProperty("first_seen")
    FIRST_SEEN,
    @JsonProperty("price_drop")
    PRICE_DROP,
    @JsonProperty("price_rise")
    PRICE_RISE,
    @JsonProperty("anomaly")
    ANOMALY
}
