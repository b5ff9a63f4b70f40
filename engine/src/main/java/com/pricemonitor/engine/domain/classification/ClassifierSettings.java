package com.pricemonitor.engine.domain.classification;

import java.math.BigDecimal;
import lombok.Builder;

@Builder(toBuilder = true)
public record ClassifierSettings(BigDecimal epsilon, BigDecimal mediumSignificance, BigDecimal highSignificance) {

    public static ClassifierSettings defaults() {
        return new ClassifierSettings(new BigDecimal("0.001"), new BigDecimal("0.05"), new BigDecimal("0.20"));
    }
}
