package com.pricemonitor.engine.domain.anomaly;

import java.util.Locale;

public record AnomalyVerdict(boolean anomalous, Reason reason, double mean, double stddev, double score) {

    public enum Reason {
        Z_SCORE,
        JUMP
    }

    private static final AnomalyVerdict NONE = new AnomalyVerdict(false, null, 0, 0, 0);

    public static AnomalyVerdict none() {
        return NONE;
    }

    public String describe() {
        if (!anomalous) {
            return "none";
        }
        return String.format(Locale.ROOT, "%s (mean=%.2f, stddev=%.2f, score=%.2f)",
                reason.name().toLowerCase(Locale.ROOT), mean, stddev, score);
    }
}
