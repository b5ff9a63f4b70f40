package com.pricemonitor.engine.domain.snapshot;

import java.util.List;
import lombok.Builder;

@Builder
public record NormalizerSettings(List<String> trackingParameters, String defaultCurrency) {

    public static NormalizerSettings defaults() {
        return new NormalizerSettings(
                List.of("utm_*", "gclid", "fbclid", "ref", "ref_", "tag", "mc_cid", "mc_eid", "_ga"), "MAD");
    }
}
