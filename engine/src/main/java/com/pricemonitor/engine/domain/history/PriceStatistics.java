package com.pricemonitor.engine.domain.history;

import java.util.Optional;

/** Read-only aggregates over the stored history. */
public interface PriceStatistics {

    /** Empty when nothing has been recorded for the product. */
    Optional<ProductStats> forProduct(String productId);

    StoreTotals totals();
}
