package com.pricemonitor.engine.domain.rule;

import java.util.List;

/**
 * Supplies the rules that may apply to a product. Read once per product per batch.
 */
public interface RuleSource {

    List<AlertRule> rulesFor(String productId);
}
