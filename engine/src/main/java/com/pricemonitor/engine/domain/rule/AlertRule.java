package com.pricemonitor.engine.domain.rule;

import com.pricemonitor.common.event.RuleKind;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * A subscribed alert predicate. Scoped either to one product, or to every product whose
 * {@code category} and/or {@code brand} attribute matches (case-insensitive). A rule with no scope
 * at all applies to every product.
 */
@Builder(toBuilder = true)
public record AlertRule(
        String id,
        RuleKind kind,
        String productId,
        String category,
        String brand,
        BigDecimal parameter,
        boolean active,
        Duration cooldown,
        String recipient) {

    public AlertRule {
        Objects.requireNonNull(id, "Rule id must not be null");
        Objects.requireNonNull(kind, "Rule kind must not be null");
        if (kind != RuleKind.ANOMALY_FLAG && parameter == null) {
            throw new IllegalArgumentException("Rule " + id + " of kind " + kind + " requires a parameter");
        }
        cooldown = cooldown == null ? Duration.ZERO : cooldown;
    }

    public boolean appliesTo(String targetProductId, Map<String, ?> attributes) {
        if (productId != null) {
            return productId.equals(targetProductId);
        }
        return matches(category, attributes.get("category")) && matches(brand, attributes.get("brand"));
    }

    private static boolean matches(String expected, Object actual) {
        return expected == null || (actual != null && expected.equalsIgnoreCase(actual.toString().trim()));
    }
}
