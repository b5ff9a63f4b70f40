package com.pricemonitor.engine.domain.rule;

import com.pricemonitor.common.event.AlertRecord;
import com.pricemonitor.common.event.ChangeKind;
import com.pricemonitor.common.id.UlidGenerator;
import com.pricemonitor.engine.domain.history.ChangeRecord;
import com.pricemonitor.engine.domain.snapshot.ProductSnapshot;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides which rules fire for one classified transition. Stateless: the last firing time of each
 * rule for this product is passed in, and the returned alerts are persisted by the caller.
 *
 * <p>The trigger time of an alert is the observation time of the transition, so replaying a batch
 * produces the same alerts and the same cooldown decisions.
 */
@Slf4j
public class AlertRuleEngine {

    /** Width of the persisted alert message. */
    public static final int MAX_MESSAGE_LENGTH = 512;

    static final int MAX_LABEL_LENGTH = 160;

    public List<AlertRecord> evaluate(
            ChangeRecord change,
            ProductSnapshot product,
            Collection<AlertRule> rules,
            Map<String, Instant> lastFired) {

        var triggeredAt = change.observedAt();
        var fired = new ArrayList<AlertRecord>();
        for (var rule : rules) {
            if (!rule.active() || !rule.appliesTo(change.productId(), product.attributes())) {
                continue;
            }
            if (!matches(rule, change)) {
                continue;
            }
            var last = lastFired.get(rule.id());
            if (last != null && Duration.between(last, triggeredAt).compareTo(rule.cooldown()) < 0) {
                log.debug("rule.cooldown: rule_id={}, product_id={}, last_fired={}",
                        rule.id(), change.productId(), last);
                continue;
            }
            fired.add(AlertRecord.builder()
                    .alertId(UlidGenerator.generate(triggeredAt))
                    .ruleId(rule.id())
                    .ruleKind(rule.kind())
                    .productId(change.productId())
                    .sequence(change.toSequence())
                    .changeRecordRef(change.id())
                    .changeKind(change.kind())
                    .triggeredAt(triggeredAt)
                    .message(truncate(message(rule, change, product), MAX_MESSAGE_LENGTH))
                    .priceAtTrigger(change.currentPrice())
                    .currency(product.currency())
                    .recipient(rule.recipient())
                    .build());
        }
        return fired;
    }

    static boolean matches(AlertRule rule, ChangeRecord change) {
        switch (rule.kind()) {
            case THRESHOLD_DROP_PCT:
                return (change.kind() == ChangeKind.PRICE_DROP || change.kind() == ChangeKind.ANOMALY)
                        && change.deltaPct() != null
                        && change.deltaPct().signum() < 0
                        && change.deltaPct().abs().compareTo(rule.parameter()) >= 0;
            case BELOW_ABSOLUTE_PRICE:
                return change.currentPrice().compareTo(rule.parameter()) <= 0;
            case ANOMALY_FLAG:
                return change.kind() == ChangeKind.ANOMALY;
            default:
                throw new IllegalStateException("Unhandled rule kind: " + rule.kind());
        }
    }

    private static String message(AlertRule rule, ChangeRecord change, ProductSnapshot product) {
        var label = label(product);
        var price = change.currentPrice().toPlainString() + " " + product.currency();
        switch (rule.kind()) {
            case THRESHOLD_DROP_PCT:
                var pct = change.deltaPct().abs().multiply(BigDecimal.valueOf(100)).setScale(1, RoundingMode.HALF_UP);
                return "Price of " + label + " dropped " + pct + "% from "
                        + change.previousPrice().toPlainString() + " to " + price;
            case BELOW_ABSOLUTE_PRICE:
                return "Price of " + label + " is " + price + ", at or below " + rule.parameter().toPlainString();
            case ANOMALY_FLAG:
                return "Anomalous price for " + label + ": " + price + " (" + change.anomalyReason() + ")";
            default:
                throw new IllegalStateException("Unhandled rule kind: " + rule.kind());
        }
    }

    private static String label(ProductSnapshot product) {
        var name = product.attribute("name");
        if (name == null) {
            name = product.attribute("product_name");
        }
        return name != null ? truncate(name.toString().strip(), MAX_LABEL_LENGTH) : product.productId();
    }

    static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
