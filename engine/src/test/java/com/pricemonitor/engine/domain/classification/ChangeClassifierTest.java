package com.pricemonitor.engine.domain.classification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pricemonitor.common.event.ChangeKind;
import com.pricemonitor.common.event.Significance;
import com.pricemonitor.engine.domain.exceptions.InvariantViolationException;
import com.pricemonitor.engine.domain.history.HistoryRecord;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ChangeClassifierTest {

    private static final Instant T0 = Instant.parse("2026-03-01T06:00:00Z");

    private final ChangeClassifier classifier = new ChangeClassifier(ClassifierSettings.defaults());

    private HistoryRecord record(long sequence, String price) {
        return HistoryRecord.builder()
                .productId("p1")
                .sequence(sequence)
                .observedAt(T0.plusSeconds(sequence * 3600))
                .price(new BigDecimal(price))
                .currency("MAD")
                .build();
    }

    @Test
    void classify_noPrevious_isFirstSeen() {
        var change = classifier.classify(null, record(1, "50")).orElseThrow();

        assertThat(change.kind()).isEqualTo(ChangeKind.FIRST_SEEN);
        assertThat(change.fromSequence()).isNull();
        assertThat(change.toSequence()).isEqualTo(1);
        assertThat(change.deltaAbs()).isNull();
        assertThat(change.deltaPct()).isNull();
        assertThat(change.id()).hasSize(26);
    }

    @Test
    void classify_tenPercentDrop_isPriceDrop() {
        var change = classifier.classify(record(1, "100"), record(2, "90")).orElseThrow();

        assertThat(change.kind()).isEqualTo(ChangeKind.PRICE_DROP);
        assertThat(change.deltaAbs()).isEqualByComparingTo("-10");
        assertThat(change.deltaPct()).isEqualByComparingTo("-0.10");
        assertThat(change.fromSequence()).isEqualTo(1L);
        assertThat(change.toSequence()).isEqualTo(2);
        assertThat(change.significance()).isEqualTo(Significance.MEDIUM);
        assertThat(change.isDecrease()).isTrue();
    }

    @Test
    void classify_fivePercentRise_isPriceRise() {
        var change = classifier.classify(record(1, "100"), record(2, "105")).orElseThrow();

        assertThat(change.kind()).isEqualTo(ChangeKind.PRICE_RISE);
        assertThat(change.deltaPct()).isEqualByComparingTo("0.05");
        assertThat(change.significance()).isEqualTo(Significance.LOW);
    }

    @Test
    void classify_samePrice_isUnchanged() {
        assertThat(classifier.classify(record(1, "100"), record(2, "100.00"))).isEmpty();
    }

    @Test
    void classify_moveBelowEpsilon_isUnchanged() {
        assertThat(classifier.classify(record(1, "1000"), record(2, "1000.50"))).isEmpty();
        assertThat(classifier.classify(record(1, "1000"), record(2, "999.50"))).isEmpty();
    }

    @Test
    void classify_moveExactlyAtEpsilon_isClassified() {
        assertThat(classifier.classify(record(1, "1000"), record(2, "999")))
                .hasValueSatisfying(change -> assertThat(change.kind()).isEqualTo(ChangeKind.PRICE_DROP));
    }

    @Test
    void classify_zeroEpsilon_stillTreatsExactTieAsUnchanged() {
        var strict = new ChangeClassifier(ClassifierSettings.defaults().toBuilder().epsilon(BigDecimal.ZERO).build());

        assertThat(strict.classify(record(1, "100"), record(2, "100"))).isEmpty();
    }

    @Test
    void classify_riseFromZero_isLowConfidenceRiseWithoutPercentage() {
        var change = classifier.classify(record(1, "0"), record(2, "25")).orElseThrow();

        assertThat(change.kind()).isEqualTo(ChangeKind.PRICE_RISE);
        assertThat(change.deltaPct()).isNull();
        assertThat(change.deltaAbs()).isEqualByComparingTo("25");
        assertThat(change.lowConfidence()).isTrue();
    }

    @Test
    void classify_zeroToZero_isUnchanged() {
        assertThat(classifier.classify(record(1, "0"), record(2, "0"))).isEmpty();
    }

    @Test
    void classify_significance_followsBands() {
        var change = classifier.classify(record(1, "50"), record(2, "40")).orElseThrow();

        assertThat(change.deltaPct()).isEqualByComparingTo("-0.20");
        assertThat(change.significance()).isEqualTo(Significance.MEDIUM);
        assertThat(classifier.classify(record(1, "50"), record(2, "30")).orElseThrow().significance())
                .isEqualTo(Significance.HIGH);
    }

    @Test
    void classify_negativePrice_isInvariantViolation() {
        assertThatThrownBy(() -> classifier.classify(record(1, "10"), record(2, "-1")))
                .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void classify_sequenceNotIncreasing_isInvariantViolation() {
        assertThatThrownBy(() -> classifier.classify(record(2, "10"), record(2, "12")))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("went from 2 to 2");
    }
}
