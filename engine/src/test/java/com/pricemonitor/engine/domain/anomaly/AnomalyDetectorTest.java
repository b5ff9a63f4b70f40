package com.pricemonitor.engine.domain.anomaly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import com.pricemonitor.engine.domain.history.HistoryRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnomalyDetectorTest {

    private final AnomalyDetector detector = new AnomalyDetector(AnomalySettings.defaults());

    /** Window in most-recent-first order from prices given oldest first. */
    private static List<HistoryRecord> window(double... oldestFirst) {
        var records = new ArrayList<HistoryRecord>();
        for (int i = oldestFirst.length - 1; i >= 0; i--) {
            records.add(record(i + 1, oldestFirst[i]));
        }
        return records;
    }

    private static HistoryRecord record(long sequence, double price) {
        return HistoryRecord.builder()
                .productId("p1")
                .sequence(sequence)
                .observedAt(Instant.parse("2026-03-01T00:00:00Z").plusSeconds(sequence * 3600))
                .price(BigDecimal.valueOf(price))
                .build();
    }

    @Test
    void check_fewerThanMinimumPoints_neverFlags() {
        var verdict = detector.check(window(100, 100, 100, 100), record(5, 100_000));

        assertThat(verdict.anomalous()).isFalse();
    }

    @Test
    void check_stableWindowAndFarValue_flagsZScore() {
        var verdict = detector.check(window(99, 101, 100, 99, 101, 100, 100), record(8, 500));

        assertThat(verdict.anomalous()).isTrue();
        assertThat(verdict.reason()).isEqualTo(AnomalyVerdict.Reason.Z_SCORE);
        assertThat(verdict.mean()).isCloseTo(100.0, offset(0.001));
        assertThat(verdict.stddev()).isLessThan(1.0);
        assertThat(verdict.score()).isGreaterThan(3.0);
    }

    @Test
    void check_moveBeyondThreeDeviationsOfTightWindow_isFlagged() {
        var verdict = detector.check(window(99, 101, 100, 99, 101, 100), record(7, 92));

        assertThat(verdict.anomalous()).isTrue();
        assertThat(verdict.reason()).isEqualTo(AnomalyVerdict.Reason.Z_SCORE);
        assertThat(verdict.stddev()).isCloseTo(0.8165, offset(0.0001));
        assertThat(verdict.score()).isCloseTo(9.798, offset(0.001));
    }

    @Test
    void check_moveWithinThreeDeviations_isNotFlagged() {
        var verdict = detector.check(window(99, 101, 100, 99, 101, 100), record(7, 101.5));

        assertThat(verdict.anomalous()).isFalse();
        assertThat(verdict).isEqualTo(AnomalyVerdict.none());
    }

    @Test
    void check_relativeDeviationOnlyAppliesToFlatWindow() {
        var wideFloor = new AnomalyDetector(AnomalySettings.defaults().toBuilder().minRelativeDeviation(0.5).build());

        var verdict = wideFloor.check(window(99, 101, 100, 99, 101, 100), record(7, 95));

        assertThat(verdict.anomalous()).isTrue();
    }

    @Test
    void check_flatHistory_toleratesRealisticDiscount() {
        var verdict = detector.check(window(200, 200, 200, 200, 200), record(6, 180));

        assertThat(verdict.anomalous()).isFalse();
    }

    @Test
    void check_tenfoldJump_flagsJumpRegardlessOfSpread() {
        var verdict = detector.check(window(10, 500, 20, 800, 15), record(6, 0.9));

        assertThat(verdict.anomalous()).isTrue();
        assertThat(verdict.reason()).isEqualTo(AnomalyVerdict.Reason.JUMP);
        assertThat(verdict.score()).isGreaterThan(10.0);
    }

    @Test
    void check_dropToZero_isJump() {
        var verdict = detector.check(window(100, 100, 100, 100, 100), record(6, 0));

        assertThat(verdict.anomalous()).isTrue();
        assertThat(verdict.reason()).isEqualTo(AnomalyVerdict.Reason.JUMP);
    }

    @Test
    void check_onlyLastWindowSizePricesCount() {
        var narrow = new AnomalyDetector(AnomalySettings.defaults().toBuilder().windowSize(5).build());
        var prices = new double[] {1000, 1000, 1000, 1000, 1000, 100, 100, 100, 100, 100};

        var verdict = narrow.check(window(prices), record(11, 1000));

        assertThat(verdict.anomalous()).isTrue();
        assertThat(verdict.mean()).isCloseTo(100.0, offset(0.001));
    }

    @Test
    void describe_includesReasonAndStatistics() {
        var verdict = new AnomalyVerdict(true, AnomalyVerdict.Reason.Z_SCORE, 100, 0.8165, 80);

        assertThat(verdict.describe()).isEqualTo("z_score (mean=100.00, stddev=0.82, score=80.00)");
    }

    @Test
    void constructor_rejectsWindowSmallerThanMinimum() {
        assertThatThrownBy(() -> new AnomalyDetector(new AnomalySettings(3, 5, 3.0, 10.0, 0.05)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
