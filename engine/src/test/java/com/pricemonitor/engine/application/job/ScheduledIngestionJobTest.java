package com.pricemonitor.engine.application.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

import com.pricemonitor.common.event.AlertRecord;
import com.pricemonitor.engine.application.config.IngestMetrics;
import com.pricemonitor.engine.application.config.MetricsConfig;
import com.pricemonitor.engine.domain.exceptions.StoreUnavailableException;
import com.pricemonitor.engine.domain.history.PriceStatistics;
import com.pricemonitor.engine.domain.history.ProductStats;
import com.pricemonitor.engine.domain.history.StoreTotals;
import com.pricemonitor.engine.domain.ingestion.IngestReport;
import com.pricemonitor.engine.domain.ingestion.IngestionCoordinator;
import com.pricemonitor.engine.domain.ingestion.ProductError;
import com.pricemonitor.engine.infrastructure.batch.BatchFileException;
import com.pricemonitor.engine.infrastructure.batch.BatchInbox;
import com.pricemonitor.engine.infrastructure.batch.JsonBatchFileReader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScheduledIngestionJobTest {

    private static final Path FIRST = Path.of("/inbox/a.json");
    private static final Path SECOND = Path.of("/inbox/b.jsonl");
    private static final Path THIRD = Path.of("/inbox/c.json");

    @Mock
    BatchInbox inbox;

    @Mock
    JsonBatchFileReader reader;

    @Mock
    IngestionCoordinator coordinator;

    @Mock
    PriceStatistics statistics;

    IngestMetrics metrics;
    ScheduledIngestionJob job;

    @BeforeEach
    void setUp() {
        metrics = new MetricsConfig().ingestMetrics(new SimpleMeterRegistry());
        job = new ScheduledIngestionJob(inbox, reader, coordinator, metrics, statistics);
    }

    private static List<Map<String, Object>> records(String url) {
        return List.of(Map.of("url", url, "price", "10.00"));
    }

    private static IngestReport report(int received, int accepted) {
        return IngestReport.builder().received(received).accepted(accepted).build();
    }

    @Test
    void drainInbox_ingestsEachFileAndMarksItProcessed() {
        given(inbox.pending()).willReturn(List.of(FIRST, SECOND));
        given(reader.read(FIRST)).willReturn(records("https://shop.example/p/1"));
        given(reader.read(SECOND)).willReturn(records("https://shop.example/p/2"));
        given(coordinator.ingest(records("https://shop.example/p/1"))).willReturn(report(1, 1));
        given(coordinator.ingest(records("https://shop.example/p/2"))).willReturn(report(1, 0));

        var reports = job.drainInbox();

        assertThat(reports).extracting(IngestReport::accepted).containsExactly(1, 0);
        then(inbox).should().markProcessed(FIRST);
        then(inbox).should().markProcessed(SECOND);
        assertThat(metrics.received().count()).isEqualTo(2.0);
        assertThat(metrics.accepted().count()).isEqualTo(1.0);
    }

    @Test
    void drainInbox_unreadableFile_isMarkedFailedAndOthersContinue() {
        given(inbox.pending()).willReturn(List.of(FIRST, SECOND));
        given(reader.read(FIRST)).willThrow(BatchFileException.malformed(FIRST, "expected an array of records", null));
        given(reader.read(SECOND)).willReturn(records("https://shop.example/p/2"));
        given(coordinator.ingest(records("https://shop.example/p/2"))).willReturn(report(1, 1));

        var reports = job.drainInbox();

        assertThat(reports).hasSize(1);
        then(inbox).should().markFailed(FIRST);
        then(inbox).should().markProcessed(SECOND);
        assertThat(metrics.failedBatches().count()).isEqualTo(1.0);
    }

    @Test
    void drainInbox_storeUnavailable_stopsAndLeavesRemainingFiles() {
        given(inbox.pending()).willReturn(List.of(FIRST, SECOND, THIRD));
        given(reader.read(FIRST)).willReturn(records("https://shop.example/p/1"));
        given(reader.read(SECOND)).willReturn(records("https://shop.example/p/2"));
        given(coordinator.ingest(records("https://shop.example/p/1"))).willReturn(report(1, 1));
        given(coordinator.ingest(records("https://shop.example/p/2")))
                .willThrow(StoreUnavailableException.of("latest", new IllegalStateException("connection refused")));

        var reports = job.drainInbox();

        assertThat(reports).hasSize(1);
        then(inbox).should().markProcessed(FIRST);
        then(inbox).should().markFailed(SECOND);
        then(reader).should(never()).read(THIRD);
        then(inbox).should(never()).markProcessed(THIRD);
    }

    @Test
    void drainInbox_productErrors_countedButFileStillProcessed() {
        var withErrors = IngestReport.builder()
                .received(2)
                .accepted(1)
                .errors(List.of(new ProductError("p2", ProductError.TIMEOUT, "Product p2 exceeded PT30S")))
                .build();
        given(inbox.pending()).willReturn(List.of(FIRST));
        given(reader.read(FIRST)).willReturn(records("https://shop.example/p/1"));
        given(coordinator.ingest(any())).willReturn(withErrors);

        job.drainInbox();

        then(inbox).should().markProcessed(FIRST);
        assertThat(metrics.productErrors().count()).isEqualTo(1.0);
    }

    @Test
    void run_emptyInbox_doesNothing() {
        given(inbox.pending()).willReturn(List.of());

        job.run();

        then(reader).shouldHaveNoInteractions();
        then(coordinator).shouldHaveNoInteractions();
        then(statistics).shouldHaveNoInteractions();
    }

    @Test
    void run_withAlerts_looksUpStatisticsOncePerAlertedProduct() {
        var alert = AlertRecord.builder().ruleId("r1").productId("p1").sequence(2).build();
        var withAlerts = IngestReport.builder()
                .received(2)
                .accepted(2)
                .alertsFired(2)
                .alerts(List.of(alert, alert.toBuilder().ruleId("r2").build()))
                .build();
        given(inbox.pending()).willReturn(List.of(FIRST));
        given(reader.read(FIRST)).willReturn(records("https://shop.example/p/1"));
        given(coordinator.ingest(any())).willReturn(withAlerts);
        given(statistics.forProduct("p1")).willReturn(Optional.of(ProductStats.builder().productId("p1").build()));
        given(statistics.totals()).willReturn(StoreTotals.builder().products(1).build());

        job.run();

        then(statistics).should(times(1)).forProduct("p1");
        then(statistics).should().totals();
    }

    @Test
    void logStatistics_storeDown_doesNotFailTheRun() {
        given(statistics.totals()).willThrow(StoreUnavailableException.of("totals", new IllegalStateException("down")));

        job.logStatistics(List.of(report(1, 1)));

        then(statistics).should().totals();
    }
}
