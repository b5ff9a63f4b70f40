package com.pricemonitor.engine.infrastructure.db;

import static com.pricemonitor.engine.infrastructure.db.StoreExceptionTranslator.translate;

import com.pricemonitor.common.event.ChangeKind;
import com.pricemonitor.common.event.Source;
import com.pricemonitor.engine.domain.history.PriceStatistics;
import com.pricemonitor.engine.domain.history.ProductStats;
import com.pricemonitor.engine.domain.history.StoreTotals;
import com.pricemonitor.engine.infrastructure.db.mapper.PriceHistoryRowMapper;
import java.util.EnumMap;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/** Aggregate queries over the history tables. */
@Repository
public class PriceStatisticsAdapter implements PriceStatistics {

    private final PriceHistoryJpaRepository historyRepository;
    private final PriceChangeJpaRepository changeRepository;
    private final PriceAlertJpaRepository alertRepository;
    private final PriceHistoryRowMapper historyMapper;
    private final TransactionTemplate readTx;

    public PriceStatisticsAdapter(
            PriceHistoryJpaRepository historyRepository,
            PriceChangeJpaRepository changeRepository,
            PriceAlertJpaRepository alertRepository,
            PriceHistoryRowMapper historyMapper,
            PlatformTransactionManager transactionManager) {
        this.historyRepository = historyRepository;
        this.changeRepository = changeRepository;
        this.alertRepository = alertRepository;
        this.historyMapper = historyMapper;
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
    }

    @Override
    public Optional<ProductStats> forProduct(String productId) {
        return read("productStats", () -> {
            var aggregate = historyRepository.aggregateByProductId(productId);
            if (aggregate == null || aggregate.getObservations() == null || aggregate.getObservations() == 0) {
                return Optional.empty();
            }
            return historyRepository.findFirstByProductIdOrderBySequenceDesc(productId)
                    .map(historyMapper::toDomain)
                    .map(latest -> ProductStats.of(
                            aggregate.getObservations(),
                            aggregate.getMinPrice(),
                            aggregate.getMaxPrice(),
                            aggregate.getTotalPrice(),
                            latest));
        });
    }

    @Override
    public StoreTotals totals() {
        return read("totals", () -> {
            var bySource = new EnumMap<Source, Long>(Source.class);
            historyRepository.countProductsBySource()
                    .forEach(view -> bySource.put(view.getSource(), view.getProducts()));
            return StoreTotals.builder()
                    .products(historyRepository.countProducts())
                    .historyRecords(historyRepository.count())
                    .changes(changeRepository.count())
                    .anomalies(changeRepository.countByKind(ChangeKind.ANOMALY))
                    .alerts(alertRepository.count())
                    .productsBySource(bySource)
                    .build();
        });
    }

    private <T> T read(String operation, Supplier<T> work) {
        return translate(operation, () -> readTx.execute(status -> work.get()));
    }
}
