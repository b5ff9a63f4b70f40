package com.pricemonitor.engine.infrastructure.db;

import static com.pricemonitor.engine.infrastructure.db.StoreExceptionTranslator.translate;

import com.pricemonitor.common.event.AlertRecord;
import com.pricemonitor.engine.domain.exceptions.InvariantViolationException;
import com.pricemonitor.engine.domain.history.ChangeRecord;
import com.pricemonitor.engine.domain.history.HistoryRecord;
import com.pricemonitor.engine.domain.history.HistoryStore;
import com.pricemonitor.engine.infrastructure.db.mapper.PriceAlertRowMapper;
import com.pricemonitor.engine.infrastructure.db.mapper.PriceChangeRowMapper;
import com.pricemonitor.engine.infrastructure.db.mapper.PriceHistoryRowMapper;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * PostgreSQL-backed history store. Transactions are opened here with {@link TransactionTemplate}
 * rather than {@code @Transactional} so that a failure to obtain a connection is translated like
 * any other store failure. Calls made inside {@link #atomically} join its transaction.
 */
@Slf4j
@Repository
public class HistoryStoreAdapter implements HistoryStore {

    private final PriceHistoryJpaRepository historyRepository;
    private final PriceChangeJpaRepository changeRepository;
    private final PriceAlertJpaRepository alertRepository;
    private final PriceHistoryRowMapper historyMapper;
    private final PriceChangeRowMapper changeMapper;
    private final PriceAlertRowMapper alertMapper;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;

    public HistoryStoreAdapter(
            PriceHistoryJpaRepository historyRepository,
            PriceChangeJpaRepository changeRepository,
            PriceAlertJpaRepository alertRepository,
            PriceHistoryRowMapper historyMapper,
            PriceChangeRowMapper changeMapper,
            PriceAlertRowMapper alertMapper,
            PlatformTransactionManager transactionManager) {
        this.historyRepository = historyRepository;
        this.changeRepository = changeRepository;
        this.alertRepository = alertRepository;
        this.historyMapper = historyMapper;
        this.changeMapper = changeMapper;
        this.alertMapper = alertMapper;
        this.writeTx = new TransactionTemplate(transactionManager);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
    }

    @Override
    public long append(HistoryRecord record) {
        return write("append", () -> {
            try {
                return historyRepository.saveAndFlush(historyMapper.toRow(record)).getSequence();
            } catch (DataIntegrityViolationException e) {
                throw InvariantViolationException.sequenceConflict(record.productId(), record.sequence(), e);
            }
        });
    }

    @Override
    public Optional<HistoryRecord> latest(String productId) {
        return read("latest", () -> historyRepository.findFirstByProductIdOrderBySequenceDesc(productId)
                .map(historyMapper::toDomain));
    }

    @Override
    public List<HistoryRecord> window(String productId, int size) {
        return read("window", () -> historyRepository.findByProductIdOrderBySequenceDesc(productId, Limit.of(size))
                .stream()
                .map(historyMapper::toDomain)
                .toList());
    }

    @Override
    public void appendChange(ChangeRecord change) {
        write("appendChange", () -> changeRepository.save(changeMapper.toRow(change)));
    }

    @Override
    public boolean appendAlert(AlertRecord alert) {
        return write("appendAlert", () -> alertRepository.insertIdempotent(alertMapper.toRow(alert)) > 0);
    }

    @Override
    public Optional<Instant> lastFired(String ruleId, String productId) {
        return read("lastFired", () -> alertRepository.findLastTriggeredAt(ruleId, productId));
    }

    @Override
    public <T> T atomically(Supplier<T> work) {
        return write("atomically", work);
    }

    private <T> T write(String operation, Supplier<T> work) {
        return translate(operation, () -> writeTx.execute(status -> work.get()));
    }

    private <T> T read(String operation, Supplier<T> work) {
        return translate(operation, () -> readTx.execute(status -> work.get()));
    }
}
