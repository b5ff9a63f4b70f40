package com.pricemonitor.engine.infrastructure.db;

import com.pricemonitor.engine.domain.exceptions.StoreUnavailableException;
import com.pricemonitor.engine.domain.exceptions.TransientStoreException;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Maps Spring's data access exceptions onto the engine's store failure taxonomy. Anything not
 * listed here, including the engine's own exceptions, passes through unchanged.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class StoreExceptionTranslator {

    static <T> T translate(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException e) {
            throw TransientStoreException.of(operation, e);
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw StoreUnavailableException.of(operation, e);
        }
    }
}
