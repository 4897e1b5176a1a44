package com.unwind.backend.modules.database.infrastructure;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

import javax.sql.DataSource;

import com.unwind.backend.global.config.DatabaseProperties;
import com.unwind.backend.modules.database.domain.PoolStatsSnapshot;

/**
 * Opens and closes the pooled {@link DataSource} behind the query executor.
 */
public interface ConnectionPoolFactory {

    DataSource open(DatabaseProperties properties);

    default void close(DataSource dataSource) {
        if (dataSource instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to close database pool", ex);
            }
        }
    }

    default Optional<PoolStatsSnapshot> stats(DataSource dataSource) {
        return Optional.empty();
    }
}
