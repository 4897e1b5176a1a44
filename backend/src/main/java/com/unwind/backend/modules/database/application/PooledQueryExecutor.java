package com.unwind.backend.modules.database.application;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.RowMapper;

import com.unwind.backend.global.config.DatabaseProperties;
import com.unwind.backend.global.error.QueryExecutionException;
import com.unwind.backend.modules.auth.application.VerifiedIdentity;
import com.unwind.backend.modules.database.domain.ExecutionStatus;
import com.unwind.backend.modules.database.domain.PoolState;
import com.unwind.backend.modules.database.domain.PoolStatsSnapshot;
import com.unwind.backend.modules.database.domain.QueryRequest;
import com.unwind.backend.modules.database.infrastructure.ConnectionPoolFactory;

/**
 * Runs parameterized statements on a bounded connection pool that this executor owns.
 * <p>
 * Every primitive borrows one connection for one round trip and returns it on every
 * exit path. Calling a primitive while disconnected opens the pool from the stored
 * settings first. Backend failures are logged with a truncated copy of the SQL and
 * rethrown as {@link QueryExecutionException}; zero matching rows is a normal result.
 */
public class PooledQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(PooledQueryExecutor.class);

    static final int LOGGED_SQL_LENGTH = 100;
    static final String IDENTITY_MDC_KEY = "identity";

    private static final RowMapper<Map<String, Object>> ROW_MAPPER = new ColumnMapRowMapper();
    private static final ResultSetExtractor<Map<String, Object>> FIRST_ROW =
            rs -> rs.next() ? ROW_MAPPER.mapRow(rs, 0) : null;

    private final DatabaseProperties properties;
    private final ConnectionPoolFactory poolFactory;
    private final Object lifecycleLock = new Object();

    private volatile ActivePool activePool;

    public PooledQueryExecutor(DatabaseProperties properties, ConnectionPoolFactory poolFactory) {
        this.properties = properties;
        this.poolFactory = poolFactory;
    }

    /**
     * Opens the pool. Does nothing but log a warning when a pool is already open.
     *
     * @throws com.unwind.backend.global.error.DatabaseConfigurationException when host or password is missing
     *                                                                        or the pool bounds are invalid
     */
    public void connect() {
        synchronized (lifecycleLock) {
            if (activePool != null) {
                log.warn("Database pool already exists. Skipping connection.");
                return;
            }
            openPool();
        }
    }

    /**
     * Closes every pooled connection and returns to {@link PoolState#UNINITIALIZED}.
     */
    public void disconnect() {
        synchronized (lifecycleLock) {
            ActivePool pool = activePool;
            if (pool == null) {
                return;
            }
            activePool = null;
            poolFactory.close(pool.dataSource());
            log.info("Database pool closed");
        }
    }

    public PoolState state() {
        return activePool == null ? PoolState.UNINITIALIZED : PoolState.CONNECTED;
    }

    public Optional<PoolStatsSnapshot> poolStats() {
        ActivePool pool = activePool;
        return pool == null ? Optional.empty() : poolFactory.stats(pool.dataSource());
    }

    // fetchOne

    public Map<String, Object> fetchOne(String sql, Object... params) {
        return fetchOne(QueryRequest.of(sql, params));
    }

    public Map<String, Object> fetchOne(VerifiedIdentity identity, String sql, Object... params) {
        return fetchOne(QueryRequest.tagged(identity, sql, params));
    }

    /**
     * @return the first row keyed by column label, or null when nothing matched
     */
    public Map<String, Object> fetchOne(QueryRequest request) {
        return run("fetchOne", request, jdbc -> jdbc.query(request.sql(), FIRST_ROW, request.paramArray()));
    }

    // fetchAll

    public List<Map<String, Object>> fetchAll(String sql, Object... params) {
        return fetchAll(QueryRequest.of(sql, params));
    }

    public List<Map<String, Object>> fetchAll(VerifiedIdentity identity, String sql, Object... params) {
        return fetchAll(QueryRequest.tagged(identity, sql, params));
    }

    /**
     * @return every row in backend order; empty when nothing matched
     */
    public List<Map<String, Object>> fetchAll(QueryRequest request) {
        return run("fetchAll", request, jdbc -> jdbc.query(request.sql(), ROW_MAPPER, request.paramArray()));
    }

    // execute

    public ExecutionStatus execute(String sql, Object... params) {
        return execute(QueryRequest.of(sql, params));
    }

    public ExecutionStatus execute(VerifiedIdentity identity, String sql, Object... params) {
        return execute(QueryRequest.tagged(identity, sql, params));
    }

    /**
     * Runs a statement without a {@code RETURNING} clause.
     */
    public ExecutionStatus execute(QueryRequest request) {
        return run("execute", request,
                jdbc -> ExecutionStatus.of(request.sql(), jdbc.update(request.sql(), request.paramArray())));
    }

    // executeReturning

    public Map<String, Object> executeReturning(String sql, Object... params) {
        return executeReturning(QueryRequest.of(sql, params));
    }

    public Map<String, Object> executeReturning(VerifiedIdentity identity, String sql, Object... params) {
        return executeReturning(QueryRequest.tagged(identity, sql, params));
    }

    /**
     * Runs a mutating statement with a {@code RETURNING} clause.
     *
     * @return the affected row, or null when the predicate matched nothing
     */
    public Map<String, Object> executeReturning(QueryRequest request) {
        return run("executeReturning", request,
                jdbc -> jdbc.query(request.sql(), FIRST_ROW, request.paramArray()));
    }

    /**
     * Lends one pooled connection to {@code callback}; it is released when the callback returns
     * or throws. The connection must not escape the callback.
     */
    public <T> T withConnection(ConnectionCallback<T> callback) {
        ActivePool pool = ensureConnected();
        try {
            return pool.jdbc().execute(callback);
        } catch (DataAccessException ex) {
            log.error("Connection callback failed: {}", ex.getMessage());
            throw new QueryExecutionException("withConnection", "<connection callback>", null, ex);
        }
    }

    private <T> T run(String operation, QueryRequest request, Function<JdbcTemplate, T> action) {
        ActivePool pool = ensureConnected();
        String identityTag = request.maskedIdentityTag();
        if (identityTag != null) {
            MDC.put(IDENTITY_MDC_KEY, identityTag);
        }
        try {
            return action.apply(pool.jdbc());
        } catch (DataAccessException ex) {
            String sqlPreview = truncate(request.sql());
            log.error("Query failed: {}... Error: {}", sqlPreview, ex.getMessage());
            throw new QueryExecutionException(operation, sqlPreview, identityTag, ex);
        } finally {
            if (identityTag != null) {
                MDC.remove(IDENTITY_MDC_KEY);
            }
        }
    }

    private ActivePool ensureConnected() {
        ActivePool pool = activePool;
        if (pool != null) {
            return pool;
        }
        synchronized (lifecycleLock) {
            if (activePool == null) {
                log.info("Database pool not initialized; connecting on first use");
                openPool();
            }
            return activePool;
        }
    }

    private void openPool() {
        properties.validate();
        DataSource dataSource;
        try {
            dataSource = poolFactory.open(properties);
        } catch (RuntimeException ex) {
            log.error("Failed to create database pool: {}", ex.getMessage());
            throw ex;
        }
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.setQueryTimeout(toTimeoutSeconds(properties.getCommandTimeout()));
        activePool = new ActivePool(dataSource, jdbc);
        log.info("Database pool created: {} (pool size: {}-{})",
                properties.describeTarget(), properties.getMinPoolSize(), properties.getMaxPoolSize());
    }

    static String truncate(String sql) {
        String flattened = sql.strip().replaceAll("\\s+", " ");
        return flattened.length() <= LOGGED_SQL_LENGTH ? flattened : flattened.substring(0, LOGGED_SQL_LENGTH);
    }

    private static int toTimeoutSeconds(Duration timeout) {
        long seconds = timeout.toSeconds();
        if (timeout.toNanosPart() > 0) {
            seconds++;
        }
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, seconds));
    }

    private record ActivePool(DataSource dataSource, JdbcTemplate jdbc) {
    }
}
