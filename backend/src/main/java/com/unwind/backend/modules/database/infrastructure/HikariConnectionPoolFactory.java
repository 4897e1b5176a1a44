package com.unwind.backend.modules.database.infrastructure;

import java.util.Optional;

import javax.sql.DataSource;

import com.unwind.backend.global.config.DatabaseProperties;
import com.unwind.backend.modules.database.domain.PoolStatsSnapshot;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;

public class HikariConnectionPoolFactory implements ConnectionPoolFactory {

    static final String POOL_NAME = "unwind-db";

    @Override
    public DataSource open(DatabaseProperties properties) {
        HikariConfig config = new HikariConfig();
        config.setPoolName(POOL_NAME);
        config.setJdbcUrl(properties.jdbcUrl());
        config.setUsername(properties.getUser());
        config.setPassword(properties.getPassword());
        config.setMinimumIdle(properties.getMinPoolSize());
        config.setMaximumPoolSize(properties.getMaxPoolSize());
        config.setConnectionTimeout(properties.getAcquireTimeout().toMillis());
        // let the server infer parameter types (uuid, enum columns) from text binds
        config.addDataSourceProperty("stringtype", "unspecified");
        config.addDataSourceProperty("ApplicationName", POOL_NAME);
        return new HikariDataSource(config);
    }

    @Override
    public Optional<PoolStatsSnapshot> stats(DataSource dataSource) {
        if (!(dataSource instanceof HikariDataSource hikari)) {
            return Optional.empty();
        }
        HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
        if (pool == null) {
            return Optional.empty();
        }
        return Optional.of(new PoolStatsSnapshot(
                hikari.getPoolName(),
                hikari.getMaximumPoolSize(),
                hikari.getMinimumIdle(),
                pool.getActiveConnections(),
                pool.getIdleConnections(),
                pool.getTotalConnections(),
                pool.getThreadsAwaitingConnection()
        ));
    }
}
