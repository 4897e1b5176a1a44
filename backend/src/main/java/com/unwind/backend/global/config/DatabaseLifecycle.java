package com.unwind.backend.global.config;

import org.springframework.context.SmartLifecycle;

import com.unwind.backend.modules.database.application.PooledQueryExecutor;

/**
 * Opens the pool when the context starts and closes it on shutdown.
 */
public class DatabaseLifecycle implements SmartLifecycle {

    private final PooledQueryExecutor executor;
    private final DatabaseProperties properties;
    private volatile boolean running;

    public DatabaseLifecycle(PooledQueryExecutor executor, DatabaseProperties properties) {
        this.executor = executor;
        this.properties = properties;
    }

    @Override
    public void start() {
        if (properties.isConnectOnStartup()) {
            executor.connect();
        }
        running = true;
    }

    @Override
    public void stop() {
        try {
            executor.disconnect();
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
