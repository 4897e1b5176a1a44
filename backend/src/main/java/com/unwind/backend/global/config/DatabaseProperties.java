package com.unwind.backend.global.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import com.unwind.backend.global.error.DatabaseConfigurationException;

/**
 * Connection settings for the pooled PostgreSQL executor.
 */
@ConfigurationProperties(prefix = "app.database")
public class DatabaseProperties {

    private String host;
    private int port = 5432;
    private String name = "postgres";
    private String user = "postgres";
    private String password;
    private int minPoolSize = 1;
    private int maxPoolSize = 10;
    // bare numbers are seconds, e.g. DB_COMMAND_TIMEOUT=60
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration commandTimeout = Duration.ofSeconds(60);
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration acquireTimeout = Duration.ofSeconds(30);
    private boolean connectOnStartup = true;

    /**
     * Checks that a pool can be built from these settings.
     *
     * @throws DatabaseConfigurationException listing every missing or invalid setting
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        if (host == null || host.isBlank()) {
            missing.add("app.database.host");
        }
        if (password == null || password.isBlank()) {
            missing.add("app.database.password");
        }
        if (!missing.isEmpty()) {
            throw new DatabaseConfigurationException(
                    "Missing required database credentials: " + String.join(", ", missing));
        }

        List<String> invalid = describeInvalidSettings();
        if (!invalid.isEmpty()) {
            throw new DatabaseConfigurationException(
                    "Invalid database settings: " + String.join("; ", invalid));
        }
    }

    /**
     * Pool bound and timeout problems, independent of credentials.
     */
    public List<String> describeInvalidSettings() {
        List<String> invalid = new ArrayList<>();
        if (port < 1 || port > 65535) {
            invalid.add("app.database.port must be between 1 and 65535");
        }
        if (minPoolSize < 0) {
            invalid.add("app.database.min-pool-size must be >= 0");
        }
        if (maxPoolSize < 1) {
            invalid.add("app.database.max-pool-size must be >= 1");
        }
        if (minPoolSize > maxPoolSize) {
            invalid.add("app.database.min-pool-size must not exceed max-pool-size");
        }
        if (commandTimeout == null || commandTimeout.isNegative() || commandTimeout.isZero()) {
            invalid.add("app.database.command-timeout must be positive");
        }
        if (acquireTimeout == null || acquireTimeout.isNegative() || acquireTimeout.isZero()) {
            invalid.add("app.database.acquire-timeout must be positive");
        }
        return invalid;
    }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + name;
    }

    public String describeTarget() {
        return host + ":" + port + "/" + name;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getMinPoolSize() {
        return minPoolSize;
    }

    public void setMinPoolSize(int minPoolSize) {
        this.minPoolSize = minPoolSize;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    public Duration getAcquireTimeout() {
        return acquireTimeout;
    }

    public void setAcquireTimeout(Duration acquireTimeout) {
        this.acquireTimeout = acquireTimeout;
    }

    public boolean isConnectOnStartup() {
        return connectOnStartup;
    }

    public void setConnectOnStartup(boolean connectOnStartup) {
        this.connectOnStartup = connectOnStartup;
    }
}
