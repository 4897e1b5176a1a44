package com.unwind.backend.global.config;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;

import com.unwind.backend.global.error.DatabaseConfigurationException;

/**
 * Checks settings once all beans exist, before the pool is opened.
 * Invalid pool bounds stop startup; a missing signing secret or identity
 * provider URL only warns.
 */
public class EnvironmentValidator implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private final AuthProperties authProperties;
    private final DatabaseProperties databaseProperties;

    public EnvironmentValidator(AuthProperties authProperties, DatabaseProperties databaseProperties) {
        this.authProperties = authProperties;
        this.databaseProperties = databaseProperties;
    }

    @Override
    public void afterSingletonsInstantiated() {
        List<String> invalid = databaseProperties.describeInvalidSettings();
        if (!invalid.isEmpty()) {
            throw new DatabaseConfigurationException("Invalid database settings: " + String.join("; ", invalid));
        }

        if (!databaseProperties.isConnectOnStartup()
                && (isBlank(databaseProperties.getHost()) || isBlank(databaseProperties.getPassword()))) {
            log.warn("app.database.host or app.database.password is not set; the first query will fail");
        }
        if (isBlank(authProperties.getIdentityProviderUrl())) {
            log.info("app.auth.identity-provider-url is not set");
        }
        if (authProperties.getClockSkew() == null || authProperties.getClockSkew().isNegative()) {
            throw new IllegalStateException("app.auth.clock-skew must not be negative");
        }
        log.info("Environment validated");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
