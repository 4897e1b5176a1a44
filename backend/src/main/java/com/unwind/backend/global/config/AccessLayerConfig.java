package com.unwind.backend.global.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.unwind.backend.modules.auth.application.CredentialValidator;
import com.unwind.backend.modules.auth.infrastructure.jwt.JwtSecretKeyProvider;
import com.unwind.backend.modules.auth.infrastructure.jwt.UnverifiedTokenDecoder;
import com.unwind.backend.modules.database.application.PooledQueryExecutor;
import com.unwind.backend.modules.database.infrastructure.ConnectionPoolFactory;
import com.unwind.backend.modules.database.infrastructure.HikariConnectionPoolFactory;

/**
 * Wires the credential validator and the pooled query executor. The two share nothing;
 * callers combine them per request.
 */
@Configuration
@EnableConfigurationProperties({AuthProperties.class, DatabaseProperties.class})
public class AccessLayerConfig {

    @Bean
    public EnvironmentValidator environmentValidator(AuthProperties authProperties,
                                                     DatabaseProperties databaseProperties) {
        return new EnvironmentValidator(authProperties, databaseProperties);
    }

    @Bean
    public JwtSecretKeyProvider jwtSecretKeyProvider(AuthProperties authProperties) {
        return new JwtSecretKeyProvider(authProperties);
    }

    @Bean
    public CredentialValidator credentialValidator(JwtSecretKeyProvider jwtSecretKeyProvider,
                                                   AuthProperties authProperties,
                                                   Clock clock) {
        return new CredentialValidator(
                jwtSecretKeyProvider,
                new UnverifiedTokenDecoder(new ObjectMapper()),
                clock,
                authProperties.getClockSkew()
        );
    }

    @Bean
    public ConnectionPoolFactory connectionPoolFactory() {
        return new HikariConnectionPoolFactory();
    }

    @Bean
    public PooledQueryExecutor pooledQueryExecutor(DatabaseProperties databaseProperties,
                                                   ConnectionPoolFactory connectionPoolFactory) {
        return new PooledQueryExecutor(databaseProperties, connectionPoolFactory);
    }

    @Bean
    public DatabaseLifecycle databaseLifecycle(PooledQueryExecutor pooledQueryExecutor,
                                               DatabaseProperties databaseProperties) {
        return new DatabaseLifecycle(pooledQueryExecutor, databaseProperties);
    }
}
