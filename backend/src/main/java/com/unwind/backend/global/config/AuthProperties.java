package com.unwind.backend.global.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

/**
 * Settings for verifying bearer tokens issued by the external identity provider.
 */
@ConfigurationProperties(prefix = "app.auth")
public class AuthProperties {

    /**
     * Shared HS256 secret. Left empty, every token is rejected.
     */
    private String jwtSecret;

    /**
     * Whether {@link #jwtSecret} is Base64 text rather than the raw key.
     */
    private boolean jwtSecretBase64;

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration clockSkew = Duration.ZERO;

    /**
     * Identity provider base URL. Not used for verification.
     */
    private String identityProviderUrl;

    public String getJwtSecret() {
        return jwtSecret;
    }

    public void setJwtSecret(String jwtSecret) {
        this.jwtSecret = jwtSecret;
    }

    public boolean isJwtSecretBase64() {
        return jwtSecretBase64;
    }

    public void setJwtSecretBase64(boolean jwtSecretBase64) {
        this.jwtSecretBase64 = jwtSecretBase64;
    }

    public Duration getClockSkew() {
        return clockSkew;
    }

    public void setClockSkew(Duration clockSkew) {
        this.clockSkew = clockSkew;
    }

    public String getIdentityProviderUrl() {
        return identityProviderUrl;
    }

    public void setIdentityProviderUrl(String identityProviderUrl) {
        this.identityProviderUrl = identityProviderUrl;
    }
}
