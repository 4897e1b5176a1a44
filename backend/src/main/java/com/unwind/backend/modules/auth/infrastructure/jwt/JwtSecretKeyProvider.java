package com.unwind.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.unwind.backend.global.config.AuthProperties;

/**
 * Resolves the HS256 verification key once, at startup.
 * An absent or too-short secret leaves the provider without a key.
 */
public class JwtSecretKeyProvider {

    private static final Logger log = LoggerFactory.getLogger(JwtSecretKeyProvider.class);

    private static final String HMAC_SHA_256 = "HmacSHA256";
    static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;

    public JwtSecretKeyProvider(AuthProperties properties) {
        this.secretKey = resolve(properties.getJwtSecret(), properties.isJwtSecretBase64());
    }

    public Optional<SecretKey> getSecretKey() {
        return Optional.ofNullable(secretKey);
    }

    private static SecretKey resolve(String secretString, boolean base64) {
        if (secretString == null || secretString.isBlank()) {
            log.warn("app.auth.jwt-secret is not set. Every bearer token will be rejected. "
                    + "Copy the JWT secret from the identity provider settings.");
            return null;
        }
        byte[] keyBytes;
        if (base64) {
            try {
                keyBytes = Base64.getDecoder().decode(secretString.trim());
            } catch (IllegalArgumentException ex) {
                log.warn("app.auth.jwt-secret is not valid Base64. Every bearer token will be rejected.");
                return null;
            }
        } else {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            log.warn("app.auth.jwt-secret is {} bits, HS256 needs at least {}. Every bearer token will be rejected.",
                    keyBytes.length * 8, MIN_KEY_BYTES * 8);
            return null;
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }
}
