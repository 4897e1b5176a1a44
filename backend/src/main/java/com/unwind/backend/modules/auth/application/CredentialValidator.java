package com.unwind.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.Optional;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.unwind.backend.modules.auth.infrastructure.jwt.JwtSecretKeyProvider;
import com.unwind.backend.modules.auth.infrastructure.jwt.UnverifiedTokenDecoder;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.KeyException;
import io.jsonwebtoken.security.SignatureException;

/**
 * Turns an {@code Authorization} header into a {@link VerifiedIdentity}.
 * <p>
 * Tokens are HS256 JWTs from the external identity provider. Signature, expiry and
 * issued-at are checked in that order; any failure yields no identity. Failures are
 * classified and logged but never thrown to the caller.
 */
public class CredentialValidator {

    private static final Logger log = LoggerFactory.getLogger(CredentialValidator.class);

    private static final String BEARER_SCHEME = "bearer";
    private static final String REQUIRED_ALGORITHM = "HS256";

    private final JwtSecretKeyProvider keyProvider;
    private final UnverifiedTokenDecoder unverifiedTokenDecoder;
    private final Clock clock;
    private final Duration clockSkew;

    public CredentialValidator(
            JwtSecretKeyProvider keyProvider,
            UnverifiedTokenDecoder unverifiedTokenDecoder,
            Clock clock,
            Duration clockSkew
    ) {
        this.keyProvider = keyProvider;
        this.unverifiedTokenDecoder = unverifiedTokenDecoder;
        this.clock = clock;
        this.clockSkew = clockSkew == null ? Duration.ZERO : clockSkew;
    }

    /**
     * Reads an identity from a raw {@code Authorization} header value.
     *
     * @param authorizationHeader header value such as {@code "Bearer eyJ..."}, may be null
     * @return the token's identity, or empty when the header is absent, malformed or the token is invalid
     */
    public Optional<VerifiedIdentity> extractIdentity(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isEmpty()) {
            log.warn("Credential rejected: {}", CredentialFailure.MISSING_HEADER);
            return Optional.empty();
        }
        String[] parts = authorizationHeader.split(" ", -1);
        if (parts.length != 2 || !BEARER_SCHEME.equalsIgnoreCase(parts[0]) || parts[1].isEmpty()) {
            log.warn("Credential rejected: {} (expected 'Bearer <token>')", CredentialFailure.MALFORMED_HEADER);
            return Optional.empty();
        }
        return validate(parts[1]);
    }

    /**
     * @return the subject of a valid token, or empty
     */
    public Optional<VerifiedIdentity> validate(String token) {
        return verify(token).identity();
    }

    /**
     * Same checks as {@link #validate(String)}, keeping the rejection reason.
     */
    public TokenVerification verify(String token) {
        Optional<SecretKey> secretKey = keyProvider.getSecretKey();
        if (secretKey.isEmpty()) {
            log.error("Cannot validate token: app.auth.jwt-secret is not configured");
            return TokenVerification.rejected(CredentialFailure.SECRET_NOT_CONFIGURED);
        }
        if (token == null || token.isBlank()) {
            return reject(CredentialFailure.MALFORMED_TOKEN, "empty token");
        }

        try {
            Jws<Claims> jws = Jwts.parser()
                    .verifyWith(secretKey.get())
                    .clock(() -> Date.from(clock.instant()))
                    .clockSkewSeconds(clockSkew.toSeconds())
                    .build()
                    .parseSignedClaims(token);

            if (!REQUIRED_ALGORITHM.equals(jws.getHeader().getAlgorithm())) {
                return reject(CredentialFailure.UNSUPPORTED_ALGORITHM, jws.getHeader().getAlgorithm());
            }

            Claims claims = jws.getPayload();
            if (claims.getExpiration() == null) {
                return reject(CredentialFailure.MALFORMED_TOKEN, "missing 'exp' claim");
            }
            Date issuedAt = claims.getIssuedAt();
            if (issuedAt != null && issuedAt.toInstant().isAfter(latestAcceptedIssuedAt())) {
                return reject(CredentialFailure.NOT_YET_VALID, "'iat' is in the future");
            }

            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                return reject(CredentialFailure.MISSING_SUBJECT, "token payload missing 'sub' claim");
            }

            VerifiedIdentity identity = new VerifiedIdentity(subject, IdentityRole.AUTHENTICATED);
            log.debug("Token validated for user: {}", identity.maskedSubject());
            return TokenVerification.verified(identity);
        } catch (ExpiredJwtException ex) {
            return reject(CredentialFailure.EXPIRED, "token has expired");
        } catch (SignatureException ex) {
            return reject(CredentialFailure.BAD_SIGNATURE, "invalid token signature");
        } catch (PrematureJwtException ex) {
            return reject(CredentialFailure.NOT_YET_VALID, ex.getMessage());
        } catch (KeyException ex) {
            // raised when the header names an algorithm the configured key cannot serve
            return reject(CredentialFailure.UNSUPPORTED_ALGORITHM, ex.getMessage());
        } catch (UnsupportedJwtException ex) {
            return reject(CredentialFailure.UNSUPPORTED_ALGORITHM, ex.getMessage());
        } catch (MalformedJwtException | IllegalArgumentException ex) {
            return reject(CredentialFailure.MALFORMED_TOKEN, ex.getMessage());
        } catch (JwtException ex) {
            return reject(CredentialFailure.OTHER, ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Unexpected error validating token: {}", ex.getMessage());
            return TokenVerification.rejected(CredentialFailure.OTHER);
        }
    }

    /**
     * Decodes the token payload WITHOUT verifying its signature.
     * <p>
     * For debugging and test tooling only. The returned claims may be forged and must
     * never be used to decide who a caller is; use {@link #validate(String)} for that.
     */
    public Optional<Map<String, Object>> decodeUnsafe(String token) {
        return unverifiedTokenDecoder.decodePayload(token);
    }

    /**
     * Builds an identity with role {@code service} for internal calls made on behalf of
     * a subject that the caller has already authenticated by other means. Must not be
     * fed from request input.
     */
    public VerifiedIdentity serviceIdentity(String subject) {
        return new VerifiedIdentity(subject, IdentityRole.SERVICE);
    }

    private Instant latestAcceptedIssuedAt() {
        return clock.instant().plus(clockSkew);
    }

    private static TokenVerification reject(CredentialFailure failure, String detail) {
        log.warn("Credential rejected: {} ({})", failure, detail);
        return TokenVerification.rejected(failure);
    }
}
