package com.unwind.backend.modules.auth.application;

import java.util.Optional;

/**
 * Result of checking one token: an identity, or the reason there is none.
 */
public record TokenVerification(VerifiedIdentity verifiedIdentity, CredentialFailure failure) {

    public TokenVerification {
        if ((verifiedIdentity == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of identity or failure must be set");
        }
    }

    static TokenVerification verified(VerifiedIdentity identity) {
        return new TokenVerification(identity, null);
    }

    static TokenVerification rejected(CredentialFailure failure) {
        return new TokenVerification(null, failure);
    }

    public boolean isVerified() {
        return verifiedIdentity != null;
    }

    public Optional<VerifiedIdentity> identity() {
        return Optional.ofNullable(verifiedIdentity);
    }
}
