package com.unwind.backend.modules.auth.application;

import java.util.Objects;

/**
 * Subject a request acts for. Instances are created only by {@link CredentialValidator}:
 * either from a signature- and expiry-checked token or through
 * {@link CredentialValidator#serviceIdentity(String)}.
 */
public final class VerifiedIdentity {

    private static final int VISIBLE_SUBJECT_CHARS = 8;

    private final String subject;
    private final IdentityRole role;

    VerifiedIdentity(String subject, IdentityRole role) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        this.subject = subject;
        this.role = Objects.requireNonNull(role, "role");
    }

    public String subject() {
        return subject;
    }

    public IdentityRole role() {
        return role;
    }

    public boolean isService() {
        return role == IdentityRole.SERVICE;
    }

    /**
     * Subject shortened for log lines and MDC values.
     */
    public String maskedSubject() {
        return mask(subject);
    }

    public static String mask(String subject) {
        if (subject == null) {
            return null;
        }
        if (subject.length() <= VISIBLE_SUBJECT_CHARS) {
            return subject;
        }
        return subject.substring(0, VISIBLE_SUBJECT_CHARS) + "...";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VerifiedIdentity other)) {
            return false;
        }
        return subject.equals(other.subject) && role == other.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, role);
    }

    @Override
    public String toString() {
        return "VerifiedIdentity[subject=" + maskedSubject() + ", role=" + role.value() + "]";
    }
}
