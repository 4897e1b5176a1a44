package com.unwind.backend.modules.auth.application;

/**
 * Why a presented credential did not yield an identity. Used for logging only;
 * every reason resolves to "no identity" for the caller.
 */
public enum CredentialFailure {
    MISSING_HEADER,
    MALFORMED_HEADER,
    SECRET_NOT_CONFIGURED,
    BAD_SIGNATURE,
    EXPIRED,
    NOT_YET_VALID,
    UNSUPPORTED_ALGORITHM,
    MALFORMED_TOKEN,
    MISSING_SUBJECT,
    OTHER
}
