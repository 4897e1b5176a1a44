package com.unwind.backend.global.error;

/**
 * A statement reached the backend and failed: constraint violation, timeout, lost
 * connection. Zero matching rows is never reported this way.
 */
public class QueryExecutionException extends RuntimeException {

    private final String operation;
    private final String sqlPreview;
    private final String identityTag;

    public QueryExecutionException(String operation, String sqlPreview, String identityTag, Throwable cause) {
        super(operation + " failed: " + sqlPreview, cause);
        this.operation = operation;
        this.sqlPreview = sqlPreview;
        this.identityTag = identityTag;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * Leading part of the statement text, never the bound values.
     */
    public String getSqlPreview() {
        return sqlPreview;
    }

    /**
     * Masked subject the statement ran for, or null.
     */
    public String getIdentityTag() {
        return identityTag;
    }
}
