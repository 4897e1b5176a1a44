package com.unwind.backend.modules.database.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.unwind.backend.modules.auth.application.VerifiedIdentity;

/**
 * SQL text with positional {@code ?} placeholders, its bind values in order, and the
 * subject it runs for. The subject is only used for log correlation; it is never
 * spliced into the SQL text.
 *
 * @param sql         statement text
 * @param params      bind values, may contain nulls
 * @param identityTag subject the statement runs for, or null
 */
public record QueryRequest(String sql, List<Object> params, String identityTag) {

    public QueryRequest {
        Objects.requireNonNull(sql, "sql");
        if (sql.isBlank()) {
            throw new IllegalArgumentException("sql must not be blank");
        }
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static QueryRequest of(String sql, Object... params) {
        return new QueryRequest(sql, asList(params), null);
    }

    /**
     * A request tagged with the caller's identity. The SQL is responsible for binding
     * the subject itself.
     */
    public static QueryRequest tagged(VerifiedIdentity identity, String sql, Object... params) {
        Objects.requireNonNull(identity, "identity");
        return new QueryRequest(sql, asList(params), identity.subject());
    }

    /**
     * A request for rows owned by one user. The subject is always bound to the first
     * placeholder, so the SQL must filter on it there, e.g.
     * {@code UPDATE items SET status = 'completed' WHERE user_id = ? AND id = ?}.
     *
     * @throws IllegalArgumentException when the placeholder count does not match the subject plus {@code params}
     */
    public static QueryRequest scopedTo(VerifiedIdentity identity, String sql, Object... params) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(sql, "sql");
        List<Object> bound = new ArrayList<>();
        bound.add(identity.subject());
        bound.addAll(asList(params));
        int placeholders = SqlPlaceholders.count(sql);
        if (placeholders != bound.size()) {
            throw new IllegalArgumentException("Identity-scoped SQL declares " + placeholders
                    + " placeholders but " + bound.size() + " values are bound (subject first)");
        }
        return new QueryRequest(sql, bound, identity.subject());
    }

    public Object[] paramArray() {
        return params.toArray();
    }

    public String maskedIdentityTag() {
        return VerifiedIdentity.mask(identityTag);
    }

    private static List<Object> asList(Object[] params) {
        return params == null ? List.of() : Arrays.asList(params);
    }
}
