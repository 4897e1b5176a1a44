package com.unwind.backend.modules.database.domain;

import java.util.Locale;

/**
 * Outcome of a statement run without {@code RETURNING}, rendered like a PostgreSQL
 * command tag ({@code UPDATE 1}, {@code INSERT 0 3}).
 */
public record ExecutionStatus(String command, int rowCount) {

    private static final String UNKNOWN_COMMAND = "UNKNOWN";

    public static ExecutionStatus of(String sql, int rowCount) {
        return new ExecutionStatus(leadingKeyword(sql), rowCount);
    }

    public String tag() {
        if ("INSERT".equals(command)) {
            return "INSERT 0 " + rowCount;
        }
        return command + " " + rowCount;
    }

    @Override
    public String toString() {
        return tag();
    }

    static String leadingKeyword(String sql) {
        if (sql == null) {
            return UNKNOWN_COMMAND;
        }
        int i = 0;
        int length = sql.length();
        while (i < length) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (sql.startsWith("--", i)) {
                int newline = sql.indexOf('\n', i);
                i = newline < 0 ? length : newline + 1;
            } else if (sql.startsWith("/*", i)) {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
            } else {
                break;
            }
        }
        int start = i;
        while (i < length && Character.isLetter(sql.charAt(i))) {
            i++;
        }
        return start == i ? UNKNOWN_COMMAND : sql.substring(start, i).toUpperCase(Locale.ROOT);
    }
}
