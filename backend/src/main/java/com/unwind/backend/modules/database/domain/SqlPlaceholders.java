package com.unwind.backend.modules.database.domain;

final class SqlPlaceholders {

    private SqlPlaceholders() {
    }

    /**
     * Counts JDBC {@code ?} markers outside string literals, quoted identifiers and
     * comments. {@code ??} is the driver's escape for a literal question mark.
     */
    static int count(String sql) {
        int count = 0;
        int i = 0;
        int length = sql.length();
        while (i < length) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int close = sql.indexOf(c, i + 1);
                i = close < 0 ? length : close + 1;
            } else if (sql.startsWith("--", i)) {
                int newline = sql.indexOf('\n', i);
                i = newline < 0 ? length : newline + 1;
            } else if (sql.startsWith("/*", i)) {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
            } else if (c == '?') {
                if (i + 1 < length && sql.charAt(i + 1) == '?') {
                    i += 2;
                } else {
                    count++;
                    i++;
                }
            } else {
                i++;
            }
        }
        return count;
    }
}
