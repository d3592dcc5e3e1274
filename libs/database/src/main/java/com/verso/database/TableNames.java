package com.verso.database;

import java.util.regex.Pattern;

/** Validation of table names spliced into SQL text. */
final class TableNames {

    private static final Pattern IDENTIFIER =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private TableNames() {}

    /**
     * Returns {@code table} if it is a plain, optionally schema-qualified SQL identifier.
     *
     * @throws IllegalArgumentException otherwise
     */
    static String require(String table) {
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new IllegalArgumentException("invalid table name: " + table);
        }
        return table;
    }
}
