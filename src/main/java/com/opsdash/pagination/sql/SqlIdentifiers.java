package com.opsdash.pagination.sql;

import java.util.regex.Pattern;

/**
 * Column and table names are the only text spliced into generated SQL, so they are
 * restricted to plain unquoted identifiers.
 */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");

    private SqlIdentifiers() {}

    public static boolean isValid(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    public static String require(String name) {
        if (!isValid(name)) {
            throw new IllegalArgumentException("Illegal SQL identifier: " + name);
        }
        return name;
    }
}
