package io.dbmaint.sql;

import java.util.Objects;

/**
 * Validation for database, table and column names taken from configuration.
 *
 * <p>Identifiers are interpolated into statement text (quoted by the dialect), so only plain
 * unqualified names are accepted.
 */
public final class Identifiers {
    private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_$]*";

    private Identifiers() {}

    /**
     * Returns {@code name} unchanged if it is a valid identifier.
     *
     * @throws NullPointerException     if {@code name} is null
     * @throws IllegalArgumentException if {@code name} is not a plain identifier
     */
    public static String validate(String name) {
        Objects.requireNonNull(name, "identifier");
        if (!name.matches(IDENTIFIER_PATTERN)) {
            throw new IllegalArgumentException("Invalid identifier: " + name);
        }
        return name;
    }

    public static boolean isValid(String name) {
        return name != null && name.matches(IDENTIFIER_PATTERN);
    }
}
