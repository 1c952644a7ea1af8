package de.bsommerfeld.gridkeeper.protocol;

/**
 * Helpers for splicing identifiers into SQL text. Table and column names come
 * from the catalog and cannot be bound as parameters.
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {
    }

    /** Wraps {@code identifier} in double quotes, doubling any embedded quote. */
    public static String quote(String identifier) {
        if (identifier == null || identifier.isEmpty())
            throw new IllegalArgumentException("Identifier must not be empty");
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    /** Wraps {@code value} as a single-quoted SQL string literal. */
    public static String literal(String value) {
        return '\'' + value.replace("'", "''") + '\'';
    }
}
