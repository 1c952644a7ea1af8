package de.bsommerfeld.gridkeeper.db.schema;

/**
 * A user data column.
 *
 * @param name        column name in the data table
 * @param sqlType     declared SQL type, e.g. {@code TEXT}
 * @param dataType    application-level type stored in the column metadata
 * @param displayName label shown to users; {@code null} falls back to
 *                    {@code name}
 */
public record ColumnSpec(String name, String sqlType, String dataType, String displayName) {

    public static ColumnSpec text(String name) {
        return new ColumnSpec(name, "TEXT", "String", null);
    }

    public static ColumnSpec integer(String name) {
        return new ColumnSpec(name, "INTEGER", "Integer", null);
    }

    public String displayNameOrName() {
        return displayName != null ? displayName : name;
    }
}
