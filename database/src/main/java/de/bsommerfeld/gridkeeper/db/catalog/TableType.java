package de.bsommerfeld.gridkeeper.db.catalog;

import java.util.Locale;

public enum TableType {

    MAIN("main"),
    /** Child table holding one-to-many rows for a parent row. */
    STRUCTURE("structure");

    private final String dbValue;

    TableType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    /** Unknown or missing values are read as {@link #MAIN}. */
    public static TableType fromDb(String value) {
        if (value != null && STRUCTURE.dbValue.equals(value.trim().toLowerCase(Locale.ROOT)))
            return STRUCTURE;
        return MAIN;
    }
}
