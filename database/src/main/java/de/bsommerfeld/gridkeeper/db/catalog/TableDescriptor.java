package de.bsommerfeld.gridkeeper.db.catalog;

/**
 * One row of the {@code _Metadata} catalog.
 *
 * @param parentTable  recorded parent, {@code null} for main tables and for
 *                     structure rows written before parents were recorded
 * @param parentColumn column of the parent this table expands
 */
public record TableDescriptor(
        String name,
        TableType type,
        String parentTable,
        String parentColumn,
        int displayOrder,
        boolean hidden) {

    public static TableDescriptor main(String name, int displayOrder) {
        return new TableDescriptor(name, TableType.MAIN, null, null, displayOrder, false);
    }

    public static TableDescriptor structure(String name, String parentTable, String parentColumn) {
        return new TableDescriptor(name, TableType.STRUCTURE, parentTable, parentColumn, 0, false);
    }

    public boolean isStructure() {
        return type == TableType.STRUCTURE;
    }

    /** Name of this table's per-column metadata table. */
    public String metadataTable() {
        return metadataTableOf(name);
    }

    public static String metadataTableOf(String table) {
        return table + "_Metadata";
    }
}
