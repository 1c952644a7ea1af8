package de.bsommerfeld.gridkeeper.db.migration.fixes;

import de.bsommerfeld.gridkeeper.db.migration.MigrationFix;

import java.util.List;

/**
 * The released fixes in application order. Append only: ids and order of
 * released entries never change.
 */
public final class MigrationFixes {

    public static final String RETIRE_TEMP_NEW_ROW_INDEX = "retire_temp_new_row_index_2025_10_27";

    private MigrationFixes() {
    }

    public static List<MigrationFix> standard() {
        return List.of(
                new MetadataColumnIndexRepair(),
                new SequentialRowIndexRepair(),
                new ColumnRetirement(RETIRE_TEMP_NEW_ROW_INDEX, "temp_new_row_index"));
    }
}
