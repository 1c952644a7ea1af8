package de.bsommerfeld.gridkeeper.db.cascade;

import java.util.Map;

/**
 * Result of one cascade.
 *
 * @param changesByTable rows rewritten per descendant table; tables without
 *                       matching values are absent
 * @param rowsChanged    rows affected as reported by the daemon
 */
public record CascadeReport(Map<String, Long> changesByTable, long rowsChanged) {

    public CascadeReport {
        changesByTable = Map.copyOf(changesByTable);
    }

    public static CascadeReport empty() {
        return new CascadeReport(Map.of(), 0);
    }

    public boolean isEmpty() {
        return rowsChanged == 0;
    }
}
