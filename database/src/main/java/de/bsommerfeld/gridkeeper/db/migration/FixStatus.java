package de.bsommerfeld.gridkeeper.db.migration;

public record FixStatus(String id, String description, boolean applied) {
}
