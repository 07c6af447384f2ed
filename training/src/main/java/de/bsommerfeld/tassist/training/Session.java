package de.bsommerfeld.tassist.training;

import de.bsommerfeld.tassist.core.db.DisplayTable;
import de.bsommerfeld.tassist.core.db.RowId;

import java.time.LocalDate;
import java.util.Optional;

/**
 * One training session of a client with a trainer. {@code charge} points at
 * the billing row once the session was invoiced.
 */
public record Session(LocalDate date,
        @DisplayTable(table = TrainingPlugin.TRAINER_TABLE, column = "name") RowId trainer,
        @DisplayTable(table = TrainingPlugin.CLIENT_TABLE, column = "name") RowId client,
        Optional<RowId> charge) {
}
