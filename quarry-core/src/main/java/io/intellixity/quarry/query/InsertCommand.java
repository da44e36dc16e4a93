package io.intellixity.quarry.query;

import java.util.*;

/** Rows to insert into one model, with optional upsert and RETURNING projection. */
public final class InsertCommand {
  private List<Map<String, ?>> rows = new ArrayList<>();
  private boolean returnRecords = true;
  private List<String> returnSelect;
  private OnConflict onConflict;

  public InsertCommand() {}

  public List<Map<String, ?>> rows() { return rows; }
  public boolean returnRecords() { return returnRecords; }
  /** RETURNING projection, or null for every column. */
  public List<String> returnSelect() { return returnSelect; }
  public OnConflict onConflict() { return onConflict; }

  public InsertCommand withRow(Map<String, ?> row) { this.rows.add(Objects.requireNonNull(row, "row")); return this; }
  public InsertCommand withRows(List<? extends Map<String, ?>> rows) { this.rows = new ArrayList<>(rows == null ? List.of() : rows); return this; }
  public InsertCommand withReturnRecords(boolean returnRecords) { this.returnRecords = returnRecords; return this; }
  public InsertCommand withReturnSelect(String... properties) { this.returnSelect = List.of(properties); return this; }
  public InsertCommand withOnConflict(OnConflict onConflict) { this.onConflict = onConflict; return this; }

  public static InsertCommand of(Map<String, ?> row) {
    return new InsertCommand().withRow(row);
  }
}
