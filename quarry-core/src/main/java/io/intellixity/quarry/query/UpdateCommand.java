package io.intellixity.quarry.query;

import java.util.*;

public final class UpdateCommand {
  private Map<String, ?> values = new LinkedHashMap<>();
  private Map<String, ?> where;
  private boolean returnRecords = true;
  private List<String> returnSelect;

  public UpdateCommand() {}

  public Map<String, ?> values() { return values; }
  public Map<String, ?> where() { return where; }
  public boolean returnRecords() { return returnRecords; }
  public List<String> returnSelect() { return returnSelect; }

  public UpdateCommand withValues(Map<String, ?> values) { this.values = values == null ? Map.of() : values; return this; }
  public UpdateCommand withWhere(Map<String, ?> where) { this.where = where; return this; }
  public UpdateCommand withReturnRecords(boolean returnRecords) { this.returnRecords = returnRecords; return this; }
  public UpdateCommand withReturnSelect(String... properties) { this.returnSelect = List.of(properties); return this; }

  public static UpdateCommand set(Map<String, ?> values) {
    return new UpdateCommand().withValues(values);
  }
}
