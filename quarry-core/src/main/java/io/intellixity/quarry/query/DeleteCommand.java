package io.intellixity.quarry.query;

import java.util.List;
import java.util.Map;

public final class DeleteCommand {
  private Map<String, ?> where;
  private boolean returnRecords = true;
  private List<String> returnSelect;

  public DeleteCommand() {}

  public Map<String, ?> where() { return where; }
  public boolean returnRecords() { return returnRecords; }
  public List<String> returnSelect() { return returnSelect; }

  public DeleteCommand withWhere(Map<String, ?> where) { this.where = where; return this; }
  public DeleteCommand withReturnRecords(boolean returnRecords) { this.returnRecords = returnRecords; return this; }
  public DeleteCommand withReturnSelect(String... properties) { this.returnSelect = List.of(properties); return this; }

  public static DeleteCommand where(Map<String, ?> where) {
    return new DeleteCommand().withWhere(where);
  }
}
