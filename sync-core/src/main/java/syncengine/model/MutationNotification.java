package syncengine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A row-level change observed on one of the store's change streams.
 *
 * <p>Inserts carry only {@code newRecord}, deletes only {@code oldRecord}; updates carry both.
 * Record maps are copied and exposed read-only; absent records are empty maps.
 *
 * @param streamName logical stream (table) name
 * @param operation  kind of mutation
 * @param oldRecord  row before the change
 * @param newRecord  row after the change
 */
public record MutationNotification(
    String streamName,
    MutationOperation operation,
    Map<String, Object> oldRecord,
    Map<String, Object> newRecord) {

  public MutationNotification {
    Objects.requireNonNull(streamName, "streamName");
    Objects.requireNonNull(operation, "operation");
    oldRecord = copy(oldRecord);
    newRecord = copy(newRecord);
  }

  /**
   * Returns a column value from the new row, falling back to the old row.
   *
   * @param column the column name
   * @return the value, or {@code null} if neither row has it
   */
  public Object value(String column) {
    Object value = newRecord.get(column);
    return value != null ? value : oldRecord.get(column);
  }

  /** Returns the column value from the old row only. */
  public Object oldValue(String column) {
    return oldRecord.get(column);
  }

  private static Map<String, Object> copy(Map<String, Object> record) {
    if (record == null || record.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(record));
  }
}
