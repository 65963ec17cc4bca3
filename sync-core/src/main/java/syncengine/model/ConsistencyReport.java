package syncengine.model;

/**
 * Result of comparing one team's capacity computed by the team-level path with the value
 * reported for the same team by the summary-view path.
 */
public record ConsistencyReport(
    long scopeId,
    boolean consistent,
    double scopeLevel,
    double summaryLevel,
    double difference) {

  /** Report for a check that could not complete. */
  public static ConsistencyReport failed(long scopeId) {
    return new ConsistencyReport(scopeId, false, 0.0, 0.0, 0.0);
  }
}
