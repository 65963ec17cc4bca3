package syncengine.model;

/**
 * Snapshot of the engine's processing counters.
 *
 * @param totalEvents           completed processing attempts, successful or not
 * @param successfulSyncs       attempts that completed every step
 * @param failedSyncs           attempts that failed or timed out
 * @param averageProcessingTime running average duration of successful attempts in ms
 * @param lastSyncTimestamp     completion time of the latest attempt, 0 if none
 */
public record SyncMetrics(
    long totalEvents,
    long successfulSyncs,
    long failedSyncs,
    double averageProcessingTime,
    long lastSyncTimestamp) {

  public static final SyncMetrics EMPTY = new SyncMetrics(0, 0, 0, 0.0, 0);

  /** Fraction of failed attempts, {@code 0} when nothing was processed. */
  public double errorRate() {
    return totalEvents == 0 ? 0.0 : (double) failedSyncs / totalEvents;
  }
}
