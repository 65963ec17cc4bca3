package syncengine.dispatch;

import syncengine.model.SyncMetrics;

/**
 * Processing counters updated once per settled attempt. Each update is atomic, so a
 * snapshot always satisfies {@code totalEvents == successfulSyncs + failedSyncs}.
 */
public final class SyncMetricsRecorder {
  private long totalEvents;
  private long successfulSyncs;
  private long failedSyncs;
  private double averageProcessingTime;
  private long lastSyncTimestamp;

  /**
   * @param durationMs duration of the successful attempt
   * @param now        completion time
   */
  public synchronized void recordSuccess(long durationMs, long now) {
    totalEvents++;
    successfulSyncs++;
    averageProcessingTime =
        ((averageProcessingTime * (successfulSyncs - 1)) + durationMs) / successfulSyncs;
    lastSyncTimestamp = now;
  }

  public synchronized void recordFailure(long now) {
    totalEvents++;
    failedSyncs++;
    lastSyncTimestamp = now;
  }

  public synchronized SyncMetrics snapshot() {
    return new SyncMetrics(totalEvents, successfulSyncs, failedSyncs, averageProcessingTime,
        lastSyncTimestamp);
  }
}
