package syncengine.spi;

/**
 * Observability hook for exporting engine counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of events appended to the queue.
   */
  void incrementEventsEnqueued();

  /**
   * Increments the count of events that replaced a queued event for the same entity.
   */
  void incrementEventsDeduplicated();

  /**
   * Increments the count of events dropped because the queue was full.
   */
  void incrementEventsDropped();

  /**
   * Increments the count of events processed successfully.
   */
  void incrementSyncSuccess();

  /**
   * Increments the count of processing attempts that failed.
   */
  void incrementSyncFailure();

  /**
   * Increments the count of retries started by the health monitor.
   */
  default void incrementSyncRetried() {
  }

  /**
   * Increments the count of pending updates dropped as unrecoverable.
   */
  void incrementSyncUnrecoverable();

  /**
   * Increments the count of broadcasts the transport did not accept.
   */
  default void incrementBroadcastFailure() {
  }

  /**
   * Records the current number of queued events.
   */
  void recordQueueDepth(int depth);

  /**
   * Records the current number of pending updates.
   */
  void recordPendingUpdates(int pending);

  /**
   * Records the current number of registered connections.
   */
  default void recordConnectedClients(int clients) {
  }

  /**
   * Records the time since the latest completed event.
   *
   * @param lagMs lag in milliseconds (always non-negative)
   */
  void recordSyncLagMs(long lagMs);

  /**
   * Records the duration of one successful processing attempt.
   *
   * @param durationMs duration in milliseconds (always non-negative)
   */
  default void recordProcessingTimeMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEventsEnqueued() {
    }

    @Override
    public void incrementEventsDeduplicated() {
    }

    @Override
    public void incrementEventsDropped() {
    }

    @Override
    public void incrementSyncSuccess() {
    }

    @Override
    public void incrementSyncFailure() {
    }

    @Override
    public void incrementSyncUnrecoverable() {
    }

    @Override
    public void recordQueueDepth(int depth) {
    }

    @Override
    public void recordPendingUpdates(int pending) {
    }

    @Override
    public void recordSyncLagMs(long lagMs) {
    }
  }
}
