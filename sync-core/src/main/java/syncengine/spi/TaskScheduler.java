package syncengine.spi;

/**
 * Runs the engine's periodic ticks and delayed tasks. Injected so that tests can drive
 * time deterministically.
 *
 * @see syncengine.util.ExecutorTaskScheduler
 */
public interface TaskScheduler extends AutoCloseable {

  /**
   * Runs {@code task} repeatedly, {@code delayMs} after the previous run completed.
   */
  ScheduledTask scheduleWithFixedDelay(Runnable task, long initialDelayMs, long delayMs);

  /** Runs {@code task} once after {@code delayMs}. */
  ScheduledTask schedule(Runnable task, long delayMs);

  /** Cancels every task and releases threads. */
  @Override
  void close();

  /** Handle to a scheduled task. */
  interface ScheduledTask {
    void cancel();
  }
}
