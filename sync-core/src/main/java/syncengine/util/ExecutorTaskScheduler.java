package syncengine.util;

import syncengine.spi.TaskScheduler;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} backed by a single-threaded {@link ScheduledExecutorService}.
 *
 * <p>Both engine ticks share the one thread, so a tick never overlaps another run of
 * itself; a long health check delays the next batch tick instead.
 */
public final class ExecutorTaskScheduler implements TaskScheduler {
  private final ScheduledExecutorService executor;

  public ExecutorTaskScheduler() {
    this("sync-scheduler-");
  }

  public ExecutorTaskScheduler(String threadPrefix) {
    this.executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory(threadPrefix));
  }

  @Override
  public ScheduledTask scheduleWithFixedDelay(Runnable task, long initialDelayMs, long delayMs) {
    ScheduledFuture<?> future = executor.scheduleWithFixedDelay(
        task, initialDelayMs, delayMs, TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  @Override
  public ScheduledTask schedule(Runnable task, long delayMs) {
    ScheduledFuture<?> future = executor.schedule(task, delayMs, TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  @Override
  public void close() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
