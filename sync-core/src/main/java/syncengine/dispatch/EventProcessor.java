package syncengine.dispatch;

import syncengine.broadcast.BroadcastPublisher;
import syncengine.cache.CacheInvalidationRouter;
import syncengine.model.SyncEvent;
import syncengine.recalc.RecalculationTrigger;
import syncengine.spi.MetricsExporter;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the processing steps of one sync event and records the outcome.
 *
 * <p>Steps, in order: cache invalidation, recalculation, broadcast. An exception from the
 * first two steps fails the attempt; a hung collaborator surfaces as one, since every
 * call is bounded by the call timeout of the step that makes it. Broadcast failures
 * never fail it. Exactly one of success or failure is recorded per attempt, once all
 * steps have returned.
 *
 * <p>The recorded duration starts when a worker picks the event up, not while it waits
 * in the executor's queue.
 */
public final class EventProcessor {
  private static final Logger logger = Logger.getLogger(EventProcessor.class.getName());

  private final CacheInvalidationRouter invalidationRouter;
  private final RecalculationTrigger recalculationTrigger;
  private final BroadcastPublisher broadcastPublisher;
  private final SyncMetricsRecorder recorder;
  private final MetricsExporter metrics;
  private final Executor executor;
  private final Clock clock;

  public EventProcessor(
      CacheInvalidationRouter invalidationRouter,
      RecalculationTrigger recalculationTrigger,
      BroadcastPublisher broadcastPublisher,
      SyncMetricsRecorder recorder,
      MetricsExporter metrics,
      Executor executor,
      Clock clock) {
    this.invalidationRouter = Objects.requireNonNull(invalidationRouter, "invalidationRouter");
    this.recalculationTrigger = Objects.requireNonNull(recalculationTrigger, "recalculationTrigger");
    this.broadcastPublisher = Objects.requireNonNull(broadcastPublisher, "broadcastPublisher");
    this.recorder = Objects.requireNonNull(recorder, "recorder");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Processes one event on the executor.
   *
   * @param event the event
   * @return future completing with {@code true} on success and {@code false} on failure;
   *     it never completes exceptionally
   */
  public CompletableFuture<Boolean> process(SyncEvent event) {
    AtomicLong startedAt = new AtomicLong(clock.millis());
    CompletableFuture<Void> steps;
    try {
      steps = CompletableFuture.runAsync(() -> {
        startedAt.set(clock.millis());
        runSteps(event);
      }, executor);
    } catch (RejectedExecutionException e) {
      steps = CompletableFuture.failedFuture(e);
    }
    return steps.handle((ignored, error) -> settle(event, startedAt.get(), error));
  }

  private void runSteps(SyncEvent event) {
    invalidationRouter.invalidate(event);
    recalculationTrigger.recalculate(event);
    broadcastPublisher.publish(event);
  }

  private boolean settle(SyncEvent event, long startedAt, Throwable error) {
    long now = clock.millis();
    if (error == null) {
      long duration = Math.max(0L, now - startedAt);
      recorder.recordSuccess(duration, now);
      metrics.incrementSyncSuccess();
      metrics.recordProcessingTimeMs(duration);
      logger.log(Level.FINE, "Processed {0} ({1}) in {2} ms",
          new Object[]{event.id(), event.type(), duration});
      return true;
    }
    Throwable cause = error instanceof CompletionException && error.getCause() != null
        ? error.getCause() : error;
    recorder.recordFailure(now);
    metrics.incrementSyncFailure();
    logger.log(Level.WARNING, "Processing of " + event.id() + " (" + event.type() + ") failed", cause);
    return false;
  }
}
