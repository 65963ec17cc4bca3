package syncengine.dispatch;

import syncengine.model.SyncEvent;
import syncengine.queue.SyncEventQueue;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains the queue in batches.
 *
 * <p>Each call to {@link #processBatch()} takes up to {@code batchSize} events and
 * processes them concurrently; each event settles independently and failed events are
 * parked for retry. A call made while the previous batch is still settling does nothing.
 */
public final class BatchProcessor {
  private static final Logger logger = Logger.getLogger(BatchProcessor.class.getName());

  private final SyncEventQueue queue;
  private final EventProcessor processor;
  private final PendingUpdateStore pendingUpdates;
  private final Clock clock;
  private final int batchSize;
  private final AtomicBoolean processing = new AtomicBoolean(false);
  private volatile CompletableFuture<Void> currentBatch = CompletableFuture.completedFuture(null);

  public BatchProcessor(SyncEventQueue queue, EventProcessor processor,
      PendingUpdateStore pendingUpdates, Clock clock, int batchSize) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.processor = Objects.requireNonNull(processor, "processor");
    this.pendingUpdates = Objects.requireNonNull(pendingUpdates, "pendingUpdates");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.batchSize = batchSize;
  }

  /**
   * Starts one batch.
   *
   * @return the number of events taken from the queue, 0 if the tick was skipped
   */
  public int processBatch() {
    if (queue.isEmpty()) {
      return 0;
    }
    if (!processing.compareAndSet(false, true)) {
      logger.fine("Previous batch still settling; skipping tick");
      return 0;
    }
    try {
      List<SyncEvent> batch = queue.poll(batchSize);
      if (batch.isEmpty()) {
        processing.set(false);
        return 0;
      }
      CompletableFuture<?>[] settled = new CompletableFuture<?>[batch.size()];
      for (int i = 0; i < batch.size(); i++) {
        SyncEvent event = batch.get(i);
        settled[i] = processor.process(event).thenAccept(ok -> {
          if (!ok) {
            pendingUpdates.park(event, clock.millis());
          }
        });
      }
      currentBatch = CompletableFuture.allOf(settled)
          .whenComplete((ignored, error) -> {
            if (error != null) {
              logger.log(Level.SEVERE, "Batch settlement error", error);
            }
            processing.set(false);
          });
      logger.log(Level.FINE, "Dispatched batch of {0} events", batch.size());
      return batch.size();
    } catch (Throwable t) {
      processing.set(false);
      logger.log(Level.SEVERE, "Batch processing error", t);
      return 0;
    }
  }

  public boolean isProcessing() {
    return processing.get();
  }

  /**
   * Waits for the current batch to settle.
   *
   * @return {@code false} if it was still running after {@code timeoutMs}
   */
  public boolean awaitIdle(long timeoutMs) {
    try {
      currentBatch.get(timeoutMs, TimeUnit.MILLISECONDS);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (ExecutionException e) {
      return true;
    } catch (TimeoutException e) {
      return false;
    }
  }
}
