package syncengine.queue;

import syncengine.model.SyncEvent;
import syncengine.spi.MetricsExporter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pending sync events in processing order, with same-entity deduplication.
 *
 * <p>Ordering: priority ({@code CRITICAL} first), then ascending event timestamp. An event
 * whose type and entity match an entry enqueued less than {@code dedupWindowMs} ago replaces
 * that entry in place. When an insertion makes the queue longer than {@code maxLength}, the
 * last entry in queue order is discarded, which may be the event just added.
 *
 * <p>This class is thread-safe; every operation holds the queue's monitor.
 */
public final class SyncEventQueue {
  private static final Logger logger = Logger.getLogger(SyncEventQueue.class.getName());

  private static final Comparator<QueuedSyncEvent> ORDER = Comparator
      .comparing((QueuedSyncEvent e) -> e.event().priority())
      .thenComparingLong(e -> e.event().timestamp());

  private final List<QueuedSyncEvent> entries = new ArrayList<>();
  private final Clock clock;
  private final long dedupWindowMs;
  private final int maxLength;
  private final MetricsExporter metrics;

  /**
   * @param clock         time source for enqueue times
   * @param dedupWindowMs window within which same-entity events are merged; must be &ge; 0
   * @param maxLength     maximum number of entries; must be &gt; 0
   * @param metrics       metrics exporter
   */
  public SyncEventQueue(Clock clock, long dedupWindowMs, int maxLength, MetricsExporter metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (dedupWindowMs < 0) {
      throw new IllegalArgumentException("dedupWindowMs must be >= 0");
    }
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be > 0");
    }
    this.dedupWindowMs = dedupWindowMs;
    this.maxLength = maxLength;
  }

  /**
   * Adds an event, merging it into a recent entry for the same type and entity if one exists.
   *
   * @param event the event to add
   * @return what happened to the event
   */
  public synchronized EnqueueOutcome add(SyncEvent event) {
    Objects.requireNonNull(event, "event");
    long now = clock.millis();
    QueuedSyncEvent entry = new QueuedSyncEvent(event, now);

    EnqueueOutcome outcome = EnqueueOutcome.APPENDED;
    int existing = indexOfRecent(event, now);
    if (existing >= 0) {
      entries.set(existing, entry);
      outcome = EnqueueOutcome.REPLACED;
    } else {
      entries.add(entry);
    }
    entries.sort(ORDER);

    if (entries.size() > maxLength) {
      QueuedSyncEvent dropped = entries.remove(entries.size() - 1);
      metrics.incrementEventsDropped();
      logger.log(Level.WARNING, "Sync queue full ({0}); dropped event {1} ({2}, {3})",
          new Object[]{maxLength, dropped.event().id(), dropped.event().type(), dropped.event().priority()});
      if (dropped == entry) {
        outcome = EnqueueOutcome.DROPPED;
      }
    }

    if (outcome == EnqueueOutcome.REPLACED) {
      metrics.incrementEventsDeduplicated();
      logger.log(Level.FINE, "Replaced queued event with {0}", event.id());
    } else if (outcome == EnqueueOutcome.APPENDED) {
      metrics.incrementEventsEnqueued();
      logger.log(Level.FINE, "Queued event {0}", event.id());
    }
    metrics.recordQueueDepth(entries.size());
    return outcome;
  }

  private int indexOfRecent(SyncEvent event, long now) {
    for (int i = 0; i < entries.size(); i++) {
      QueuedSyncEvent queued = entries.get(i);
      if (queued.event().sameTarget(event) && now - queued.enqueuedAt() < dedupWindowMs) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Removes and returns up to {@code max} events from the head of the queue.
   *
   * @param max maximum number of events
   * @return events in queue order, possibly empty
   */
  public synchronized List<SyncEvent> poll(int max) {
    int count = Math.min(max, entries.size());
    List<SyncEvent> batch = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      batch.add(entries.get(i).event());
    }
    entries.subList(0, count).clear();
    metrics.recordQueueDepth(entries.size());
    return batch;
  }

  /** Returns the queued events in processing order without removing them. */
  public synchronized List<SyncEvent> snapshot() {
    List<SyncEvent> events = new ArrayList<>(entries.size());
    for (QueuedSyncEvent entry : entries) {
      events.add(entry.event());
    }
    return events;
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized boolean isEmpty() {
    return entries.isEmpty();
  }

  public synchronized void clear() {
    entries.clear();
    metrics.recordQueueDepth(0);
  }
}
