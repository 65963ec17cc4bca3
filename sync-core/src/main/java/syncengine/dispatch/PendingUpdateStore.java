package syncengine.dispatch;

import syncengine.model.PendingUpdate;
import syncengine.model.SyncEvent;
import syncengine.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Failed events awaiting retry, keyed by event id. Thread-safe.
 */
public final class PendingUpdateStore {
  private static final Logger logger = Logger.getLogger(PendingUpdateStore.class.getName());

  private final Map<String, PendingUpdate> pending = new ConcurrentHashMap<>();
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;

  public PendingUpdateStore(RetryPolicy retryPolicy, MetricsExporter metrics) {
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Parks a failed event; it is due on the next health tick. An event that is already
   * parked keeps its existing entry.
   *
   * @return the stored entry
   */
  public PendingUpdate park(SyncEvent event, long now) {
    PendingUpdate stored = pending.computeIfAbsent(event.id(),
        id -> new PendingUpdate(event, now, 0, now));
    metrics.recordPendingUpdates(pending.size());
    logger.log(Level.FINE, "Parked sync event {0} for retry", event.id());
    return stored;
  }

  /**
   * Records a failed retry and schedules the next one using the retry policy. An entry
   * removed while its retry was running stays removed.
   *
   * @return the updated entry, or {@code null} if the entry is no longer parked
   */
  public PendingUpdate reschedule(PendingUpdate update, long now) {
    int attempts = update.attempts() + 1;
    PendingUpdate next = update.afterFailedAttempt(now + retryPolicy.computeDelayMs(attempts));
    PendingUpdate previous = pending.replace(update.eventId(), next);
    metrics.recordPendingUpdates(pending.size());
    return previous != null ? next : null;
  }

  public boolean remove(String eventId) {
    boolean removed = pending.remove(eventId) != null;
    metrics.recordPendingUpdates(pending.size());
    return removed;
  }

  public PendingUpdate find(String eventId) {
    return pending.get(eventId);
  }

  /** Returns the parked entries, oldest failure first. */
  public List<PendingUpdate> snapshot() {
    List<PendingUpdate> updates = new ArrayList<>(pending.values());
    updates.sort(Comparator.comparingLong(PendingUpdate::firstFailedAt));
    return Collections.unmodifiableList(updates);
  }

  public int size() {
    return pending.size();
  }

  public void clear() {
    pending.clear();
    metrics.recordPendingUpdates(0);
  }
}
