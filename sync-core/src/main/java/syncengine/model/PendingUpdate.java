package syncengine.model;

import java.util.Objects;

/**
 * A {@link SyncEvent} that failed processing and waits for a retry by the health monitor.
 *
 * @param event         the original event
 * @param firstFailedAt time of the first failure
 * @param attempts      retry attempts made so far (the initial failure is not counted)
 * @param nextAttemptAt earliest time of the next retry
 */
public record PendingUpdate(SyncEvent event, long firstFailedAt, int attempts, long nextAttemptAt) {

  public PendingUpdate {
    Objects.requireNonNull(event, "event");
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0");
    }
  }

  public String eventId() {
    return event.id();
  }

  /** Age measured from the original event timestamp. */
  public long ageMs(long now) {
    return now - event.timestamp();
  }

  public boolean isDue(long now) {
    return now >= nextAttemptAt;
  }

  public PendingUpdate afterFailedAttempt(long nextAttemptAt) {
    return new PendingUpdate(event, firstFailedAt, attempts + 1, nextAttemptAt);
  }
}
