package syncengine.model;

/**
 * Processing priority of a {@link SyncEvent}. Declaration order is queue order:
 * {@link #CRITICAL} events are dequeued first.
 */
public enum Priority {
  CRITICAL,
  HIGH,
  MEDIUM,
  LOW
}
