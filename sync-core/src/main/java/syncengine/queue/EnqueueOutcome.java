package syncengine.queue;

/** Result of {@link SyncEventQueue#add}. */
public enum EnqueueOutcome {
  /** The event was added as a new entry. */
  APPENDED,
  /** The event replaced a recent entry for the same type and entity. */
  REPLACED,
  /** The queue was full and the event ranked last, so it was discarded. */
  DROPPED
}
