package syncengine.model;

/** Where a {@link SyncEvent} originated. */
public enum EventSource {
  /** A team-scoped view triggered the change. */
  SCOPED_VIEW,
  /** The company-wide summary view triggered the change. */
  SUMMARY_VIEW,
  /** Observed on a change stream or received from another process. */
  SYSTEM
}
