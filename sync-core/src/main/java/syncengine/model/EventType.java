package syncengine.model;

/**
 * Kind of change a {@link SyncEvent} describes.
 *
 * <p>Each type carries the priority assigned to events observed on the change streams.
 * {@link #SPRINT_UPDATE} is {@link Priority#CRITICAL} because it invalidates every
 * period-derived calculation in the system.
 */
public enum EventType {
  SCHEDULE_CHANGE("schedule_change", Priority.HIGH),
  MEMBER_UPDATE("member_update", Priority.HIGH),
  SPRINT_UPDATE("sprint_update", Priority.CRITICAL),
  TEAM_DATA_CHANGE("team_data_change", Priority.HIGH);

  private final String wireName;
  private final Priority defaultPriority;

  EventType(String wireName, Priority defaultPriority) {
    this.wireName = wireName;
    this.defaultPriority = defaultPriority;
  }

  /** Name used on the broadcast channel, e.g. {@code schedule_change}. */
  public String wireName() {
    return wireName;
  }

  public Priority defaultPriority() {
    return defaultPriority;
  }
}
