package syncengine.model;

/** What part of a team changed, for application-initiated change notifications. */
public enum ChangeKind {
  SCHEDULE,
  MEMBER,
  CAPACITY,
  SETTINGS
}
