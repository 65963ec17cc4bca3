package syncengine.model;

public enum EntityType {
  TEAM,
  MEMBER,
  SPRINT,
  SCHEDULE_ENTRY
}
