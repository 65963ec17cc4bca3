package syncengine.listener;

/** Change-stream (table) names and the row columns read from them. */
public final class ChangeStreams {

  public static final String SCHEDULE_ENTRIES = "schedule_entries";
  public static final String TEAM_MEMBERS = "team_members";
  public static final String GLOBAL_SPRINT_SETTINGS = "global_sprint_settings";

  static final String ID = "id";
  static final String MEMBER_ID = "member_id";
  static final String TEAM_ID = "team_id";
  static final String DATE = "date";
  static final String VALUE = "value";
  static final String NAME = "name";
  static final String IS_MANAGER = "is_manager";
  static final String CURRENT_SPRINT_NUMBER = "current_sprint_number";
  static final String SPRINT_START_DATE = "sprint_start_date";
  static final String SPRINT_LENGTH_WEEKS = "sprint_length_weeks";

  private ChangeStreams() {
  }
}
