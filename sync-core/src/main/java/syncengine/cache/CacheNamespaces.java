package syncengine.cache;

/** Cache namespaces and key fragments shared by the router and the reference cache. */
public final class CacheNamespaces {

  public static final String SCHEDULE_ENTRIES = "schedule_entries";
  public static final String TEAM_MEMBERS = "team_members";
  public static final String GLOBAL_SPRINT_SETTINGS = "global_sprint_settings";
  public static final String TEAMS = "teams";

  /** Prefix of every per-team aggregate key. */
  public static final String TEAM_PREFIX = "team_";
  public static final String COMPANY_SUMMARY = "company_summary";
  public static final String COMPANY_TOTALS = "company_totals";
  public static final String SPRINT = "sprint";
  public static final String CALCULATION = "calculation";

  private CacheNamespaces() {
  }

  /** Key fragment matching every aggregate of one team, e.g. {@code team_7}. */
  public static String team(long teamId) {
    return TEAM_PREFIX + teamId;
  }
}
