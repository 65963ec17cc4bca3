package syncengine.broadcast;

/** Channel and event names used on the pub/sub transport. */
public final class SyncChannels {

  /** Channel carrying change-stream mutations and engine broadcasts. */
  public static final String CHANNEL = "sync_manager";

  /** Published once per processed event. */
  public static final String DATA_REFRESH = "data_refresh";

  /** Published by forced synchronization; consumers must refetch everything. */
  public static final String FORCE_REFRESH = "force_refresh";

  /** Published by other engine instances; consumed as inbound events. */
  public static final String DATA_CHANGE = "data_change";

  private SyncChannels() {
  }
}
