package syncengine.model;

/** Payload of the {@code force_refresh} broadcast: every consumer must refetch. */
public record ForceRefreshNotification(long timestamp) {
}
