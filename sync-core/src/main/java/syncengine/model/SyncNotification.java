package syncengine.model;

import java.util.Objects;

/**
 * Normalized payload published on the broadcast channel for every processed event.
 *
 * <p>Consumers receive every notification and filter by their own scope. Other engine
 * instances publish the same shape on the {@code data_change} event to feed this one.
 * Fields other than {@code type}, {@code affectedEntityType} and {@code changeDetails}
 * may be absent on inbound notifications.
 */
public record SyncNotification(
    String eventId,
    EventType type,
    long affectedEntityId,
    EntityType affectedEntityType,
    ChangeDetails changeDetails,
    long timestamp,
    Priority priority) {

  public static SyncNotification from(SyncEvent event) {
    Objects.requireNonNull(event, "event");
    return new SyncNotification(
        event.id(),
        event.type(),
        event.affectedEntityId(),
        event.affectedEntityType(),
        event.changeDetails(),
        event.timestamp(),
        event.priority());
  }
}
