package syncengine.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Objects;

/**
 * Immutable record of one observed or manually triggered change to a tracked entity.
 *
 * <p>Each event is assigned a ULID-based id ({@code sync_<ulid>}) unless one is supplied.
 * The {@code changeDetails} variant must match {@code type}.
 *
 * @param id                 unique event id
 * @param type               kind of change
 * @param source             where the change originated
 * @param affectedEntityId   id of the entity the event is keyed on
 * @param affectedEntityType kind of entity {@code affectedEntityId} refers to
 * @param changeDetails      typed payload for {@code type}
 * @param timestamp          creation time in epoch milliseconds
 * @param priority           processing priority
 */
public record SyncEvent(
    String id,
    EventType type,
    EventSource source,
    long affectedEntityId,
    EntityType affectedEntityType,
    ChangeDetails changeDetails,
    long timestamp,
    Priority priority) {

  public SyncEvent {
    Objects.requireNonNull(id, "id");
    if (id.isEmpty()) {
      throw new IllegalArgumentException("id cannot be empty");
    }
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(affectedEntityType, "affectedEntityType");
    Objects.requireNonNull(changeDetails, "changeDetails");
    Objects.requireNonNull(priority, "priority");
    if (changeDetails.type() != type) {
      throw new IllegalArgumentException("changeDetails " + changeDetails.getClass().getSimpleName()
          + " does not belong to event type " + type);
    }
  }

  /**
   * Returns {@code true} if both events describe the same kind of change to the same entity.
   * Such events are merged by the queue within its deduplication window.
   */
  public boolean sameTarget(SyncEvent other) {
    return type == other.type && affectedEntityId == other.affectedEntityId;
  }

  /**
   * Resolves the team whose aggregates this event touches.
   *
   * <p>Member updates observed on the change stream are keyed on the team, so the
   * affected entity id stands in when the row carried no explicit team.
   *
   * @return the team id, or {@code null} when the event is not scoped to one team
   */
  public Long scopeId() {
    if (changeDetails instanceof ChangeDetails.ScheduleChange schedule) {
      return schedule.teamId();
    }
    if (changeDetails instanceof ChangeDetails.MemberUpdate member) {
      return member.teamId() != null ? member.teamId() : affectedEntityId;
    }
    if (changeDetails instanceof ChangeDetails.TeamDataChange) {
      return affectedEntityId;
    }
    return null;
  }

  /** Generates a new event id. */
  public static String newEventId() {
    return "sync_" + UlidCreator.getMonotonicUlid();
  }

  /**
   * Creates a builder for an event whose payload determines the event type.
   *
   * @param changeDetails the typed payload
   * @return a new builder
   */
  public static Builder builder(ChangeDetails changeDetails) {
    return new Builder(changeDetails);
  }

  /** Builder for {@link SyncEvent}. */
  public static final class Builder {
    private final ChangeDetails changeDetails;
    private String id;
    private EventSource source = EventSource.SYSTEM;
    private Long affectedEntityId;
    private EntityType affectedEntityType;
    private Long timestamp;
    private Priority priority;

    private Builder(ChangeDetails changeDetails) {
      this.changeDetails = Objects.requireNonNull(changeDetails, "changeDetails");
    }

    /** Optional. Defaults to a newly generated id. */
    public Builder id(String id) {
      this.id = id;
      return this;
    }

    /** Optional. Defaults to {@link EventSource#SYSTEM}. */
    public Builder source(EventSource source) {
      this.source = source;
      return this;
    }

    /** <b>Required.</b> */
    public Builder affectedEntity(EntityType type, long id) {
      this.affectedEntityType = type;
      this.affectedEntityId = id;
      return this;
    }

    /** <b>Required.</b> Creation time in epoch milliseconds, taken from the engine's clock. */
    public Builder timestamp(long timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    /** Optional. Defaults to {@link EventType#defaultPriority()}. */
    public Builder priority(Priority priority) {
      this.priority = priority;
      return this;
    }

    /**
     * @throws NullPointerException if the affected entity or the timestamp was not set
     */
    public SyncEvent build() {
      Objects.requireNonNull(affectedEntityId, "affectedEntityId");
      Objects.requireNonNull(timestamp, "timestamp");
      EventType type = changeDetails.type();
      return new SyncEvent(
          id == null ? newEventId() : id,
          type,
          source,
          affectedEntityId,
          affectedEntityType,
          changeDetails,
          timestamp,
          priority == null ? type.defaultPriority() : priority);
    }
  }
}
