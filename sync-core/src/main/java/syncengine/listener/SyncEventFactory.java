package syncengine.listener;

import syncengine.model.ChangeDetails;
import syncengine.model.ChangeKind;
import syncengine.model.EntityType;
import syncengine.model.EventSource;
import syncengine.model.MutationNotification;
import syncengine.model.Priority;
import syncengine.model.SyncEvent;
import syncengine.model.SyncNotification;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Builds {@link SyncEvent}s from change-stream rows, application calls and notifications
 * published by other engine instances.
 *
 * <p>Row values may arrive as numbers or strings depending on the transport; both are
 * accepted. A row without the column an event is keyed on is rejected with
 * {@link MalformedChangeException}.
 */
public final class SyncEventFactory {
  private final Clock clock;

  public SyncEventFactory(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Adapts a change-stream mutation.
   *
   * @param notification the mutation
   * @return the event, or {@code null} if the stream is not watched
   * @throws MalformedChangeException if the row lacks a required column or has a bad value
   */
  public SyncEvent fromMutation(MutationNotification notification) {
    switch (notification.streamName()) {
      case ChangeStreams.SCHEDULE_ENTRIES:
        return scheduleChange(notification);
      case ChangeStreams.TEAM_MEMBERS:
        return memberUpdate(notification);
      case ChangeStreams.GLOBAL_SPRINT_SETTINGS:
        return sprintUpdate(notification);
      default:
        return null;
    }
  }

  private SyncEvent scheduleChange(MutationNotification n) {
    ChangeDetails.ScheduleChange details = new ChangeDetails.ScheduleChange(
        n.operation(),
        asLong(n.value(ChangeStreams.ID)),
        asLong(n.value(ChangeStreams.MEMBER_ID)),
        asLong(n.value(ChangeStreams.TEAM_ID)),
        asDate(n.value(ChangeStreams.DATE)),
        asString(n.value(ChangeStreams.VALUE)),
        asString(n.oldValue(ChangeStreams.VALUE)));
    return SyncEvent.builder(details)
        .source(EventSource.SYSTEM)
        .affectedEntity(EntityType.SCHEDULE_ENTRY, required(details.memberId(), n, ChangeStreams.MEMBER_ID))
        .timestamp(clock.millis())
        .priority(Priority.HIGH)
        .build();
  }

  private SyncEvent memberUpdate(MutationNotification n) {
    ChangeDetails.MemberUpdate details = new ChangeDetails.MemberUpdate(
        n.operation(),
        asLong(n.value(ChangeStreams.ID)),
        asLong(n.value(ChangeStreams.TEAM_ID)),
        asString(n.value(ChangeStreams.NAME)),
        asBoolean(n.value(ChangeStreams.IS_MANAGER)));
    return SyncEvent.builder(details)
        .source(EventSource.SYSTEM)
        .affectedEntity(EntityType.MEMBER, required(details.teamId(), n, ChangeStreams.TEAM_ID))
        .timestamp(clock.millis())
        .priority(Priority.HIGH)
        .build();
  }

  private SyncEvent sprintUpdate(MutationNotification n) {
    Long id = asLong(n.value(ChangeStreams.ID));
    ChangeDetails.SprintUpdate details = new ChangeDetails.SprintUpdate(
        n.operation(),
        asInteger(n.value(ChangeStreams.CURRENT_SPRINT_NUMBER)),
        asDate(n.value(ChangeStreams.SPRINT_START_DATE)),
        asInteger(n.value(ChangeStreams.SPRINT_LENGTH_WEEKS)));
    return SyncEvent.builder(details)
        .source(EventSource.SYSTEM)
        .affectedEntity(EntityType.SPRINT, required(id, n, ChangeStreams.ID))
        .timestamp(clock.millis())
        .priority(Priority.CRITICAL)
        .build();
  }

  /**
   * Builds the event for an application-initiated change to a team.
   */
  public SyncEvent manualChange(long teamId, ChangeKind kind, EventSource source) {
    return SyncEvent.builder(new ChangeDetails.TeamDataChange(kind))
        .source(source)
        .affectedEntity(EntityType.TEAM, teamId)
        .timestamp(clock.millis())
        .priority(Priority.HIGH)
        .build();
  }

  /**
   * Rebuilds an event published by another engine instance. A missing id is generated,
   * a missing priority becomes {@link Priority#MEDIUM}, a missing timestamp becomes now.
   *
   * @throws MalformedChangeException if the notification has no type, entity type or details,
   *     or its details do not match its type
   */
  public SyncEvent fromRemote(SyncNotification notification) {
    if (notification.type() == null || notification.affectedEntityType() == null
        || notification.changeDetails() == null) {
      throw new MalformedChangeException("Incomplete remote notification " + notification);
    }
    try {
      return SyncEvent.builder(notification.changeDetails())
          .id(notification.eventId())
          .source(EventSource.SYSTEM)
          .affectedEntity(notification.affectedEntityType(), notification.affectedEntityId())
          .timestamp(notification.timestamp() > 0 ? notification.timestamp() : clock.millis())
          .priority(notification.priority() != null ? notification.priority() : Priority.MEDIUM)
          .build();
    } catch (IllegalArgumentException e) {
      throw new MalformedChangeException("Invalid remote notification " + notification.eventId(), e);
    }
  }

  private static long required(Long value, MutationNotification n, String column) {
    if (value == null) {
      throw new MalformedChangeException(n.operation() + " on " + n.streamName() + " has no " + column);
    }
    return value;
  }

  static Long asLong(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new MalformedChangeException("Not a number: " + value, e);
    }
  }

  static Integer asInteger(Object value) {
    Long number = asLong(value);
    return number == null ? null : Math.toIntExact(number);
  }

  static LocalDate asDate(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof LocalDate date) {
      return date;
    }
    String text = value.toString();
    try {
      return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
    } catch (DateTimeParseException e) {
      throw new MalformedChangeException("Not a date: " + value, e);
    }
  }

  static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  static boolean asBoolean(Object value) {
    if (value instanceof Boolean flag) {
      return flag;
    }
    return value != null && Boolean.parseBoolean(value.toString());
  }
}
