package syncengine.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Typed payload of a {@link SyncEvent}. There is exactly one variant per {@link EventType};
 * {@link SyncEvent} rejects a variant that does not match its type.
 *
 * <p>Identifiers that a change row may not carry (for example the team of a schedule
 * entry) are nullable.
 */
public sealed interface ChangeDetails
    permits ChangeDetails.ScheduleChange, ChangeDetails.MemberUpdate,
        ChangeDetails.SprintUpdate, ChangeDetails.TeamDataChange {

  /** The event type this payload belongs to. */
  EventType type();

  /** A schedule entry was inserted, updated or deleted. */
  record ScheduleChange(
      MutationOperation operation,
      Long scheduleEntryId,
      Long memberId,
      Long teamId,
      LocalDate date,
      String value,
      String oldValue) implements ChangeDetails {

    public ScheduleChange {
      Objects.requireNonNull(operation, "operation");
    }

    @Override
    public EventType type() {
      return EventType.SCHEDULE_CHANGE;
    }
  }

  /** A team membership row changed. */
  record MemberUpdate(
      MutationOperation operation,
      Long memberId,
      Long teamId,
      String memberName,
      boolean manager) implements ChangeDetails {

    public MemberUpdate {
      Objects.requireNonNull(operation, "operation");
    }

    @Override
    public EventType type() {
      return EventType.MEMBER_UPDATE;
    }
  }

  /** The global sprint settings changed. */
  record SprintUpdate(
      MutationOperation operation,
      Integer sprintNumber,
      LocalDate startDate,
      Integer lengthWeeks) implements ChangeDetails {

    public SprintUpdate {
      Objects.requireNonNull(operation, "operation");
    }

    @Override
    public EventType type() {
      return EventType.SPRINT_UPDATE;
    }
  }

  /** Application-initiated change to a team outside the watched streams. */
  record TeamDataChange(ChangeKind changeKind) implements ChangeDetails {

    public TeamDataChange {
      Objects.requireNonNull(changeKind, "changeKind");
    }

    @Override
    public EventType type() {
      return EventType.TEAM_DATA_CHANGE;
    }
  }
}
