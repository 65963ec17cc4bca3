package syncengine.cache;

import syncengine.model.ChangeDetails;
import syncengine.model.SyncEvent;
import syncengine.spi.CacheLayer;
import syncengine.spi.CalculationLayer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maps each event type to the cache entries it makes stale and removes them.
 *
 * <table>
 *   <caption>Invalidation per event type</caption>
 *   <tr><th>Event type</th><th>Targets</th></tr>
 *   <tr><td>{@code SCHEDULE_CHANGE}</td>
 *       <td>related {@code schedule_entries} for the entry id; {@code team_<teamId>}
 *           (every {@code team_} entry when the team is unknown); {@code company_summary}</td></tr>
 *   <tr><td>{@code MEMBER_UPDATE}</td>
 *       <td>related {@code team_members} for the member id; {@code team_<teamId>}</td></tr>
 *   <tr><td>{@code SPRINT_UPDATE}</td>
 *       <td>related {@code global_sprint_settings}; every {@code sprint} and
 *           {@code calculation} entry</td></tr>
 *   <tr><td>{@code TEAM_DATA_CHANGE}</td>
 *       <td>{@code team_<affectedEntityId>}; {@code company_totals}</td></tr>
 * </table>
 *
 * <p>After the targets are removed the calculation layer is told to drop its memoized
 * results. Exceptions from either collaborator propagate to the caller.
 */
public final class CacheInvalidationRouter {
  private static final Logger logger = Logger.getLogger(CacheInvalidationRouter.class.getName());

  private final CacheLayer cache;
  private final CalculationLayer calculations;

  public CacheInvalidationRouter(CacheLayer cache, CalculationLayer calculations) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.calculations = Objects.requireNonNull(calculations, "calculations");
  }

  /**
   * Invalidates every cache entry affected by {@code event}.
   *
   * @param event the event being processed
   */
  public void invalidate(SyncEvent event) {
    List<InvalidationTarget> targets = targetsFor(event);
    for (InvalidationTarget target : targets) {
      target.applyTo(cache);
    }
    calculations.invalidateCalculations();
    logger.log(Level.FINE, "Invalidated {0} cache targets for {1}",
        new Object[]{targets.size(), event.id()});
  }

  /**
   * Returns the cache operations for an event, in the order they are applied.
   *
   * @param event the event
   * @return the targets (never empty)
   */
  public static List<InvalidationTarget> targetsFor(SyncEvent event) {
    List<InvalidationTarget> targets = new ArrayList<>(3);
    Long scope = event.scopeId();
    switch (event.type()) {
      case SCHEDULE_CHANGE -> {
        ChangeDetails.ScheduleChange details = (ChangeDetails.ScheduleChange) event.changeDetails();
        targets.add(InvalidationTarget.related(CacheNamespaces.SCHEDULE_ENTRIES, details.scheduleEntryId()));
        targets.add(InvalidationTarget.pattern(
            scope != null ? CacheNamespaces.team(scope) : CacheNamespaces.TEAM_PREFIX));
        targets.add(InvalidationTarget.pattern(CacheNamespaces.COMPANY_SUMMARY));
      }
      case MEMBER_UPDATE -> {
        ChangeDetails.MemberUpdate details = (ChangeDetails.MemberUpdate) event.changeDetails();
        targets.add(InvalidationTarget.related(CacheNamespaces.TEAM_MEMBERS, details.memberId()));
        targets.add(InvalidationTarget.pattern(CacheNamespaces.team(scope)));
      }
      case SPRINT_UPDATE -> {
        targets.add(InvalidationTarget.related(CacheNamespaces.GLOBAL_SPRINT_SETTINGS, null));
        targets.add(InvalidationTarget.pattern(CacheNamespaces.SPRINT));
        targets.add(InvalidationTarget.pattern(CacheNamespaces.CALCULATION));
      }
      case TEAM_DATA_CHANGE -> {
        targets.add(InvalidationTarget.pattern(CacheNamespaces.team(event.affectedEntityId())));
        targets.add(InvalidationTarget.pattern(CacheNamespaces.COMPANY_TOTALS));
      }
      default -> throw new IllegalStateException("Unhandled event type " + event.type());
    }
    return Collections.unmodifiableList(targets);
  }
}
