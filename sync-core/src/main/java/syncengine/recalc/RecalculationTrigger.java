package syncengine.recalc;

import syncengine.TransientProcessingException;
import syncengine.model.SyncEvent;
import syncengine.spi.CalculationLayer;
import syncengine.util.Futures;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Asks the calculation layer to recompute the aggregates an event affects.
 *
 * <ul>
 *   <li>schedule and member changes: the team aggregate (when the team is known), then
 *       the summary view</li>
 *   <li>sprint updates: period data, then the global totals</li>
 *   <li>team data changes: the aggregate of the affected team</li>
 * </ul>
 *
 * <p>Each call is awaited for at most {@code callTimeoutMs}, in order.
 */
public final class RecalculationTrigger {
  private static final Logger logger = Logger.getLogger(RecalculationTrigger.class.getName());

  private final CalculationLayer calculations;
  private final long callTimeoutMs;

  /**
   * @param calculations  the calculation layer
   * @param callTimeoutMs maximum wait for each calculation; must be &gt; 0
   */
  public RecalculationTrigger(CalculationLayer calculations, long callTimeoutMs) {
    this.calculations = Objects.requireNonNull(calculations, "calculations");
    if (callTimeoutMs <= 0) {
      throw new IllegalArgumentException("callTimeoutMs must be > 0");
    }
    this.callTimeoutMs = callTimeoutMs;
  }

  /**
   * Recomputes the aggregates affected by {@code event}.
   *
   * @param event the event being processed
   * @throws TransientProcessingException if a calculation fails or times out
   */
  public void recalculate(SyncEvent event) {
    switch (event.type()) {
      case SCHEDULE_CHANGE, MEMBER_UPDATE -> {
        Long scope = event.scopeId();
        if (scope != null) {
          Futures.await(calculations.recomputeScopeAggregate(scope), callTimeoutMs,
              "recomputeScopeAggregate(" + scope + ")");
        }
        Futures.await(calculations.recomputeSummaryView(), callTimeoutMs, "recomputeSummaryView");
      }
      case SPRINT_UPDATE -> {
        Futures.await(calculations.refreshPeriodData(), callTimeoutMs, "refreshPeriodData");
        Futures.await(calculations.recomputeGlobalTotals(), callTimeoutMs, "recomputeGlobalTotals");
      }
      case TEAM_DATA_CHANGE -> Futures.await(
          calculations.recomputeScopeAggregate(event.affectedEntityId()), callTimeoutMs,
          "recomputeScopeAggregate(" + event.affectedEntityId() + ")");
      default -> throw new IllegalStateException("Unhandled event type " + event.type());
    }
    logger.log(Level.FINE, "Recalculated aggregates for {0}", event.id());
  }
}
