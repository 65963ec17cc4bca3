package syncengine.spi;

import java.util.concurrent.CompletionStage;

/**
 * Computes the aggregates shown by the views. The engine asks it to recompute after a
 * change; how values are computed is up to the implementation.
 *
 * <p>Asynchronous operations are awaited with the engine's call timeout. A failed or
 * late stage is treated as a processing failure of the event that requested it.
 */
public interface CalculationLayer {

  /** Recomputes the aggregate for one team. */
  CompletionStage<Void> recomputeScopeAggregate(long scopeId);

  /** Recomputes the company-wide summary view. */
  CompletionStage<Void> recomputeSummaryView();

  /** Reloads the current sprint/period data. */
  CompletionStage<Void> refreshPeriodData();

  /** Recomputes the company-wide totals. */
  CompletionStage<Void> recomputeGlobalTotals();

  /** Pre-computes the aggregates the views need first. */
  CompletionStage<Void> warmupCaches();

  /** Drops memoized calculation results. Must not block. */
  void invalidateCalculations();

  /** Capacity of one team as computed by the team-level path. */
  CompletionStage<Double> scopeCapacity(long scopeId);

  /** Capacity of one team as reported by the summary-view path. */
  CompletionStage<Double> summaryCapacity(long scopeId);
}
