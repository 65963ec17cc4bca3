package syncengine.health;

import syncengine.cache.CacheNamespaces;
import syncengine.model.ConsistencyReport;
import syncengine.spi.CacheLayer;
import syncengine.spi.CalculationLayer;
import syncengine.util.Futures;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compares a team's capacity as computed by the team-level path with the value the
 * summary view reports for the same team.
 */
public final class ConsistencyChecker {
  private static final Logger logger = Logger.getLogger(ConsistencyChecker.class.getName());

  /** Largest difference still treated as consistent. */
  public static final double TOLERANCE = 0.01;

  private final CacheLayer cache;
  private final CalculationLayer calculations;
  private final long callTimeoutMs;

  public ConsistencyChecker(CacheLayer cache, CalculationLayer calculations, long callTimeoutMs) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.calculations = Objects.requireNonNull(calculations, "calculations");
    if (callTimeoutMs <= 0) {
      throw new IllegalArgumentException("callTimeoutMs must be > 0");
    }
    this.callTimeoutMs = callTimeoutMs;
  }

  /**
   * @param scopeId the team to check
   * @return the comparison; {@link ConsistencyReport#failed} if either value is unavailable
   */
  public ConsistencyReport check(long scopeId) {
    try {
      Double scopeLevel = Futures.await(calculations.scopeCapacity(scopeId), callTimeoutMs,
          "scopeCapacity(" + scopeId + ")");
      Double summaryLevel = Futures.await(calculations.summaryCapacity(scopeId), callTimeoutMs,
          "summaryCapacity(" + scopeId + ")");
      if (scopeLevel == null || summaryLevel == null) {
        logger.log(Level.WARNING, "No capacity value for team {0}", scopeId);
        return ConsistencyReport.failed(scopeId);
      }
      double difference = Math.abs(scopeLevel - summaryLevel);
      boolean consistent = difference <= TOLERANCE;
      if (!consistent) {
        logger.log(Level.WARNING, "Team {0} diverges: team view {1}, summary view {2}",
            new Object[]{scopeId, scopeLevel, summaryLevel});
      }
      return new ConsistencyReport(scopeId, consistent, scopeLevel, summaryLevel, difference);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Consistency check for team " + scopeId + " failed", e);
      return ConsistencyReport.failed(scopeId);
    }
  }

  /**
   * Drops the team's cached aggregates and memoized calculations, then checks again.
   *
   * @return the report after reconciliation
   */
  public ConsistencyReport reconcile(long scopeId) {
    try {
      cache.clearCacheByPattern(CacheNamespaces.team(scopeId));
      calculations.invalidateCalculations();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Reconciliation of team " + scopeId + " failed", e);
      return ConsistencyReport.failed(scopeId);
    }
    ConsistencyReport report = check(scopeId);
    if (report.consistent()) {
      logger.log(Level.INFO, "Team {0} reconciled", scopeId);
    }
    return report;
  }
}
