package syncengine.health;

import org.junit.jupiter.api.Test;
import syncengine.RecordingCacheLayer;
import syncengine.StubCalculationLayer;
import syncengine.model.ConsistencyReport;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsistencyCheckerTest {

  private final RecordingCacheLayer cache = new RecordingCacheLayer();
  private final StubCalculationLayer calculations = new StubCalculationLayer();
  private final ConsistencyChecker checker = new ConsistencyChecker(cache, calculations, 1_000);

  @Test
  void valuesWithinToleranceAreConsistent() {
    calculations.scopeCapacities.put(7L, 120.0);
    calculations.summaryCapacities.put(7L, 120.005);

    ConsistencyReport report = checker.check(7);

    assertTrue(report.consistent());
    assertEquals(120.0, report.scopeLevel());
    assertEquals(120.005, report.summaryLevel());
    assertEquals(0.005, report.difference(), 1e-9);
  }

  @Test
  void divergenceIsReportedNotThrown() {
    calculations.scopeCapacities.put(7L, 120.0);
    calculations.summaryCapacities.put(7L, 112.5);

    ConsistencyReport report = checker.check(7);

    assertFalse(report.consistent());
    assertEquals(7.5, report.difference(), 1e-9);
  }

  @Test
  void failingCalculationYieldsFailedReport() {
    calculations.failing = true;

    assertEquals(ConsistencyReport.failed(7), checker.check(7));
  }

  @Test
  void reconcileClearsTeamCachesThenChecksAgain() {
    calculations.scopeCapacities.put(7L, 80.0);
    calculations.summaryCapacities.put(7L, 80.0);

    ConsistencyReport report = checker.reconcile(7);

    assertTrue(report.consistent());
    assertEquals(List.of("pattern:team_7"), cache.operations);
    assertEquals(List.of("invalidateCalculations", "scopeCapacity:7", "summaryCapacity:7"), calculations.calls);
  }

  @Test
  void reconcileWithFailingCacheReportsFailure() {
    cache.failing = true;

    assertFalse(checker.reconcile(7).consistent());
  }
}
