package syncengine.cache;

import org.junit.jupiter.api.Test;
import syncengine.RecordingCacheLayer;
import syncengine.StubCalculationLayer;
import syncengine.TestEvents;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CacheInvalidationRouterTest {

  private final RecordingCacheLayer cache = new RecordingCacheLayer();
  private final StubCalculationLayer calculations = new StubCalculationLayer();
  private final CacheInvalidationRouter router = new CacheInvalidationRouter(cache, calculations);

  @Test
  void scheduleChangeClearsEntryTeamAndSummary() {
    router.invalidate(TestEvents.scheduleChange(11, 4L, 0));

    assertEquals(List.of(
        "related:schedule_entries:511",
        "pattern:team_4",
        "pattern:company_summary"), cache.operations);
    assertEquals(List.of("invalidateCalculations"), calculations.calls);
  }

  @Test
  void scheduleChangeWithoutTeamClearsEveryTeam() {
    router.invalidate(TestEvents.scheduleChange(11, null, 0));

    assertTrue(cache.operations.contains("pattern:team_"));
  }

  @Test
  void memberUpdateClearsMemberAndTeam() {
    router.invalidate(TestEvents.memberUpdate(7, 3, 0));

    assertEquals(List.of("related:team_members:3", "pattern:team_7"), cache.operations);
  }

  @Test
  void sprintUpdateClearsEverySprintAndCalculationEntry() {
    router.invalidate(TestEvents.sprintUpdate(0));

    assertEquals(List.of(
        "related:global_sprint_settings:null",
        "pattern:sprint",
        "pattern:calculation"), cache.operations);
  }

  @Test
  void teamDataChangeClearsTeamAndTotals() {
    router.invalidate(TestEvents.teamChange(9, 0));

    assertEquals(List.of("pattern:team_9", "pattern:company_totals"), cache.operations);
    assertEquals(List.of("invalidateCalculations"), calculations.calls);
  }

  @Test
  void cacheFailurePropagates() {
    cache.failing = true;

    assertThrows(IllegalStateException.class, () -> router.invalidate(TestEvents.teamChange(9, 0)));
    assertTrue(calculations.calls.isEmpty());
  }

  @Test
  void targetsAreAppliedInDeclaredOrder() {
    List<InvalidationTarget> targets = CacheInvalidationRouter.targetsFor(TestEvents.teamChange(9, 0));

    assertEquals(List.of(
        InvalidationTarget.pattern("team_9"),
        InvalidationTarget.pattern("company_totals")), targets);
  }
}
