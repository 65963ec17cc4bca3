package syncengine.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryCacheLayerTest {

  private final InMemoryCacheLayer cache = new InMemoryCacheLayer();

  @BeforeEach
  void fill() {
    cache.put("schedule_entries_5", "entry");
    cache.put("team_hours_4", 120.0);
    cache.put("team_4_capacity", 0.8);
    cache.put("team_5_capacity", 0.9);
    cache.put("company_summary", "summary");
    cache.put("company_totals", 42);
    cache.put("current_sprint", 12);
    cache.put("sprint_calculations_12", "calc");
  }

  @Test
  void relatedInvalidationRemovesNamespaceAndDependents() {
    cache.invalidateRelatedCaches("schedule_entries", "5");

    assertFalse(cache.contains("schedule_entries_5"));
    assertFalse(cache.contains("team_hours_4"));
    assertFalse(cache.contains("company_summary"));
    assertTrue(cache.contains("team_4_capacity"));
    assertTrue(cache.contains("company_totals"));
  }

  @Test
  void sprintSettingsInvalidationRemovesSprintData() {
    cache.invalidateRelatedCaches("global_sprint_settings", null);

    assertFalse(cache.contains("current_sprint"));
    assertFalse(cache.contains("sprint_calculations_12"));
    assertEquals(6, cache.size());
  }

  @Test
  void patternMatchesSubstring() {
    cache.clearCacheByPattern("team_4");

    assertFalse(cache.contains("team_4_capacity"));
    assertTrue(cache.contains("team_5_capacity"));
    assertTrue(cache.contains("team_hours_4"));
  }

  @Test
  void invalidatingAbsentKeysIsNoOp() {
    cache.clearCacheByPattern("no_such_key");
    cache.invalidateRelatedCaches("unknown_namespace", "1");

    assertEquals(8, cache.size());
  }

  @Test
  void clearAllEmptiesCache() {
    cache.clearAllCache();

    assertEquals(Set.of(), cache.keys());
  }
}
