package syncengine.cache;

import syncengine.spi.CacheLayer;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Map-backed {@link CacheLayer} for embedded use and tests.
 *
 * <p>Keys follow the {@code <namespace>_<id>} convention. Invalidating a namespace also
 * invalidates its dependent namespaces:
 * <ul>
 *   <li>{@code teams} &rarr; {@code team_members}, {@code schedule_entries}</li>
 *   <li>{@code global_sprint_settings} &rarr; {@code current_sprint}, {@code sprint_calculations}</li>
 *   <li>{@code schedule_entries} &rarr; {@code team_hours}, {@code sprint_capacity},
 *       {@code company_summary}, {@code team_dashboard}</li>
 *   <li>{@code team_members} &rarr; {@code team_calculations}, {@code company_totals}</li>
 * </ul>
 */
public final class InMemoryCacheLayer implements CacheLayer {
  private static final Logger logger = Logger.getLogger(InMemoryCacheLayer.class.getName());

  private static final Map<String, List<String>> DEPENDENCIES = Map.of(
      CacheNamespaces.TEAMS, List.of(CacheNamespaces.TEAM_MEMBERS, CacheNamespaces.SCHEDULE_ENTRIES),
      CacheNamespaces.GLOBAL_SPRINT_SETTINGS, List.of("current_sprint", "sprint_calculations"),
      CacheNamespaces.SCHEDULE_ENTRIES, List.of("team_hours", "sprint_capacity",
          CacheNamespaces.COMPANY_SUMMARY, "team_dashboard"),
      CacheNamespaces.TEAM_MEMBERS, List.of("team_calculations", CacheNamespaces.COMPANY_TOTALS));

  private final Map<String, Object> entries = new ConcurrentHashMap<>();

  public void put(String key, Object value) {
    entries.put(key, value);
  }

  public Object get(String key) {
    return entries.get(key);
  }

  public boolean contains(String key) {
    return entries.containsKey(key);
  }

  public int size() {
    return entries.size();
  }

  /** Returns the current keys in sorted order. */
  public Set<String> keys() {
    return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
  }

  /**
   * Removes every entry of {@code namespace} and of its direct dependents. Because keys
   * embed their namespace, the per-key entry is covered by the namespace sweep.
   */
  @Override
  public void invalidateRelatedCaches(String namespace, String key) {
    int removed = removeIf(namespace);
    for (String dependent : DEPENDENCIES.getOrDefault(namespace, List.of())) {
      removed += removeIf(dependent);
    }
    logger.log(Level.FINE, "Invalidated {0} cache entries related to {1} (key {2})",
        new Object[]{removed, namespace, key});
  }

  @Override
  public void clearCacheByPattern(String pattern) {
    int removed = removeIf(pattern);
    logger.log(Level.FINE, "Cleared {0} cache entries matching {1}", new Object[]{removed, pattern});
  }

  @Override
  public void clearAllCache() {
    entries.clear();
  }

  private int removeIf(String fragment) {
    int before = entries.size();
    entries.keySet().removeIf(k -> k.contains(fragment));
    return before - entries.size();
  }
}
