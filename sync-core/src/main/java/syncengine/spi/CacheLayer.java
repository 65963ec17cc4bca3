package syncengine.spi;

/**
 * Cache holding derived data read by the views. The engine only ever removes entries.
 *
 * <p>All operations must be idempotent: invalidating an absent key is a no-op.
 */
public interface CacheLayer {

  /**
   * Invalidates the entries of a namespace, the namespaces that depend on it, and the
   * entries for one key within it.
   *
   * @param namespace the cache namespace (usually a table name)
   * @param key       an entity id within the namespace, or {@code null} for the whole namespace
   */
  void invalidateRelatedCaches(String namespace, String key);

  /**
   * Removes every entry whose key contains {@code pattern}.
   *
   * @param pattern substring to match
   */
  void clearCacheByPattern(String pattern);

  /** Removes every entry. */
  void clearAllCache();
}
