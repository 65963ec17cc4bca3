package syncengine.cache;

import syncengine.spi.CacheLayer;

import java.util.Objects;

/** One cache operation requested by the {@link CacheInvalidationRouter}. */
public sealed interface InvalidationTarget
    permits InvalidationTarget.Related, InvalidationTarget.Pattern {

  void applyTo(CacheLayer cache);

  static InvalidationTarget related(String namespace, Object key) {
    return new Related(namespace, key == null ? null : String.valueOf(key));
  }

  static InvalidationTarget pattern(String pattern) {
    return new Pattern(pattern);
  }

  /** Invalidates a namespace and its dependents, optionally narrowed to one key. */
  record Related(String namespace, String key) implements InvalidationTarget {

    public Related {
      Objects.requireNonNull(namespace, "namespace");
    }

    @Override
    public void applyTo(CacheLayer cache) {
      cache.invalidateRelatedCaches(namespace, key);
    }
  }

  /** Clears every entry whose key contains {@code pattern}. */
  record Pattern(String pattern) implements InvalidationTarget {

    public Pattern {
      Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public void applyTo(CacheLayer cache) {
      cache.clearCacheByPattern(pattern);
    }
  }
}
