/**
 * Cache invalidation routing and an in-memory {@link syncengine.spi.CacheLayer}.
 */
package syncengine.cache;
