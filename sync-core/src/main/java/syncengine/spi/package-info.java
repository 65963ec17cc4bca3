/**
 * Service provider interfaces for the engine's collaborators.
 *
 * <p>{@link syncengine.spi.CacheLayer}, {@link syncengine.spi.CalculationLayer} and
 * {@link syncengine.spi.PubSubTransport} are the external systems the engine drives;
 * {@link syncengine.spi.MetricsExporter} and {@link syncengine.spi.TaskScheduler} are
 * infrastructure hooks with defaults.
 */
package syncengine.spi;
