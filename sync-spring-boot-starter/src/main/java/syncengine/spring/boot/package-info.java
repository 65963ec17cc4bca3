/**
 * Spring Boot auto-configuration for the sync engine.
 *
 * <p>Binds {@code sync.*} properties to {@link syncengine.spring.boot.SyncProperties} and
 * creates a started {@link syncengine.SyncEngine} once the application provides a
 * {@link syncengine.spi.CalculationLayer}.
 */
package syncengine.spring.boot;
