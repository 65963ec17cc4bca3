package syncengine.broadcast;

import syncengine.model.ForceRefreshNotification;
import syncengine.model.SyncEvent;
import syncengine.model.SyncNotification;
import syncengine.registry.ConnectionRegistry;
import syncengine.spi.MetricsExporter;
import syncengine.spi.PubSubTransport;
import syncengine.util.Futures;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes refresh notifications on the shared {@link SyncChannels#CHANNEL} channel.
 *
 * <p>Broadcasts are not addressed to individual connections; every consumer receives
 * every notification and filters by its own scope. A successful broadcast advances the
 * sync version of every registered connection.
 */
public final class BroadcastPublisher {
  private static final Logger logger = Logger.getLogger(BroadcastPublisher.class.getName());

  private final PubSubTransport transport;
  private final ConnectionRegistry registry;
  private final MetricsExporter metrics;
  private final long callTimeoutMs;

  public BroadcastPublisher(PubSubTransport transport, ConnectionRegistry registry,
      MetricsExporter metrics, long callTimeoutMs) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (callTimeoutMs <= 0) {
      throw new IllegalArgumentException("callTimeoutMs must be > 0");
    }
    this.callTimeoutMs = callTimeoutMs;
  }

  /**
   * Broadcasts a {@code data_refresh} notification for a processed event. Best effort:
   * transport failures are logged and counted, never thrown.
   *
   * @param event the processed event
   * @return {@code true} if the transport accepted the notification
   */
  public boolean publish(SyncEvent event) {
    try {
      send(SyncChannels.DATA_REFRESH, SyncNotification.from(event));
      registry.advanceSyncVersions();
      return true;
    } catch (RuntimeException e) {
      metrics.incrementBroadcastFailure();
      logger.log(Level.WARNING, "Broadcast of " + event.id() + " failed; consumers refresh on their next fetch", e);
      return false;
    }
  }

  /**
   * Broadcasts a {@code force_refresh} notification.
   *
   * @param timestamp time of the forced synchronization
   * @throws BroadcastDeliveryException if the transport did not accept it
   */
  public void publishForceRefresh(long timestamp) {
    try {
      send(SyncChannels.FORCE_REFRESH, new ForceRefreshNotification(timestamp));
    } catch (RuntimeException e) {
      metrics.incrementBroadcastFailure();
      throw new BroadcastDeliveryException("force_refresh broadcast failed", e);
    }
  }

  private void send(String eventName, Object payload) {
    Futures.await(transport.send(SyncChannels.CHANNEL, eventName, payload), callTimeoutMs,
        "send(" + eventName + ")");
  }
}
