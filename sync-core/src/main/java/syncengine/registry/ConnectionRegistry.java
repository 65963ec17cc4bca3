package syncengine.registry;

import syncengine.model.ClientConnection;
import syncengine.model.ClientType;
import syncengine.spi.MetricsExporter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks connected downstream consumers and their liveness.
 *
 * <p>Connections are keyed by id; registering an existing id replaces the connection.
 * Entries idle for longer than {@code idleTimeoutMs} are removed by {@link #purgeInactive}.
 * This class is thread-safe.
 */
public final class ConnectionRegistry {
  private static final Logger logger = Logger.getLogger(ConnectionRegistry.class.getName());

  private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
  private final Clock clock;
  private final long idleTimeoutMs;
  private final MetricsExporter metrics;

  public ConnectionRegistry(Clock clock, long idleTimeoutMs, MetricsExporter metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (idleTimeoutMs <= 0) {
      throw new IllegalArgumentException("idleTimeoutMs must be > 0");
    }
    this.idleTimeoutMs = idleTimeoutMs;
  }

  /**
   * Registers a consumer with {@code connectedAt = lastActivity = now} and sync version 1.
   *
   * @param id        connection id
   * @param type      consumer type
   * @param scope     team the consumer shows, or {@code null}
   * @param principal user behind the consumer, or {@code null}
   * @return the new connection
   */
  public ClientConnection register(String id, ClientType type, Long scope, String principal) {
    ClientConnection connection = new ClientConnection(id, type, scope, principal, clock.millis());
    ClientConnection previous = connections.put(id, connection);
    if (previous != null) {
      logger.log(Level.FINE, "Replaced connection {0}", id);
    }
    metrics.recordConnectedClients(connections.size());
    return connection;
  }

  /**
   * Refreshes the last activity time of a connection.
   *
   * @return {@code false} if the id is not registered
   */
  public boolean touch(String id) {
    ClientConnection connection = connections.get(id);
    if (connection == null) {
      return false;
    }
    connection.touch(clock.millis());
    return true;
  }

  public boolean unregister(String id) {
    boolean removed = connections.remove(id) != null;
    metrics.recordConnectedClients(connections.size());
    return removed;
  }

  /**
   * Removes every connection with {@code now - lastActivity > idleTimeoutMs}.
   *
   * @param now current time in epoch milliseconds
   * @return the number of connections removed
   */
  public int purgeInactive(long now) {
    int removed = 0;
    Iterator<ClientConnection> it = connections.values().iterator();
    while (it.hasNext()) {
      ClientConnection connection = it.next();
      if (connection.isIdle(now, idleTimeoutMs)) {
        it.remove();
        removed++;
        logger.log(Level.INFO, "Removed idle connection {0}", connection.id());
      }
    }
    metrics.recordConnectedClients(connections.size());
    return removed;
  }

  /** Advances the sync version of every connection. */
  public void advanceSyncVersions() {
    for (ClientConnection connection : connections.values()) {
      connection.advanceSyncVersion();
    }
  }

  public ClientConnection find(String id) {
    return connections.get(id);
  }

  public List<ClientConnection> connections() {
    return Collections.unmodifiableList(new ArrayList<>(connections.values()));
  }

  public int size() {
    return connections.size();
  }

  public void clear() {
    connections.clear();
    metrics.recordConnectedClients(0);
  }
}
