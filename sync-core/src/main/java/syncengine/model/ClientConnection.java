package syncengine.model;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A connected downstream consumer and its liveness metadata.
 *
 * <p>{@code lastActivity} and {@code syncVersion} are updated concurrently by the
 * registry; everything else is fixed at registration.
 */
public final class ClientConnection {
  private final String id;
  private final ClientType type;
  private final Long scope;
  private final String principal;
  private final long connectedAt;
  private volatile long lastActivity;
  private final AtomicLong syncVersion = new AtomicLong(1);

  public ClientConnection(String id, ClientType type, Long scope, String principal, long connectedAt) {
    this.id = Objects.requireNonNull(id, "id");
    this.type = Objects.requireNonNull(type, "type");
    this.scope = scope;
    this.principal = principal;
    this.connectedAt = connectedAt;
    this.lastActivity = connectedAt;
  }

  public String id() {
    return id;
  }

  public ClientType type() {
    return type;
  }

  /** Team the consumer is scoped to, or {@code null} for unscoped consumers. */
  public Long scope() {
    return scope;
  }

  public String principal() {
    return principal;
  }

  public long connectedAt() {
    return connectedAt;
  }

  public long lastActivity() {
    return lastActivity;
  }

  public long syncVersion() {
    return syncVersion.get();
  }

  public void touch(long now) {
    this.lastActivity = now;
  }

  public long advanceSyncVersion() {
    return syncVersion.incrementAndGet();
  }

  public boolean isIdle(long now, long idleTimeoutMs) {
    return now - lastActivity > idleTimeoutMs;
  }

  @Override
  public String toString() {
    return "ClientConnection{id=" + id + ", type=" + type + ", scope=" + scope
        + ", lastActivity=" + lastActivity + ", syncVersion=" + syncVersion.get() + '}';
  }
}
