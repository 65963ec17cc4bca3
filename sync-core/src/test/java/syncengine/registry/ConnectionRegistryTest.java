package syncengine.registry;

import org.junit.jupiter.api.Test;
import syncengine.CountingMetricsExporter;
import syncengine.TestClock;
import syncengine.model.ClientConnection;
import syncengine.model.ClientType;
import syncengine.spi.MetricsExporter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionRegistryTest {

  private final TestClock clock = new TestClock(1_000);
  private final CountingMetricsExporter metrics = new CountingMetricsExporter();
  private final ConnectionRegistry registry = new ConnectionRegistry(clock, 300_000, metrics);

  @Test
  void rejectsNonPositiveIdleTimeout() {
    assertThrows(IllegalArgumentException.class, () -> new ConnectionRegistry(clock, 0, MetricsExporter.NOOP));
  }

  @Test
  void registerSetsTimesAndVersion() {
    ClientConnection connection = registry.register("c1", ClientType.SCOPED_VIEW, 7L, "ana");

    assertEquals(1_000, connection.connectedAt());
    assertEquals(1_000, connection.lastActivity());
    assertEquals(1, connection.syncVersion());
    assertEquals(7L, connection.scope());
    assertEquals("ana", connection.principal());
    assertEquals(1, metrics.clients.get());
  }

  @Test
  void reRegisteringReplacesConnection() {
    ClientConnection first = registry.register("c1", ClientType.SCOPED_VIEW, 7L, null);
    first.advanceSyncVersion();

    ClientConnection second = registry.register("c1", ClientType.MOBILE_APP, null, null);

    assertNotSame(first, second);
    assertEquals(1, registry.size());
    assertEquals(1, registry.find("c1").syncVersion());
  }

  @Test
  void touchRefreshesActivity() {
    registry.register("c1", ClientType.SCOPED_VIEW, 7L, null);
    clock.advance(60_000);

    assertTrue(registry.touch("c1"));
    assertEquals(61_000, registry.find("c1").lastActivity());
    assertFalse(registry.touch("unknown"));
  }

  @Test
  void purgeRemovesConnectionsIdleLongerThanTimeout() {
    registry.register("idle", ClientType.SCOPED_VIEW, 7L, null);
    registry.register("active", ClientType.SUMMARY_VIEW, null, null);
    clock.advance(301_000);
    registry.touch("active");

    assertEquals(1, registry.purgeInactive(clock.millis()));

    assertNull(registry.find("idle"));
    assertEquals(1, registry.size());
    assertEquals(1, metrics.clients.get());
  }

  @Test
  void purgeKeepsConnectionExactlyAtTimeout() {
    registry.register("c1", ClientType.SCOPED_VIEW, 7L, null);

    assertEquals(0, registry.purgeInactive(1_000 + 300_000));
  }

  @Test
  void unregisterRemoves() {
    registry.register("c1", ClientType.SCOPED_VIEW, 7L, null);

    assertTrue(registry.unregister("c1"));
    assertFalse(registry.unregister("c1"));
    assertEquals(0, registry.size());
  }
}
