package syncengine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import syncengine.broadcast.InMemoryPubSubTransport;
import syncengine.broadcast.SyncChannels;
import syncengine.model.ChangeKind;
import syncengine.model.ClientType;
import syncengine.model.ConsistencyReport;
import syncengine.model.EventSource;
import syncengine.model.EventType;
import syncengine.model.MutationNotification;
import syncengine.model.MutationOperation;
import syncengine.model.Priority;
import syncengine.model.SyncEvent;
import syncengine.model.SyncMetrics;
import syncengine.model.SyncNotification;
import syncengine.model.SyncStatusReport;
import syncengine.queue.EnqueueOutcome;
import syncengine.spi.MetricsExporter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncEngineTest {

  private final TestClock clock = new TestClock(1_000_000);
  private final ManualTaskScheduler scheduler = new ManualTaskScheduler(clock);
  private final RecordingCacheLayer cache = new RecordingCacheLayer();
  private final StubCalculationLayer calculations = new StubCalculationLayer();
  private final InMemoryPubSubTransport transport = new InMemoryPubSubTransport();
  private final CountingMetricsExporter metrics = new CountingMetricsExporter();
  private SyncEngine engine = newEngine();

  private SyncEngine newEngine() {
    return SyncEngine.builder()
        .cacheLayer(cache)
        .calculationLayer(calculations)
        .transport(transport)
        .metrics(metrics)
        .clock(clock)
        .scheduler(scheduler)
        .processingExecutor(Runnable::run)
        .build();
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builderRejectsMissingCacheLayer() {
    assertThrows(NullPointerException.class, () -> SyncEngine.builder()
        .calculationLayer(calculations)
        .transport(transport)
        .build());
  }

  @Test
  void builderRejectsMissingCalculationLayer() {
    assertThrows(NullPointerException.class, () -> SyncEngine.builder()
        .cacheLayer(cache)
        .transport(transport)
        .build());
  }

  @Test
  void builderRejectsMissingTransport() {
    assertThrows(NullPointerException.class, () -> SyncEngine.builder()
        .cacheLayer(cache)
        .calculationLayer(calculations)
        .build());
  }

  @Test
  void builderRejectsInvalidNumbers() {
    assertThrows(IllegalArgumentException.class, () -> SyncEngine.builder()
        .cacheLayer(cache).calculationLayer(calculations).transport(transport)
        .batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () -> SyncEngine.builder()
        .cacheLayer(cache).calculationLayer(calculations).transport(transport)
        .workerCount(0).build());
    assertThrows(IllegalArgumentException.class, () -> SyncEngine.builder()
        .cacheLayer(cache).calculationLayer(calculations).transport(transport)
        .maxRetryAttempts(0).scheduler(scheduler).processingExecutor(Runnable::run).build());
  }

  // ── Lifecycle ───────────────────────────────────────────────────

  @Test
  void startSubscribesAndSchedulesTicks() {
    engine.start();

    assertTrue(engine.isRunning());
    assertEquals(1, transport.subscriberCount(SyncChannels.CHANNEL));
    assertEquals(2, scheduler.activeTaskCount());
  }

  @Test
  void batchTickProcessesQueuedChanges() {
    engine.start();
    engine.onEntityChange(7, ChangeKind.CAPACITY);

    scheduler.advance(1_000);

    assertTrue(engine.queuedEvents().isEmpty());
    assertEquals(1, engine.getSyncMetrics().successfulSyncs());
    assertEquals(1, transport.sentMessages().size());
  }

  @Test
  void stopCancelsTicksAndKeepsQueue() {
    engine.start();
    engine.stop();
    engine.onEntityChange(7, ChangeKind.CAPACITY);

    scheduler.advance(5_000);

    assertFalse(engine.isRunning());
    assertEquals(1, engine.queuedEvents().size());
    assertEquals(0, transport.subscriberCount(SyncChannels.CHANNEL));
  }

  @Test
  void startAfterCloseFails() {
    engine.close();

    assertThrows(IllegalStateException.class, () -> engine.start());
  }

  @Test
  void closeDiscardsStateAndClosesMetrics() {
    AtomicBoolean metricsClosed = new AtomicBoolean();
    engine = SyncEngine.builder()
        .cacheLayer(cache)
        .calculationLayer(calculations)
        .transport(transport)
        .metrics(new ClosableMetrics(metricsClosed))
        .clock(clock)
        .scheduler(scheduler)
        .processingExecutor(Runnable::run)
        .build();
    engine.registerClient("c1", ClientType.SUMMARY_VIEW);
    engine.onEntityChange(7, ChangeKind.CAPACITY);

    engine.close();

    assertTrue(engine.queuedEvents().isEmpty());
    assertEquals(0, engine.validateSyncStatus().connectedClients());
    assertTrue(metricsClosed.get());
  }

  // ── Change intake ───────────────────────────────────────────────

  @Test
  void onEntityChangeQueuesHighPriorityTeamChange() {
    engine.onEntityChange(7, ChangeKind.MEMBER);

    SyncEvent event = engine.queuedEvents().get(0);
    assertEquals(EventType.TEAM_DATA_CHANGE, event.type());
    assertEquals(EventSource.SCOPED_VIEW, event.source());
    assertEquals(Priority.HIGH, event.priority());
    assertEquals(7, event.affectedEntityId());
  }

  @Test
  void onEntityChangeNeverThrows() {
    assertDoesNotThrow(() -> engine.onEntityChange(7, null));
    assertTrue(engine.queuedEvents().isEmpty());
  }

  @Test
  void repeatedChangesWithinWindowAreMerged() {
    engine.onEntityChange(7, ChangeKind.MEMBER);
    clock.advance(2_000);
    engine.onEntityChange(7, ChangeKind.SCHEDULE);

    assertEquals(1, engine.queuedEvents().size());
    assertEquals(1, metrics.deduplicated.get());
  }

  @Test
  void submitReportsQueueOutcome() {
    assertEquals(EnqueueOutcome.APPENDED, engine.submit(TestEvents.teamChange(3, clock.millis())));
    assertEquals(EnqueueOutcome.REPLACED, engine.submit(TestEvents.teamChange(3, clock.millis())));
  }

  // ── Processing scenarios ────────────────────────────────────────

  @Test
  void sprintUpdateCompletesBeforeEarlierQueuedScheduleChange() {
    engine.start();
    transport.publishMutation(SyncChannels.CHANNEL, new MutationNotification("schedule_entries",
        MutationOperation.UPDATE, null, Map.of("id", 900, "member_id", 11, "team_id", 4)));
    clock.advance(1);
    transport.publishMutation(SyncChannels.CHANNEL, new MutationNotification("global_sprint_settings",
        MutationOperation.UPDATE, null, Map.of("id", 1, "current_sprint_number", 12)));

    engine.processBatch();

    List<InMemoryPubSubTransport.SentMessage> sent = transport.sentMessages();
    assertEquals(2, sent.size());
    assertEquals(EventType.SPRINT_UPDATE, ((SyncNotification) sent.get(0).payload()).type());
    assertEquals(EventType.SCHEDULE_CHANGE, ((SyncNotification) sent.get(1).payload()).type());
    SyncMetrics syncMetrics = engine.getSyncMetrics();
    assertEquals(2, syncMetrics.totalEvents());
    assertEquals(2, syncMetrics.successfulSyncs());
  }

  @Test
  void twentyFiveEventsDrainInThreeBatches() {
    for (int i = 0; i < 25; i++) {
      engine.onEntityChange(i, ChangeKind.CAPACITY);
    }

    assertEquals(10, engine.processBatch());
    assertEquals(10, engine.processBatch());
    assertEquals(5, engine.processBatch());
    assertTrue(engine.queuedEvents().isEmpty());
  }

  @Test
  void failedEventIsRetriedByHealthTick() {
    engine.start();
    calculations.failingScopes.add(3L);
    engine.onEntityChange(3, ChangeKind.CAPACITY);
    engine.onEntityChange(4, ChangeKind.CAPACITY);

    scheduler.advance(1_000);

    assertEquals(1, engine.pendingUpdates().size());
    assertEquals(1, engine.getSyncMetrics().failedSyncs());

    calculations.failingScopes.clear();
    scheduler.advance(59_000);

    assertTrue(engine.pendingUpdates().isEmpty());
    SyncMetrics syncMetrics = engine.getSyncMetrics();
    assertEquals(3, syncMetrics.totalEvents());
    assertEquals(2, syncMetrics.successfulSyncs());
    assertEquals(syncMetrics.totalEvents(), syncMetrics.successfulSyncs() + syncMetrics.failedSyncs());
  }

  @Test
  void errorRateMatchesCounters() {
    calculations.failingScopes.add(2L);
    for (int i = 1; i <= 4; i++) {
      engine.onEntityChange(i, ChangeKind.CAPACITY);
    }
    engine.processBatch();

    SyncStatusReport status = engine.validateSyncStatus();
    SyncMetrics syncMetrics = engine.getSyncMetrics();
    assertEquals(0.25, status.errorRate(), 1e-9);
    assertEquals((double) syncMetrics.failedSyncs() / syncMetrics.totalEvents(), status.errorRate(), 1e-9);
    assertEquals(1, status.pendingUpdates());
  }

  // ── Connections and health ──────────────────────────────────────

  @Test
  void idleClientIsPurgedByHealthTick() {
    engine.registerClient("c1", ClientType.SCOPED_VIEW, 7L, null);
    assertEquals(1, engine.validateSyncStatus().connectedClients());

    clock.advance(301_000);
    engine.performHealthCheck();

    assertEquals(0, engine.validateSyncStatus().connectedClients());
  }

  @Test
  void activityKeepsClientAlive() {
    engine.registerClient("c1", ClientType.SCOPED_VIEW, 7L, "ana");
    clock.advance(200_000);
    engine.updateClientActivity("c1");
    clock.advance(200_000);

    engine.performHealthCheck();

    assertEquals(1, engine.validateSyncStatus().connectedClients());
    engine.unregisterClient("c1");
    assertEquals(0, engine.validateSyncStatus().connectedClients());
  }

  @Test
  void forceSynchronizationWithFailingCacheReturnsFalse() {
    engine.onEntityChange(1, ChangeKind.CAPACITY);
    engine.processBatch();
    cache.failing = true;

    boolean result = assertDoesNotThrow(() -> engine.forceSynchronization());

    assertFalse(result);
    SyncMetrics syncMetrics = engine.getSyncMetrics();
    assertEquals(1, syncMetrics.totalEvents());
    assertEquals(syncMetrics.totalEvents(), syncMetrics.successfulSyncs() + syncMetrics.failedSyncs());
    assertTrue(syncMetrics.errorRate() >= 0.0 && syncMetrics.errorRate() <= 1.0);
  }

  @Test
  void forceSynchronizationBroadcastsRefresh() {
    engine.registerClient("c1", ClientType.SUMMARY_VIEW);

    assertTrue(engine.forceSynchronization());

    assertEquals(SyncChannels.FORCE_REFRESH, transport.sentMessages().get(0).eventName());
    assertEquals(2, engine.findClient("c1").syncVersion());
  }

  @Test
  void consistencyChecksDelegateToCalculationLayer() {
    calculations.scopeCapacities.put(7L, 10.0);
    calculations.summaryCapacities.put(7L, 12.0);

    ConsistencyReport report = engine.checkConsistency(7);
    assertFalse(report.consistent());

    calculations.summaryCapacities.put(7L, 10.0);
    assertTrue(engine.reconcile(7).consistent());
    assertTrue(cache.operations.contains("pattern:team_7"));
  }

  @Test
  void statusReportsQueuedEvents() {
    engine.onEntityChange(1, ChangeKind.CAPACITY);

    SyncStatusReport status = engine.validateSyncStatus();

    assertEquals(1, status.queuedEvents());
    assertEquals(Instant.EPOCH, status.lastSyncEvent());
  }

  /** Metrics exporter that records whether it was closed. */
  static final class ClosableMetrics implements MetricsExporter, AutoCloseable {
    private final AtomicBoolean closed;

    ClosableMetrics(AtomicBoolean closed) {
      this.closed = closed;
    }

    @Override
    public void incrementEventsEnqueued() {
    }

    @Override
    public void incrementEventsDeduplicated() {
    }

    @Override
    public void incrementEventsDropped() {
    }

    @Override
    public void incrementSyncSuccess() {
    }

    @Override
    public void incrementSyncFailure() {
    }

    @Override
    public void incrementSyncUnrecoverable() {
    }

    @Override
    public void recordQueueDepth(int depth) {
    }

    @Override
    public void recordPendingUpdates(int pending) {
    }

    @Override
    public void recordSyncLagMs(long lagMs) {
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
