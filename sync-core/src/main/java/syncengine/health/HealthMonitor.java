package syncengine.health;

import syncengine.broadcast.BroadcastPublisher;
import syncengine.dispatch.EventProcessor;
import syncengine.dispatch.PendingUpdateStore;
import syncengine.dispatch.SyncMetricsRecorder;
import syncengine.model.PendingUpdate;
import syncengine.model.SyncMetrics;
import syncengine.model.SyncStatusReport;
import syncengine.queue.SyncEventQueue;
import syncengine.registry.ConnectionRegistry;
import syncengine.spi.CacheLayer;
import syncengine.spi.CalculationLayer;
import syncengine.spi.MetricsExporter;
import syncengine.util.Futures;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic health pass: connection purge, pending-update retry, lag and error-rate checks.
 *
 * <p>A pending update is retried when due. A failed retry counts as an attempt; the update
 * is dropped as unrecoverable once its event is older than {@code maxEventAgeMs} or it has
 * used {@code maxRetryAttempts} attempts. An update that expired while waiting for its
 * next attempt is dropped without another retry.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class HealthMonitor {
  private static final Logger logger = Logger.getLogger(HealthMonitor.class.getName());

  private final ConnectionRegistry registry;
  private final PendingUpdateStore pendingUpdates;
  private final SyncEventQueue queue;
  private final EventProcessor processor;
  private final SyncMetricsRecorder recorder;
  private final BroadcastPublisher broadcastPublisher;
  private final CacheLayer cache;
  private final CalculationLayer calculations;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final long syncTimeoutMs;
  private final int maxRetryAttempts;
  private final double errorRateThreshold;
  private final long callTimeoutMs;

  private HealthMonitor(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.pendingUpdates = Objects.requireNonNull(builder.pendingUpdates, "pendingUpdates");
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.processor = Objects.requireNonNull(builder.processor, "processor");
    this.recorder = Objects.requireNonNull(builder.recorder, "recorder");
    this.broadcastPublisher = Objects.requireNonNull(builder.broadcastPublisher, "broadcastPublisher");
    this.cache = Objects.requireNonNull(builder.cache, "cache");
    this.calculations = Objects.requireNonNull(builder.calculations, "calculations");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.syncTimeoutMs <= 0) {
      throw new IllegalArgumentException("syncTimeoutMs must be > 0");
    }
    if (builder.maxRetryAttempts < 1) {
      throw new IllegalArgumentException("maxRetryAttempts must be >= 1");
    }
    if (builder.errorRateThreshold < 0 || builder.errorRateThreshold > 1) {
      throw new IllegalArgumentException("errorRateThreshold must be within [0, 1]");
    }
    if (builder.callTimeoutMs <= 0) {
      throw new IllegalArgumentException("callTimeoutMs must be > 0");
    }
    this.syncTimeoutMs = builder.syncTimeoutMs;
    this.maxRetryAttempts = builder.maxRetryAttempts;
    this.errorRateThreshold = builder.errorRateThreshold;
    this.callTimeoutMs = builder.callTimeoutMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Age after which a pending update is no longer retried. */
  public long maxEventAgeMs() {
    return syncTimeoutMs * maxRetryAttempts;
  }

  /**
   * Runs one health pass. Waits for the retries it starts to settle.
   */
  public void tick() {
    try {
      long now = clock.millis();
      int purged = registry.purgeInactive(now);
      if (purged > 0) {
        logger.log(Level.INFO, "Purged {0} idle connections", purged);
      }
      retryPendingUpdates(now);
      checkLagAndErrorRate(clock.millis());
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Health check error", t);
    }
  }

  private void retryPendingUpdates(long now) {
    List<CompletableFuture<Void>> retries = new ArrayList<>();
    for (PendingUpdate update : pendingUpdates.snapshot()) {
      if (!update.isDue(now)) {
        if (isExpired(update, now)) {
          dropUnrecoverable(update, now);
        }
        continue;
      }
      metrics.incrementSyncRetried();
      retries.add(processor.process(update.event())
          .thenAccept(ok -> settleRetry(update, ok)));
    }
    if (!retries.isEmpty()) {
      CompletableFuture.allOf(retries.toArray(new CompletableFuture<?>[0])).join();
    }
  }

  private void settleRetry(PendingUpdate update, boolean succeeded) {
    long now = clock.millis();
    if (succeeded) {
      pendingUpdates.remove(update.eventId());
      logger.log(Level.INFO, "Retry of {0} succeeded", update.eventId());
      return;
    }
    PendingUpdate next = pendingUpdates.reschedule(update, now);
    if (next == null) {
      return;
    }
    if (isExpired(next, now) || next.attempts() >= maxRetryAttempts) {
      dropUnrecoverable(next, now);
    }
  }

  private boolean isExpired(PendingUpdate update, long now) {
    return update.ageMs(now) > maxEventAgeMs();
  }

  private void dropUnrecoverable(PendingUpdate update, long now) {
    if (pendingUpdates.remove(update.eventId())) {
      metrics.incrementSyncUnrecoverable();
      logger.log(Level.SEVERE, "Dropping unrecoverable sync event {0} ({1}) after {2} retries, age {3} ms",
          new Object[]{update.eventId(), update.event().type(), update.attempts(), update.ageMs(now)});
    }
  }

  private void checkLagAndErrorRate(long now) {
    SyncMetrics snapshot = recorder.snapshot();
    long lag = Math.max(0L, now - snapshot.lastSyncTimestamp());
    double errorRate = snapshot.errorRate();
    metrics.recordSyncLagMs(lag);
    metrics.recordPendingUpdates(pendingUpdates.size());
    metrics.recordQueueDepth(queue.size());
    if (lag > syncTimeoutMs) {
      logger.log(Level.WARNING, "Sync lag {0} ms exceeds {1} ms", new Object[]{lag, syncTimeoutMs});
    }
    if (errorRate > errorRateThreshold) {
      logger.log(Level.WARNING, "Sync error rate {0} exceeds {1}",
          new Object[]{String.format("%.3f", errorRate), errorRateThreshold});
    }
  }

  /**
   * Purges idle connections and reports the engine's health.
   */
  public SyncStatusReport validateSyncStatus() {
    long now = clock.millis();
    registry.purgeInactive(now);
    SyncMetrics snapshot = recorder.snapshot();
    return new SyncStatusReport(
        registry.size(),
        pendingUpdates.size(),
        queue.size(),
        Math.max(0L, now - snapshot.lastSyncTimestamp()),
        Instant.ofEpochMilli(snapshot.lastSyncTimestamp()),
        snapshot.averageProcessingTime(),
        snapshot.errorRate());
  }

  /**
   * Clears every cache, re-warms the critical aggregates and tells every consumer to refetch.
   *
   * @return {@code true} if every step succeeded; never throws
   */
  public boolean forceSynchronization() {
    try {
      logger.info("Forcing full synchronization");
      cache.clearAllCache();
      calculations.invalidateCalculations();
      Futures.await(calculations.warmupCaches(), callTimeoutMs, "warmupCaches");
      broadcastPublisher.publishForceRefresh(clock.millis());
      registry.advanceSyncVersions();
      return true;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Forced synchronization failed", e);
      return false;
    }
  }

  /**
   * Builder for {@link HealthMonitor}.
   */
  public static final class Builder {
    private ConnectionRegistry registry;
    private PendingUpdateStore pendingUpdates;
    private SyncEventQueue queue;
    private EventProcessor processor;
    private SyncMetricsRecorder recorder;
    private BroadcastPublisher broadcastPublisher;
    private CacheLayer cache;
    private CalculationLayer calculations;
    private MetricsExporter metrics;
    private Clock clock;
    private long syncTimeoutMs = 30_000L;
    private int maxRetryAttempts = 3;
    private double errorRateThreshold = 0.10;
    private long callTimeoutMs = 10_000L;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder registry(ConnectionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /** <b>Required.</b> */
    public Builder pendingUpdates(PendingUpdateStore pendingUpdates) {
      this.pendingUpdates = pendingUpdates;
      return this;
    }

    /** <b>Required.</b> Only read for status reporting. */
    public Builder queue(SyncEventQueue queue) {
      this.queue = queue;
      return this;
    }

    /** <b>Required.</b> Runs retries. */
    public Builder processor(EventProcessor processor) {
      this.processor = processor;
      return this;
    }

    /** <b>Required.</b> */
    public Builder recorder(SyncMetricsRecorder recorder) {
      this.recorder = recorder;
      return this;
    }

    /** <b>Required.</b> */
    public Builder broadcastPublisher(BroadcastPublisher broadcastPublisher) {
      this.broadcastPublisher = broadcastPublisher;
      return this;
    }

    /** <b>Required.</b> */
    public Builder cache(CacheLayer cache) {
      this.cache = cache;
      return this;
    }

    /** <b>Required.</b> */
    public Builder calculations(CalculationLayer calculations) {
      this.calculations = calculations;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Lag above which a warning is logged. Defaults to 30 000 ms. */
    public Builder syncTimeoutMs(long syncTimeoutMs) {
      this.syncTimeoutMs = syncTimeoutMs;
      return this;
    }

    /** Defaults to 3. Also scales the maximum event age. */
    public Builder maxRetryAttempts(int maxRetryAttempts) {
      this.maxRetryAttempts = maxRetryAttempts;
      return this;
    }

    /** Defaults to 0.10. */
    public Builder errorRateThreshold(double errorRateThreshold) {
      this.errorRateThreshold = errorRateThreshold;
      return this;
    }

    /** Maximum wait for cache warm-up. Defaults to 10 000 ms. */
    public Builder callTimeoutMs(long callTimeoutMs) {
      this.callTimeoutMs = callTimeoutMs;
      return this;
    }

    public HealthMonitor build() {
      return new HealthMonitor(this);
    }
  }
}
