package syncengine;

import syncengine.broadcast.BroadcastPublisher;
import syncengine.cache.CacheInvalidationRouter;
import syncengine.dispatch.BatchProcessor;
import syncengine.dispatch.EventProcessor;
import syncengine.dispatch.ExponentialBackoffRetryPolicy;
import syncengine.dispatch.PendingUpdateStore;
import syncengine.dispatch.RetryPolicy;
import syncengine.dispatch.SyncMetricsRecorder;
import syncengine.health.ConsistencyChecker;
import syncengine.health.HealthMonitor;
import syncengine.listener.ChangeSourceListener;
import syncengine.listener.SyncEventFactory;
import syncengine.model.ChangeKind;
import syncengine.model.ClientConnection;
import syncengine.model.ClientType;
import syncengine.model.ConsistencyReport;
import syncengine.model.EventSource;
import syncengine.model.PendingUpdate;
import syncengine.model.SyncEvent;
import syncengine.model.SyncMetrics;
import syncengine.model.SyncStatusReport;
import syncengine.queue.EnqueueOutcome;
import syncengine.queue.SyncEventQueue;
import syncengine.recalc.RecalculationTrigger;
import syncengine.registry.ConnectionRegistry;
import syncengine.spi.CacheLayer;
import syncengine.spi.CalculationLayer;
import syncengine.spi.MetricsExporter;
import syncengine.spi.PubSubTransport;
import syncengine.spi.TaskScheduler;
import syncengine.util.DaemonThreadFactory;
import syncengine.util.ExecutorTaskScheduler;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the queue, batch processor, health monitor and change
 * listener around the host's cache, calculation layer and transport.
 *
 * <p>Nothing runs until {@link #start()}: it subscribes to the sync channel and schedules
 * the batch tick and the health tick. {@link #stop()} cancels both and unsubscribes;
 * {@link #close()} additionally releases owned threads and discards all state.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (SyncEngine engine = SyncEngine.builder()
 *     .cacheLayer(cache)
 *     .calculationLayer(calculations)
 *     .transport(transport)
 *     .build()) {
 *   engine.start();
 *   engine.registerClient("dashboard-1", ClientType.SUMMARY_VIEW);
 *   engine.onEntityChange(7, ChangeKind.CAPACITY);
 * }
 * }</pre>
 *
 * <p>The tick methods {@link #processBatch()} and {@link #performHealthCheck()} may also
 * be called directly, for example from tests that drive time manually.
 */
public final class SyncEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SyncEngine.class.getName());

  private final SyncEventQueue queue;
  private final PendingUpdateStore pendingUpdates;
  private final SyncMetricsRecorder recorder;
  private final ConnectionRegistry registry;
  private final BatchProcessor batchProcessor;
  private final HealthMonitor healthMonitor;
  private final ConsistencyChecker consistencyChecker;
  private final ChangeSourceListener listener;
  private final SyncEventFactory eventFactory;
  private final MetricsExporter metrics;
  private final TaskScheduler scheduler;
  private final boolean ownsScheduler;
  private final ExecutorService ownedExecutor;
  private final long batchIntervalMs;
  private final long healthIntervalMs;
  private final long callTimeoutMs;

  private TaskScheduler.ScheduledTask batchTask;
  private TaskScheduler.ScheduledTask healthTask;
  private boolean started;
  private boolean closed;

  private SyncEngine(Builder builder) {
    CacheLayer cacheLayer = Objects.requireNonNull(builder.cacheLayer, "cacheLayer");
    CalculationLayer calculationLayer = Objects.requireNonNull(builder.calculationLayer, "calculationLayer");
    PubSubTransport transport = Objects.requireNonNull(builder.transport, "transport");
    builder.validate();

    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    RetryPolicy retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1_000, 30_000);
    this.batchIntervalMs = builder.batchIntervalMs;
    this.healthIntervalMs = builder.healthIntervalMs;
    this.callTimeoutMs = builder.callTimeoutMs;

    Executor executor;
    if (builder.processingExecutor != null) {
      executor = builder.processingExecutor;
      this.ownedExecutor = null;
    } else {
      this.ownedExecutor = Executors.newFixedThreadPool(
          builder.workerCount, new DaemonThreadFactory("sync-worker-"));
      executor = ownedExecutor;
    }
    if (builder.scheduler != null) {
      this.scheduler = builder.scheduler;
      this.ownsScheduler = false;
    } else {
      this.scheduler = new ExecutorTaskScheduler("sync-batch-");
      this.ownsScheduler = true;
    }

    this.queue = new SyncEventQueue(clock, builder.dedupWindowMs, builder.maxQueueLength, metrics);
    this.pendingUpdates = new PendingUpdateStore(retryPolicy, metrics);
    this.recorder = new SyncMetricsRecorder();
    this.registry = new ConnectionRegistry(clock, builder.clientIdleTimeoutMs, metrics);

    BroadcastPublisher broadcastPublisher =
        new BroadcastPublisher(transport, registry, metrics, callTimeoutMs);
    EventProcessor processor = new EventProcessor(
        new CacheInvalidationRouter(cacheLayer, calculationLayer),
        new RecalculationTrigger(calculationLayer, callTimeoutMs),
        broadcastPublisher,
        recorder,
        metrics,
        executor,
        clock);
    this.batchProcessor = new BatchProcessor(queue, processor, pendingUpdates, clock, builder.batchSize);
    this.healthMonitor = HealthMonitor.builder()
        .registry(registry)
        .pendingUpdates(pendingUpdates)
        .queue(queue)
        .processor(processor)
        .recorder(recorder)
        .broadcastPublisher(broadcastPublisher)
        .cache(cacheLayer)
        .calculations(calculationLayer)
        .metrics(metrics)
        .clock(clock)
        .syncTimeoutMs(builder.syncTimeoutMs)
        .maxRetryAttempts(builder.maxRetryAttempts)
        .errorRateThreshold(builder.errorRateThreshold)
        .callTimeoutMs(callTimeoutMs)
        .build();
    this.consistencyChecker = new ConsistencyChecker(cacheLayer, calculationLayer, callTimeoutMs);
    this.eventFactory = new SyncEventFactory(clock);
    this.listener = new ChangeSourceListener(
        transport, queue, eventFactory, scheduler, builder.resubscribeDelayMs);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Subscribes to the sync channel and schedules the batch and health ticks.
   * Calling it on a started engine does nothing.
   *
   * @throws IllegalStateException if the engine was closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SyncEngine is closed");
    }
    if (started) {
      return;
    }
    listener.subscribe();
    batchTask = scheduler.scheduleWithFixedDelay(this::processBatch, batchIntervalMs, batchIntervalMs);
    healthTask = scheduler.scheduleWithFixedDelay(this::performHealthCheck, healthIntervalMs, healthIntervalMs);
    started = true;
    logger.log(Level.INFO, "Sync engine started (batch every {0} ms, health every {1} ms)",
        new Object[]{batchIntervalMs, healthIntervalMs});
  }

  /**
   * Cancels the ticks, unsubscribes, and waits up to the call timeout for the running
   * batch to settle. Queued and pending events are kept; {@link #start()} resumes.
   */
  public synchronized void stop() {
    if (!started) {
      return;
    }
    started = false;
    batchTask.cancel();
    healthTask.cancel();
    listener.close();
    if (!batchProcessor.awaitIdle(callTimeoutMs)) {
      logger.warning("Batch still running after stop timeout");
    }
    logger.info("Sync engine stopped");
  }

  public synchronized boolean isRunning() {
    return started;
  }

  /**
   * Stops the engine, shuts down owned threads and discards queued events, pending
   * updates and connections.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    stop();
    closed = true;
    RuntimeException first = null;
    if (ownsScheduler) {
      try {
        scheduler.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    if (ownedExecutor != null) {
      ownedExecutor.shutdownNow();
      try {
        ownedExecutor.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    queue.clear();
    pendingUpdates.clear();
    registry.clear();
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  // ── Change intake ──────────────────────────────────────────────

  /**
   * Queues a {@code TEAM_DATA_CHANGE} for a team changed by a team-scoped view.
   * Never throws; processing outcomes are only visible through the metrics.
   *
   * @param entityId the team id
   * @param kind     what changed
   */
  public void onEntityChange(long entityId, ChangeKind kind) {
    onEntityChange(entityId, kind, EventSource.SCOPED_VIEW);
  }

  /**
   * Queues a {@code TEAM_DATA_CHANGE} for a team changed by {@code source}.
   */
  public void onEntityChange(long entityId, ChangeKind kind, EventSource source) {
    try {
      SyncEvent event = eventFactory.manualChange(entityId, Objects.requireNonNull(kind, "kind"),
          Objects.requireNonNull(source, "source"));
      EnqueueOutcome outcome = queue.add(event);
      logger.log(Level.FINE, "Entity change for team {0}: {1}", new Object[]{entityId, outcome});
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to queue change for team " + entityId, e);
    }
  }

  /**
   * Queues a prepared event, for hosts that build events themselves.
   *
   * @return what the queue did with it
   */
  public EnqueueOutcome submit(SyncEvent event) {
    return queue.add(event);
  }

  // ── Connections ────────────────────────────────────────────────

  public ClientConnection registerClient(String id, ClientType type) {
    return registerClient(id, type, null, null);
  }

  public ClientConnection registerClient(String id, ClientType type, Long scope, String principal) {
    ClientConnection connection = registry.register(id, type, scope, principal);
    logger.log(Level.FINE, "Registered {0}", connection);
    return connection;
  }

  /** Refreshes a connection's last activity; unknown ids are ignored. */
  public void updateClientActivity(String id) {
    registry.touch(id);
  }

  public void unregisterClient(String id) {
    registry.unregister(id);
  }

  /** Returns the connection with {@code id}, or {@code null}. */
  public ClientConnection findClient(String id) {
    return registry.find(id);
  }

  // ── Status ─────────────────────────────────────────────────────

  public SyncMetrics getSyncMetrics() {
    return recorder.snapshot();
  }

  public SyncStatusReport validateSyncStatus() {
    return healthMonitor.validateSyncStatus();
  }

  /** Events waiting in the queue, in processing order. */
  public List<SyncEvent> queuedEvents() {
    return queue.snapshot();
  }

  public List<PendingUpdate> pendingUpdates() {
    return pendingUpdates.snapshot();
  }

  /**
   * Clears every cache, re-warms critical aggregates and broadcasts {@code force_refresh}.
   *
   * @return {@code false} if any step failed; never throws
   */
  public boolean forceSynchronization() {
    return healthMonitor.forceSynchronization();
  }

  public ConsistencyReport checkConsistency(long teamId) {
    return consistencyChecker.check(teamId);
  }

  public ConsistencyReport reconcile(long teamId) {
    return consistencyChecker.reconcile(teamId);
  }

  // ── Ticks ──────────────────────────────────────────────────────

  /**
   * Runs one batch tick.
   *
   * @return the number of events dispatched
   */
  public int processBatch() {
    return batchProcessor.processBatch();
  }

  /** Runs one health tick. */
  public void performHealthCheck() {
    healthMonitor.tick();
  }

  /**
   * Builder for {@link SyncEngine}.
   */
  public static final class Builder {
    private CacheLayer cacheLayer;
    private CalculationLayer calculationLayer;
    private PubSubTransport transport;
    private MetricsExporter metrics;
    private Clock clock;
    private TaskScheduler scheduler;
    private Executor processingExecutor;
    private RetryPolicy retryPolicy;
    private int workerCount = 4;
    private int batchSize = 10;
    private long batchIntervalMs = 1_000L;
    private long healthIntervalMs = 60_000L;
    private long dedupWindowMs = 5_000L;
    private int maxQueueLength = 1_000;
    private long syncTimeoutMs = 30_000L;
    private int maxRetryAttempts = 3;
    private long clientIdleTimeoutMs = 300_000L;
    private double errorRateThreshold = 0.10;
    private long callTimeoutMs = 10_000L;
    private long resubscribeDelayMs = 5_000L;

    private Builder() {
    }

    /** <b>Required.</b> Cache holding the derived data read by the views. */
    public Builder cacheLayer(CacheLayer cacheLayer) {
      this.cacheLayer = cacheLayer;
      return this;
    }

    /** <b>Required.</b> */
    public Builder calculationLayer(CalculationLayer calculationLayer) {
      this.calculationLayer = calculationLayer;
      return this;
    }

    /** <b>Required.</b> Carries change-stream mutations in and broadcasts out. */
    public Builder transport(PubSubTransport transport) {
      this.transport = transport;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the engine if closeable. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Runs the ticks and delayed resubscribes. Defaults to a single daemon
     * thread owned (and closed) by the engine.
     */
    public Builder scheduler(TaskScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /**
     * Optional. Runs per-event processing. Defaults to a fixed pool of
     * {@link #workerCount(int)} daemon threads owned by the engine.
     */
    public Builder processingExecutor(Executor processingExecutor) {
      this.processingExecutor = processingExecutor;
      return this;
    }

    /** Optional. Defaults to exponential backoff from 1 s up to 30 s. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Size of the default processing pool. Defaults to 4. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Events taken per batch tick. Defaults to 10. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder batchIntervalMs(long batchIntervalMs) {
      this.batchIntervalMs = batchIntervalMs;
      return this;
    }

    public Builder healthIntervalMs(long healthIntervalMs) {
      this.healthIntervalMs = healthIntervalMs;
      return this;
    }

    /** Window within which events for the same entity are merged. Defaults to 5 000 ms. */
    public Builder dedupWindowMs(long dedupWindowMs) {
      this.dedupWindowMs = dedupWindowMs;
      return this;
    }

    /** Defaults to 1 000. */
    public Builder maxQueueLength(int maxQueueLength) {
      this.maxQueueLength = maxQueueLength;
      return this;
    }

    /**
     * Lag warning threshold. Together with {@link #maxRetryAttempts(int)} it bounds the age
     * of a retried event. Defaults to 30 000 ms.
     */
    public Builder syncTimeoutMs(long syncTimeoutMs) {
      this.syncTimeoutMs = syncTimeoutMs;
      return this;
    }

    public Builder maxRetryAttempts(int maxRetryAttempts) {
      this.maxRetryAttempts = maxRetryAttempts;
      return this;
    }

    /** Defaults to 5 minutes. */
    public Builder clientIdleTimeoutMs(long clientIdleTimeoutMs) {
      this.clientIdleTimeoutMs = clientIdleTimeoutMs;
      return this;
    }

    public Builder errorRateThreshold(double errorRateThreshold) {
      this.errorRateThreshold = errorRateThreshold;
      return this;
    }

    /** Maximum wait for each collaborator call. Defaults to 10 000 ms. */
    public Builder callTimeoutMs(long callTimeoutMs) {
      this.callTimeoutMs = callTimeoutMs;
      return this;
    }

    /** Delay before resubscribing after a channel error. Defaults to 5 000 ms. */
    public Builder resubscribeDelayMs(long resubscribeDelayMs) {
      this.resubscribeDelayMs = resubscribeDelayMs;
      return this;
    }

    void validate() {
      if (workerCount <= 0) {
        throw new IllegalArgumentException("workerCount must be > 0");
      }
      if (batchSize <= 0) {
        throw new IllegalArgumentException("batchSize must be > 0");
      }
      if (batchIntervalMs <= 0 || healthIntervalMs <= 0) {
        throw new IllegalArgumentException("Tick intervals must be > 0");
      }
      if (dedupWindowMs < 0) {
        throw new IllegalArgumentException("dedupWindowMs must be >= 0");
      }
      if (maxQueueLength <= 0) {
        throw new IllegalArgumentException("maxQueueLength must be > 0");
      }
      if (clientIdleTimeoutMs <= 0) {
        throw new IllegalArgumentException("clientIdleTimeoutMs must be > 0");
      }
      if (resubscribeDelayMs < 0) {
        throw new IllegalArgumentException("resubscribeDelayMs must be >= 0");
      }
    }

    /**
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public SyncEngine build() {
      return new SyncEngine(this);
    }
  }
}
