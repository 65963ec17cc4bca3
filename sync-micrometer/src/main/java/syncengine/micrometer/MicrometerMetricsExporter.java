package syncengine.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import syncengine.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code sync.events.enqueued} - events appended to the queue</li>
 *   <li>{@code sync.events.deduplicated} - events that replaced a queued event</li>
 *   <li>{@code sync.events.dropped} - events dropped (queue full)</li>
 *   <li>{@code sync.process.success} - events processed successfully</li>
 *   <li>{@code sync.process.failure} - failed processing attempts</li>
 *   <li>{@code sync.retry.attempted} - retries started by the health monitor</li>
 *   <li>{@code sync.retry.unrecoverable} - pending updates given up on</li>
 *   <li>{@code sync.broadcast.failure} - broadcasts the transport rejected</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code sync.queue.depth} - queued events</li>
 *   <li>{@code sync.pending.updates} - failed events awaiting retry</li>
 *   <li>{@code sync.clients.connected} - registered connections</li>
 *   <li>{@code sync.lag.ms} - time since the latest completed event</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code sync.process.duration} - duration of successful processing attempts</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter enqueued;
  private final Counter deduplicated;
  private final Counter dropped;
  private final Counter processSuccess;
  private final Counter processFailure;
  private final Counter retryAttempted;
  private final Counter retryUnrecoverable;
  private final Counter broadcastFailure;
  private final Gauge queueDepthGauge;
  private final Gauge pendingGauge;
  private final Gauge clientsGauge;
  private final Gauge lagGauge;
  private final Timer processDuration;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicInteger pendingUpdates = new AtomicInteger();
  private final AtomicInteger connectedClients = new AtomicInteger();
  private final AtomicLong lagMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "sync"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "sync");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "planning.sync"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.enqueued = counter(namePrefix + ".events.enqueued", "Events appended to the queue");
    this.deduplicated = counter(namePrefix + ".events.deduplicated", "Events that replaced a queued event");
    this.dropped = counter(namePrefix + ".events.dropped", "Events dropped (queue full)");
    this.processSuccess = counter(namePrefix + ".process.success", "Events processed successfully");
    this.processFailure = counter(namePrefix + ".process.failure", "Failed processing attempts");
    this.retryAttempted = counter(namePrefix + ".retry.attempted", "Retries of pending updates");
    this.retryUnrecoverable = counter(namePrefix + ".retry.unrecoverable", "Pending updates given up on");
    this.broadcastFailure = counter(namePrefix + ".broadcast.failure", "Broadcasts rejected by the transport");

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.pendingGauge = Gauge.builder(namePrefix + ".pending.updates", pendingUpdates, AtomicInteger::get)
        .register(registry);
    this.clientsGauge = Gauge.builder(namePrefix + ".clients.connected", connectedClients, AtomicInteger::get)
        .register(registry);
    this.lagGauge = Gauge.builder(namePrefix + ".lag.ms", lagMs, AtomicLong::get)
        .register(registry);
    this.processDuration = Timer.builder(namePrefix + ".process.duration")
        .description("Duration of successful processing attempts")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementEventsEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementEventsDeduplicated() {
    if (closed) return;
    deduplicated.increment();
  }

  @Override
  public void incrementEventsDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void incrementSyncSuccess() {
    if (closed) return;
    processSuccess.increment();
  }

  @Override
  public void incrementSyncFailure() {
    if (closed) return;
    processFailure.increment();
  }

  @Override
  public void incrementSyncRetried() {
    if (closed) return;
    retryAttempted.increment();
  }

  @Override
  public void incrementSyncUnrecoverable() {
    if (closed) return;
    retryUnrecoverable.increment();
  }

  @Override
  public void incrementBroadcastFailure() {
    if (closed) return;
    broadcastFailure.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordPendingUpdates(int pending) {
    if (closed) return;
    pendingUpdates.set(pending);
  }

  @Override
  public void recordConnectedClients(int clients) {
    if (closed) return;
    connectedClients.set(clients);
  }

  @Override
  public void recordSyncLagMs(long lagMs) {
    if (closed) return;
    this.lagMs.set(lagMs);
  }

  @Override
  public void recordProcessingTimeMs(long durationMs) {
    if (closed) return;
    processDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>The engine calls this when it is closed.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(enqueued, deduplicated, dropped, processSuccess, processFailure,
        retryAttempted, retryUnrecoverable, broadcastFailure,
        queueDepthGauge, pendingGauge, clientsGauge, lagGauge, processDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
