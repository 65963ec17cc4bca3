package syncengine.listener;

import syncengine.broadcast.SyncChannels;
import syncengine.model.MutationNotification;
import syncengine.model.SyncEvent;
import syncengine.model.SyncNotification;
import syncengine.queue.SyncEventQueue;
import syncengine.spi.PubSubTransport;
import syncengine.spi.TaskScheduler;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subscribes to the sync channel and feeds observed changes into the queue.
 *
 * <p>Handles row mutations on the watched streams and {@code data_change} broadcasts from
 * other engine instances. On a channel error the subscription is dropped and recreated
 * after {@code resubscribeDelayMs}.
 */
public final class ChangeSourceListener implements PubSubTransport.ChannelListener, AutoCloseable {
  private static final Logger logger = Logger.getLogger(ChangeSourceListener.class.getName());

  private final PubSubTransport transport;
  private final SyncEventQueue queue;
  private final SyncEventFactory eventFactory;
  private final TaskScheduler scheduler;
  private final long resubscribeDelayMs;

  private PubSubTransport.Subscription subscription;
  private TaskScheduler.ScheduledTask pendingResubscribe;
  private boolean active;
  private boolean subscribing;
  private boolean failedWhileSubscribing;

  public ChangeSourceListener(PubSubTransport transport, SyncEventQueue queue,
      SyncEventFactory eventFactory, TaskScheduler scheduler, long resubscribeDelayMs) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.eventFactory = Objects.requireNonNull(eventFactory, "eventFactory");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    if (resubscribeDelayMs < 0) {
      throw new IllegalArgumentException("resubscribeDelayMs must be >= 0");
    }
    this.resubscribeDelayMs = resubscribeDelayMs;
  }

  /**
   * Subscribes to {@link SyncChannels#CHANNEL}. No-op if already subscribed.
   *
   * <p>A channel error reported while the transport is still subscribing discards the new
   * subscription; the scheduled resubscribe then tries again.
   */
  public synchronized void subscribe() {
    active = true;
    if (subscription != null || subscribing) {
      return;
    }
    subscribing = true;
    failedWhileSubscribing = false;
    PubSubTransport.Subscription created;
    try {
      created = transport.subscribe(SyncChannels.CHANNEL, this);
    } finally {
      subscribing = false;
    }
    if (failedWhileSubscribing) {
      unsubscribeQuietly(created);
      return;
    }
    subscription = created;
    logger.log(Level.INFO, "Subscribed to {0}", SyncChannels.CHANNEL);
  }

  public synchronized boolean isSubscribed() {
    return subscription != null;
  }

  @Override
  public void onMutation(MutationNotification notification) {
    try {
      SyncEvent event = eventFactory.fromMutation(notification);
      if (event == null) {
        logger.log(Level.FINE, "Ignoring mutation on unwatched stream {0}", notification.streamName());
        return;
      }
      queue.add(event);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Ignoring malformed " + notification.operation()
          + " on " + notification.streamName(), e);
    }
  }

  @Override
  public void onBroadcast(String eventName, Object payload) {
    if (!SyncChannels.DATA_CHANGE.equals(eventName)) {
      return;
    }
    if (!(payload instanceof SyncNotification notification)) {
      logger.log(Level.WARNING, "Ignoring {0} with payload {1}", new Object[]{eventName, payload});
      return;
    }
    try {
      queue.add(eventFactory.fromRemote(notification));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Ignoring malformed remote change", e);
    }
  }

  @Override
  public void onStatus(PubSubTransport.ChannelStatus status) {
    if (status == PubSubTransport.ChannelStatus.CHANNEL_ERROR) {
      handleChannelError();
    }
  }

  private synchronized void handleChannelError() {
    if (!active) {
      return;
    }
    logger.log(Level.WARNING, "Channel {0} failed; resubscribing in {1} ms",
        new Object[]{SyncChannels.CHANNEL, resubscribeDelayMs});
    if (subscribing) {
      failedWhileSubscribing = true;
    }
    dropSubscription();
    if (pendingResubscribe == null) {
      pendingResubscribe = scheduler.schedule(this::resubscribe, resubscribeDelayMs);
    }
  }

  private synchronized void resubscribe() {
    pendingResubscribe = null;
    if (!active) {
      return;
    }
    try {
      subscribe();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Resubscribe failed; retrying in " + resubscribeDelayMs + " ms", e);
      pendingResubscribe = scheduler.schedule(this::resubscribe, resubscribeDelayMs);
    }
  }

  private void dropSubscription() {
    PubSubTransport.Subscription current = subscription;
    subscription = null;
    unsubscribeQuietly(current);
  }

  private static void unsubscribeQuietly(PubSubTransport.Subscription target) {
    if (target == null) {
      return;
    }
    try {
      target.unsubscribe();
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Unsubscribe failed", e);
    }
  }

  /** Cancels the subscription and any pending resubscribe. */
  @Override
  public synchronized void close() {
    active = false;
    if (pendingResubscribe != null) {
      pendingResubscribe.cancel();
      pendingResubscribe = null;
    }
    dropSubscription();
  }
}
