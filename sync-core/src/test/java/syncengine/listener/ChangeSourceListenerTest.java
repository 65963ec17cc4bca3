package syncengine.listener;

import org.junit.jupiter.api.Test;
import syncengine.ManualTaskScheduler;
import syncengine.TestClock;
import syncengine.TestEvents;
import syncengine.broadcast.InMemoryPubSubTransport;
import syncengine.broadcast.SyncChannels;
import syncengine.model.EventType;
import syncengine.model.MutationNotification;
import syncengine.model.MutationOperation;
import syncengine.model.SyncEvent;
import syncengine.model.SyncNotification;
import syncengine.queue.SyncEventQueue;
import syncengine.spi.MetricsExporter;
import syncengine.spi.PubSubTransport;

import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeSourceListenerTest {

  private final TestClock clock = new TestClock(0);
  private final ManualTaskScheduler scheduler = new ManualTaskScheduler(clock);
  private final InMemoryPubSubTransport transport = new InMemoryPubSubTransport();
  private final SyncEventQueue queue = new SyncEventQueue(clock, 5_000, 100, MetricsExporter.NOOP);
  private final ChangeSourceListener listener =
      new ChangeSourceListener(transport, queue, new SyncEventFactory(clock), scheduler, 5_000);

  @Test
  void mutationOnWatchedStreamIsQueued() {
    listener.subscribe();

    transport.publishMutation(SyncChannels.CHANNEL, new MutationNotification(
        "team_members", MutationOperation.UPDATE, null, Map.of("id", 3, "team_id", 7)));

    assertEquals(1, queue.size());
    assertEquals(EventType.MEMBER_UPDATE, queue.snapshot().get(0).type());
  }

  @Test
  void unknownStreamAndMalformedRowsAreIgnored() {
    listener.subscribe();

    transport.publishMutation(SyncChannels.CHANNEL, new MutationNotification(
        "audit_log", MutationOperation.INSERT, null, Map.of("id", 1)));
    transport.publishMutation(SyncChannels.CHANNEL, new MutationNotification(
        "schedule_entries", MutationOperation.INSERT, null, Map.of("id", 1)));

    assertTrue(queue.isEmpty());
  }

  @Test
  void remoteDataChangeIsQueued() {
    listener.subscribe();
    SyncEvent remote = TestEvents.teamChange(9, 0);

    transport.send(SyncChannels.CHANNEL, SyncChannels.DATA_CHANGE, SyncNotification.from(remote));

    assertEquals(1, queue.size());
    assertEquals(remote.id(), queue.snapshot().get(0).id());
  }

  @Test
  void ownRefreshBroadcastsAreNotQueued() {
    listener.subscribe();

    transport.send(SyncChannels.CHANNEL, SyncChannels.DATA_REFRESH,
        SyncNotification.from(TestEvents.teamChange(9, 0)));
    transport.send(SyncChannels.CHANNEL, SyncChannels.DATA_CHANGE, "not a notification");

    assertTrue(queue.isEmpty());
  }

  @Test
  void channelErrorResubscribesAfterDelay() {
    listener.subscribe();
    assertEquals(1, transport.subscriberCount(SyncChannels.CHANNEL));

    transport.signalStatus(SyncChannels.CHANNEL, PubSubTransport.ChannelStatus.CHANNEL_ERROR);

    assertFalse(listener.isSubscribed());
    assertEquals(0, transport.subscriberCount(SyncChannels.CHANNEL));

    scheduler.advance(4_999);
    assertFalse(listener.isSubscribed());

    scheduler.advance(1);
    assertTrue(listener.isSubscribed());
    assertEquals(1, transport.subscriberCount(SyncChannels.CHANNEL));
  }

  @Test
  void closeCancelsPendingResubscribe() {
    listener.subscribe();
    transport.signalStatus(SyncChannels.CHANNEL, PubSubTransport.ChannelStatus.CHANNEL_ERROR);

    listener.close();
    scheduler.advance(10_000);

    assertFalse(listener.isSubscribed());
    assertEquals(0, transport.subscriberCount(SyncChannels.CHANNEL));
  }

  @Test
  void subscribeIsIdempotent() {
    listener.subscribe();
    listener.subscribe();

    assertEquals(1, transport.subscriberCount(SyncChannels.CHANNEL));
  }

  @Test
  void errorReportedDuringSubscribeStillResubscribes() {
    FailingFirstSubscribeTransport flaky = new FailingFirstSubscribeTransport(transport);
    ChangeSourceListener flakyListener =
        new ChangeSourceListener(flaky, queue, new SyncEventFactory(clock), scheduler, 5_000);

    flakyListener.subscribe();

    assertFalse(flakyListener.isSubscribed());
    assertEquals(0, transport.subscriberCount(SyncChannels.CHANNEL));

    scheduler.advance(5_000);

    assertEquals(2, flaky.subscribeCalls.get());
    assertTrue(flakyListener.isSubscribed());
    transport.publishMutation(SyncChannels.CHANNEL, new MutationNotification(
        "team_members", MutationOperation.UPDATE, null, Map.of("id", 3, "team_id", 7)));
    assertEquals(1, queue.size());

    scheduler.advance(10_000);
    assertEquals(2, flaky.subscribeCalls.get());
    flakyListener.close();
  }

  /** Reports a channel error from inside the first subscribe call, then behaves normally. */
  static final class FailingFirstSubscribeTransport implements PubSubTransport {
    final AtomicInteger subscribeCalls = new AtomicInteger();
    private final InMemoryPubSubTransport delegate;

    FailingFirstSubscribeTransport(InMemoryPubSubTransport delegate) {
      this.delegate = delegate;
    }

    @Override
    public CompletionStage<Void> send(String channel, String eventName, Object payload) {
      return delegate.send(channel, eventName, payload);
    }

    @Override
    public Subscription subscribe(String channel, ChannelListener listener) {
      Subscription subscription = delegate.subscribe(channel, listener);
      if (subscribeCalls.incrementAndGet() == 1) {
        listener.onStatus(ChannelStatus.CHANNEL_ERROR);
      }
      return subscription;
    }
  }
}
