package syncengine.broadcast;

import syncengine.model.MutationNotification;
import syncengine.spi.PubSubTransport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-process {@link PubSubTransport} that delivers synchronously on the caller's thread.
 *
 * <p>Besides engine broadcasts it lets the host (or a test) inject change-stream mutations
 * with {@link #publishMutation} and channel status changes with {@link #signalStatus}.
 * Every sent message is recorded and can be inspected with {@link #sentMessages()}.
 */
public final class InMemoryPubSubTransport implements PubSubTransport {
  private static final Logger logger = Logger.getLogger(InMemoryPubSubTransport.class.getName());

  /** A message accepted by {@link #send}. */
  public record SentMessage(String channel, String eventName, Object payload) {
  }

  private final Map<String, List<ChannelListener>> listeners = new ConcurrentHashMap<>();
  private final List<SentMessage> sent = new CopyOnWriteArrayList<>();

  @Override
  public CompletionStage<Void> send(String channel, String eventName, Object payload) {
    sent.add(new SentMessage(channel, eventName, payload));
    for (ChannelListener listener : listenersOf(channel)) {
      try {
        listener.onBroadcast(eventName, payload);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Listener failed on " + channel + "/" + eventName, e);
      }
    }
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public Subscription subscribe(String channel, ChannelListener listener) {
    List<ChannelListener> channelListeners =
        listeners.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>());
    channelListeners.add(listener);
    listener.onStatus(ChannelStatus.SUBSCRIBED);
    return () -> {
      if (channelListeners.remove(listener)) {
        listener.onStatus(ChannelStatus.CLOSED);
      }
    };
  }

  /** Delivers a change-stream mutation to the channel's subscribers. */
  public void publishMutation(String channel, MutationNotification notification) {
    for (ChannelListener listener : listenersOf(channel)) {
      listener.onMutation(notification);
    }
  }

  /** Delivers a status change to the channel's subscribers. */
  public void signalStatus(String channel, ChannelStatus status) {
    for (ChannelListener listener : listenersOf(channel)) {
      listener.onStatus(status);
    }
  }

  public int subscriberCount(String channel) {
    return listenersOf(channel).size();
  }

  public List<SentMessage> sentMessages() {
    return Collections.unmodifiableList(new ArrayList<>(sent));
  }

  private List<ChannelListener> listenersOf(String channel) {
    return listeners.getOrDefault(channel, Collections.emptyList());
  }
}
