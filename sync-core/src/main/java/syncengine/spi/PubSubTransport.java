package syncengine.spi;

import syncengine.model.MutationNotification;

import java.util.concurrent.CompletionStage;

/**
 * Publish/subscribe transport connecting the engine to consumers, to the store's change
 * streams, and to other engine instances.
 *
 * @see syncengine.broadcast.InMemoryPubSubTransport
 */
public interface PubSubTransport {

  /**
   * Publishes a payload to every subscriber of a channel.
   *
   * @param channel   channel name
   * @param eventName event name within the channel
   * @param payload   payload object
   * @return stage completing when the transport accepted the message
   */
  CompletionStage<Void> send(String channel, String eventName, Object payload);

  /**
   * Subscribes to a channel. The listener receives mutations, broadcasts and status changes.
   *
   * @param channel  channel name
   * @param listener callback
   * @return handle used to cancel the subscription
   */
  Subscription subscribe(String channel, ChannelListener listener);

  /** Subscription handle. */
  interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
      unsubscribe();
    }
  }

  /** Callback for channel traffic. Implementations must not block. */
  interface ChannelListener {

    default void onMutation(MutationNotification notification) {
    }

    default void onBroadcast(String eventName, Object payload) {
    }

    default void onStatus(ChannelStatus status) {
    }
  }

  enum ChannelStatus {
    SUBSCRIBED,
    CHANNEL_ERROR,
    CLOSED
  }
}
