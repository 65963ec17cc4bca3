package syncengine.broadcast;

/**
 * Thrown when the transport did not accept a broadcast that the caller must know about.
 *
 * <p>Per-event {@code data_refresh} broadcasts never throw this; their failures are only
 * logged and counted.
 */
public class BroadcastDeliveryException extends RuntimeException {

  public BroadcastDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
