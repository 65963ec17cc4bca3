package syncengine.listener;

/** An inbound change could not be turned into a sync event. */
public class MalformedChangeException extends RuntimeException {

  public MalformedChangeException(String message) {
    super(message);
  }

  public MalformedChangeException(String message, Throwable cause) {
    super(message, cause);
  }
}
