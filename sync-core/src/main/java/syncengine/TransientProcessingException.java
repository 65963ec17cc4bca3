package syncengine;

/**
 * Thrown when a processing step of a sync event fails in a way a later retry may fix:
 * a collaborator call failed, timed out, or was interrupted.
 *
 * <p>The engine never lets this escape to callers of its public API. The failed event is
 * parked as a pending update and retried by the health monitor.
 */
public class TransientProcessingException extends RuntimeException {

  public TransientProcessingException(String message) {
    super(message);
  }

  public TransientProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
