package syncengine.util;

import syncengine.TransientProcessingException;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** Bounded waits on collaborator calls. */
public final class Futures {

  private Futures() {
  }

  /**
   * Waits for {@code stage} for at most {@code timeoutMs}.
   *
   * @param stage     the stage returned by a collaborator
   * @param timeoutMs maximum wait in milliseconds
   * @param operation name used in error messages
   * @return the stage's value
   * @throws TransientProcessingException if the stage is null, failed, timed out,
   *     or the caller was interrupted
   */
  public static <T> T await(CompletionStage<T> stage, long timeoutMs, String operation) {
    if (stage == null) {
      throw new TransientProcessingException(operation + " returned no result");
    }
    try {
      return stage.toCompletableFuture().get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientProcessingException(operation + " interrupted", e);
    } catch (ExecutionException e) {
      throw new TransientProcessingException(operation + " failed", e.getCause());
    } catch (TimeoutException e) {
      throw new TransientProcessingException(operation + " timed out after " + timeoutMs + " ms", e);
    }
  }
}
