package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Lifecycle assertions every {@link ReplicationStream} implementation must satisfy.
 */
public final class ReplicationStreamContractKit {

  private ReplicationStreamContractKit() {
  }

  public static void assertInitiallyDisconnected(ReplicationStream stream) {
    Objects.requireNonNull(stream, "stream");
    if (stream.state() != ReplicationStreamState.DISCONNECTED) {
      throw new AssertionError("Expected DISCONNECTED state before start(), got " + stream.state());
    }
  }

  public static void assertClosePreventsStart(ReplicationStream stream, Duration timeout) {
    Objects.requireNonNull(stream, "stream");
    try {
      stream.close();
    } catch (RuntimeException e) {
      throw new AssertionError("Unexpected failure while closing stream", e);
    }
    if (stream.state() != ReplicationStreamState.STOPPED) {
      throw new AssertionError("Expected STOPPED state after close(), got " + stream.state());
    }
    Throwable failure = awaitFailure(stream.start(), timeout);
    if (failure == null) {
      throw new AssertionError("Expected start() failure after close()");
    }
  }

  public static void assertCloseIsIdempotent(ReplicationStream stream) {
    Objects.requireNonNull(stream, "stream");
    stream.close();
    stream.close();
    if (stream.state() != ReplicationStreamState.STOPPED) {
      throw new AssertionError("Expected STOPPED state after repeated close(), got " + stream.state());
    }
  }

  public static void assertPreflightFailureTransitionsToFailed(ReplicationStream stream, Duration timeout) {
    Objects.requireNonNull(stream, "stream");
    Throwable failure = awaitFailure(stream.start(), timeout);
    if (!(failure instanceof PreflightFailedException)) {
      throw new AssertionError("Expected PreflightFailedException, got: " + failure);
    }
    if (stream.state() != ReplicationStreamState.FAILED) {
      throw new AssertionError("Expected FAILED state after preflight failure, got " + stream.state());
    }
  }

  public static Throwable awaitFailure(Future<?> future, Duration timeout) {
    Objects.requireNonNull(future, "future");
    Objects.requireNonNull(timeout, "timeout");
    try {
      future.toCompletionStage().toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return null;
    } catch (ExecutionException e) {
      return e.getCause();
    } catch (TimeoutException e) {
      throw new AssertionError("Timed out waiting for future completion", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return e;
    }
  }
}
