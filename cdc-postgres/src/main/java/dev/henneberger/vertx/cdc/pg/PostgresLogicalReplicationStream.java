/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.henneberger.vertx.cdc.pg;

import dev.henneberger.vertx.cdc.core.Checkpoint;
import dev.henneberger.vertx.cdc.core.ConsumerFailedException;
import dev.henneberger.vertx.cdc.core.EnvelopeConsumer;
import dev.henneberger.vertx.cdc.core.EnvelopeDispatcher;
import dev.henneberger.vertx.cdc.core.InMemoryCheckpointStore;
import dev.henneberger.vertx.cdc.core.Lsn;
import dev.henneberger.vertx.cdc.core.PreflightFailedException;
import dev.henneberger.vertx.cdc.core.PreflightReport;
import dev.henneberger.vertx.cdc.core.ReplicationConnectionException;
import dev.henneberger.vertx.cdc.core.ReplicationErrors;
import dev.henneberger.vertx.cdc.core.ReplicationException;
import dev.henneberger.vertx.cdc.core.ReplicationMetricsListener;
import dev.henneberger.vertx.cdc.core.ReplicationStateChange;
import dev.henneberger.vertx.cdc.core.ReplicationStream;
import dev.henneberger.vertx.cdc.core.ReplicationStreamState;
import dev.henneberger.vertx.cdc.core.ReplicationSubscription;
import dev.henneberger.vertx.cdc.core.RetryPolicy;
import dev.henneberger.vertx.cdc.core.SubscriptionRegistration;
import dev.henneberger.vertx.cdc.core.TransactionEnvelope;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Change stream of one wal2json replication slot.
 *
 * <p>A single worker thread runs {@link ReplicationSession}s one after another. A session that fails
 * with a retryable error is followed by a new one after a backoff delay; a fatal error, or running
 * out of attempts, moves the stream to {@link ReplicationStreamState#FAILED}. The attempt counter
 * starts over after every session that reached {@link ReplicationStreamState#STREAMING}.
 */
public class PostgresLogicalReplicationStream implements ReplicationStream {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresLogicalReplicationStream.class);

  private final Vertx vertx;
  private final PostgresReplicationOptions options;
  private final PostgresConnector connector;
  private final ReplicationSlotManager slotManager;
  private final List<EnvelopeDispatcher.Subscriber> subscribers = new CopyOnWriteArrayList<>();
  private final List<Handler<ReplicationStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final List<ReplicationMetricsListener> metricsListeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shouldRun = new AtomicBoolean(false);

  private volatile Thread worker;
  private volatile Promise<Void> startPromise;
  private volatile ReplicationStreamState state = ReplicationStreamState.DISCONNECTED;
  private volatile Lsn confirmedLsn;
  private long attempt;

  public PostgresLogicalReplicationStream(Vertx vertx, PostgresReplicationOptions options) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = Objects.requireNonNull(options, "options").resolved();
    this.options.validate();
    this.connector = new PostgresConnector(this.options);
    this.slotManager = new ReplicationSlotManager(connector, this.options);
  }

  @Override
  public Future<Void> start() {
    Promise<Void> promiseToReturn;
    synchronized (this) {
      if (state == ReplicationStreamState.STOPPED) {
        return Future.failedFuture("stream is closed");
      }
      if (state == ReplicationStreamState.STREAMING) {
        return Future.succeededFuture();
      }
      if (shouldRun.get() && startPromise != null) {
        return startPromise.future();
      }

      shouldRun.set(true);
      startPromise = Promise.promise();
      promiseToReturn = startPromise;
      transition(ReplicationStreamState.CONNECTING, null, 0);
    }

    if (options.getCheckpointStore() instanceof InMemoryCheckpointStore) {
      LOG.warn("Slot '{}' uses an in-memory checkpoint store; positions are lost on restart", options.getSlotName());
    }

    Future<Void> preflightFuture;
    if (options.isPreflightEnabled()) {
      preflightFuture = preflight().compose(report -> {
        if (report.ok()) {
          return Future.succeededFuture();
        }
        return Future.failedFuture(new PreflightFailedException(options.getSlotName(), report, ReplicationStreamState.CONNECTING));
      });
    } else {
      preflightFuture = Future.succeededFuture();
    }

    preflightFuture.onSuccess(v -> startWorker())
      .onFailure(err -> {
        LOG.error("Preflight failed for slot '{}': {}", options.getSlotName(), err.getMessage());
        shouldRun.set(false);
        transition(ReplicationStreamState.FAILED, err, 0);
        failStart(err);
      });

    return promiseToReturn.future();
  }

  @Override
  public Future<PreflightReport> preflight() {
    return vertx.executeBlocking(() -> new PostgresPreflightChecks(options, connector, slotManager).run());
  }

  @Override
  public ReplicationStreamState state() {
    return state;
  }

  /**
   * Last checkpoint saved for the slot, or {@code null} before the first session loaded it.
   */
  @Override
  public Lsn confirmedLsn() {
    return confirmedLsn;
  }

  public String slotName() {
    return options.getSlotName();
  }

  public ReplicationSlotManager slotManager() {
    return slotManager;
  }

  @Override
  public ReplicationSubscription onStateChange(Handler<ReplicationStateChange> handler) {
    Handler<ReplicationStateChange> resolved = Objects.requireNonNull(handler, "handler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  @Override
  public ReplicationSubscription addMetricsListener(ReplicationMetricsListener listener) {
    ReplicationMetricsListener resolved = Objects.requireNonNull(listener, "listener");
    metricsListeners.add(resolved);
    return () -> metricsListeners.remove(resolved);
  }

  @Override
  public ReplicationSubscription subscribe(EnvelopeConsumer consumer, Handler<Throwable> errorHandler) {
    return registerSubscription(consumer, errorHandler, true);
  }

  public ReplicationSubscription subscribe(Handler<TransactionEnvelope> handler, Handler<Throwable> errorHandler) {
    Objects.requireNonNull(handler, "handler");
    return subscribe(envelope -> {
      handler.handle(envelope);
      return Future.succeededFuture();
    }, errorHandler);
  }

  @Override
  public SubscriptionRegistration startAndSubscribe(EnvelopeConsumer consumer, Handler<Throwable> errorHandler) {
    ReplicationSubscription subscription = registerSubscription(consumer, errorHandler, false);
    Future<Void> started = start().onFailure(err -> {
      subscription.cancel();
      if (errorHandler != null) {
        errorHandler.handle(err);
      }
    });
    return new SubscriptionRegistration(options.getSlotName(), subscription, started);
  }

  @Override
  public synchronized void close() {
    if (state == ReplicationStreamState.STOPPED) {
      return;
    }
    shouldRun.set(false);
    transition(ReplicationStreamState.STOPPED, null, 0);

    Thread thread = worker;
    worker = null;
    if (thread != null) {
      thread.interrupt();
    }

    Promise<Void> currentStartPromise = startPromise;
    startPromise = null;
    if (currentStartPromise != null && !currentStartPromise.future().isComplete()) {
      currentStartPromise.fail("stream closed before reaching STREAMING");
    }
    LOG.info("Stopped change stream for slot '{}' at {}", options.getSlotName(), confirmedLsn);
  }

  private ReplicationSubscription registerSubscription(EnvelopeConsumer consumer,
                                                       Handler<Throwable> errorHandler,
                                                       boolean withAutoStart) {
    EnvelopeDispatcher.Subscriber subscriber = new EnvelopeDispatcher.Subscriber(consumer, errorHandler);
    subscribers.add(subscriber);

    if (withAutoStart && options.isAutoStart()) {
      start().onFailure(err -> {
        if (errorHandler != null) {
          errorHandler.handle(err);
        }
      });
    }

    return () -> subscribers.remove(subscriber);
  }

  private synchronized void startWorker() {
    if (!shouldRun.get()) {
      return;
    }
    if (worker != null && worker.isAlive()) {
      return;
    }

    worker = new Thread(this::runLoop, "pg-repl-" + options.getSlotName());
    worker.setDaemon(true);
    worker.start();
  }

  private void runLoop() {
    attempt = 0;
    try {
      while (shouldRun.get()) {
        transition(ReplicationStreamState.CONNECTING, null, attempt + 1);
        ReplicationSession session = new ReplicationSession(
          vertx, options, connector, slotManager, subscribers, new SessionCallbacks(), shouldRun::get);
        try {
          session.run();
          if (!shouldRun.get()) {
            return;
          }
          throw new ReplicationConnectionException("replication session ended unexpectedly", null);
        } catch (Exception e) {
          if (!shouldRun.get()) {
            LOG.debug("Session of slot '{}' ended during shutdown", options.getSlotName(), e);
            return;
          }
          if (session.reachedStreaming()) {
            attempt = 0;
          }
          attempt++;
          if (!handleFailure(e)) {
            return;
          }
        }
      }
    } finally {
      synchronized (this) {
        if (worker == Thread.currentThread()) {
          worker = null;
        }
      }
    }
  }

  /**
   * @return whether the loop should try again
   */
  private boolean handleFailure(Exception error) {
    ReplicationException classified = PostgresErrors.classify(error, options.getSlotName(), confirmedLsn);
    Throwable failure = classified == null ? error : classified;
    RetryPolicy retryPolicy = options.getRetryPolicy();

    if (!retryPolicy.shouldRetry(failure, attempt)) {
      LOG.error("Change stream failed: {}",
        ReplicationErrors.describe(failure, options.getSlotName(), confirmedLsn), failure);
      if (!(failure instanceof ConsumerFailedException)) {
        notifyError(failure);
      }
      synchronized (this) {
        shouldRun.set(false);
        transition(ReplicationStreamState.FAILED, failure, attempt);
      }
      failStart(failure);
      return false;
    }

    long delay = retryPolicy.computeDelayMillis(attempt);
    LOG.warn("Change stream for slot '{}' disconnected (attempt {}), reconnecting in {} ms: {}",
      options.getSlotName(), attempt, delay, failure.toString());
    transition(ReplicationStreamState.DISCONNECTED, failure, attempt);
    sleepInterruptibly(delay);
    return true;
  }

  private void notifyError(Throwable error) {
    for (EnvelopeDispatcher.Subscriber subscriber : subscribers) {
      if (subscriber.errorHandler() != null) {
        vertx.runOnContext(v -> subscriber.notifyError(error));
      }
    }
  }

  private void transition(ReplicationStreamState nextState, Throwable cause, long attemptNumber) {
    ReplicationStreamState previous = this.state;
    if (previous == nextState && cause == null) {
      return;
    }
    if (previous == ReplicationStreamState.STOPPED) {
      return;
    }

    this.state = nextState;
    ReplicationStateChange change = new ReplicationStateChange(previous, nextState, cause, attemptNumber, confirmedLsn);

    for (ReplicationMetricsListener listener : metricsListeners) {
      listener.onStateChange(change);
    }
    for (Handler<ReplicationStateChange> handler : stateHandlers) {
      vertx.runOnContext(v -> handler.handle(change));
    }
  }

  private void failStart(Throwable error) {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.fail(error);
    }
  }

  private void completeStart() {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.complete();
    }
  }

  private void sleepInterruptibly(long millis) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  private final class SessionCallbacks implements ReplicationSession.Callbacks {

    @Override
    public void onCheckpointLoaded(Lsn lsn) {
      confirmedLsn = lsn;
    }

    @Override
    public void onStreaming(ReplicationSlot slot, Lsn startLsn) {
      synchronized (PostgresLogicalReplicationStream.this) {
        if (!shouldRun.get()) {
          return;
        }
        transition(ReplicationStreamState.STREAMING, null, attempt + 1);
      }
      completeStart();
    }

    @Override
    public void onEnvelope(TransactionEnvelope envelope) {
      for (ReplicationMetricsListener listener : metricsListeners) {
        listener.onEnvelope(envelope);
      }
    }

    @Override
    public void onDecodeFailure(String payload, Throwable error) {
      for (ReplicationMetricsListener listener : metricsListeners) {
        listener.onDecodeFailure(payload, error);
      }
    }

    @Override
    public void onCheckpointSaved(Checkpoint checkpoint) {
      confirmedLsn = checkpoint.confirmedLsn();
      for (ReplicationMetricsListener listener : metricsListeners) {
        listener.onCheckpointSaved(checkpoint);
      }
    }

    @Override
    public void onAcknowledged(Lsn lsn) {
      for (ReplicationMetricsListener listener : metricsListeners) {
        listener.onAcknowledged(options.getSlotName(), lsn);
      }
    }
  }
}
