package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer stage of a replication session.
 *
 * <p>The reading thread {@link #offer offers} assembled envelopes into a bounded queue. A dedicated
 * thread takes them in order, hands each to every subscriber on the Vert.x context and waits for all
 * of them to acknowledge before taking the next one. Acknowledged positions are saved through the
 * {@link AcknowledgementTracker} every {@code ackBatchSize} envelopes, and whenever the queue runs
 * empty.
 *
 * <p>While no subscriber is registered the next envelope waits in place, so a position is never saved for
 * a transaction nobody received. A dispatcher serves exactly one session. After {@link #close()} the queued envelopes are dropped.
 */
public final class EnvelopeDispatcher implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(EnvelopeDispatcher.class);
  private static final long IDLE_POLL_MS = 200L;
  private static final long JOIN_TIMEOUT_MS = 5000L;

  private final Vertx vertx;
  private final String slotName;
  private final AcknowledgementTracker tracker;
  private final List<Subscriber> subscribers;
  private final BlockingQueue<TransactionEnvelope> queue;
  private final int ackBatchSize;
  private final int maxConcurrentDispatch;
  private final boolean skipEmptyTransactions;
  private final long emptyTransactionFlushNanos;
  private final Handler<TransactionEnvelope> onDelivered;
  private final Handler<Checkpoint> onCheckpointSaved;
  private final AtomicReference<Throwable> failure = new AtomicReference<>();

  private volatile boolean running;
  private volatile Thread thread;
  private long lastSaveNanos;

  public EnvelopeDispatcher(Vertx vertx,
                            String slotName,
                            AcknowledgementTracker tracker,
                            List<Subscriber> subscribers,
                            Settings settings,
                            Handler<TransactionEnvelope> onDelivered,
                            Handler<Checkpoint> onCheckpointSaved) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.slotName = Objects.requireNonNull(slotName, "slotName");
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.subscribers = Objects.requireNonNull(subscribers, "subscribers");
    Objects.requireNonNull(settings, "settings");
    this.queue = new ArrayBlockingQueue<>(settings.maxPendingTransactions);
    this.ackBatchSize = settings.ackBatchSize;
    this.maxConcurrentDispatch = settings.maxConcurrentDispatch;
    this.skipEmptyTransactions = settings.skipEmptyTransactions;
    this.emptyTransactionFlushNanos = TimeUnit.MILLISECONDS.toNanos(settings.emptyTransactionFlushMs);
    this.onDelivered = onDelivered == null ? envelope -> { } : onDelivered;
    this.onCheckpointSaved = onCheckpointSaved == null ? checkpoint -> { } : onCheckpointSaved;
  }

  public synchronized void start() {
    if (thread != null) {
      throw new IllegalStateException("dispatcher already started");
    }
    running = true;
    Thread worker = new Thread(this::runLoop, "pg-repl-dispatch-" + slotName);
    worker.setDaemon(true);
    thread = worker;
    worker.start();
  }

  /**
   * Queues an envelope for delivery, waiting up to {@code timeout} for space.
   *
   * @return {@code false} when the queue stayed full; the caller should keep the connection alive and
   *   offer again
   * @throws Exception the failure that stopped the dispatcher, if any
   */
  public boolean offer(TransactionEnvelope envelope, long timeout, TimeUnit unit) throws Exception {
    Objects.requireNonNull(envelope, "envelope");
    checkFailure();
    if (!running) {
      throw new IllegalStateException("dispatcher for slot '" + slotName + "' is not running");
    }
    return queue.offer(envelope, timeout, unit);
  }

  /**
   * Rethrows the failure that stopped the dispatcher thread.
   */
  public void checkFailure() throws Exception {
    Throwable err = failure.get();
    if (err == null) {
      return;
    }
    if (err instanceof Exception) {
      throw (Exception) err;
    }
    throw new IllegalStateException("dispatcher failed", err);
  }

  public Optional<Throwable> failure() {
    return Optional.ofNullable(failure.get());
  }

  /**
   * Stops the dispatcher thread and waits for it to exit. Undelivered envelopes are discarded and an
   * in-flight consumer call is abandoned; envelopes acknowledged before the stop are still saved.
   */
  @Override
  public void close() {
    running = false;
    Thread worker;
    synchronized (this) {
      worker = thread;
    }
    if (worker == null) {
      return;
    }
    int dropped = queue.size();
    queue.clear();
    if (dropped > 0) {
      LOG.debug("Dropping {} undelivered envelope(s) for slot '{}'", dropped, slotName);
    }
    if (worker != Thread.currentThread()) {
      worker.interrupt();
      try {
        worker.join(JOIN_TIMEOUT_MS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      if (worker.isAlive()) {
        LOG.warn("Dispatcher thread for slot '{}' did not stop within {} ms", slotName, JOIN_TIMEOUT_MS);
      }
    }
  }

  private void runLoop() {
    lastSaveNanos = System.nanoTime();
    try {
      while (running) {
        TransactionEnvelope envelope = queue.poll(IDLE_POLL_MS, TimeUnit.MILLISECONDS);
        if (envelope == null) {
          persistWhenIdle();
          continue;
        }
        if (deliver(envelope)) {
          onDelivered.handle(envelope);
        }
        if (envelope.isEmpty()) {
          tracker.skipped(envelope.commitLsn());
          continue;
        }
        int unsaved = tracker.delivered(envelope.commitLsn());
        if (unsaved >= ackBatchSize || queue.isEmpty()) {
          persist();
        }
      }
    } catch (InterruptedException e) {
      LOG.debug("Dispatcher for slot '{}' interrupted", slotName);
    } catch (Exception e) {
      failure.compareAndSet(null, e);
      running = false;
    } finally {
      flushOnExit();
    }
  }

  private void flushOnExit() {
    // Clear the interrupt so the checkpoint write is not aborted by it.
    boolean interrupted = Thread.interrupted();
    try {
      persist();
    } catch (Exception e) {
      LOG.warn("Could not save acknowledged position for slot '{}' while stopping", slotName, e);
      failure.compareAndSet(null, e);
    } finally {
      running = false;
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Positions reached only through empty transactions are saved at most once per
   * {@code emptyTransactionFlushMs}: a save into the replicated database is itself an empty transaction.
   */
  private void persistWhenIdle() throws Exception {
    if (tracker.hasUnsaved()) {
      persist();
    } else if (tracker.hasUnsavedPosition() && System.nanoTime() - lastSaveNanos >= emptyTransactionFlushNanos) {
      persist();
    }
  }

  private void persist() throws Exception {
    Optional<Checkpoint> saved = tracker.persist();
    if (saved.isPresent()) {
      lastSaveNanos = System.nanoTime();
      onCheckpointSaved.handle(saved.get());
    }
  }

  /**
   * @return whether the envelope was handed to the subscribers
   */
  private boolean deliver(TransactionEnvelope envelope) throws Exception {
    if (envelope.isEmpty() && skipEmptyTransactions) {
      LOG.debug("Skipping empty transaction {} at {}", envelope.transactionId(), envelope.commitLsn());
      return false;
    }
    List<Subscriber> targets = awaitSubscribers(envelope);
    try {
      dispatchAndAwait(envelope, targets);
    } catch (InterruptedException e) {
      throw e;
    } catch (Exception e) {
      throw new ConsumerFailedException(slotName, tracker.confirmedLsn(), envelope.commitLsn(), e);
    }
    return true;
  }

  /**
   * Holds the envelope until at least one subscriber is registered. Nothing is acknowledged meanwhile.
   *
   * @throws InterruptedException when the dispatcher stops first
   */
  private List<Subscriber> awaitSubscribers(TransactionEnvelope envelope) throws Exception {
    List<Subscriber> targets = List.copyOf(subscribers);
    if (!targets.isEmpty()) {
      return targets;
    }
    persist();
    LOG.debug("Holding transaction {} at {} until a subscriber registers",
      envelope.transactionId(), envelope.commitLsn());
    while (targets.isEmpty()) {
      if (!running) {
        throw new InterruptedException("dispatcher for slot '" + slotName + "' stopped without a subscriber");
      }
      Thread.sleep(IDLE_POLL_MS);
      targets = List.copyOf(subscribers);
    }
    return targets;
  }

  private void dispatchAndAwait(TransactionEnvelope envelope, List<Subscriber> targets) throws Exception {
    int chunkSize = Math.max(1, maxConcurrentDispatch);
    for (int start = 0; start < targets.size(); start += chunkSize) {
      int end = Math.min(targets.size(), start + chunkSize);
      CountDownLatch latch = new CountDownLatch(end - start);
      AtomicReference<Throwable> consumerFailure = new AtomicReference<>();
      for (int i = start; i < end; i++) {
        Subscriber subscriber = targets.get(i);
        vertx.runOnContext(v -> invoke(envelope, subscriber, latch, consumerFailure));
      }
      latch.await();
      Throwable err = consumerFailure.get();
      if (err != null) {
        if (err instanceof Exception) {
          throw (Exception) err;
        }
        throw new IllegalStateException(err);
      }
    }
  }

  private void invoke(TransactionEnvelope envelope,
                      Subscriber subscriber,
                      CountDownLatch latch,
                      AtomicReference<Throwable> consumerFailure) {
    try {
      Future<Void> result = subscriber.consumer.handle(envelope);
      if (result == null) {
        result = Future.succeededFuture();
      }
      result.onComplete(ar -> {
        if (ar.failed()) {
          subscriber.notifyError(ar.cause());
          consumerFailure.compareAndSet(null, ar.cause());
        }
        latch.countDown();
      });
    } catch (Throwable err) {
      subscriber.notifyError(err);
      consumerFailure.compareAndSet(null, err);
      latch.countDown();
    }
  }

  /**
   * A registered envelope consumer with its optional error handler.
   */
  public static final class Subscriber {
    private final EnvelopeConsumer consumer;
    private final Handler<Throwable> errorHandler;

    public Subscriber(EnvelopeConsumer consumer, Handler<Throwable> errorHandler) {
      this.consumer = Objects.requireNonNull(consumer, "consumer");
      this.errorHandler = errorHandler;
    }

    public EnvelopeConsumer consumer() {
      return consumer;
    }

    public Handler<Throwable> errorHandler() {
      return errorHandler;
    }

    public void notifyError(Throwable error) {
      if (errorHandler == null) {
        return;
      }
      try {
        errorHandler.handle(error);
      } catch (RuntimeException handlerError) {
        LOG.warn("Subscriber error handler failed", handlerError);
      }
    }
  }

  public static final class Settings {
    private int maxPendingTransactions = 1024;
    private int ackBatchSize = 1;
    private int maxConcurrentDispatch = 1;
    private boolean skipEmptyTransactions = true;
    private long emptyTransactionFlushMs = 10000L;

    public Settings setMaxPendingTransactions(int maxPendingTransactions) {
      OptionValidation.requireMin("maxPendingTransactions", maxPendingTransactions, 1);
      this.maxPendingTransactions = maxPendingTransactions;
      return this;
    }

    public Settings setAckBatchSize(int ackBatchSize) {
      OptionValidation.requireMin("ackBatchSize", ackBatchSize, 1);
      this.ackBatchSize = ackBatchSize;
      return this;
    }

    public Settings setMaxConcurrentDispatch(int maxConcurrentDispatch) {
      OptionValidation.requireMin("maxConcurrentDispatch", maxConcurrentDispatch, 1);
      this.maxConcurrentDispatch = maxConcurrentDispatch;
      return this;
    }

    public Settings setSkipEmptyTransactions(boolean skipEmptyTransactions) {
      this.skipEmptyTransactions = skipEmptyTransactions;
      return this;
    }

    public Settings setEmptyTransactionFlushMs(long emptyTransactionFlushMs) {
      OptionValidation.requireMin("emptyTransactionFlushMs", emptyTransactionFlushMs, 0);
      this.emptyTransactionFlushMs = emptyTransactionFlushMs;
      return this;
    }
  }
}
