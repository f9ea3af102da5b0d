package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;
import java.util.Objects;

/**
 * Result of subscribing and starting in one call. {@link #started()} completes once the slot is
 * streaming; envelopes reach the consumer only after that.
 */
public final class SubscriptionRegistration {
  private final String slotName;
  private final ReplicationSubscription subscription;
  private final Future<Void> started;

  public SubscriptionRegistration(String slotName, ReplicationSubscription subscription, Future<Void> started) {
    this.slotName = Objects.requireNonNull(slotName, "slotName");
    this.subscription = Objects.requireNonNull(subscription, "subscription");
    this.started = Objects.requireNonNull(started, "started");
  }

  public String slotName() {
    return slotName;
  }

  public ReplicationSubscription subscription() {
    return subscription;
  }

  public Future<Void> started() {
    return started;
  }

  /**
   * Removes the consumer. The stream keeps its slot and holds further envelopes until another
   * consumer subscribes.
   */
  public void cancel() {
    subscription.cancel();
  }
}
