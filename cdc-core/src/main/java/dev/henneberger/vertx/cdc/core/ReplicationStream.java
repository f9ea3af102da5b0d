package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;

public interface ReplicationStream extends AutoCloseable {
  Future<Void> start();
  Future<PreflightReport> preflight();
  ReplicationStreamState state();
  Lsn confirmedLsn();
  ReplicationSubscription onStateChange(Handler<ReplicationStateChange> handler);
  ReplicationSubscription addMetricsListener(ReplicationMetricsListener listener);
  ReplicationSubscription subscribe(EnvelopeConsumer consumer, Handler<Throwable> errorHandler);
  SubscriptionRegistration startAndSubscribe(EnvelopeConsumer consumer, Handler<Throwable> errorHandler);

  @Override
  void close();
}
