package dev.henneberger.vertx.cdc.core;

@FunctionalInterface
public interface ReplicationSubscription {
  void cancel();
}
