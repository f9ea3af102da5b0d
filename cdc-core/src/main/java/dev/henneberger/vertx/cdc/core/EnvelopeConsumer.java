package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Future;

/**
 * Receives committed transactions. Completing the returned future acknowledges the envelope; failing
 * it stops the session and the envelope is delivered again after reconnecting.
 */
@FunctionalInterface
public interface EnvelopeConsumer {
  Future<Void> handle(TransactionEnvelope envelope);
}
