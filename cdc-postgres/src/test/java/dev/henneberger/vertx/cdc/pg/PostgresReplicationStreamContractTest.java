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

import static dev.henneberger.vertx.cdc.core.ReplicationStreamContractKit.assertCloseIsIdempotent;
import static dev.henneberger.vertx.cdc.core.ReplicationStreamContractKit.assertClosePreventsStart;
import static dev.henneberger.vertx.cdc.core.ReplicationStreamContractKit.assertInitiallyDisconnected;
import static dev.henneberger.vertx.cdc.core.ReplicationStreamContractKit.assertPreflightFailureTransitionsToFailed;
import static dev.henneberger.vertx.cdc.core.ReplicationStreamContractKit.awaitFailure;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.cdc.core.Checkpoint;
import dev.henneberger.vertx.cdc.core.Lsn;
import dev.henneberger.vertx.cdc.core.ReplicationConnectionException;
import dev.henneberger.vertx.cdc.core.ReplicationMetricsListener;
import dev.henneberger.vertx.cdc.core.ReplicationStateChange;
import dev.henneberger.vertx.cdc.core.ReplicationStreamState;
import dev.henneberger.vertx.cdc.core.RetryPolicy;
import dev.henneberger.vertx.cdc.core.TransactionEnvelope;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class PostgresReplicationStreamContractTest {

  @Test
  void contract_initiallyDisconnected() {
    Vertx vertx = Vertx.vertx();
    PostgresLogicalReplicationStream stream = new PostgresLogicalReplicationStream(vertx, options());
    try {
      assertInitiallyDisconnected(stream);
    } finally {
      stream.close();
      vertx.close();
    }
  }

  @Test
  void contract_closePreventsStart() {
    Vertx vertx = Vertx.vertx();
    PostgresLogicalReplicationStream stream = new PostgresLogicalReplicationStream(vertx, options());
    try {
      assertClosePreventsStart(stream, Duration.ofSeconds(5));
      assertCloseIsIdempotent(stream);
    } finally {
      vertx.close();
    }
  }

  @Test
  void contract_preflightFailureTransitionsToFailed() {
    Vertx vertx = Vertx.vertx();
    PostgresLogicalReplicationStream stream = new PostgresLogicalReplicationStream(vertx, options());
    try {
      assertPreflightFailureTransitionsToFailed(stream, Duration.ofSeconds(20));
    } finally {
      stream.close();
      vertx.close();
    }
  }

  @Test
  void exhaustedRetriesFailStart() throws InterruptedException {
    Vertx vertx = Vertx.vertx();
    PostgresLogicalReplicationStream stream = new PostgresLogicalReplicationStream(vertx, options()
      .setPort(1)
      .setPreflightEnabled(false)
      .setAutoStart(false)
      .setRetryPolicy(RetryPolicy.exponentialBackoff()
        .setInitialDelay(Duration.ofMillis(10))
        .setMaxDelay(Duration.ofMillis(10))
        .setMaxAttempts(1)));
    List<ReplicationStateChange> changes = new CopyOnWriteArrayList<>();
    List<Throwable> errors = new CopyOnWriteArrayList<>();
    stream.addMetricsListener(new RecordingMetrics(changes));
    stream.subscribe(envelope -> {
      return Future.succeededFuture();
    }, errors::add);
    try {
      Throwable failure = awaitFailure(stream.start(), Duration.ofSeconds(30));

      assertTrue(failure instanceof ReplicationConnectionException, String.valueOf(failure));
      assertEquals(ReplicationStreamState.FAILED, stream.state());
      ReplicationStateChange retry = changes.stream()
        .filter(change -> change.state() == ReplicationStreamState.DISCONNECTED)
        .findFirst()
        .orElseThrow();
      assertEquals(1L, retry.attempt());
      assertTrue(retry.cause() instanceof ReplicationConnectionException);
      assertEquals(ReplicationStreamState.FAILED, changes.get(changes.size() - 1).state());

      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      while (errors.isEmpty() && System.nanoTime() < deadline) {
        Thread.sleep(20);
      }
      assertEquals(1, errors.size());
    } finally {
      stream.close();
      vertx.close();
    }
  }

  private static PostgresReplicationOptions options() {
    return new PostgresReplicationOptions()
      .setHost("localhost")
      .setPort(5432)
      .setDatabase("db")
      .setUser("user")
      .setSlotName("slot")
      .setConnectTimeoutSeconds(2)
      .setPreflightEnabled(true);
  }

  private static final class RecordingMetrics implements ReplicationMetricsListener {
    private final List<ReplicationStateChange> changes;

    private RecordingMetrics(List<ReplicationStateChange> changes) {
      this.changes = changes;
    }

    @Override
    public void onEnvelope(TransactionEnvelope envelope) {
    }

    @Override
    public void onDecodeFailure(String payload, Throwable error) {
    }

    @Override
    public void onStateChange(ReplicationStateChange stateChange) {
      changes.add(stateChange);
    }

    @Override
    public void onCheckpointSaved(Checkpoint checkpoint) {
    }

    @Override
    public void onAcknowledged(String slotName, Lsn lsn) {
    }
  }
}
