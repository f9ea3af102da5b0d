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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import dev.henneberger.vertx.cdc.core.ReplicationSubscription;
import dev.henneberger.vertx.cdc.core.RetryPolicy;
import io.vertx.core.Vertx;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ReplicationLoggingTest {

  @Test
  void logsStateTransitionsWithSlotName() throws Exception {
    Logger logger = (Logger) LoggerFactory.getLogger("cdc.test.state");
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);

    Vertx vertx = Vertx.vertx();
    PostgresLogicalReplicationStream stream = new PostgresLogicalReplicationStream(vertx,
      new PostgresReplicationOptions()
        .setHost("localhost")
        .setPort(1)
        .setDatabase("db")
        .setUser("user")
        .setSlotName("orders_slot")
        .setPreflightEnabled(false)
        .setRetryPolicy(RetryPolicy.disabled()));
    try {
      ReplicationSubscription subscription = ReplicationLogging.attachDefaultLogging(stream, logger, null);
      stream.start().toCompletionStage().toCompletableFuture()
        .handle((v, err) -> err)
        .get(30, TimeUnit.SECONDS);

      List<ILoggingEvent> events = awaitFailedEvent(appender, Duration.ofSeconds(5));
      ILoggingEvent connecting = find(events, "state=CONNECTING");
      assertEquals(Level.INFO, connecting.getLevel());
      assertTrue(connecting.getFormattedMessage().startsWith("stream=orders_slot state=CONNECTING prev=DISCONNECTED"));

      ILoggingEvent failed = find(events, "state=FAILED");
      assertEquals(Level.WARN, failed.getLevel());
      assertTrue(failed.getFormattedMessage().contains("cause="));

      subscription.cancel();
    } finally {
      stream.close();
      logger.detachAppender(appender);
      vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }
  }

  private static List<ILoggingEvent> awaitFailedEvent(ListAppender<ILoggingEvent> appender, Duration timeout)
    throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (System.nanoTime() < deadline) {
      List<ILoggingEvent> snapshot = snapshot(appender);
      for (ILoggingEvent event : snapshot) {
        if (event.getFormattedMessage().contains("state=FAILED")) {
          return snapshot;
        }
      }
      Thread.sleep(20);
    }
    return snapshot(appender);
  }

  private static ILoggingEvent find(List<ILoggingEvent> events, String fragment) {
    for (ILoggingEvent event : events) {
      if (event.getFormattedMessage().contains(fragment)) {
        return event;
      }
    }
    throw new AssertionError("No log event containing '" + fragment + "' in " + events.size() + " event(s)");
  }

  private static List<ILoggingEvent> snapshot(ListAppender<ILoggingEvent> appender) {
    synchronized (appender) {
      return new ArrayList<>(appender.list);
    }
  }
}
