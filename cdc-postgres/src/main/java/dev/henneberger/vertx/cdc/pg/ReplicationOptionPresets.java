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

import dev.henneberger.vertx.cdc.core.RetryPolicy;
import java.time.Duration;
import java.util.Objects;

public final class ReplicationOptionPresets {

  private ReplicationOptionPresets() {
  }

  /**
   * Preflight on, manual start, unbounded reconnects between one second and one minute, checkpoints
   * saved every 100 transactions.
   */
  public static void applyProductionDefaults(PostgresReplicationOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setPreflightEnabled(true)
      .setAutoStart(false)
      .setAckBatchSize(100)
      .setRetryPolicy(
        RetryPolicy.exponentialBackoff()
          .setInitialDelay(Duration.ofSeconds(1))
          .setMaxDelay(Duration.ofSeconds(60))
          .setMultiplier(2.0d)
          .setJitter(0.2d)
      );
  }

  public static void applyLocalDevDefaults(PostgresReplicationOptions options) {
    Objects.requireNonNull(options, "options");
    options
      .setPreflightEnabled(false)
      .setAutoStart(true)
      .setAckBatchSize(1)
      .setStatusIntervalMs(1000L)
      .setRetryPolicy(
        RetryPolicy.exponentialBackoff()
          .setInitialDelay(Duration.ofMillis(200))
          .setMaxDelay(Duration.ofSeconds(5))
          .setMultiplier(1.5d)
          .setJitter(0.1d)
      );
  }
}
