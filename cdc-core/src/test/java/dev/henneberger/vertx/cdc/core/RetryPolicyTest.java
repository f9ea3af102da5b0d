package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void growsExponentiallyUpToCap() {
    RetryPolicy policy = RetryPolicy.exponentialBackoff()
      .setInitialDelay(Duration.ofMillis(100))
      .setMaxDelay(Duration.ofMillis(1000))
      .setMultiplier(2.0d)
      .setJitter(0.0d);

    assertEquals(100L, policy.computeDelayMillis(1));
    assertEquals(200L, policy.computeDelayMillis(2));
    assertEquals(800L, policy.computeDelayMillis(4));
    assertEquals(1000L, policy.computeDelayMillis(5));
    assertEquals(1000L, policy.computeDelayMillis(30));
  }

  @Test
  void jitterStaysWithinBounds() {
    RetryPolicy policy = RetryPolicy.exponentialBackoff()
      .setInitialDelay(Duration.ofMillis(1000))
      .setMaxDelay(Duration.ofMillis(1000))
      .setJitter(0.2d);

    for (int i = 0; i < 200; i++) {
      long delay = policy.computeDelayMillis(3);
      assertTrue(delay >= 800L && delay <= 1200L, "delay " + delay);
    }
  }

  @Test
  void retriesOnlyRetryableErrorsWithinAttempts() {
    RetryPolicy policy = RetryPolicy.exponentialBackoff().setMaxAttempts(2);

    assertTrue(policy.shouldRetry(new ReplicationConnectionException("reset", new IOException("reset")), 1));
    assertTrue(policy.shouldRetry(new IOException("reset"), 2));
    assertFalse(policy.shouldRetry(new IOException("reset"), 3));
    assertFalse(policy.shouldRetry(new SlotConflictException("s", "wal2json", "pgoutput"), 1));
    assertFalse(policy.shouldRetry(new LsnTooOldException("s", Lsn.of(1), Lsn.of(2), "gone", null), 1));
    assertFalse(RetryPolicy.disabled().shouldRetry(new IOException("reset"), 1));
  }

  @Test
  void readsFromJson() {
    RetryPolicy policy = RetryPolicy.fromJson(new JsonObject()
      .put("initialDelayMs", 250L)
      .put("maxDelayMs", 5000L)
      .put("multiplier", 1.5d)
      .put("jitter", 0.1d)
      .put("maxAttempts", 5L));

    assertEquals(Duration.ofMillis(250), policy.getInitialDelay());
    assertEquals(Duration.ofMillis(5000), policy.getMaxDelay());
    assertEquals(1.5d, policy.getMultiplier());
    assertEquals(5L, policy.getMaxAttempts());
    assertEquals(5000L, policy.toJson().getLong("maxDelayMs"));
  }

  @Test
  void validatesBounds() {
    RetryPolicy policy = RetryPolicy.exponentialBackoff()
      .setInitialDelay(Duration.ofSeconds(10))
      .setMaxDelay(Duration.ofSeconds(1));

    assertThrows(IllegalArgumentException.class, policy::validate);
  }
}
