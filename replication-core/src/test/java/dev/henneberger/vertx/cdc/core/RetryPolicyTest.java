package dev.henneberger.vertx.cdc.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void delayGrowsUntilCapped() {
    RetryPolicy policy = RetryPolicy.exponentialBackoff()
      .setInitialDelay(Duration.ofMillis(100))
      .setMaxDelay(Duration.ofSeconds(1))
      .setJitter(0.0d);

    assertEquals(100, policy.computeDelayMillis(1));
    assertEquals(200, policy.computeDelayMillis(2));
    assertEquals(800, policy.computeDelayMillis(4));
    assertEquals(1000, policy.computeDelayMillis(5));
    assertEquals(1000, policy.computeDelayMillis(60));
  }

  @Test
  void jitterStaysWithinBounds() {
    RetryPolicy policy = RetryPolicy.exponentialBackoff()
      .setInitialDelay(Duration.ofMillis(1000))
      .setMaxDelay(Duration.ofMillis(1000))
      .setJitter(0.2d);

    for (int i = 0; i < 100; i++) {
      long delay = policy.computeDelayMillis(3);
      assertTrue(delay >= 800 && delay <= 1200, "delay " + delay);
    }
  }

  @Test
  void maxAttemptsCountsEveryAttempt() {
    RetryPolicy policy = RetryPolicy.exponentialBackoff().setMaxAttempts(3);
    RuntimeException error = new ConnectionException("refused");

    assertTrue(policy.shouldRetry(error, 1));
    assertTrue(policy.shouldRetry(error, 2));
    assertFalse(policy.shouldRetry(error, 3));
    assertFalse(RetryPolicy.disabled().shouldRetry(error, 1));
  }

  @Test
  void honoursRetryPredicate() {
    RetryPolicy policy = RetryPolicy.exponentialBackoff()
      .setRetryOn(err -> err instanceof ReplicationException && ((ReplicationException) err).isTransient());

    assertTrue(policy.shouldRetry(new StreamException("reset", null), 1));
    assertFalse(policy.shouldRetry(new PublishException("rejected"), 1));
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.exponentialBackoff().setJitter(1.5d));
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.exponentialBackoff()
      .setInitialDelay(Duration.ofSeconds(10))
      .setMaxDelay(Duration.ofSeconds(1))
      .validate());
  }
}
