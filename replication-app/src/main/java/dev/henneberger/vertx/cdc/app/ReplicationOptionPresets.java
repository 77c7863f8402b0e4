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

package dev.henneberger.vertx.cdc.app;

import dev.henneberger.vertx.cdc.core.PublisherOptions;
import dev.henneberger.vertx.cdc.core.RetryPolicy;
import dev.henneberger.vertx.cdc.core.WorkerOptions;
import java.time.Duration;
import java.util.Objects;

public final class ReplicationOptionPresets {

  private ReplicationOptionPresets() {
  }

  public static void apply(ReplicationAppConfig.Profile profile, WorkerOptions worker, PublisherOptions publisher) {
    if (profile == ReplicationAppConfig.Profile.LOCAL) {
      applyLocalDevDefaults(worker, publisher);
    } else {
      applyProductionDefaults(worker, publisher);
    }
  }

  public static void applyProductionDefaults(WorkerOptions worker, PublisherOptions publisher) {
    Objects.requireNonNull(worker, "worker");
    Objects.requireNonNull(publisher, "publisher");
    worker
      .setAcknowledgeInterval(Duration.ofSeconds(1))
      .setRetryPolicy(
        RetryPolicy.exponentialBackoff()
          .setInitialDelay(Duration.ofMillis(500))
          .setMaxDelay(Duration.ofSeconds(30))
          .setMultiplier(2.0d)
          .setJitter(0.2d)
          .setMaxAttempts(10)
      );
    publisher
      .setMaxBatchDelay(Duration.ofMillis(200))
      .setRetryPolicy(
        RetryPolicy.exponentialBackoff()
          .setInitialDelay(Duration.ofMillis(100))
          .setMaxDelay(Duration.ofSeconds(5))
          .setMultiplier(2.0d)
          .setJitter(0.2d)
          .setMaxAttempts(10)
      );
  }

  public static void applyLocalDevDefaults(WorkerOptions worker, PublisherOptions publisher) {
    Objects.requireNonNull(worker, "worker");
    Objects.requireNonNull(publisher, "publisher");
    worker
      .setAcknowledgeInterval(Duration.ofMillis(250))
      .setRetryPolicy(
        RetryPolicy.exponentialBackoff()
          .setInitialDelay(Duration.ofMillis(200))
          .setMaxDelay(Duration.ofSeconds(5))
          .setMultiplier(1.5d)
          .setJitter(0.1d)
          .setMaxAttempts(5)
      );
    publisher
      .setMaxBatchDelay(Duration.ofMillis(50))
      .setRetryPolicy(
        RetryPolicy.exponentialBackoff()
          .setInitialDelay(Duration.ofMillis(50))
          .setMaxDelay(Duration.ofSeconds(1))
          .setMultiplier(1.5d)
          .setJitter(0.1d)
          .setMaxAttempts(5)
      );
  }
}
