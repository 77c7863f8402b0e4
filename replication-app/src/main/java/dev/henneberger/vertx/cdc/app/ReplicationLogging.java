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

import dev.henneberger.vertx.cdc.core.LogPosition;
import dev.henneberger.vertx.cdc.core.ReplicationWorker;
import dev.henneberger.vertx.cdc.core.Subscription;
import dev.henneberger.vertx.cdc.core.TransactionBatch;
import dev.henneberger.vertx.cdc.core.WorkerMetricsListener;
import java.util.Objects;
import org.slf4j.Logger;

public final class ReplicationLogging {

  private ReplicationLogging() {
  }

  public static Subscription attachDefaultLogging(ReplicationWorker worker, Logger logger, String streamName) {
    Objects.requireNonNull(worker, "worker");
    Objects.requireNonNull(logger, "logger");
    String name = streamName == null || streamName.isBlank() ? "replication" : streamName;

    Subscription states = worker.onStateChange(change -> {
      Throwable cause = change.cause();
      if (cause != null) {
        logger.warn("stream={} state={} prev={} attempt={} confirmed={} cause={}",
          name,
          change.state(),
          change.previousState(),
          change.attempt(),
          LogPosition.format(change.confirmedPosition()),
          cause.toString());
      } else {
        logger.info("stream={} state={} prev={} attempt={} confirmed={}",
          name,
          change.state(),
          change.previousState(),
          change.attempt(),
          LogPosition.format(change.confirmedPosition()));
      }
    });

    Subscription metrics = worker.addMetricsListener(new WorkerMetricsListener() {
      @Override
      public void onBatchPublished(TransactionBatch batch) {
        if (logger.isDebugEnabled()) {
          logger.debug("stream={} published xid={} commit={} events={} tables={}",
            name, batch.transactionId(), LogPosition.format(batch.commitPosition()), batch.size(), batch.tables());
        }
      }

      @Override
      public void onDecodeFailure(String payload, Throwable error) {
        logger.error("stream={} undecodable payload: {}", name, payload, error);
      }

      @Override
      public void onPositionAcknowledged(String slotName, long position) {
        logger.debug("stream={} slot={} acknowledged={}", name, slotName, LogPosition.format(position));
      }
    });

    return () -> {
      states.cancel();
      metrics.cancel();
    };
  }
}
