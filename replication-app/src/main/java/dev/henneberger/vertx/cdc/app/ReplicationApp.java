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

import dev.henneberger.vertx.cdc.core.BatchingChangePublisher;
import dev.henneberger.vertx.cdc.core.LogPosition;
import dev.henneberger.vertx.cdc.core.PreflightFailedException;
import dev.henneberger.vertx.cdc.core.PreflightReports;
import dev.henneberger.vertx.cdc.core.PublisherOptions;
import dev.henneberger.vertx.cdc.core.ReplicationWorker;
import dev.henneberger.vertx.cdc.core.WorkerFailure;
import dev.henneberger.vertx.cdc.core.WorkerOptions;
import dev.henneberger.vertx.cdc.core.WorkerOutcome;
import dev.henneberger.vertx.cdc.kinesis.KinesisRecordSink;
import dev.henneberger.vertx.cdc.kinesis.KinesisSinkOptions;
import dev.henneberger.vertx.cdc.pg.PostgresReplicationOptions;
import dev.henneberger.vertx.cdc.pg.PostgresSessionManager;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkClientException;

/**
 * Runs one replication worker until it stops or fails and maps the outcome to an exit code.
 */
public final class ReplicationApp {

  private static final Logger LOG = LoggerFactory.getLogger(ReplicationApp.class);

  static final int EXIT_STOPPED = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_INVALID_CONFIG = 2;

  private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;
  private static final Duration SIGNAL_EXIT_TIMEOUT = Duration.ofSeconds(2 * SHUTDOWN_TIMEOUT_SECONDS);

  private ReplicationApp() {
  }

  public static void main(String[] args) {
    ShutdownSignalHandler shutdown = new ShutdownSignalHandler(Runtime.getRuntime()::halt, SIGNAL_EXIT_TIMEOUT);
    int exitCode = run(System.getenv(), shutdown);
    if (!shutdown.handOver(exitCode)) {
      System.exit(exitCode);
    }
  }

  static int run(Map<String, String> env, ShutdownSignalHandler shutdown) {
    ReplicationAppConfig config;
    PostgresReplicationOptions replicationOptions;
    KinesisSinkOptions kinesisOptions;
    WorkerOptions workerOptions = new WorkerOptions();
    PublisherOptions publisherOptions = new PublisherOptions();
    try {
      config = ReplicationAppConfig.fromMap(env);
      replicationOptions = config.toReplicationOptions();
      kinesisOptions = config.toKinesisOptions();
      kinesisOptions.validate();
      ReplicationOptionPresets.apply(config.profile(), workerOptions, publisherOptions);
      workerOptions.setName(config.slotName());
    } catch (IllegalArgumentException e) {
      LOG.error("Invalid configuration: {}", e.getMessage());
      return EXIT_INVALID_CONFIG;
    }

    Vertx vertx = Vertx.vertx();
    try {
      return run(vertx, config, replicationOptions, kinesisOptions, workerOptions, publisherOptions, shutdown);
    } finally {
      try {
        vertx.close().toCompletionStage().toCompletableFuture().get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (ExecutionException | TimeoutException e) {
        LOG.warn("Vert.x did not close cleanly", e);
      }
    }
  }

  private static int run(Vertx vertx,
                         ReplicationAppConfig config,
                         PostgresReplicationOptions replicationOptions,
                         KinesisSinkOptions kinesisOptions,
                         WorkerOptions workerOptions,
                         PublisherOptions publisherOptions,
                         ShutdownSignalHandler shutdown) {
    PostgresSessionManager sessionManager;
    KinesisRecordSink sink;
    try {
      sessionManager = new PostgresSessionManager(vertx, replicationOptions);
      sink = new KinesisRecordSink(kinesisOptions);
    } catch (IllegalArgumentException | SdkClientException e) {
      LOG.error("Invalid configuration: {}", e.getMessage());
      return EXIT_INVALID_CONFIG;
    }

    BatchingChangePublisher publisher = new BatchingChangePublisher(vertx, sink, publisherOptions);
    try {
      if (replicationOptions.isPreflightEnabled() && !preflight(sessionManager)) {
        return EXIT_FAILED;
      }

      ReplicationWorker worker = new ReplicationWorker(vertx, workerOptions, sessionManager,
        replicationOptions.getChangeDecoder(), publisher);
      ReplicationLogging.attachDefaultLogging(worker, LOG, config.streamName());
      shutdown.install(worker);

      LOG.info("Streaming slot {} on {}:{}/{} to Kinesis stream {} ({} profile)",
        config.slotName(), config.pgHost(), config.pgPort(), config.pgDatabase(), config.streamName(),
        config.profile().name().toLowerCase(Locale.ROOT));
      worker.start();
      return report(config, await(worker.termination()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.error("Interrupted while waiting for the worker");
      return EXIT_FAILED;
    } finally {
      publisher.close();
    }
  }

  private static boolean preflight(PostgresSessionManager sessionManager) throws InterruptedException {
    try {
      PreflightReports.logFindings(await(sessionManager.verifyPreflight()), LOG);
      return true;
    } catch (PreflightFailedException e) {
      PreflightReports.logFindings(e.report(), LOG);
      LOG.error("{}", e.getMessage());
      return false;
    } catch (RuntimeException e) {
      LOG.error("Preflight could not run: {}", e.getMessage(), e);
      return false;
    }
  }

  static int report(ReplicationAppConfig config, WorkerOutcome outcome) {
    if (!outcome.failed()) {
      LOG.info("Worker stopped at {}", LogPosition.format(outcome.confirmedPosition()));
      return EXIT_STOPPED;
    }
    WorkerFailure failure = outcome.failure().orElse(null);
    LOG.error("Worker failed: {}", failure == null ? "unknown cause" : failure.toJson().encode());
    LOG.warn("Replication slot {} keeps retaining WAL until it is consumed or dropped. If it is no longer "
      + "needed run: SELECT pg_drop_replication_slot('{}');", config.slotName(), config.slotName());
    return outcome.exitCode();
  }

  private static <T> T await(Future<T> future) throws InterruptedException {
    try {
      return future.toCompletionStage().toCompletableFuture().get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IllegalStateException(cause);
    }
  }
}
