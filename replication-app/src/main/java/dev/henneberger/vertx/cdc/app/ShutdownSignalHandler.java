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

import dev.henneberger.vertx.cdc.core.ReplicationWorker;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns SIGTERM into a graceful worker stop that still ends the process with the worker's exit
 * code.
 *
 * <p>The JVM runs shutdown hooks while holding its shutdown lock, so a {@code System.exit}
 * from the main thread would block behind the hook and the process would exit with the signal's
 * status. Instead the hook waits for the main thread to {@link #handOver hand over} its exit
 * code and halts with it.
 */
final class ShutdownSignalHandler {

  private static final Logger LOG = LoggerFactory.getLogger(ShutdownSignalHandler.class);

  private final IntConsumer halt;
  private final Duration timeout;
  private final CompletableFuture<Integer> exitCode = new CompletableFuture<>();
  private final AtomicBoolean signalled = new AtomicBoolean();
  private final Thread hook = new Thread(this::onSignal, "replication-shutdown");
  private volatile ReplicationWorker worker;

  ShutdownSignalHandler(IntConsumer halt, Duration timeout) {
    this.halt = Objects.requireNonNull(halt, "halt");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  void install(ReplicationWorker worker) {
    attach(worker);
    Runtime.getRuntime().addShutdownHook(hook);
  }

  void attach(ReplicationWorker worker) {
    this.worker = Objects.requireNonNull(worker, "worker");
  }

  void onSignal() {
    signalled.set(true);
    ReplicationWorker current = worker;
    if (current != null) {
      LOG.info("Shutdown signal received, stopping worker {}", current.name());
      current.stop();
    }

    int code;
    try {
      code = exitCode.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      code = ReplicationApp.EXIT_FAILED;
    } catch (ExecutionException | TimeoutException e) {
      LOG.error("Worker did not stop within {} ms; exiting without a clean shutdown", timeout.toMillis());
      code = ReplicationApp.EXIT_FAILED;
    }
    halt.accept(code);
  }

  /**
   * Passes the final exit code to a running shutdown hook.
   *
   * @return {@code true} if a shutdown signal owns the exit and the caller must not call
   *     {@code System.exit}
   */
  boolean handOver(int code) {
    exitCode.complete(code);
    if (signalled.get()) {
      return true;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
      return false;
    } catch (IllegalStateException shuttingDown) {
      return true;
    }
  }
}
