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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.henneberger.vertx.cdc.core.ChangeDecoder;
import dev.henneberger.vertx.cdc.core.ChangePublisher;
import dev.henneberger.vertx.cdc.core.DecodedSegment;
import dev.henneberger.vertx.cdc.core.RawSegment;
import dev.henneberger.vertx.cdc.core.ReplicationSession;
import dev.henneberger.vertx.cdc.core.ReplicationWorker;
import dev.henneberger.vertx.cdc.core.TransactionBatch;
import dev.henneberger.vertx.cdc.core.WorkerOptions;
import dev.henneberger.vertx.cdc.core.WorkerOutcome;
import dev.henneberger.vertx.cdc.core.WorkerState;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ShutdownSignalHandlerTest {

  private Vertx vertx;
  private final CompletableFuture<Integer> halted = new CompletableFuture<>();

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
  }

  @AfterEach
  void tearDown() throws Exception {
    vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
  }

  @Test
  void signalStopsWorkerAndHaltsWithItsExitCode() throws Exception {
    ShutdownSignalHandler handler = new ShutdownSignalHandler(halted::complete, Duration.ofSeconds(10));
    ReplicationWorker worker = idleWorker();
    handler.attach(worker);
    worker.start().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);

    // the main thread waits for the worker, then hands over the code it would exit with
    CompletableFuture<Boolean> mainExits = worker.termination().toCompletionStage().toCompletableFuture()
      .thenApply(outcome -> handler.handOver(outcome.exitCode()));
    Thread signal = new Thread(handler::onSignal, "test-signal");
    signal.start();

    assertEquals(ReplicationApp.EXIT_STOPPED, halted.get(10, TimeUnit.SECONDS));
    assertTrue(mainExits.get(5, TimeUnit.SECONDS));
    WorkerOutcome outcome = worker.termination().toCompletionStage().toCompletableFuture().get();
    assertEquals(WorkerState.STOPPED, outcome.state());
    signal.join(5000);
  }

  @Test
  void signalAfterFailureKeepsFailureCode() throws Exception {
    ShutdownSignalHandler handler = new ShutdownSignalHandler(halted::complete, Duration.ofSeconds(10));

    assertFalse(handler.handOver(ReplicationApp.EXIT_FAILED));
    handler.onSignal();

    assertEquals(ReplicationApp.EXIT_FAILED, halted.get(1, TimeUnit.SECONDS));
  }

  @Test
  void haltsWithFailureWhenWorkerDoesNotFinishInTime() throws Exception {
    ShutdownSignalHandler handler = new ShutdownSignalHandler(halted::complete, Duration.ofMillis(50));

    handler.onSignal();

    assertEquals(ReplicationApp.EXIT_FAILED, halted.get(1, TimeUnit.SECONDS));
  }

  private ReplicationWorker idleWorker() {
    ChangeDecoder decoder = new ChangeDecoder() {
      @Override
      public DecodedSegment decode(RawSegment segment) {
        return DecodedSegment.empty(segment);
      }

      @Override
      public boolean supportsPlugin(String plugin) {
        return true;
      }
    };
    ChangePublisher publisher = new ChangePublisher() {
      @Override
      public Future<Long> publish(TransactionBatch batch) {
        return Future.succeededFuture(batch.commitPosition());
      }

      @Override
      public Future<Void> flush() {
        return Future.succeededFuture();
      }

      @Override
      public void close() {
      }
    };
    return new ReplicationWorker(vertx, new WorkerOptions()
      .setName("signal-test")
      .setPollTimeout(Duration.ofMillis(10)),
      IdleSession::new, decoder, publisher);
  }

  private static final class IdleSession implements ReplicationSession {

    @Override
    public String slotName() {
      return "signal_slot";
    }

    @Override
    public long startPosition() {
      return 0x100;
    }

    @Override
    public RawSegment nextSegment(Duration timeout) {
      try {
        Thread.sleep(Math.min(10L, timeout.toMillis()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return null;
    }

    @Override
    public void acknowledge(long position) {
    }

    @Override
    public void close() {
    }
  }
}
