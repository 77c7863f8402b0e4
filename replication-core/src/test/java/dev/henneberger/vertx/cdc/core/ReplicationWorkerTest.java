package dev.henneberger.vertx.cdc.core;

import static dev.henneberger.vertx.cdc.core.ScriptedDecoder.begin;
import static dev.henneberger.vertx.cdc.core.ScriptedDecoder.commit;
import static dev.henneberger.vertx.cdc.core.ScriptedDecoder.row;
import static dev.henneberger.vertx.cdc.core.ScriptedDecoder.tx;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Vertx;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReplicationWorkerTest {

  private Vertx vertx;
  private FakeRecordSink sink;
  private BatchingChangePublisher publisher;

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
    sink = new FakeRecordSink();
    publisher = new BatchingChangePublisher(vertx, sink, new PublisherOptions()
      .setMaxBatchDelay(Duration.ofMillis(5))
      .setRetryPolicy(RetryPolicy.exponentialBackoff()
        .setInitialDelay(Duration.ofMillis(1))
        .setMaxDelay(Duration.ofMillis(5))
        .setMaxAttempts(3)));
  }

  @AfterEach
  void tearDown() throws Exception {
    publisher.close();
    vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
  }

  @Test
  void publishesCommittedTransactionBeforeAcknowledging() throws Exception {
    ScriptedSessionFactory factory = new ScriptedSessionFactory(50).session(tx(731, 100, 3));
    List<Integer> acceptedAtAck = new CopyOnWriteArrayList<>();
    factory.onAcknowledge = position -> acceptedAtAck.add(sink.accepted.size());
    ReplicationWorker worker = worker(factory);

    worker.start().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> factory.acknowledged.contains(100L));

    assertEquals(List.of(3), acceptedAtAck);
    // rows of one table go out one request each to keep their order
    assertEquals(3, sink.requests.size());
    assertTrue(sink.accepted.stream().allMatch(record -> record.partitionKey().equals("public.orders")));

    worker.stop();
    WorkerOutcome outcome = terminate(worker);
    assertEquals(WorkerState.STOPPED, outcome.state());
    assertEquals(100, outcome.confirmedPosition());
    assertEquals(0, outcome.exitCode());
  }

  @Test
  void malformedPayloadFailsWithoutMovingPosition() throws Exception {
    ScriptedSessionFactory factory = new ScriptedSessionFactory(50)
      .session(tx(1, 100, 1), RawSegment.of("{\"xid\":", 150));
    ReplicationWorker worker = worker(factory);
    List<String> decodeFailures = new CopyOnWriteArrayList<>();
    worker.addMetricsListener(new WorkerMetricsListener() {
      @Override
      public void onDecodeFailure(String payload, Throwable error) {
        decodeFailures.add(payload);
      }
    });

    worker.start();
    WorkerOutcome outcome = terminate(worker);

    assertEquals(WorkerState.FAILED, outcome.state());
    assertEquals(1, outcome.exitCode());
    WorkerFailure failure = outcome.failure().orElseThrow();
    assertInstanceOf(DecodeException.class, failure.cause());
    assertEquals("{\"xid\":", failure.toJson().getString("payload"));
    assertEquals(WorkerState.STREAMING, failure.failedIn());
    assertEquals(100, failure.lastConfirmedPosition());
    assertEquals(100, factory.slotPosition);
    assertEquals(List.of("{\"xid\":"), decodeFailures);
    assertEquals(1, factory.opens.get());
  }

  @Test
  void redeliveryAfterDroppedConnectionIsNotPublishedTwice() throws Exception {
    ScriptedSessionFactory factory = new ScriptedSessionFactory(50)
      .session(tx(1, 100, 1), new StreamException("terminating connection due to administrator command", null))
      .session(tx(1, 100, 1), tx(2, 200, 2));
    ReplicationWorker worker = worker(factory);
    List<WorkerState> states = new CopyOnWriteArrayList<>();
    worker.addMetricsListener(new WorkerMetricsListener() {
      @Override
      public void onStateChange(WorkerStateChange stateChange) {
        states.add(stateChange.state());
      }
    });

    worker.start();
    Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> factory.acknowledged.contains(200L));
    worker.stop();
    WorkerOutcome outcome = terminate(worker);

    assertEquals(WorkerState.STOPPED, outcome.state());
    assertEquals(200, outcome.confirmedPosition());
    assertEquals(3, sink.accepted.size());
    assertEquals(2, factory.opens.get());
    assertTrue(states.contains(WorkerState.RECOVERING));
  }

  @Test
  void partialTransactionIsDroppedWhenConnectionBreaks() throws Exception {
    ScriptedSessionFactory factory = new ScriptedSessionFactory(50)
      .session(begin(7, 60), row(1, 70), row(2, 80),
        new StreamException("terminating connection due to administrator command", null))
      .session(begin(7, 60), row(1, 70), row(2, 80), commit(7, 150));
    ReplicationWorker worker = worker(factory);

    worker.start();
    Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> factory.acknowledged.contains(150L));
    worker.stop();
    WorkerOutcome outcome = terminate(worker);

    assertEquals(WorkerState.STOPPED, outcome.state());
    assertEquals(150, outcome.confirmedPosition());
    assertEquals(2, factory.opens.get());
    assertEquals(List.of("7:0/96:0", "7:0/96:1"),
      sink.accepted.stream().map(SinkRecord::idempotencyKey).collect(Collectors.toList()));
  }

  @Test
  void givesUpAfterBoundedReconnectAttempts() throws Exception {
    ConnectionException refused = new ConnectionException("Connection to localhost:5432 refused");
    ScriptedSessionFactory factory = new ScriptedSessionFactory(50)
      .failOpen(refused)
      .failOpen(refused)
      .failOpen(refused);
    ReplicationWorker worker = worker(factory);

    worker.start();
    WorkerOutcome outcome = terminate(worker);

    assertEquals(WorkerState.FAILED, outcome.state());
    assertEquals(3, factory.opens.get());
    WorkerFailure failure = outcome.failure().orElseThrow();
    assertEquals(refused, failure.cause());
    assertEquals(WorkerState.STARTING, failure.failedIn());
    assertTrue(worker.start().failed());
  }

  @Test
  void invalidSlotIsNotRetried() throws Exception {
    ScriptedSessionFactory factory = new ScriptedSessionFactory(50)
      .failOpen(new SlotInvalidException("test_slot", "replication slot \"test_slot\" does not exist"))
      .session(tx(1, 100, 1));
    ReplicationWorker worker = worker(factory);

    worker.start();
    WorkerOutcome outcome = terminate(worker);

    assertEquals(WorkerState.FAILED, outcome.state());
    assertEquals(1, factory.opens.get());
    assertEquals("test_slot", outcome.failure().orElseThrow().toJson().getString("slot"));
  }

  @Test
  void publishFailureHaltsWithoutAcknowledging() throws Exception {
    sink.rejectRecords(false, 0);
    ScriptedSessionFactory factory = new ScriptedSessionFactory(50).session(tx(1, 100, 1), tx(2, 200, 1));
    ReplicationWorker worker = worker(factory);

    worker.start();
    WorkerOutcome outcome = terminate(worker);

    assertEquals(WorkerState.FAILED, outcome.state());
    assertInstanceOf(PublishException.class, outcome.failure().orElseThrow().cause());
    assertEquals(50, outcome.confirmedPosition());
    assertTrue(factory.acknowledged.isEmpty());
  }

  @Test
  void endOfStreamStopsGracefully() throws Exception {
    ScriptedSessionFactory factory = new ScriptedSessionFactory(50)
      .session(tx(1, 100, 2), tx(2, 200, 0), RawSegment.endOfStream());
    ReplicationWorker worker = worker(factory);

    worker.start();
    WorkerOutcome outcome = terminate(worker);

    assertEquals(WorkerState.STOPPED, outcome.state());
    assertEquals(200, outcome.confirmedPosition());
    assertEquals(200L, factory.acknowledged.get(factory.acknowledged.size() - 1));
    assertEquals(2, sink.accepted.size());
  }

  @Test
  void notifiesStateHandlersOnContext() throws Exception {
    ScriptedSessionFactory factory = new ScriptedSessionFactory(50).session(tx(1, 100, 1));
    ReplicationWorker worker = worker(factory);
    List<WorkerState> states = new CopyOnWriteArrayList<>();
    AtomicInteger offContext = new AtomicInteger();
    worker.onStateChange(change -> {
      if (Vertx.currentContext() == null) {
        offContext.incrementAndGet();
      }
      states.add(change.state());
    });

    worker.start().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    worker.stop();
    terminate(worker);

    Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> states.contains(WorkerState.STOPPED));
    assertEquals(List.of(WorkerState.STARTING, WorkerState.STREAMING, WorkerState.STOPPED), states);
    assertEquals(0, offContext.get());
  }

  private ReplicationWorker worker(ScriptedSessionFactory factory) {
    return new ReplicationWorker(vertx, new WorkerOptions()
      .setName("test")
      .setAcknowledgeInterval(Duration.ZERO)
      .setPollTimeout(Duration.ofMillis(10))
      .setRetryPolicy(RetryPolicy.exponentialBackoff()
        .setInitialDelay(Duration.ofMillis(1))
        .setMaxDelay(Duration.ofMillis(10))
        .setMaxAttempts(3)),
      factory, new ScriptedDecoder(), publisher);
  }

  private static WorkerOutcome terminate(ReplicationWorker worker) throws Exception {
    return worker.termination().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
  }
}
