package dev.henneberger.vertx.cdc.core;

import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one replication slot into a {@link ChangePublisher}.
 *
 * <pre>
 * CREATED -> STARTING -> STREAMING -> (RECOVERING -> STREAMING)* -> STOPPED | FAILED
 * </pre>
 *
 * <p>The blocking session is read on a dedicated daemon thread. Committed transactions are
 * published with up to {@code maxInFlightBatches} outstanding; the slot is only ever
 * acknowledged up to the {@link PositionTracker}'s confirmed position, so anything not
 * durably in the sink is re-delivered after a restart.
 */
public class ReplicationWorker implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ReplicationWorker.class);
  private static final long SLEEP_SLICE_MILLIS = 50;

  private final Context context;
  private final WorkerOptions options;
  private final ReplicationSessionFactory sessionFactory;
  private final ChangeDecoder decoder;
  private final ChangePublisher publisher;
  private final PositionTracker tracker = new PositionTracker();
  private final TransactionAssembler assembler = new TransactionAssembler();
  private final List<Handler<WorkerStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final List<WorkerMetricsListener> metricsListeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shouldRun = new AtomicBoolean(false);
  private final Promise<Void> startPromise = Promise.promise();
  private final Promise<WorkerOutcome> terminationPromise = Promise.promise();

  // owned by the worker thread
  private final Deque<InFlight> inFlight = new ArrayDeque<>();
  private long lastAcknowledged = LogPosition.INVALID;
  private long lastAcknowledgedAtNanos;
  private long attempt;
  private boolean streamedOnce;

  private volatile Thread worker;
  private volatile WorkerState state = WorkerState.CREATED;

  public ReplicationWorker(Vertx vertx,
                           WorkerOptions options,
                           ReplicationSessionFactory sessionFactory,
                           ChangeDecoder decoder,
                           ChangePublisher publisher) {
    this.context = Objects.requireNonNull(vertx, "vertx").getOrCreateContext();
    this.options = new WorkerOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
  }

  public String name() {
    return options.getName();
  }

  /**
   * Starts the worker thread.
   *
   * @return a future completed once the worker is STREAMING for the first time, or failed
   *   if it terminates before getting there
   */
  public Future<Void> start() {
    synchronized (this) {
      if (state.isTerminal()) {
        return Future.failedFuture("worker " + name() + " is " + state);
      }
      if (worker != null) {
        return startPromise.future();
      }
      shouldRun.set(true);
      transition(WorkerState.STARTING, null);
      Thread thread = new Thread(this::run, "replication-" + name());
      thread.setDaemon(true);
      worker = thread;
      thread.start();
    }
    return startPromise.future();
  }

  /**
   * Requests a graceful stop: buffered batches are flushed and confirmed, the slot is
   * acknowledged and the session closed before the worker reports STOPPED.
   */
  public void stop() {
    if (shouldRun.compareAndSet(true, false)) {
      LOG.info("Stop requested for worker {}", name());
    }
  }

  public Future<WorkerOutcome> termination() {
    return terminationPromise.future();
  }

  @Override
  public void close() {
    stop();
    synchronized (this) {
      if (worker == null && !state.isTerminal()) {
        transition(WorkerState.STOPPED, null);
        WorkerOutcome outcome = new WorkerOutcome(WorkerState.STOPPED, tracker.current(), null);
        terminationPromise.tryComplete(outcome);
        startPromise.tryFail("worker closed before streaming");
      }
    }
  }

  public WorkerState state() {
    return state;
  }

  public long confirmedPosition() {
    return tracker.current();
  }

  public Subscription onStateChange(Handler<WorkerStateChange> handler) {
    Handler<WorkerStateChange> resolved = Objects.requireNonNull(handler, "handler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  public Subscription addMetricsListener(WorkerMetricsListener listener) {
    WorkerMetricsListener resolved = Objects.requireNonNull(listener, "listener");
    metricsListeners.add(resolved);
    return () -> metricsListeners.remove(resolved);
  }

  private void run() {
    WorkerOutcome outcome;
    try {
      outcome = runLoop();
    } catch (RuntimeException | Error unexpected) {
      LOG.error("Worker {} crashed", name(), unexpected);
      outcome = fail(unexpected, null);
    }
    terminationPromise.tryComplete(outcome);
    if (outcome.failed()) {
      startPromise.tryFail(outcome.failure().map(WorkerFailure::cause)
        .orElseGet(() -> new IllegalStateException("worker failed")));
    } else {
      startPromise.tryFail("worker stopped before streaming");
    }
  }

  private WorkerOutcome runLoop() {
    while (true) {
      if (!shouldRun.get()) {
        return stopGracefully(null);
      }

      ReplicationSession session;
      try {
        session = sessionFactory.open();
      } catch (ReplicationException e) {
        if (!e.isTransient() || !backoff(e)) {
          return fail(e, null);
        }
        continue;
      }

      try {
        attach(session);
        stream(session);
        return stopGracefully(session);
      } catch (ReplicationException e) {
        if (!e.isTransient()) {
          return fail(e, session);
        }
        LOG.warn("Replication session of worker {} on slot {} broke: {}", name(), session.slotName(), e.getMessage());
        try {
          drainInFlight();
        } catch (ReplicationException drainError) {
          return fail(drainError, session);
        }
        // the broken session cannot be acknowledged; attach() catches up on the next one
        closeQuietly(session);
        assembler.reset();
        if (!shouldRun.get()) {
          return stopGracefully(null);
        }
        if (!backoff(e)) {
          return fail(e, null);
        }
      }
    }
  }

  private void attach(ReplicationSession session) {
    tracker.initialize(session.startPosition());
    assembler.reset();
    lastAcknowledged = session.startPosition();
    lastAcknowledgedAtNanos = System.nanoTime();
    if (tracker.current() > session.startPosition()) {
      // the previous session confirmed more than the slot recorded before it went away
      acknowledge(session, true);
    }
    streamedOnce = true;
    transition(WorkerState.STREAMING, null);
    startPromise.tryComplete();
    LOG.info("Worker {} streaming slot {} from {}", name(), session.slotName(), LogPosition.format(tracker.current()));
  }

  private void stream(ReplicationSession session) {
    while (shouldRun.get()) {
      RawSegment segment = session.nextSegment(options.getPollTimeout());
      if (segment != null) {
        if (segment.isEndOfStream()) {
          LOG.info("Replication stream of worker {} ended", name());
          return;
        }
        attempt = 0;
        Optional<TransactionBatch> batch;
        try {
          batch = assembler.accept(decoder.decode(segment));
        } catch (DecodeException e) {
          emitDecodeFailure(segment.payload(), e);
          throw e;
        }
        if (batch.isPresent()) {
          submit(batch.get());
        }
      }
      collectCompleted();
      acknowledge(session, false);
    }
  }

  private void submit(TransactionBatch batch) {
    long position = batch.commitPosition();
    if (position <= tracker.current()) {
      LOG.debug("Skipping re-delivered {} at or below confirmed {}", batch, LogPosition.format(tracker.current()));
      return;
    }
    tracker.record(position);
    if (batch.isEmpty()) {
      tracker.confirm(position);
      return;
    }
    inFlight.addLast(new InFlight(batch, publisher.publish(batch)));
    if (inFlight.size() > options.getMaxInFlightBatches()) {
      publisher.flush();
      while (inFlight.size() > options.getMaxInFlightBatches()) {
        completeOldest();
      }
    }
  }

  private void collectCompleted() {
    Iterator<InFlight> it = inFlight.iterator();
    while (it.hasNext()) {
      InFlight next = it.next();
      if (!next.future.isComplete()) {
        continue;
      }
      it.remove();
      if (next.future.failed()) {
        throw asReplicationException(next.future.cause());
      }
      confirmed(next.batch);
    }
  }

  private void completeOldest() {
    InFlight oldest = inFlight.pollFirst();
    if (oldest == null) {
      return;
    }
    await(oldest.future);
    confirmed(oldest.batch);
  }

  private void confirmed(TransactionBatch batch) {
    tracker.confirm(batch.commitPosition());
    for (WorkerMetricsListener listener : metricsListeners) {
      listener.onBatchPublished(batch);
    }
  }

  private void drainInFlight() {
    if (inFlight.isEmpty()) {
      return;
    }
    await(publisher.flush());
    while (!inFlight.isEmpty()) {
      completeOldest();
    }
  }

  private void acknowledge(ReplicationSession session, boolean force) {
    long position = tracker.current();
    if (position <= lastAcknowledged) {
      return;
    }
    long sinceLast = System.nanoTime() - lastAcknowledgedAtNanos;
    if (!force && sinceLast < options.getAcknowledgeInterval().toNanos()) {
      return;
    }
    session.acknowledge(position);
    lastAcknowledged = position;
    lastAcknowledgedAtNanos = System.nanoTime();
    LOG.debug("Acknowledged {} on slot {}", LogPosition.format(position), session.slotName());
    for (WorkerMetricsListener listener : metricsListeners) {
      listener.onPositionAcknowledged(session.slotName(), position);
    }
  }

  private boolean backoff(ReplicationException error) {
    attempt++;
    if (!options.getRetryPolicy().shouldRetry(error, attempt)) {
      LOG.error("Worker {} giving up after {} attempt(s)", name(), attempt);
      return false;
    }
    long delay = options.getRetryPolicy().computeDelayMillis(attempt);
    transition(streamedOnce ? WorkerState.RECOVERING : WorkerState.STARTING, error);
    LOG.warn("Worker {} reconnecting in {} ms (attempt {}): {}", name(), delay, attempt, error.getMessage());
    sleepWhileRunning(delay);
    return true;
  }

  private WorkerOutcome stopGracefully(ReplicationSession session) {
    if (assembler.hasOpenTransaction()) {
      LOG.info("Dropping {} event(s) of an uncommitted transaction; they are re-sent on restart",
        assembler.bufferedEvents());
      assembler.reset();
    }
    try {
      drainInFlight();
      if (session != null) {
        acknowledge(session, true);
      }
    } catch (ReplicationException e) {
      return fail(e, session);
    }
    closeQuietly(session);
    transition(WorkerState.STOPPED, null);
    LOG.info("Worker {} stopped at {}", name(), LogPosition.format(tracker.current()));
    return new WorkerOutcome(WorkerState.STOPPED, tracker.current(), null);
  }

  private WorkerOutcome fail(Throwable error, ReplicationSession session) {
    WorkerState failedIn = state;
    if (error instanceof PublishException) {
      inFlight.clear();
    } else {
      try {
        drainInFlight();
      } catch (ReplicationException drainError) {
        error.addSuppressed(drainError);
        inFlight.clear();
      }
    }
    if (session != null) {
      try {
        acknowledge(session, true);
      } catch (RuntimeException ackError) {
        LOG.warn("Could not acknowledge {} before failing", LogPosition.format(tracker.current()), ackError);
      }
      closeQuietly(session);
    }
    shouldRun.set(false);
    WorkerFailure failure = new WorkerFailure(failedIn, tracker.current(), error);
    transition(WorkerState.FAILED, error);
    LOG.error("Worker {} failed: {}", name(), failure);
    return new WorkerOutcome(WorkerState.FAILED, tracker.current(), failure);
  }

  private void transition(WorkerState nextState, Throwable cause) {
    WorkerState previous = state;
    if (previous == nextState && cause == null) {
      return;
    }
    state = nextState;
    WorkerStateChange change = new WorkerStateChange(previous, nextState, cause, attempt, tracker.current());
    for (WorkerMetricsListener listener : metricsListeners) {
      listener.onStateChange(change);
    }
    for (Handler<WorkerStateChange> handler : stateHandlers) {
      context.runOnContext(v -> handler.handle(change));
    }
  }

  private void emitDecodeFailure(String payload, Throwable error) {
    for (WorkerMetricsListener listener : metricsListeners) {
      listener.onDecodeFailure(payload, error);
    }
  }

  private void sleepWhileRunning(long millis) {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
    try {
      long remaining;
      while (shouldRun.get() && (remaining = deadline - System.nanoTime()) > 0) {
        Thread.sleep(Math.min(SLEEP_SLICE_MILLIS, TimeUnit.NANOSECONDS.toMillis(remaining) + 1));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      shouldRun.set(false);
    }
  }

  private static void closeQuietly(ReplicationSession session) {
    if (session == null) {
      return;
    }
    try {
      session.close();
    } catch (RuntimeException e) {
      LOG.debug("Ignoring failure closing replication session", e);
    }
  }

  private static <T> T await(Future<T> future) {
    try {
      return future.toCompletionStage().toCompletableFuture().get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StreamException("interrupted while waiting for the publisher", e);
    } catch (ExecutionException e) {
      throw asReplicationException(e.getCause());
    }
  }

  private static ReplicationException asReplicationException(Throwable error) {
    if (error instanceof ReplicationException) {
      return (ReplicationException) error;
    }
    return new PublishException("publishing failed", error);
  }

  private static final class InFlight {
    private final TransactionBatch batch;
    private final Future<Long> future;

    private InFlight(TransactionBatch batch, Future<Long> future) {
      this.batch = batch;
      this.future = future;
    }
  }
}
