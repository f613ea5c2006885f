package org.waabox.sourcevault.reconcile;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.sourcevault.model.ResourceKey;
import org.waabox.sourcevault.store.ResourceStore;

/**
 * Runs reconciliation passes in-process.
 *
 * <p>Passes run on a bounded worker pool. A key is never reconciled by two
 * workers at once: a key enqueued while its pass runs is rerun once the pass
 * finishes. Requeue delays from {@link ReconcileResult} are honored through
 * a scheduler, and failed passes without a delay are retried after the
 * retry interval of the reconciler's {@link RequeuePolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ReconcileLoop {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ReconcileLoop.class);

  /** The reconciler, never null. */
  private final SourceReconciler reconciler;

  /** The store whose resources are enqueued on start, never null. */
  private final ResourceStore store;

  /** The number of worker threads. */
  private final int workers;

  /** The keys with a pass running. Guarded by this. */
  private final Set<ResourceKey> running = new HashSet<>();

  /** The keys enqueued while their pass was running. Guarded by this. */
  private final Set<ResourceKey> dirty = new HashSet<>();

  /** The keys deleted while their pass was running. Guarded by this. */
  private final Set<ResourceKey> deleted = new HashSet<>();

  /** The pending delayed requeues. Guarded by this. */
  private final Map<ResourceKey, ScheduledFuture<?>> pending =
      new HashMap<>();

  /** The worker pool, null when stopped. Guarded by this. */
  private ExecutorService pool;

  /** The requeue scheduler, null when stopped. Guarded by this. */
  private ScheduledExecutorService scheduler;

  /**
   * Creates a new loop.
   *
   * @param theReconciler the reconciler, never null
   * @param theStore      the resource store, never null
   * @param theWorkers    the maximum number of concurrent passes, must be
   *                      greater than zero
   */
  public ReconcileLoop(final SourceReconciler theReconciler,
      final ResourceStore theStore, final int theWorkers) {
    reconciler = Objects.requireNonNull(theReconciler,
        "reconciler must not be null");
    store = Objects.requireNonNull(theStore, "store must not be null");
    if (theWorkers <= 0) {
      throw new IllegalArgumentException(
          "workers must be greater than 0, got: " + theWorkers);
    }
    workers = theWorkers;
  }

  /**
   * Starts the workers and enqueues every resource of the store.
   *
   * @throws IllegalStateException if the loop is already running
   */
  public void start() {
    synchronized (this) {
      if (pool != null) {
        throw new IllegalStateException("Reconcile loop already started");
      }
      final AtomicInteger counter = new AtomicInteger();
      pool = Executors.newFixedThreadPool(workers, r -> {
        final Thread thread = new Thread(r,
            "sourcevault-reconcile-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      });
      scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread thread = new Thread(r, "sourcevault-requeue");
        thread.setDaemon(true);
        return thread;
      });
    }
    log.info("Reconcile loop started with {} workers", workers);
    for (final ResourceKey key : store.list()) {
      enqueue(key);
    }
  }

  /**
   * Stops the workers and drops every pending requeue.
   *
   * <p>Running passes are interrupted. Stopping a stopped loop does
   * nothing.
   */
  public void stop() {
    synchronized (this) {
      if (pool == null) {
        return;
      }
      for (final ScheduledFuture<?> future : pending.values()) {
        future.cancel(false);
      }
      pending.clear();
      dirty.clear();
      deleted.clear();
      running.clear();
      scheduler.shutdownNow();
      pool.shutdownNow();
      scheduler = null;
      pool = null;
    }
    log.info("Reconcile loop stopped");
  }

  /**
   * Returns whether the loop is running.
   *
   * @return true between {@link #start()} and {@link #stop()}
   */
  public synchronized boolean isRunning() {
    return pool != null;
  }

  /**
   * Requests a pass for the given resource as soon as a worker is free.
   *
   * <p>Ignored while the loop is stopped.
   *
   * @param key the resource key, never null
   */
  public void enqueue(final ResourceKey key) {
    Objects.requireNonNull(key, "key must not be null");
    synchronized (this) {
      if (pool == null) {
        log.debug("Reconcile loop stopped, ignoring '{}'", key);
        return;
      }
      final ScheduledFuture<?> scheduled = pending.remove(key);
      if (scheduled != null) {
        scheduled.cancel(false);
      }
      deleted.remove(key);
      if (!running.add(key)) {
        dirty.add(key);
        return;
      }
      pool.execute(() -> run(key));
    }
  }

  /**
   * Stops reconciling a deleted resource and removes its artifacts.
   *
   * <p>A pass already running for the resource is not rescheduled, and the
   * artifacts it may write are removed again once it finishes.
   *
   * @param key the deleted resource, never null
   */
  public void delete(final ResourceKey key) {
    Objects.requireNonNull(key, "key must not be null");
    synchronized (this) {
      final ScheduledFuture<?> scheduled = pending.remove(key);
      if (scheduled != null) {
        scheduled.cancel(false);
      }
      dirty.remove(key);
      if (running.contains(key)) {
        deleted.add(key);
      }
    }
    reconciler.delete(key);
  }

  /**
   * Runs one pass and schedules the next one.
   *
   * @param key the resource key, never null
   */
  private void run(final ResourceKey key) {
    ReconcileResult result;
    try {
      result = reconciler.reconcile(key);
    } catch (final RuntimeException e) {
      log.error("Unexpected failure reconciling '{}': {}", key,
          e.getMessage(), e);
      result = ReconcileResult.failed(e,
          reconciler.requeuePolicy().retryInterval());
    }

    final boolean rerun;
    final boolean removed;
    synchronized (this) {
      running.remove(key);
      rerun = dirty.remove(key);
      removed = deleted.remove(key);
    }
    if (removed) {
      log.debug("'{}' was deleted during its pass, removing artifacts", key);
      try {
        reconciler.delete(key);
      } catch (final RuntimeException e) {
        log.error("Failed to remove artifacts of deleted '{}': {}", key,
            e.getMessage(), e);
      }
      return;
    }
    if (rerun) {
      enqueue(key);
      return;
    }
    schedule(key, result);
  }

  /**
   * Schedules the next pass according to a result.
   *
   * @param key    the resource key, never null
   * @param result the last result, never null
   */
  private void schedule(final ResourceKey key, final ReconcileResult result) {
    Duration delay = result.requeueAfter();
    if (delay == null && !result.isSuccess()) {
      delay = reconciler.requeuePolicy().retryInterval();
    }
    if (delay == null) {
      return;
    }
    if (delay.isZero() || delay.isNegative()) {
      enqueue(key);
      return;
    }
    synchronized (this) {
      if (scheduler == null) {
        return;
      }
      final ScheduledFuture<?> previous = pending.put(key,
          scheduler.schedule(() -> enqueue(key), delay.toMillis(),
              TimeUnit.MILLISECONDS));
      if (previous != null) {
        previous.cancel(false);
      }
    }
  }
}
