package org.waabox.sourcevault.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.waabox.sourcevault.TransportException;
import org.waabox.sourcevault.fetch.SourceFetcher;
import org.waabox.sourcevault.model.ConditionType;
import org.waabox.sourcevault.model.ResourceKey;
import org.waabox.sourcevault.model.SourceKind;
import org.waabox.sourcevault.model.SourceSpec;
import org.waabox.sourcevault.source.HelmRepositoryProvider;
import org.waabox.sourcevault.storage.InMemoryArtifactStorage;
import org.waabox.sourcevault.store.InMemoryResourceStore;

/**
 * Tests for {@link ReconcileLoop}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ReconcileLoopTest {

  private static final byte[] INDEX = String.join("\n",
      "entries:",
      "  podinfo:",
      "  - version: 6.5.0",
      "    urls:",
      "    - podinfo-6.5.0.tgz",
      "").getBytes(StandardCharsets.UTF_8);

  private static final ResourceKey KEY =
      new ResourceKey(SourceKind.HELM_REPOSITORY, "default", "podinfo");

  private final InMemoryResourceStore store = new InMemoryResourceStore();

  private final InMemoryArtifactStorage storage =
      new InMemoryArtifactStorage("http://localhost:9090");

  private ReconcileLoop loop;

  @AfterEach
  void tearDown() {
    if (loop != null) {
      loop.stop();
    }
  }

  @Test
  void whenStarting_givenDeclaredSource_shouldReconcileAndRequeueByInterval()
      throws Exception {
    final CountDownLatch passes = new CountDownLatch(3);
    store.put(KEY, spec(Duration.ofMillis(50)));
    loop = new ReconcileLoop(reconciler(fetcherCounting(passes, false)),
        store, 2);

    loop.start();

    assertTrue(loop.isRunning());
    assertTrue(passes.await(5, TimeUnit.SECONDS));
    assertTrue(store.get(KEY).get().status().conditions()
        .isTrue(ConditionType.READY));
    assertTrue(storage.writes() >= 1);
  }

  @Test
  void whenFetchFails_givenTransportError_shouldRetryAfterRetryInterval()
      throws Exception {
    final CountDownLatch attempts = new CountDownLatch(3);
    store.put(KEY, spec(Duration.ofHours(1)));
    loop = new ReconcileLoop(reconciler(fetcherCounting(attempts, true)),
        store, 1);

    loop.start();

    assertTrue(attempts.await(5, TimeUnit.SECONDS));
    assertFalse(store.get(KEY).get().status().conditions()
        .isTrue(ConditionType.READY));
  }

  @Test
  void whenEnqueuing_givenStoppedLoop_shouldIgnoreKey() {
    final AtomicInteger calls = new AtomicInteger();
    store.put(KEY, spec(Duration.ofMinutes(1)));
    loop = new ReconcileLoop(reconciler((url, options, timeout) -> {
      calls.incrementAndGet();
      return INDEX;
    }), store, 1);

    loop.enqueue(KEY);

    assertFalse(loop.isRunning());
    assertEquals(0, calls.get());
  }

  @Test
  void whenStarting_givenRunningLoop_shouldThrow() {
    loop = new ReconcileLoop(reconciler((url, options, timeout) -> INDEX),
        store, 1);
    loop.start();

    assertThrows(IllegalStateException.class, () -> loop.start());
  }

  @Test
  void whenStopping_givenRunningLoop_shouldStopRunning() {
    loop = new ReconcileLoop(reconciler((url, options, timeout) -> INDEX),
        store, 1);
    loop.start();

    loop.stop();
    loop.stop();

    assertFalse(loop.isRunning());
  }

  @Test
  void whenDeleting_givenStoredArtifacts_shouldRemoveThem() throws Exception {
    final CountDownLatch passes = new CountDownLatch(1);
    store.put(KEY, spec(Duration.ofHours(1)));
    loop = new ReconcileLoop(reconciler(fetcherCounting(passes, false)),
        store, 1);
    loop.start();
    assertTrue(passes.await(5, TimeUnit.SECONDS));
    waitForArtifact();

    store.remove(KEY);
    loop.delete(KEY);

    assertTrue(storage.paths().isEmpty());
  }

  @Test
  void whenDeleting_givenRunningPass_shouldRemoveItsArtifactAndNotRequeue()
      throws Exception {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger calls = new AtomicInteger();
    store.put(KEY, spec(Duration.ofMillis(50)));
    loop = new ReconcileLoop(reconciler((url, options, timeout) -> {
      if (calls.incrementAndGet() == 1) {
        started.countDown();
        awaitRelease(release);
      }
      return INDEX;
    }), store, 1);
    loop.start();
    assertTrue(started.await(5, TimeUnit.SECONDS));

    loop.delete(KEY);
    release.countDown();

    waitFor(() -> storage.writes() == 1 && storage.paths().isEmpty());
    Thread.sleep(300);

    assertEquals(1, storage.writes());
    assertTrue(storage.paths().isEmpty());
    assertEquals(1, calls.get());
  }

  @Test
  void whenEnqueuing_givenKeyDeletedDuringPass_shouldReconcileAgain()
      throws Exception {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final CountDownLatch passes = new CountDownLatch(2);
    store.put(KEY, spec(Duration.ofHours(1)));
    loop = new ReconcileLoop(reconciler((url, options, timeout) -> {
      passes.countDown();
      if (started.getCount() == 1) {
        started.countDown();
        awaitRelease(release);
      }
      return INDEX;
    }), store, 1);
    loop.start();
    assertTrue(started.await(5, TimeUnit.SECONDS));

    loop.delete(KEY);
    loop.enqueue(KEY);
    release.countDown();

    assertTrue(passes.await(5, TimeUnit.SECONDS));
    waitFor(() -> !storage.paths().isEmpty());
    assertEquals(1, storage.paths().size());
  }

  @Test
  void whenCreating_givenNoWorkers_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        new ReconcileLoop(reconciler((url, options, timeout) -> INDEX),
            store, 0));
  }

  private void waitForArtifact() throws InterruptedException {
    final long deadline = System.currentTimeMillis() + 5000;
    while (store.get(KEY).get().status().artifact() == null
        && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
  }

  private static void awaitRelease(final CountDownLatch release) {
    try {
      release.await(5, TimeUnit.SECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void waitFor(final BooleanSupplier condition)
      throws InterruptedException {
    final long deadline = System.currentTimeMillis() + 5000;
    while (!condition.getAsBoolean()
        && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertTrue(condition.getAsBoolean());
  }

  private SourceReconciler reconciler(final SourceFetcher fetcher) {
    return SourceReconciler.builder()
        .storage(storage)
        .store(store)
        .provider(new HelmRepositoryProvider(fetcher))
        .requeuePolicy(RequeuePolicy.of(Duration.ofMillis(50),
            Duration.ofSeconds(5)))
        .build();
  }

  private static SourceFetcher fetcherCounting(final CountDownLatch latch,
      final boolean fail) {
    return (url, options, timeout) -> {
      latch.countDown();
      if (fail) {
        throw new TransportException(TransportException.Kind.NETWORK,
            "connection refused");
      }
      return INDEX;
    };
  }

  private static SourceSpec spec(final Duration interval) {
    return SourceSpec.builder()
        .url("https://charts.example.com")
        .interval(interval)
        .build();
  }
}
