package org.waabox.sourcevault.reconcile;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.sourcevault.ContentException;
import org.waabox.sourcevault.CredentialException;
import org.waabox.sourcevault.StorageIOException;
import org.waabox.sourcevault.TransportException;
import org.waabox.sourcevault.credentials.CredentialResolver;
import org.waabox.sourcevault.fetch.FetchOptions;
import org.waabox.sourcevault.metrics.NoopReconcileMetrics;
import org.waabox.sourcevault.metrics.ReconcileMetrics;
import org.waabox.sourcevault.model.Artifact;
import org.waabox.sourcevault.model.ConditionReason;
import org.waabox.sourcevault.model.ConditionType;
import org.waabox.sourcevault.model.Conditions;
import org.waabox.sourcevault.model.ManagedSource;
import org.waabox.sourcevault.model.ResourceKey;
import org.waabox.sourcevault.model.SourceKind;
import org.waabox.sourcevault.model.SourceStatus;
import org.waabox.sourcevault.source.FetchedSource;
import org.waabox.sourcevault.source.SourceProvider;
import org.waabox.sourcevault.storage.ArtifactLock;
import org.waabox.sourcevault.storage.ArtifactStorage;
import org.waabox.sourcevault.store.ResourceStore;

/**
 * Drives one managed resource towards its desired state.
 *
 * <p>A pass runs two phases. The storage phase checks that the recorded
 * artifact still has a backing file, collects superseded revisions and
 * refreshes URLs for the current hostname. The source phase resolves
 * credentials, fetches the candidate content and, when its checksum
 * differs from the current artifact, persists it under the artifact lock
 * and swaps it in.
 *
 * <p>Every failure ends up as a {@code FetchFailed} condition and a
 * scheduling decision in the returned {@link ReconcileResult}; a pass never
 * throws. The status is written back only when it changed.
 *
 * <p>Instances are thread-safe. Passes of different resources may run
 * concurrently, passes of the same resource must be serialized by the
 * caller, see {@link ReconcileLoop}.
 *
 * <p>Usage example:
 * <pre>{@code
 * SourceReconciler reconciler = SourceReconciler.builder()
 *     .storage(fileSystemStorage)
 *     .store(resourceStore)
 *     .provider(new HelmRepositoryProvider(fetcher))
 *     .provider(new HelmChartProvider(fetcher))
 *     .credentials(kubernetesResolver)
 *     .build();
 *
 * ReconcileResult result = reconciler.reconcile(key);
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SourceReconciler {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SourceReconciler.class);

  /** The artifact storage, never null. */
  private final ArtifactStorage storage;

  /** The resource store, never null. */
  private final ResourceStore store;

  /** The source providers by kind, never null. */
  private final Map<SourceKind, SourceProvider> providers;

  /** The credential resolver, never null. */
  private final CredentialResolver credentials;

  /** The scheduling constants, never null. */
  private final RequeuePolicy requeuePolicy;

  /** The metrics reporter, never null. */
  private final ReconcileMetrics metrics;

  /** The clock for condition transition times, never null. */
  private final Clock clock;

  /**
   * Creates a new reconciler.
   *
   * @param theBuilder the populated builder, never null
   */
  private SourceReconciler(final Builder theBuilder) {
    storage = theBuilder.storage;
    store = theBuilder.store;
    providers = new EnumMap<>(theBuilder.providers);
    credentials = theBuilder.credentials;
    requeuePolicy = theBuilder.requeuePolicy;
    metrics = theBuilder.metrics;
    clock = theBuilder.clock;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the scheduling constants of this reconciler.
   *
   * @return the policy, never null
   */
  public RequeuePolicy requeuePolicy() {
    return requeuePolicy;
  }

  /**
   * Runs one reconciliation pass for the given resource.
   *
   * <p>A resource that no longer exists is ignored.
   *
   * @param key the resource key, never null
   * @return the scheduling decision and the failure, if any, never null
   */
  public ReconcileResult reconcile(final ResourceKey key) {
    Objects.requireNonNull(key, "key must not be null");

    final Instant start = clock.instant();
    final Optional<ManagedSource> found = store.get(key);
    if (found.isEmpty()) {
      log.debug("Resource '{}' not found, nothing to reconcile", key);
      return ReconcileResult.done();
    }
    final ManagedSource source = found.get();
    final SourceStatus initial = source.status();

    Step step = reconcileStorage(source, initial);
    if (!step.stopped()) {
      step = reconcileSource(source, step.status());
    }

    ReconcileResult result = step.result();
    if (!step.status().equals(initial)) {
      try {
        store.updateStatus(key, step.status());
      } catch (final RuntimeException e) {
        log.error("Failed to update status of '{}': {}", key,
            e.getMessage(), e);
        result = ReconcileResult.failed(e, requeuePolicy.retryInterval());
      }
    }

    if (result.isSuccess()) {
      log.debug("Reconciled '{}', next pass in {}", key,
          result.delay().map(Duration::toString).orElse("never"));
    } else {
      log.error("Reconciliation of '{}' failed: {}", key,
          result.error().getMessage());
    }
    metrics.reconciled(key, Duration.between(start, clock.instant()),
        result.isSuccess());
    return result;
  }

  /**
   * Removes every artifact of a deleted resource.
   *
   * @param key the deleted resource, never null
   * @return whether anything was removed
   *
   * @throws StorageIOException if the directory cannot be removed
   */
  public boolean delete(final ResourceKey key) {
    Objects.requireNonNull(key, "key must not be null");
    final boolean removed = storage.removeAll(key);
    if (removed) {
      log.info("Removed all artifacts of deleted resource '{}'", key);
    }
    return removed;
  }

  /**
   * Checks the recorded artifact against storage.
   *
   * <p>A missing file clears the record and requests an immediate rerun.
   * Otherwise superseded files are collected and URLs are refreshed.
   *
   * @param source the resource, never null
   * @param status the status entering the phase, never null
   * @return the phase outcome, never null
   */
  private Step reconcileStorage(final ManagedSource source,
      final SourceStatus status) {
    final Artifact current = status.artifact();
    if (current == null) {
      return Step.proceed(status);
    }

    final ResourceKey key = source.key();
    if (!storage.exists(current)) {
      log.info("Artifact '{}' of '{}' is missing from storage",
          current.path(), key);
      final Conditions conditions = status.conditions()
          .remove(ConditionType.READY)
          .markTrue(ConditionType.ARTIFACT_UNAVAILABLE,
              ConditionReason.NO_ARTIFACT,
              "No artifact for resource in storage", clock.instant());
      return Step.stop(new SourceStatus(null, null, conditions),
          ReconcileResult.requeueNow());
    }

    try (ArtifactLock lock = storage.lock(current)) {
      collectGarbage(key, current);
    } catch (final StorageIOException e) {
      log.warn("Garbage collection of '{}' skipped: {}", key,
          e.getMessage());
    }

    final Artifact refreshed = storage.setUrl(current);
    final String linkUrl = status.url() == null
        ? null : linkUrl(current, key.kind().latestLinkName());
    if (!refreshed.equals(current) || !Objects.equals(linkUrl, status.url())) {
      log.debug("Rewrote artifact URL of '{}' to {}", key, refreshed.url());
      return Step.proceed(status.withArtifact(refreshed, linkUrl));
    }
    return Step.proceed(status);
  }

  /**
   * Fetches the candidate content and persists it when it changed.
   *
   * @param source the resource, never null
   * @param status the status entering the phase, never null
   * @return the phase outcome, always stopped, never null
   */
  private Step reconcileSource(final ManagedSource source,
      final SourceStatus status) {
    final Duration interval = source.spec().interval();
    final String url = source.spec().origin();

    final FetchedSource fetched;
    try {
      final SourceProvider provider = provider(source.key().kind());
      final FetchOptions options = resolveOptions(provider, source);
      fetched = provider.fetch(source, options,
          source.spec().timeout().orElse(requeuePolicy.defaultTimeout()));
    } catch (final CredentialException e) {
      return Step.stop(failed(source, status,
          ConditionReason.AUTHENTICATION_FAILED, e.getMessage()),
          ReconcileResult.failed(e, interval));
    } catch (final TransportException e) {
      final String message = "failed to fetch '" + url + "': "
          + e.getMessage();
      switch (e.kind()) {
        case INVALID_URL:
          return Step.stop(failed(source, status,
              ConditionReason.URL_INVALID, message), ReconcileResult.done());
        case UNSUPPORTED_SCHEME:
          return Step.stop(failed(source, status,
              ConditionReason.UNSUPPORTED_SCHEME, message),
              ReconcileResult.done());
        default:
          return Step.stop(failed(source, status,
              ConditionReason.TRANSPORT_FAILED, message),
              ReconcileResult.failed(e, requeuePolicy.retryInterval()));
      }
    } catch (final ContentException | IllegalArgumentException e) {
      return Step.stop(failed(source, status,
          ConditionReason.CONTENT_INVALID,
          "invalid content from '" + url + "': " + e.getMessage()),
          ReconcileResult.failed(e, interval));
    } catch (final StorageIOException e) {
      return Step.stop(failed(source, status,
          ConditionReason.STORAGE_OPERATION_FAILED,
          "failed to read '" + url + "': " + e.getMessage()),
          ReconcileResult.failed(e, requeuePolicy.retryInterval()));
    }

    final Artifact current = status.artifact();
    if (current != null && fetched.checksum().equals(current.checksum())) {
      log.debug("Revision '{}' of '{}' unchanged", current.revision(),
          source.key());
      return Step.stop(ready(status, current.revision()),
          ReconcileResult.requeueAfter(interval));
    }

    final SourceStatus outdated = status.withConditions(
        status.conditions().markTrue(ConditionType.ARTIFACT_OUTDATED,
            ConditionReason.NEW_REVISION,
            "New revision '" + fetched.revision() + "'", clock.instant()));
    return persist(source, outdated, fetched);
  }

  /**
   * Writes the candidate under the artifact lock and swaps it in.
   *
   * @param source  the resource, never null
   * @param status  the status entering persistence, never null
   * @param fetched the candidate, never null
   * @return the phase outcome, always stopped, never null
   */
  private Step persist(final ManagedSource source, final SourceStatus status,
      final FetchedSource fetched) {
    final ResourceKey key = source.key();
    final Artifact candidate;
    try {
      candidate = storage.newArtifactFor(key, fetched.revision(),
          fetched.fileName());
    } catch (final IllegalArgumentException e) {
      return Step.stop(failed(source, status,
          ConditionReason.CONTENT_INVALID,
          "invalid content from '" + source.spec().origin() + "': "
              + e.getMessage()),
          ReconcileResult.failed(e, source.spec().interval()));
    }
    final byte[] data = fetched.data();

    final String linkUrl;
    try (ArtifactLock lock = storage.lock(candidate)) {
      storage.ensureDirectory(candidate);
      storage.atomicWrite(candidate, data);
      linkUrl = storage.symlink(candidate, fetched.linkName());
      collectGarbage(key, candidate);
    } catch (final StorageIOException e) {
      return Step.stop(failed(source, status,
          ConditionReason.STORAGE_OPERATION_FAILED,
          "failed to store artifact for revision '" + fetched.revision()
              + "': " + e.getMessage()),
          ReconcileResult.failed(e, requeuePolicy.retryInterval()));
    }

    final Artifact stored = candidate.persisted(fetched.checksum(),
        clock.instant());
    log.info("Stored artifact for revision '{}' of '{}' at {}",
        stored.revision(), key, stored.path());
    metrics.artifactStored(key, stored.revision(), data.length);
    return Step.stop(ready(status.withArtifact(stored, linkUrl),
        stored.revision()),
        ReconcileResult.requeueAfter(source.spec().interval()));
  }

  /**
   * Removes every file of the artifact's directory but the artifact.
   *
   * <p>Failures are logged and swallowed. The caller holds the lock.
   *
   * @param key     the resource, never null
   * @param current the artifact to keep, never null
   */
  private void collectGarbage(final ResourceKey key, final Artifact current) {
    try {
      final List<String> removed = storage.removeAllButCurrent(current);
      if (!removed.isEmpty()) {
        log.debug("Garbage collected {} files of '{}'", removed.size(), key);
        metrics.garbageCollected(key, removed.size());
      }
    } catch (final StorageIOException e) {
      log.warn("Garbage collection of '{}' failed: {}", key, e.getMessage());
    }
  }

  /**
   * Resolves the fetch options of a resource.
   *
   * @param provider the provider of the resource kind, never null
   * @param source   the resource, never null
   * @return the options, never null
   *
   * @throws CredentialException if the secret cannot be resolved
   */
  private FetchOptions resolveOptions(final SourceProvider provider,
      final ManagedSource source) {
    final Optional<String> secretRef = provider.secretRef(source);
    if (secretRef.isEmpty()) {
      return FetchOptions.none();
    }
    return credentials.resolve(source.key().namespace(), secretRef.get());
  }

  /**
   * Looks up the provider of a kind.
   *
   * @param kind the kind, never null
   * @return the provider, never null
   *
   * @throws ContentException if no provider serves the kind
   */
  private SourceProvider provider(final SourceKind kind) {
    final SourceProvider provider = providers.get(kind);
    if (provider == null) {
      throw new ContentException("no source provider registered for kind '"
          + kind.kindName() + "'");
    }
    return provider;
  }

  /**
   * Returns the public URL of the stable link next to an artifact.
   *
   * @param artifact the artifact, never null
   * @param linkName the link name, never null
   * @return the URL, never null
   */
  private String linkUrl(final Artifact artifact, final String linkName) {
    return storage.urlFor(artifact.directory() + "/" + linkName);
  }

  /**
   * Marks the status as ready for the given revision.
   *
   * @param status   the status, never null
   * @param revision the current revision, never null
   * @return the updated status, never null
   */
  private SourceStatus ready(final SourceStatus status,
      final String revision) {
    return status.withConditions(status.conditions()
        .remove(ConditionType.ARTIFACT_OUTDATED,
            ConditionType.ARTIFACT_UNAVAILABLE, ConditionType.FETCH_FAILED)
        .markTrue(ConditionType.READY, ConditionReason.SUCCEEDED,
            "Stored artifact for revision '" + revision + "'",
            clock.instant()));
  }

  /**
   * Marks the status as failed.
   *
   * <p>{@code FetchFailed} becomes true and {@code Ready} false with the
   * same reason and message.
   *
   * @param source  the resource, never null
   * @param status  the status, never null
   * @param reason  the condition reason, never null
   * @param message the condition message, never null
   * @return the updated status, never null
   */
  private SourceStatus failed(final ManagedSource source,
      final SourceStatus status, final String reason, final String message) {
    log.warn("Fetch of '{}' failed ({}): {}", source.key(), reason, message);
    metrics.fetchFailed(source.key(), reason);
    final Instant now = clock.instant();
    return status.withConditions(status.conditions()
        .markTrue(ConditionType.FETCH_FAILED, reason, message, now)
        .markFalse(ConditionType.READY, reason, message, now));
  }

  /** The outcome of one phase: the status and, when stopped, the result.
   *
   * @param status the status after the phase, never null
   * @param result the pass result, null to continue with the next phase
   */
  private record Step(SourceStatus status, ReconcileResult result) {

    /** Continues with the next phase.
     *
     * @param status the status.
     * @return the step.
     */
    static Step proceed(final SourceStatus status) {
      return new Step(status, null);
    }

    /** Ends the pass.
     *
     * @param status the status.
     * @param result the result.
     * @return the step.
     */
    static Step stop(final SourceStatus status,
        final ReconcileResult result) {
      return new Step(status, result);
    }

    /** Whether the pass ends here.
     *
     * @return true if stopped.
     */
    boolean stopped() {
      return result != null;
    }
  }

  /**
   * A fluent builder for {@link SourceReconciler} instances.
   *
   * <p>Storage and store are required, as is one provider per reconciled
   * kind. Defaults:
   * <ul>
   *   <li>credentials: {@link CredentialResolver#unavailable()}</li>
   *   <li>requeuePolicy: {@link RequeuePolicy#defaultPolicy()}</li>
   *   <li>metrics: {@link NoopReconcileMetrics}</li>
   *   <li>clock: the system UTC clock</li>
   * </ul>
   */
  public static final class Builder {

    /** The artifact storage. */
    private ArtifactStorage storage;

    /** The resource store. */
    private ResourceStore store;

    /** The providers by kind. */
    private final Map<SourceKind, SourceProvider> providers =
        new EnumMap<>(SourceKind.class);

    /** The credential resolver. */
    private CredentialResolver credentials = CredentialResolver.unavailable();

    /** The scheduling constants. */
    private RequeuePolicy requeuePolicy = RequeuePolicy.defaultPolicy();

    /** The metrics reporter. */
    private ReconcileMetrics metrics = new NoopReconcileMetrics();

    /** The clock. */
    private Clock clock = Clock.systemUTC();

    /** Creates a new builder. */
    private Builder() {
    }

    /**
     * Sets the artifact storage.
     *
     * @param theStorage the storage, never null
     * @return this builder, never null
     */
    public Builder storage(final ArtifactStorage theStorage) {
      storage = Objects.requireNonNull(theStorage,
          "storage must not be null");
      return this;
    }

    /**
     * Sets the resource store.
     *
     * @param theStore the store, never null
     * @return this builder, never null
     */
    public Builder store(final ResourceStore theStore) {
      store = Objects.requireNonNull(theStore, "store must not be null");
      return this;
    }

    /**
     * Registers a source provider, replacing any for the same kind.
     *
     * @param theProvider the provider, never null
     * @return this builder, never null
     */
    public Builder provider(final SourceProvider theProvider) {
      Objects.requireNonNull(theProvider, "provider must not be null");
      providers.put(theProvider.kind(), theProvider);
      return this;
    }

    /**
     * Sets the credential resolver.
     *
     * @param theCredentials the resolver, never null
     * @return this builder, never null
     */
    public Builder credentials(final CredentialResolver theCredentials) {
      credentials = Objects.requireNonNull(theCredentials,
          "credentials must not be null");
      return this;
    }

    /**
     * Sets the scheduling constants.
     *
     * @param thePolicy the policy, never null
     * @return this builder, never null
     */
    public Builder requeuePolicy(final RequeuePolicy thePolicy) {
      requeuePolicy = Objects.requireNonNull(thePolicy,
          "requeuePolicy must not be null");
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics, never null
     * @return this builder, never null
     */
    public Builder metrics(final ReconcileMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Sets the clock used for condition transition and artifact times.
     *
     * @param theClock the clock, never null
     * @return this builder, never null
     */
    public Builder clock(final Clock theClock) {
      clock = Objects.requireNonNull(theClock, "clock must not be null");
      return this;
    }

    /**
     * Builds the reconciler.
     *
     * @return the reconciler, never null
     *
     * @throws IllegalStateException if storage or store is missing
     */
    public SourceReconciler build() {
      if (storage == null) {
        throw new IllegalStateException("storage must be set");
      }
      if (store == null) {
        throw new IllegalStateException("store must be set");
      }
      return new SourceReconciler(this);
    }
  }
}
