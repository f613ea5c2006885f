package org.waabox.sourcevault.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.waabox.sourcevault.model.ManagedSource;
import org.waabox.sourcevault.model.ResourceKey;
import org.waabox.sourcevault.model.SourceSpec;
import org.waabox.sourcevault.model.SourceStatus;

/**
 * A {@link ResourceStore} backed by a concurrent map.
 *
 * <p>Suited to embedded deployments where the application declares its
 * sources in code, and to tests.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryResourceStore implements ResourceStore {

  /** The resources by key. */
  private final Map<ResourceKey, ManagedSource> resources =
      new ConcurrentHashMap<>();

  /**
   * Adds or replaces the spec of a resource, keeping its status.
   *
   * @param key  the resource key, never null
   * @param spec the desired state, never null
   * @return the stored resource, never null
   */
  public ManagedSource put(final ResourceKey key, final SourceSpec spec) {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(spec, "spec must not be null");
    return resources.compute(key, (k, existing) -> existing == null
        ? ManagedSource.of(k, spec)
        : new ManagedSource(k, spec, existing.status()));
  }

  /**
   * Removes a resource.
   *
   * @param key the resource key, never null
   * @return whether the resource existed
   */
  public boolean remove(final ResourceKey key) {
    Objects.requireNonNull(key, "key must not be null");
    return resources.remove(key) != null;
  }

  /** {@inheritDoc} */
  @Override
  public Optional<ManagedSource> get(final ResourceKey key) {
    Objects.requireNonNull(key, "key must not be null");
    return Optional.ofNullable(resources.get(key));
  }

  /** {@inheritDoc} */
  @Override
  public void updateStatus(final ResourceKey key, final SourceStatus status) {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(status, "status must not be null");
    final ManagedSource updated = resources.computeIfPresent(key,
        (k, existing) -> existing.withStatus(status));
    if (updated == null) {
      throw new IllegalStateException("Resource '" + key + "' not found");
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<ResourceKey> list() {
    return new ArrayList<>(resources.keySet());
  }
}
