package org.waabox.sourcevault.model;

import java.util.Objects;

/**
 * A resource whose remote content is cached as artifacts.
 *
 * <p>The reconciler reads the spec and writes the status. It never
 * creates or deletes managed sources.
 *
 * @param key    the namespaced identity, never null
 * @param spec   the desired state, never null
 * @param status the observed state, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ManagedSource(
    ResourceKey key,
    SourceSpec spec,
    SourceStatus status
) {

  /** Validates required fields. */
  public ManagedSource {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(spec, "spec must not be null");
    Objects.requireNonNull(status, "status must not be null");
  }

  /**
   * Creates a source that has never been reconciled.
   *
   * @param key  the identity, never null
   * @param spec the desired state, never null
   * @return a new managed source with an empty status, never null
   */
  public static ManagedSource of(final ResourceKey key,
      final SourceSpec spec) {
    return new ManagedSource(key, spec, SourceStatus.empty());
  }

  /**
   * Returns a copy with the given status.
   *
   * @param theStatus the status, never null
   * @return a new managed source, never null
   */
  public ManagedSource withStatus(final SourceStatus theStatus) {
    return new ManagedSource(key, spec, theStatus);
  }
}
