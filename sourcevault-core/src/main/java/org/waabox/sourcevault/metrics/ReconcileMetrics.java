package org.waabox.sourcevault.metrics;

import java.time.Duration;

import org.waabox.sourcevault.model.ResourceKey;

/**
 * An abstraction for recording operational metrics of reconciliation.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopReconcileMetrics} when metrics
 * collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ReconcileMetrics {

  /**
   * Records a finished reconciliation pass.
   *
   * @param key      the resource, never null
   * @param duration the pass duration, never null
   * @param success  whether the pass ended without an error
   */
  void reconciled(ResourceKey key, Duration duration, boolean success);

  /**
   * Records a newly persisted artifact.
   *
   * @param key      the resource, never null
   * @param revision the stored revision, never null
   * @param size     the artifact size in bytes
   */
  void artifactStored(ResourceKey key, String revision, long size);

  /**
   * Records superseded files removed by garbage collection.
   *
   * @param key   the resource, never null
   * @param files the number of files removed
   */
  void garbageCollected(ResourceKey key, int files);

  /**
   * Records a failed fetch or persistence step.
   *
   * @param key    the resource, never null
   * @param reason the condition reason, never null
   */
  void fetchFailed(ResourceKey key, String reason);
}
