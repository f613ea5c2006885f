package org.waabox.sourcevault.metrics;

import java.time.Duration;

import org.waabox.sourcevault.model.ResourceKey;

/**
 * A no-operation implementation of {@link ReconcileMetrics}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopReconcileMetrics implements ReconcileMetrics {

  /** {@inheritDoc} */
  @Override
  public void reconciled(final ResourceKey key, final Duration duration,
      final boolean success) {
  }

  /** {@inheritDoc} */
  @Override
  public void artifactStored(final ResourceKey key, final String revision,
      final long size) {
  }

  /** {@inheritDoc} */
  @Override
  public void garbageCollected(final ResourceKey key, final int files) {
  }

  /** {@inheritDoc} */
  @Override
  public void fetchFailed(final ResourceKey key, final String reason) {
  }
}
