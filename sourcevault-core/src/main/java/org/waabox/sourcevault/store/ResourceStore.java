package org.waabox.sourcevault.store;

import java.util.List;
import java.util.Optional;

import org.waabox.sourcevault.model.ManagedSource;
import org.waabox.sourcevault.model.ResourceKey;
import org.waabox.sourcevault.model.SourceStatus;

/**
 * Access to the managed resources, reading spec and writing status.
 *
 * <p>Resources are created and deleted by the owner of the store, never by
 * the reconciler.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ResourceStore {

  /**
   * Looks up a resource.
   *
   * @param key the resource key, never null
   * @return the resource, or empty if it does not exist
   */
  Optional<ManagedSource> get(ResourceKey key);

  /**
   * Replaces the whole status of a resource.
   *
   * @param key    the resource key, never null
   * @param status the new status, never null
   *
   * @throws IllegalStateException if the resource no longer exists
   */
  void updateStatus(ResourceKey key, SourceStatus status);

  /**
   * Lists the keys of every resource.
   *
   * @return a snapshot of the keys, never null
   */
  List<ResourceKey> list();
}
