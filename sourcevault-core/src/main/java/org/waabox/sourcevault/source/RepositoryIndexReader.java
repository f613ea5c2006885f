package org.waabox.sourcevault.source;

import java.util.Objects;

import org.waabox.sourcevault.ContentException;
import org.waabox.sourcevault.model.Artifact;
import org.waabox.sourcevault.model.ManagedSource;
import org.waabox.sourcevault.model.ResourceKey;
import org.waabox.sourcevault.model.SourceKind;
import org.waabox.sourcevault.storage.ArtifactStorage;
import org.waabox.sourcevault.store.ResourceStore;

/**
 * Reads the index a chart repository resource has already stored.
 *
 * <p>Charts with a repository reference select their version from this
 * index instead of fetching one, and connect with the repository's
 * credentials.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RepositoryIndexReader {

  /** The store holding the repository resources, never null. */
  private final ResourceStore store;

  /** The storage holding the repository artifacts, never null. */
  private final ArtifactStorage storage;

  /**
   * Creates a new reader.
   *
   * @param theStore   the resource store, never null
   * @param theStorage the artifact storage, never null
   */
  public RepositoryIndexReader(final ResourceStore theStore,
      final ArtifactStorage theStorage) {
    store = Objects.requireNonNull(theStore, "store must not be null");
    storage = Objects.requireNonNull(theStorage, "storage must not be null");
  }

  /**
   * Looks up the repository a chart refers to.
   *
   * <p>The repository lives in the chart's namespace and must have a
   * current artifact.
   *
   * @param chart the chart resource, never null
   * @return the repository resource, never null
   *
   * @throws ContentException if the chart has no reference, or the
   *         repository does not exist or has no index artifact yet
   */
  public ManagedSource repository(final ManagedSource chart) {
    Objects.requireNonNull(chart, "chart must not be null");
    final String name = chart.spec().repositoryRef().orElseThrow(() ->
        new ContentException("no HelmRepository reference given"));
    final ResourceKey key = new ResourceKey(SourceKind.HELM_REPOSITORY,
        chart.key().namespace(), name);

    final ManagedSource repository = store.get(key).orElseThrow(() ->
        new ContentException("failed to get HelmRepository '"
            + key.namespace() + "/" + name + "': not found"));
    if (repository.status().artifact() == null) {
      throw new ContentException(
          "no repository index artifact found in HelmRepository '" + name
              + "'");
    }
    return repository;
  }

  /**
   * Reads the stored index of a repository.
   *
   * @param repository the repository, as returned by
   *                   {@link #repository(ManagedSource)}, never null
   * @return the raw index, never null
   *
   * @throws org.waabox.sourcevault.StorageIOException if the index file
   *         cannot be read
   */
  public byte[] index(final ManagedSource repository) {
    Objects.requireNonNull(repository, "repository must not be null");
    final Artifact artifact = repository.status().artifact();
    if (artifact == null) {
      throw new ContentException(
          "no repository index artifact found in HelmRepository '"
              + repository.key().name() + "'");
    }
    return storage.read(artifact);
  }
}
