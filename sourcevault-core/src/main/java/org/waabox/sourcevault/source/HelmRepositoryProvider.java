package org.waabox.sourcevault.source;

import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.sourcevault.ContentException;
import org.waabox.sourcevault.fetch.FetchOptions;
import org.waabox.sourcevault.fetch.SourceFetcher;
import org.waabox.sourcevault.index.ChartIndex;
import org.waabox.sourcevault.index.ChartIndexCodec;
import org.waabox.sourcevault.model.ManagedSource;
import org.waabox.sourcevault.model.SourceKind;
import org.waabox.sourcevault.storage.Checksums;

/**
 * Caches the {@code index.yaml} of a chart repository.
 *
 * <p>The revision of an index is its checksum, so every content change
 * produces a new artifact file {@code index-<checksum>.yaml}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HelmRepositoryProvider implements SourceProvider {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(HelmRepositoryProvider.class);

  /** The fetcher, never null. */
  private final SourceFetcher fetcher;

  /**
   * Creates a new provider.
   *
   * @param theFetcher the fetcher, never null
   */
  public HelmRepositoryProvider(final SourceFetcher theFetcher) {
    fetcher = Objects.requireNonNull(theFetcher, "fetcher must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public SourceKind kind() {
    return SourceKind.HELM_REPOSITORY;
  }

  /** {@inheritDoc} */
  @Override
  public FetchedSource fetch(final ManagedSource source,
      final FetchOptions options, final Duration timeout) {
    Objects.requireNonNull(source, "source must not be null");

    final String url = source.spec().url();
    if (url == null) {
      throw new ContentException("no URL set for '" + source.key() + "'");
    }
    final String indexUrl = indexUrl(url);
    final byte[] data = fetcher.fetch(indexUrl, options, timeout);

    final ChartIndex index = ChartIndexCodec.parse(data);
    if (index.isEmpty()) {
      throw new ContentException("failed to load repository index '"
          + indexUrl + "': no chart entries");
    }

    final String checksum = Checksums.sha256(data);
    log.debug("Fetched index of '{}' with {} charts, checksum {}",
        source.key(), index.entries().size(), checksum);
    return new FetchedSource(checksum, "index-" + checksum + ".yaml",
        SourceKind.HELM_REPOSITORY.latestLinkName(), data, checksum);
  }

  /**
   * Returns the index location of a repository.
   *
   * @param repositoryUrl the repository URL, never null
   * @return the index URL, never null
   */
  static String indexUrl(final String repositoryUrl) {
    String base = repositoryUrl;
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return base + "/index.yaml";
  }
}
