package org.waabox.sourcevault.source;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.sourcevault.ContentException;
import org.waabox.sourcevault.TransportException;
import org.waabox.sourcevault.fetch.FetchOptions;
import org.waabox.sourcevault.fetch.SourceFetcher;
import org.waabox.sourcevault.index.ChartIndex;
import org.waabox.sourcevault.index.ChartIndexCodec;
import org.waabox.sourcevault.index.ChartVersion;
import org.waabox.sourcevault.model.ManagedSource;
import org.waabox.sourcevault.model.SourceKind;
import org.waabox.sourcevault.storage.ArtifactPaths;
import org.waabox.sourcevault.storage.Checksums;

/**
 * Caches one packaged chart pulled from a chart repository.
 *
 * <p>The chart version, the one requested or the latest release, is
 * selected from the repository index. The index is fetched from the chart's
 * own URL or, when the chart references a repository resource, read from
 * that repository's stored artifact, in which case the repository's URL and
 * credentials are used. The package is then downloaded from its first URL.
 * When the index declares a digest the package must match it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HelmChartProvider implements SourceProvider {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(HelmChartProvider.class);

  /** The fetcher, never null. */
  private final SourceFetcher fetcher;

  /** Reads referenced repositories, null when references are unsupported. */
  private final RepositoryIndexReader repositories;

  /**
   * Creates a provider for charts that fetch their index from their URL.
   *
   * @param theFetcher the fetcher, never null
   */
  public HelmChartProvider(final SourceFetcher theFetcher) {
    this(theFetcher, null);
  }

  /**
   * Creates a provider that also serves charts referencing a repository.
   *
   * @param theFetcher      the fetcher, never null
   * @param theRepositories the repository index reader, may be null
   */
  public HelmChartProvider(final SourceFetcher theFetcher,
      final RepositoryIndexReader theRepositories) {
    fetcher = Objects.requireNonNull(theFetcher, "fetcher must not be null");
    repositories = theRepositories;
  }

  /** {@inheritDoc} */
  @Override
  public SourceKind kind() {
    return SourceKind.HELM_CHART;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Charts referencing a repository use the repository's secret.
   */
  @Override
  public Optional<String> secretRef(final ManagedSource source) {
    Objects.requireNonNull(source, "source must not be null");
    if (source.spec().repositoryRef().isEmpty()) {
      return source.spec().secretRef();
    }
    return repositories().repository(source).spec().secretRef();
  }

  /** {@inheritDoc} */
  @Override
  public FetchedSource fetch(final ManagedSource source,
      final FetchOptions options, final Duration timeout) {
    Objects.requireNonNull(source, "source must not be null");

    final String chart = source.spec().chart().orElseThrow(() ->
        new ContentException("no chart name set for '" + source.key() + "'"));
    final String version = source.spec().version().orElse(null);

    final String repositoryUrl;
    final String repositoryName;
    final byte[] indexData;
    if (source.spec().repositoryRef().isPresent()) {
      final ManagedSource repository = repositories().repository(source);
      repositoryUrl = repository.spec().url();
      repositoryName = repository.key().name();
      if (repositoryUrl == null) {
        throw new ContentException("HelmRepository '" + repositoryName
            + "' has no URL");
      }
      indexData = repositories().index(repository);
    } else {
      repositoryUrl = source.spec().url();
      repositoryName = repositoryUrl;
      indexData = fetcher.fetch(HelmRepositoryProvider.indexUrl(repositoryUrl),
          options, timeout);
    }

    final ChartIndex index = ChartIndexCodec.parse(indexData);
    final ChartVersion entry = index.get(chart, version, repositoryName);

    if (entry.urls().isEmpty()) {
      throw new ContentException("chart '" + chart
          + "' has no downloadable URLs");
    }
    final String packageUrl = resolve(repositoryUrl, entry.urls().get(0));
    final byte[] data = fetcher.fetch(packageUrl, options, timeout);
    final String checksum = Checksums.sha256(data);

    final Optional<String> declared = entry.declaredDigest();
    if (declared.isPresent()
        && !declared.get().toLowerCase(Locale.ROOT).equals(checksum)) {
      throw new ContentException("chart '" + chart + "' version '"
          + entry.version() + "' digest mismatch: index declares "
          + declared.get() + ", downloaded " + checksum);
    }

    final String fileName = chart + "-" + entry.version() + "-" + checksum
        + ".tgz";
    if (!ArtifactPaths.isSegment(fileName)) {
      throw new ContentException("chart '" + chart + "' version '"
          + entry.version() + "' is not usable as a file name");
    }

    log.debug("Fetched chart '{}' version {} for '{}' from {}", chart,
        entry.version(), source.key(), packageUrl);
    return new FetchedSource(entry.version(), fileName,
        SourceKind.HELM_CHART.latestLinkName(), data, checksum);
  }

  /** Returns the repository reader.
   *
   * @return the reader, never null.
   *
   * @throws ContentException if this provider has none.
   */
  private RepositoryIndexReader repositories() {
    if (repositories == null) {
      throw new ContentException(
          "HelmRepository references are not supported by this provider");
    }
    return repositories;
  }

  /**
   * Resolves a download URL against the repository URL.
   *
   * @param repositoryUrl the repository URL, never null
   * @param url           the absolute or relative package URL, never null
   * @return the absolute URL, never null
   *
   * @throws TransportException if either URL cannot be parsed
   */
  static String resolve(final String repositoryUrl, final String url) {
    try {
      final URI target = new URI(url);
      if (target.isAbsolute()) {
        return target.toString();
      }
      final String base = repositoryUrl.endsWith("/")
          ? repositoryUrl : repositoryUrl + "/";
      return new URI(base).resolve(target).toString();
    } catch (final URISyntaxException e) {
      throw new TransportException(TransportException.Kind.INVALID_URL,
          "invalid chart URL '" + url + "': " + e.getMessage(), e);
    }
  }
}
