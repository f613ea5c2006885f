package org.waabox.sourcevault.source;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.same;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.waabox.sourcevault.ContentException;
import org.waabox.sourcevault.TransportException;
import org.waabox.sourcevault.fetch.FetchOptions;
import org.waabox.sourcevault.fetch.SourceFetcher;
import org.waabox.sourcevault.model.ManagedSource;
import org.waabox.sourcevault.model.ResourceKey;
import org.waabox.sourcevault.model.SourceKind;
import org.waabox.sourcevault.model.SourceSpec;
import org.waabox.sourcevault.storage.Checksums;

/**
 * Tests for {@link HelmRepositoryProvider}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HelmRepositoryProviderTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(30);

  private static final String INDEX = String.join("\n",
      "apiVersion: v1",
      "entries:",
      "  podinfo:",
      "  - version: 6.5.0",
      "    urls:",
      "    - podinfo-6.5.0.tgz",
      "");

  @Test
  void whenFetching_givenValidIndex_shouldNameArtifactByChecksum() {
    final byte[] data = INDEX.getBytes(StandardCharsets.UTF_8);
    final String checksum = Checksums.sha256(data);
    final FetchOptions options = FetchOptions.none();

    final SourceFetcher fetcher = createMock(SourceFetcher.class);
    expect(fetcher.fetch(eq("https://charts.example.com/index.yaml"),
        same(options), eq(TIMEOUT))).andReturn(data);
    replay(fetcher);

    final FetchedSource fetched = new HelmRepositoryProvider(fetcher)
        .fetch(source("https://charts.example.com/"), options, TIMEOUT);

    verify(fetcher);
    assertEquals(checksum, fetched.revision());
    assertEquals(checksum, fetched.checksum());
    assertEquals("index-" + checksum + ".yaml", fetched.fileName());
    assertEquals("helmrepository-latest.yaml", fetched.linkName());
    assertArrayEquals(data, fetched.data());
  }

  @Test
  void whenFetching_givenIndexWithoutEntries_shouldThrowContentException() {
    final SourceFetcher fetcher = createMock(SourceFetcher.class);
    expect(fetcher.fetch(eq("https://charts.example.com/index.yaml"),
        same(FetchOptions.none()), eq(TIMEOUT)))
        .andReturn("apiVersion: v1\nentries: {}\n"
            .getBytes(StandardCharsets.UTF_8));
    replay(fetcher);

    final ContentException error = assertThrows(ContentException.class, () ->
        new HelmRepositoryProvider(fetcher).fetch(
            source("https://charts.example.com"), FetchOptions.none(),
            TIMEOUT));

    verify(fetcher);
    assertEquals("failed to load repository index "
        + "'https://charts.example.com/index.yaml': no chart entries",
        error.getMessage());
  }

  @Test
  void whenFetching_givenTransportFailure_shouldPropagate() {
    final TransportException failure = new TransportException(
        TransportException.Kind.NETWORK, "connection refused");
    final SourceFetcher fetcher = createMock(SourceFetcher.class);
    expect(fetcher.fetch(eq("https://charts.example.com/index.yaml"),
        same(FetchOptions.none()), eq(TIMEOUT))).andThrow(failure);
    replay(fetcher);

    final TransportException error = assertThrows(TransportException.class,
        () -> new HelmRepositoryProvider(fetcher).fetch(
            source("https://charts.example.com"), FetchOptions.none(),
            TIMEOUT));

    verify(fetcher);
    assertEquals(failure, error);
  }

  @Test
  void whenBuildingIndexUrl_givenTrailingSlashes_shouldAppendOnce() {
    assertEquals("https://h/charts/index.yaml",
        HelmRepositoryProvider.indexUrl("https://h/charts//"));
    assertEquals("https://h/index.yaml",
        HelmRepositoryProvider.indexUrl("https://h"));
  }

  private static ManagedSource source(final String url) {
    return ManagedSource.of(
        new ResourceKey(SourceKind.HELM_REPOSITORY, "default", "podinfo"),
        SourceSpec.builder().url(url).interval(Duration.ofMinutes(1))
            .build());
  }
}
