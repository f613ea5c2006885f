package org.waabox.sourcevault.source;

import java.time.Duration;
import java.util.Optional;

import org.waabox.sourcevault.fetch.FetchOptions;
import org.waabox.sourcevault.model.ManagedSource;
import org.waabox.sourcevault.model.SourceKind;

/**
 * Produces the candidate artifact content of one kind of source.
 *
 * <p>Providers read from the remote side, or from artifacts other
 * resources have stored. They never write storage or status.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SourceProvider {

  /**
   * Returns the kind this provider serves.
   *
   * @return the kind, never null
   */
  SourceKind kind();

  /**
   * Returns the secret holding the credentials to fetch the source with.
   *
   * @param source the managed resource, never null
   * @return the secret name, or empty to connect anonymously
   *
   * @throws org.waabox.sourcevault.ContentException if a resource the source
   *         depends on is not usable
   */
  default Optional<String> secretRef(final ManagedSource source) {
    return source.spec().secretRef();
  }

  /**
   * Fetches and validates the content the source currently points at.
   *
   * @param source  the managed resource, never null
   * @param options the resolved connection options, never null
   * @param timeout the fetch timeout, never null
   * @return the candidate content, never null
   *
   * @throws org.waabox.sourcevault.TransportException if the remote side
   *         cannot be reached
   * @throws org.waabox.sourcevault.ContentException if the content is not
   *         usable
   */
  FetchedSource fetch(ManagedSource source, FetchOptions options,
      Duration timeout);
}
