package org.waabox.sourcevault.fetch;

import java.time.Duration;

/**
 * Retrieves remote bytes.
 *
 * <p>Implementations must honor the timeout and report every failure as a
 * {@link org.waabox.sourcevault.TransportException} of the matching kind.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SourceFetcher {

  /**
   * Fetches the content at the given URL.
   *
   * @param url     the URL, never null
   * @param options the connection options, never null
   * @param timeout the maximum time for the whole request, never null
   * @return the content, never null
   *
   * @throws org.waabox.sourcevault.TransportException if the URL is
   *         invalid or unsupported, or the request fails or times out
   */
  byte[] fetch(String url, FetchOptions options, Duration timeout);
}
