package org.waabox.sourcevault.fetch.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration holder for the HTTP source fetcher.
 *
 * <p>Holds the connect timeout, the redirect policy and the user agent sent
 * with every request. Request timeouts are per fetch and not part of the
 * configuration.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpFetcherConfig {

  /** The default connect timeout. */
  private static final Duration DEFAULT_CONNECT_TIMEOUT =
      Duration.ofSeconds(10);

  /** The default user agent. */
  private static final String DEFAULT_USER_AGENT = "sourcevault";

  /** The connect timeout. */
  private final Duration connectTimeout;

  /** Whether redirects are followed. */
  private final boolean followRedirects;

  /** The user agent header value. */
  private final String userAgent;

  /** Private constructor; use the static factory methods instead. */
  private HttpFetcherConfig(final Duration theConnectTimeout,
      final boolean theFollowRedirects, final String theUserAgent) {
    connectTimeout = theConnectTimeout;
    followRedirects = theFollowRedirects;
    userAgent = theUserAgent;
  }

  /**
   * Creates a configuration with a 10 second connect timeout, following
   * redirects, and the user agent {@value #DEFAULT_USER_AGENT}.
   *
   * @return a new {@link HttpFetcherConfig} instance, never null
   */
  public static HttpFetcherConfig create() {
    return new HttpFetcherConfig(DEFAULT_CONNECT_TIMEOUT, true,
        DEFAULT_USER_AGENT);
  }

  /**
   * Creates a configuration with the given values.
   *
   * @param connectTimeout  the connect timeout, never null, positive
   * @param followRedirects whether redirects are followed
   * @param userAgent       the user agent, never null
   * @return a new {@link HttpFetcherConfig} instance, never null
   */
  public static HttpFetcherConfig create(final Duration connectTimeout,
      final boolean followRedirects, final String userAgent) {
    Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
    Objects.requireNonNull(userAgent, "userAgent must not be null");
    if (connectTimeout.isZero() || connectTimeout.isNegative()) {
      throw new IllegalArgumentException(
          "connectTimeout must be positive, got: " + connectTimeout);
    }
    return new HttpFetcherConfig(connectTimeout, followRedirects, userAgent);
  }

  /**
   * Returns the connect timeout.
   *
   * @return the timeout, never null
   */
  public Duration connectTimeout() {
    return connectTimeout;
  }

  /**
   * Returns whether redirects are followed.
   *
   * @return true to follow redirects, except https to http
   */
  public boolean followRedirects() {
    return followRedirects;
  }

  /**
   * Returns the user agent.
   *
   * @return the user agent, never null
   */
  public String userAgent() {
    return userAgent;
  }
}
