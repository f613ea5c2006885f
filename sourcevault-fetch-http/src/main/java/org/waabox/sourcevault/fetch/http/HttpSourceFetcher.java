package org.waabox.sourcevault.fetch.http;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;

import javax.net.ssl.SSLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.sourcevault.TransportException;
import org.waabox.sourcevault.fetch.FetchOptions;
import org.waabox.sourcevault.fetch.SourceFetcher;

/**
 * A {@link SourceFetcher} over {@code java.net.http.HttpClient}.
 *
 * <p>Only {@code http} and {@code https} URLs are accepted. Basic
 * authentication is sent preemptively. Options carrying PEM material get a
 * dedicated client with their own TLS context; every other fetch shares one
 * client.
 *
 * <p>Usage example:
 * <pre>{@code
 * SourceFetcher fetcher = new HttpSourceFetcher(HttpFetcherConfig.create());
 * byte[] index = fetcher.fetch("https://charts.example.com/index.yaml",
 *     FetchOptions.none(), Duration.ofSeconds(30));
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpSourceFetcher implements SourceFetcher {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(HttpSourceFetcher.class);

  /** The configuration, never null. */
  private final HttpFetcherConfig config;

  /** The client for fetches without TLS material, never null. */
  private final HttpClient sharedClient;

  /**
   * Creates a new fetcher.
   *
   * @param theConfig the configuration, never null
   */
  public HttpSourceFetcher(final HttpFetcherConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    sharedClient = clientBuilder().build();
  }

  /** {@inheritDoc} */
  @Override
  public byte[] fetch(final String url, final FetchOptions options,
      final Duration timeout) {
    Objects.requireNonNull(url, "url must not be null");
    Objects.requireNonNull(options, "options must not be null");
    Objects.requireNonNull(timeout, "timeout must not be null");

    final URI uri = parse(url);
    final HttpRequest.Builder request = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("User-Agent", config.userAgent())
        .GET();
    if (options.hasBasicAuth()) {
      final String token = options.username() + ":" + options.password();
      request.header("Authorization", "Basic " + Base64.getEncoder()
          .encodeToString(token.getBytes(StandardCharsets.UTF_8)));
    }

    final HttpResponse<byte[]> response;
    try {
      response = client(options).send(request.build(),
          HttpResponse.BodyHandlers.ofByteArray());
    } catch (final HttpTimeoutException e) {
      throw new TransportException(TransportException.Kind.NETWORK,
          "timeout after " + timeout + " fetching " + url, e);
    } catch (final IOException e) {
      if (isTls(e)) {
        throw new TransportException(TransportException.Kind.TLS,
            "TLS handshake with " + uri.getHost() + " failed: "
                + e.getMessage(), e);
      }
      throw new TransportException(TransportException.Kind.NETWORK,
          "failed to fetch " + url + ": " + e.getMessage(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException(TransportException.Kind.NETWORK,
          "interrupted while fetching " + url, e);
    }

    final int status = response.statusCode();
    if (status < 200 || status > 299) {
      throw new TransportException(TransportException.Kind.NETWORK,
          "failed to fetch " + url + ", status code: " + status);
    }
    log.debug("Fetched {} bytes from {}", response.body().length, url);
    return response.body();
  }

  /**
   * Parses and validates a URL.
   *
   * @param url the URL, never null
   * @return the URI, never null
   *
   * @throws TransportException of kind INVALID_URL or UNSUPPORTED_SCHEME
   */
  static URI parse(final String url) {
    final URI uri;
    try {
      uri = new URI(url);
    } catch (final URISyntaxException e) {
      throw new TransportException(TransportException.Kind.INVALID_URL,
          "invalid URL '" + url + "': " + e.getMessage(), e);
    }
    if (uri.getScheme() == null) {
      throw new TransportException(TransportException.Kind.INVALID_URL,
          "invalid URL '" + url + "': missing scheme");
    }
    final String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new TransportException(
          TransportException.Kind.UNSUPPORTED_SCHEME,
          "scheme \"" + uri.getScheme() + "\" not supported");
    }
    if (uri.getHost() == null || uri.getHost().isEmpty()) {
      throw new TransportException(TransportException.Kind.INVALID_URL,
          "invalid URL '" + url + "': missing host");
    }
    return uri;
  }

  /**
   * Returns the client for the given options.
   *
   * @param options the options, never null
   * @return the client, never null
   */
  private HttpClient client(final FetchOptions options) {
    if (!options.hasCertificateAuthority()
        && !options.hasClientCertificate()) {
      return sharedClient;
    }
    return clientBuilder().sslContext(TlsContextFactory.create(options))
        .build();
  }

  /** Creates a client builder from the configuration.
   *
   * @return the builder.
   */
  private HttpClient.Builder clientBuilder() {
    return HttpClient.newBuilder()
        .connectTimeout(config.connectTimeout())
        .followRedirects(config.followRedirects()
            ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER);
  }

  /** Whether a failure was caused by TLS.
   *
   * @param e the failure.
   * @return true for TLS failures.
   */
  private static boolean isTls(final Throwable e) {
    Throwable current = e;
    while (current != null) {
      if (current instanceof SSLException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
