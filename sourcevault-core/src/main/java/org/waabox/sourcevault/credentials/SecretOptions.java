package org.waabox.sourcevault.credentials;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

import org.waabox.sourcevault.CredentialException;
import org.waabox.sourcevault.TransportException;
import org.waabox.sourcevault.fetch.FetchOptions;

/**
 * Converts the data of a credential secret into {@link FetchOptions}.
 *
 * <p>Recognised keys:
 * <ul>
 *   <li>{@code username} and {@code password}: basic auth, both or
 *       neither</li>
 *   <li>{@code certFile} and {@code keyFile}: PEM client certificate and
 *       PKCS#8 key, both or neither</li>
 *   <li>{@code caFile}: PEM certificate authorities to trust</li>
 * </ul>
 *
 * <p>Certificates are parsed here so invalid material is reported before
 * any network call. An incomplete pair is a credential problem, while
 * certificates that do not parse are a TLS problem, like a failed
 * handshake.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SecretOptions {

  public static final String USERNAME = "username";

  public static final String PASSWORD = "password";

  public static final String CERT_FILE = "certFile";

  public static final String KEY_FILE = "keyFile";

  public static final String CA_FILE = "caFile";

  private SecretOptions() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Builds fetch options from secret data.
   *
   * @param secretName the secret name, used in messages, never null
   * @param data       the secret data, never null
   * @return the fetch options, never null
   *
   * @throws CredentialException with kind {@code MALFORMED} if a pair is
   *         incomplete
   * @throws TransportException with kind {@code TLS} if a certificate does
   *         not parse
   */
  public static FetchOptions fromSecretData(final String secretName,
      final Map<String, byte[]> data) {
    Objects.requireNonNull(secretName, "secretName must not be null");
    Objects.requireNonNull(data, "data must not be null");

    final String username = text(data.get(USERNAME));
    final String password = text(data.get(PASSWORD));
    if ((username == null) != (password == null)) {
      throw malformed(secretName,
          "required fields 'username' and 'password'");
    }

    final byte[] cert = bytes(data.get(CERT_FILE));
    final byte[] key = bytes(data.get(KEY_FILE));
    if ((cert == null) != (key == null)) {
      throw malformed(secretName,
          "fields 'certFile' and 'keyFile' require each other's presence");
    }

    final byte[] ca = bytes(data.get(CA_FILE));
    try {
      if (cert != null) {
        PemCertificates.parse(cert);
      }
      if (ca != null) {
        PemCertificates.parse(ca);
      }
    } catch (final IllegalArgumentException e) {
      throw new TransportException(TransportException.Kind.TLS,
          "can't create TLS config for client: " + e.getMessage(), e);
    }

    return new FetchOptions(username, password, cert, key, ca);
  }

  /** Creates a malformed-secret exception.
   *
   * @param secretName the secret.
   * @param detail what is wrong.
   * @return the exception, never null.
   */
  private static CredentialException malformed(final String secretName,
      final String detail) {
    return new CredentialException(CredentialException.Kind.MALFORMED,
        "invalid '" + secretName + "' secret data: " + detail);
  }

  /** Returns the value as UTF-8 text, null when missing or empty.
   *
   * @param value the raw value.
   * @return the text or null.
   */
  private static String text(final byte[] value) {
    return value == null || value.length == 0
        ? null : new String(value, StandardCharsets.UTF_8);
  }

  /** Returns the value, null when missing or empty.
   *
   * @param value the raw value.
   * @return the bytes or null.
   */
  private static byte[] bytes(final byte[] value) {
    return value == null || value.length == 0 ? null : value;
  }
}
