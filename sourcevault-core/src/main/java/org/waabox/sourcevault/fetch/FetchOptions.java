package org.waabox.sourcevault.fetch;

import java.util.Arrays;
import java.util.Objects;

/**
 * Connection options for a source fetcher, resolved from the credentials
 * a resource references.
 *
 * <p>The PEM byte arrays are defensively copied on construction and on
 * access.
 *
 * @param username the basic-auth user, may be null
 * @param password the basic-auth password, may be null
 * @param certPem  the PEM client certificate chain, may be null
 * @param keyPem   the PEM PKCS#8 client key, may be null
 * @param caPem    the PEM certificate authorities to trust, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FetchOptions(
    String username,
    String password,
    byte[] certPem,
    byte[] keyPem,
    byte[] caPem
) {

  /** Options for an anonymous fetch with the default trust store. */
  private static final FetchOptions NONE =
      new FetchOptions(null, null, null, null, null);

  /** Copies the PEM material. */
  public FetchOptions {
    certPem = certPem == null ? null : certPem.clone();
    keyPem = keyPem == null ? null : keyPem.clone();
    caPem = caPem == null ? null : caPem.clone();
  }

  /**
   * Returns options for an anonymous fetch.
   *
   * @return the empty options, never null
   */
  public static FetchOptions none() {
    return NONE;
  }

  /**
   * Returns whether basic-auth credentials are set.
   *
   * @return true if username and password are present
   */
  public boolean hasBasicAuth() {
    return username != null && password != null;
  }

  /**
   * Returns whether a client certificate and key are set.
   *
   * @return true if both are present
   */
  public boolean hasClientCertificate() {
    return certPem != null && keyPem != null;
  }

  /**
   * Returns whether custom certificate authorities are set.
   *
   * @return true if a CA bundle is present
   */
  public boolean hasCertificateAuthority() {
    return caPem != null;
  }

  @Override
  public byte[] certPem() {
    return certPem == null ? null : certPem.clone();
  }

  @Override
  public byte[] keyPem() {
    return keyPem == null ? null : keyPem.clone();
  }

  @Override
  public byte[] caPem() {
    return caPem == null ? null : caPem.clone();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FetchOptions that)) {
      return false;
    }
    return Objects.equals(username, that.username)
        && Objects.equals(password, that.password)
        && Arrays.equals(certPem, that.certPem)
        && Arrays.equals(keyPem, that.keyPem)
        && Arrays.equals(caPem, that.caPem);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(username, password);
    result = 31 * result + Arrays.hashCode(certPem);
    result = 31 * result + Arrays.hashCode(keyPem);
    result = 31 * result + Arrays.hashCode(caPem);
    return result;
  }

  @Override
  public String toString() {
    return "FetchOptions{basicAuth=" + hasBasicAuth()
        + ", clientCertificate=" + hasClientCertificate()
        + ", certificateAuthority=" + hasCertificateAuthority() + "}";
  }
}
