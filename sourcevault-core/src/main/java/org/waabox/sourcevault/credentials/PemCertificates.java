package org.waabox.sourcevault.credentials;

import java.io.ByteArrayInputStream;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Parses PEM encoded X.509 certificate bundles.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PemCertificates {

  private PemCertificates() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Parses every certificate in the given PEM bundle.
   *
   * @param pem the PEM bytes, never null
   * @return the certificates, in bundle order, never empty
   *
   * @throws IllegalArgumentException if the bundle holds no parseable
   *         certificate
   */
  public static List<X509Certificate> parse(final byte[] pem) {
    Objects.requireNonNull(pem, "pem must not be null");
    final Collection<? extends Certificate> parsed;
    try {
      parsed = CertificateFactory.getInstance("X.509")
          .generateCertificates(new ByteArrayInputStream(pem));
    } catch (final CertificateException e) {
      throw new IllegalArgumentException(
          "failed to append certificates from file", e);
    }
    final List<X509Certificate> result = new ArrayList<>(parsed.size());
    for (final Certificate certificate : parsed) {
      if (certificate instanceof X509Certificate x509) {
        result.add(x509);
      }
    }
    if (result.isEmpty()) {
      throw new IllegalArgumentException(
          "failed to append certificates from file");
    }
    return result;
  }
}
