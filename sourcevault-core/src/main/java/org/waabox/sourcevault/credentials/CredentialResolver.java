package org.waabox.sourcevault.credentials;

import org.waabox.sourcevault.CredentialException;
import org.waabox.sourcevault.fetch.FetchOptions;

/**
 * Turns a secret reference into fetch options.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface CredentialResolver {

  /**
   * Resolves the named secret in the given namespace.
   *
   * @param namespace  the namespace of the referencing resource, never null
   * @param secretName the secret name, never null
   * @return the fetch options, never null
   *
   * @throws CredentialException if the secret is missing or malformed
   * @throws org.waabox.sourcevault.TransportException with kind
   *         {@code TLS} if the secret holds unusable certificates
   */
  FetchOptions resolve(String namespace, String secretName);

  /**
   * Returns a resolver for deployments without a secret backend.
   *
   * <p>Every reference is reported as not found.
   *
   * @return the resolver, never null
   */
  static CredentialResolver unavailable() {
    return (namespace, secretName) -> {
      throw new CredentialException(CredentialException.Kind.NOT_FOUND,
          "secret '" + namespace + "/" + secretName
              + "' not found: no credential backend configured");
    };
  }
}
