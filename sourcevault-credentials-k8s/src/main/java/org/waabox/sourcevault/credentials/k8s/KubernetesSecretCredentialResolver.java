package org.waabox.sourcevault.credentials.k8s;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.sourcevault.CredentialException;
import org.waabox.sourcevault.SourceVaultException;
import org.waabox.sourcevault.credentials.CredentialResolver;
import org.waabox.sourcevault.credentials.SecretOptions;
import org.waabox.sourcevault.fetch.FetchOptions;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.util.Config;

/**
 * A {@link CredentialResolver} reading Kubernetes secrets.
 *
 * <p>The secret is read from the namespace of the referencing resource and
 * its data is turned into fetch options by
 * {@link SecretOptions#fromSecretData(String, Map)}.
 *
 * <p>Usage example:
 * <pre>{@code
 * CredentialResolver resolver =
 *     KubernetesSecretCredentialResolver.fromDefaultClient();
 * FetchOptions options = resolver.resolve("flux-system", "repo-auth");
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KubernetesSecretCredentialResolver
    implements CredentialResolver {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(KubernetesSecretCredentialResolver.class);

  /** The HTTP status of a missing object. */
  private static final int NOT_FOUND = 404;

  /** Reads secret data, never null. */
  private final SecretReader reader;

  /**
   * Creates a resolver on the given API client.
   *
   * @param apiClient the Kubernetes API client, never null
   */
  public KubernetesSecretCredentialResolver(final ApiClient apiClient) {
    this(apiReader(Objects.requireNonNull(apiClient,
        "apiClient must not be null")));
  }

  /**
   * Creates a resolver on the given reader.
   *
   * @param theReader the reader, never null
   */
  KubernetesSecretCredentialResolver(final SecretReader theReader) {
    reader = Objects.requireNonNull(theReader, "reader must not be null");
  }

  /**
   * Creates a resolver on the default client, from the in-cluster service
   * account or the local kubeconfig.
   *
   * @return the resolver, never null
   *
   * @throws SourceVaultException if no client configuration is found
   */
  public static KubernetesSecretCredentialResolver fromDefaultClient() {
    try {
      return new KubernetesSecretCredentialResolver(Config.defaultClient());
    } catch (final IOException e) {
      throw new SourceVaultException(
          "Failed to create Kubernetes API client", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public FetchOptions resolve(final String namespace,
      final String secretName) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(secretName, "secretName must not be null");

    final Map<String, byte[]> data;
    try {
      data = reader.read(namespace, secretName);
    } catch (final ApiException e) {
      if (e.getCode() == NOT_FOUND) {
        throw new CredentialException(CredentialException.Kind.NOT_FOUND,
            "secrets \"" + secretName + "\" not found", e);
      }
      log.warn("Failed to read secret '{}/{}': HTTP {} {}", namespace,
          secretName, e.getCode(), e.getMessage());
      throw new CredentialException(CredentialException.Kind.NOT_FOUND,
          "failed to get secret '" + namespace + "/" + secretName + "': "
              + e.getMessage(), e);
    }
    log.debug("Read secret '{}/{}'", namespace, secretName);
    return SecretOptions.fromSecretData(secretName,
        data == null ? Map.of() : data);
  }

  /** Creates a reader over the core API.
   *
   * @param apiClient the client.
   * @return the reader, never null.
   */
  private static SecretReader apiReader(final ApiClient apiClient) {
    final CoreV1Api api = new CoreV1Api(apiClient);
    return (namespace, name) -> {
      final V1Secret secret = api.readNamespacedSecret(name, namespace)
          .execute();
      return secret.getData();
    };
  }

  /** Reads the data of one secret. */
  @FunctionalInterface
  interface SecretReader {

    /**
     * Reads a secret.
     *
     * @param namespace the namespace, never null
     * @param name      the secret name, never null
     * @return the secret data, may be null when the secret has none
     *
     * @throws ApiException if the API call fails
     */
    Map<String, byte[]> read(String namespace, String name)
        throws ApiException;
  }
}
