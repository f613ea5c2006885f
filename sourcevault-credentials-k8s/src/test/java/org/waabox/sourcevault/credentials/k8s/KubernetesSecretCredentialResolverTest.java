package org.waabox.sourcevault.credentials.k8s;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.waabox.sourcevault.CredentialException;
import org.waabox.sourcevault.fetch.FetchOptions;

import io.kubernetes.client.openapi.ApiException;

/**
 * Tests for {@link KubernetesSecretCredentialResolver}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class KubernetesSecretCredentialResolverTest {

  @Test
  void whenResolving_givenBasicAuthSecret_shouldReturnOptions() {
    final AtomicReference<String> requested = new AtomicReference<>();
    final KubernetesSecretCredentialResolver resolver =
        new KubernetesSecretCredentialResolver((namespace, name) -> {
          requested.set(namespace + "/" + name);
          return Map.of(
              "username", utf8("admin"),
              "password", utf8("s3cr3t"));
        });

    final FetchOptions options = resolver.resolve("flux-system", "auth");

    assertEquals("flux-system/auth", requested.get());
    assertTrue(options.hasBasicAuth());
    assertEquals("admin", options.username());
    assertEquals("s3cr3t", options.password());
  }

  @Test
  void whenResolving_givenMissingSecret_shouldThrowNotFound() {
    final KubernetesSecretCredentialResolver resolver =
        new KubernetesSecretCredentialResolver((namespace, name) -> {
          throw new ApiException(404, "Not Found");
        });

    final CredentialException error = assertThrows(CredentialException.class,
        () -> resolver.resolve("default", "auth"));

    assertEquals(CredentialException.Kind.NOT_FOUND, error.kind());
    assertEquals("secrets \"auth\" not found", error.getMessage());
    assertInstanceOf(ApiException.class, error.getCause());
  }

  @Test
  void whenResolving_givenApiFailure_shouldThrowWithSecretName() {
    final KubernetesSecretCredentialResolver resolver =
        new KubernetesSecretCredentialResolver((namespace, name) -> {
          throw new ApiException(403, "Forbidden");
        });

    final CredentialException error = assertThrows(CredentialException.class,
        () -> resolver.resolve("default", "auth"));

    assertTrue(error.getMessage().startsWith(
        "failed to get secret 'default/auth'"));
  }

  @Test
  void whenResolving_givenSecretWithoutData_shouldReturnNoOptions() {
    final KubernetesSecretCredentialResolver resolver =
        new KubernetesSecretCredentialResolver((namespace, name) -> null);

    final FetchOptions options = resolver.resolve("default", "empty");

    assertFalse(options.hasBasicAuth());
    assertFalse(options.hasClientCertificate());
    assertFalse(options.hasCertificateAuthority());
  }

  @Test
  void whenResolving_givenPasswordWithoutUsername_shouldThrowMalformed() {
    final Map<String, byte[]> data = new HashMap<>();
    data.put("password", utf8("s3cr3t"));
    final KubernetesSecretCredentialResolver resolver =
        new KubernetesSecretCredentialResolver((namespace, name) -> data);

    final CredentialException error = assertThrows(CredentialException.class,
        () -> resolver.resolve("default", "auth"));

    assertEquals(CredentialException.Kind.MALFORMED, error.kind());
  }

  private static byte[] utf8(final String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
