package org.waabox.sourcevault.spring;

import org.waabox.sourcevault.store.InMemoryResourceStore;

/**
 * A callback interface for declaring managed sources during Spring Boot
 * auto-configuration.
 *
 * <p>Implement this interface as a Spring bean to declare one or more
 * sources. All discovered {@code SourceRegistrar} beans are invoked when the
 * default {@link InMemoryResourceStore} is created, before the reconcile
 * loop starts. Applications that provide their own
 * {@link org.waabox.sourcevault.store.ResourceStore} declare sources there
 * instead.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Bean
 * SourceRegistrar podinfoRegistrar() {
 *     return store -> store.put(
 *         new ResourceKey(SourceKind.HELM_REPOSITORY, "default", "podinfo"),
 *         SourceSpec.builder()
 *             .url("https://stefanprodan.github.io/podinfo")
 *             .interval(Duration.ofMinutes(5))
 *             .build());
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface SourceRegistrar {

  /**
   * Declares sources in the given store.
   *
   * @param store the store to declare sources in, never null
   */
  void register(InMemoryResourceStore store);
}
