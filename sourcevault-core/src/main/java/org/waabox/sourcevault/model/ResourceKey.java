package org.waabox.sourcevault.model;

import java.util.Objects;

/**
 * The namespaced identity of a managed source.
 *
 * @param kind      the source kind, never null
 * @param namespace the namespace, never null
 * @param name      the name, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ResourceKey(SourceKind kind, String namespace, String name) {

  /** Validates required fields. */
  public ResourceKey {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(name, "name must not be null");
    if (namespace.isBlank() || name.isBlank()) {
      throw new IllegalArgumentException(
          "namespace and name must not be blank");
    }
  }

  @Override
  public String toString() {
    return kind.kindName() + "/" + namespace + "/" + name;
  }
}
