package com.gentoro.graphsync.graph;

import java.util.List;
import java.util.Objects;

/**
 * A lookup index or uniqueness constraint the store should have. A uniqueness constraint is backed
 * by an index of its own and also serializes concurrent {@code MERGE}s on its key.
 *
 * @param kind node index, relationship index or node uniqueness constraint
 * @param label node label or relationship type
 * @param properties indexed properties, in index order
 */
public record IndexDefinition(Kind kind, String label, List<String> properties) {
  public enum Kind {
    NODE,
    RELATIONSHIP,
    UNIQUE
  }

  public IndexDefinition {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(label, "label");
    properties = List.copyOf(properties);
    if (properties.isEmpty()) {
      throw new IllegalArgumentException("An index needs at least one property");
    }
    if (kind == Kind.UNIQUE && properties.size() != 1) {
      throw new IllegalArgumentException("A uniqueness constraint covers exactly one property");
    }
  }

  public static IndexDefinition node(String label, String property) {
    return new IndexDefinition(Kind.NODE, label, List.of(property));
  }

  public static IndexDefinition unique(String label, String property) {
    return new IndexDefinition(Kind.UNIQUE, label, List.of(property));
  }

  public static IndexDefinition relationship(String type, String... properties) {
    return new IndexDefinition(Kind.RELATIONSHIP, type, List.of(properties));
  }
}
