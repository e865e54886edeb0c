package com.gentoro.graphsync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Ordered, immutable list of graph property to {@link Binding} assignments. */
public final class PropertyMap implements Iterable<PropertyMap.PropertyMapping> {
  private static final PropertyMap EMPTY = new PropertyMap(List.of());

  public record PropertyMapping(String property, Binding binding) {
    public PropertyMapping {
      Objects.requireNonNull(property, "property");
      Objects.requireNonNull(binding, "binding");
    }
  }

  private final List<PropertyMapping> entries;

  private PropertyMap(List<PropertyMapping> entries) {
    this.entries = Collections.unmodifiableList(entries);
  }

  public static PropertyMap empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Single-entry map, the common shape of a target matcher. */
  public static PropertyMap of(String property, Binding binding) {
    return builder().put(property, binding).build();
  }

  public static PropertyMap of(String p1, Binding b1, String p2, Binding b2) {
    return builder().put(p1, b1).put(p2, b2).build();
  }

  public List<PropertyMapping> entries() {
    return entries;
  }

  public Optional<Binding> get(String property) {
    for (PropertyMapping entry : entries) {
      if (entry.property().equals(property)) return Optional.of(entry.binding());
    }
    return Optional.empty();
  }

  public boolean contains(String property) {
    return get(property).isPresent();
  }

  public List<String> properties() {
    List<String> names = new ArrayList<>(entries.size());
    for (PropertyMapping entry : entries) names.add(entry.property());
    return names;
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  @Override
  public Iterator<PropertyMapping> iterator() {
    return entries.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PropertyMap other)) return false;
    return entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return "PropertyMap" + entries;
  }

  public static final class Builder {
    private final List<PropertyMapping> entries = new ArrayList<>();

    private Builder() {}

    public Builder put(String property, Binding binding) {
      Objects.requireNonNull(property, "property");
      for (PropertyMapping entry : entries) {
        if (entry.property().equals(property)) {
          throw new IllegalArgumentException("Duplicate property '" + property + "'");
        }
      }
      entries.add(new PropertyMapping(property, binding));
      return this;
    }

    public Builder putAll(PropertyMap other) {
      for (PropertyMapping entry : other) put(entry.property(), entry.binding());
      return this;
    }

    public PropertyMap build() {
      return entries.isEmpty() ? EMPTY : new PropertyMap(new ArrayList<>(entries));
    }
  }
}
