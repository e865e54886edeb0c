package com.gentoro.graphsync.model;

import java.util.Objects;

/**
 * The tenant a load or cleanup call is confined to, e.g. {@code Scope("AWSAccount", "1234")}.
 *
 * @param label label of the sub-resource node
 * @param id value of the sub-resource node's {@code id}
 */
public record Scope(String label, Object id) {
  public Scope {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(id, "id");
    if (label.isBlank()) throw new IllegalArgumentException("Scope label must not be blank");
  }

  @Override
  public String toString() {
    return label + ":" + id;
  }
}
