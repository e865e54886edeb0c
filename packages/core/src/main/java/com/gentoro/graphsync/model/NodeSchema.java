package com.gentoro.graphsync.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative description of one node type: how rows become nodes, which relationships are wired
 * while loading, and how stale instances are cleaned up. Build instances with {@link #builder};
 * the builder validates the schema.
 *
 * @param label node label
 * @param properties node properties; must contain {@code id}
 * @param subResourceRelationship relationship to the owning tenant, or null for root types
 * @param otherRelationships further relationships to already loaded nodes
 * @param extraLabels additional labels set on every node
 * @param module short provenance name stamped on written data, may be null
 * @param scopedCleanup whether cleanup is confined to one tenant
 * @param cascadeDelete whether cleanup also removes stale direct children
 */
public record NodeSchema(
    String label,
    PropertyMap properties,
    RelationshipSchema subResourceRelationship,
    List<RelationshipSchema> otherRelationships,
    List<String> extraLabels,
    String module,
    boolean scopedCleanup,
    boolean cascadeDelete) {

  public NodeSchema {
    Objects.requireNonNull(label, "label");
    properties = properties == null ? PropertyMap.empty() : properties;
    otherRelationships = otherRelationships == null ? List.of() : List.copyOf(otherRelationships);
    extraLabels = extraLabels == null ? List.of() : List.copyOf(extraLabels);
  }

  public static Builder builder(String label) {
    return new Builder(label);
  }

  public Optional<RelationshipSchema> subResource() {
    return Optional.ofNullable(subResourceRelationship);
  }

  /** Sub-resource relationship first, then the others in declaration order. */
  public List<RelationshipSchema> relationships() {
    List<RelationshipSchema> all = new ArrayList<>(otherRelationships.size() + 1);
    if (subResourceRelationship != null) all.add(subResourceRelationship);
    all.addAll(otherRelationships);
    return all;
  }

  public boolean hasRelationship(RelationshipSchema relationship) {
    return relationship.equals(subResourceRelationship)
        || otherRelationships.contains(relationship);
  }

  public static final class Builder {
    private final String label;
    private PropertyMap properties = PropertyMap.empty();
    private RelationshipSchema subResource;
    private final List<RelationshipSchema> others = new ArrayList<>();
    private final List<String> extraLabels = new ArrayList<>();
    private String module;
    private boolean scopedCleanup = true;
    private boolean cascadeDelete;

    private Builder(String label) {
      this.label = label;
    }

    public Builder properties(PropertyMap properties) {
      this.properties = properties;
      return this;
    }

    public Builder subResource(RelationshipSchema subResource) {
      this.subResource = subResource;
      return this;
    }

    public Builder relationship(RelationshipSchema relationship) {
      this.others.add(Objects.requireNonNull(relationship, "relationship"));
      return this;
    }

    public Builder extraLabel(String extraLabel) {
      this.extraLabels.add(Objects.requireNonNull(extraLabel, "extraLabel"));
      return this;
    }

    public Builder module(String module) {
      this.module = module;
      return this;
    }

    public Builder scopedCleanup(boolean scopedCleanup) {
      this.scopedCleanup = scopedCleanup;
      return this;
    }

    public Builder cascadeDelete(boolean cascadeDelete) {
      this.cascadeDelete = cascadeDelete;
      return this;
    }

    public NodeSchema build() {
      NodeSchema schema =
          new NodeSchema(
              label,
              properties,
              subResource,
              others,
              extraLabels,
              module,
              scopedCleanup,
              cascadeDelete);
      SchemaValidator.validate(schema);
      return schema;
    }
  }
}
