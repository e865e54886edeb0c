package com.gentoro.graphsync.model;

import java.util.Objects;

/**
 * A relationship from the node being loaded to a target node that already exists in the graph.
 *
 * @param targetLabel label of the node to connect to
 * @param targetMatcher how the target is found: target property to binding
 * @param relLabel relationship type
 * @param direction direction relative to the node being loaded
 * @param properties relationship properties
 */
public record RelationshipSchema(
    String targetLabel,
    PropertyMap targetMatcher,
    String relLabel,
    LinkDirection direction,
    PropertyMap properties) {

  /** Relationship type every sub-resource relationship must use. */
  public static final String SUB_RESOURCE_REL_LABEL = "RESOURCE";

  public RelationshipSchema {
    Objects.requireNonNull(targetLabel, "targetLabel");
    Objects.requireNonNull(targetMatcher, "targetMatcher");
    Objects.requireNonNull(relLabel, "relLabel");
    direction = direction == null ? LinkDirection.OUTWARD : direction;
    properties = properties == null ? PropertyMap.empty() : properties;
  }

  public static RelationshipSchema of(
      String targetLabel, PropertyMap targetMatcher, String relLabel, LinkDirection direction) {
    return new RelationshipSchema(
        targetLabel, targetMatcher, relLabel, direction, PropertyMap.empty());
  }

  /**
   * The owning-tenant relationship: {@code (tenant)-[:RESOURCE]->(node)}. The matcher must be bound
   * to kwargs so that loads and cleanups can be confined to one tenant.
   */
  public static RelationshipSchema subResource(String tenantLabel, PropertyMap tenantMatcher) {
    return new RelationshipSchema(
        tenantLabel,
        tenantMatcher,
        SUB_RESOURCE_REL_LABEL,
        LinkDirection.INWARD,
        PropertyMap.empty());
  }

  public RelationshipSchema withProperties(PropertyMap properties) {
    return new RelationshipSchema(targetLabel, targetMatcher, relLabel, direction, properties);
  }

  /** Short human readable form used in log and error messages. */
  public String describe() {
    return direction == LinkDirection.INWARD
        ? "<-[:" + relLabel + "]-(:" + targetLabel + ")"
        : "-[:" + relLabel + "]->(:" + targetLabel + ")";
  }
}
