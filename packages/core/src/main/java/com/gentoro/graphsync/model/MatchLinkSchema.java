package com.gentoro.graphsync.model;

import com.gentoro.graphsync.exception.ConfigException;
import java.util.Objects;

/**
 * A relationship between two nodes that were loaded independently. Loading a match link never
 * creates nodes. Its properties must carry {@value GraphProperties#SUB_RESOURCE_LABEL} and {@value
 * GraphProperties#SUB_RESOURCE_ID} bound from kwargs so that cleanup can be scoped without an
 * owning node; {@link #scopeProperties()} returns a builder pre-filled with both.
 */
public record MatchLinkSchema(
    String sourceLabel,
    PropertyMap sourceMatcher,
    String targetLabel,
    PropertyMap targetMatcher,
    String relLabel,
    LinkDirection direction,
    PropertyMap properties,
    String module) {

  public MatchLinkSchema {
    Objects.requireNonNull(sourceLabel, "sourceLabel");
    Objects.requireNonNull(sourceMatcher, "sourceMatcher");
    Objects.requireNonNull(targetLabel, "targetLabel");
    Objects.requireNonNull(targetMatcher, "targetMatcher");
    Objects.requireNonNull(relLabel, "relLabel");
    direction = direction == null ? LinkDirection.OUTWARD : direction;
    properties = properties == null ? PropertyMap.empty() : properties;
  }

  public static Builder builder(String relLabel) {
    return new Builder(relLabel);
  }

  public static PropertyMap.Builder scopeProperties() {
    return PropertyMap.builder()
        .put(GraphProperties.SUB_RESOURCE_LABEL, Binding.kwarg(GraphProperties.SUB_RESOURCE_LABEL))
        .put(GraphProperties.SUB_RESOURCE_ID, Binding.kwarg(GraphProperties.SUB_RESOURCE_ID));
  }

  public String describe() {
    String arrow =
        direction == LinkDirection.INWARD ? "<-[:" + relLabel + "]-" : "-[:" + relLabel + "]->";
    return "(:" + sourceLabel + ")" + arrow + "(:" + targetLabel + ")";
  }

  public static final class Builder {
    private final String relLabel;
    private String sourceLabel;
    private PropertyMap sourceMatcher;
    private String targetLabel;
    private PropertyMap targetMatcher;
    private LinkDirection direction = LinkDirection.OUTWARD;
    private PropertyMap properties = scopeProperties().build();
    private String module;

    private Builder(String relLabel) {
      this.relLabel = relLabel;
    }

    public Builder source(String label, PropertyMap matcher) {
      this.sourceLabel = label;
      this.sourceMatcher = matcher;
      return this;
    }

    public Builder target(String label, PropertyMap matcher) {
      this.targetLabel = label;
      this.targetMatcher = matcher;
      return this;
    }

    public Builder direction(LinkDirection direction) {
      this.direction = direction;
      return this;
    }

    /** Replaces the default scope-only property map. */
    public Builder properties(PropertyMap properties) {
      this.properties = properties;
      return this;
    }

    public Builder module(String module) {
      this.module = module;
      return this;
    }

    public MatchLinkSchema build() {
      if (sourceLabel == null || sourceMatcher == null) {
        throw new ConfigException("Match link '" + relLabel + "' has no source node matcher")
            .withContext("schema", relLabel);
      }
      if (targetLabel == null || targetMatcher == null) {
        throw new ConfigException("Match link '" + relLabel + "' has no target node matcher")
            .withContext("schema", relLabel);
      }
      MatchLinkSchema schema =
          new MatchLinkSchema(
              sourceLabel,
              sourceMatcher,
              targetLabel,
              targetMatcher,
              relLabel,
              direction,
              properties,
              module);
      SchemaValidator.validate(schema);
      return schema;
    }
  }
}
