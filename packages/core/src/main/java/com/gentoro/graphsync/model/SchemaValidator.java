package com.gentoro.graphsync.model;

import com.gentoro.graphsync.exception.ConfigException;
import java.util.regex.Pattern;

/**
 * Structural checks run when a schema is built. Every failure is a {@link ConfigException} whose
 * context names the schema and the offending field.
 */
public final class SchemaValidator {
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private SchemaValidator() {}

  public static boolean isIdentifier(String value) {
    return value != null && IDENTIFIER.matcher(value).matches();
  }

  public static void validate(NodeSchema schema) {
    String name = schema.label();
    requireIdentifier(name, "label", schema.label());
    for (String extra : schema.extraLabels()) {
      requireIdentifier(name, "extraLabels", extra);
    }

    Binding id =
        schema
            .properties()
            .get(GraphProperties.ID)
            .orElseThrow(
                () -> fail(name, "properties", "Node schema must declare an 'id' property"));
    if (id instanceof Binding.FromRowList) {
      throw fail(name, "properties.id", "The 'id' property cannot be bound to a row list");
    }
    validateProperties(name, "properties", schema.properties());

    RelationshipSchema subResource = schema.subResourceRelationship();
    if (subResource != null) {
      validateRelationship(name, "subResourceRelationship", subResource);
      validateSubResource(name, subResource);
      if (!schema.scopedCleanup()) {
        throw fail(
            name,
            "scopedCleanup",
            "A node with a sub-resource relationship must use scoped cleanup; unscoped cleanup"
                + " would delete stale nodes of every tenant");
      }
    }
    for (int i = 0; i < schema.otherRelationships().size(); i++) {
      validateRelationship(
          name, "otherRelationships[" + i + "]", schema.otherRelationships().get(i));
    }

    if (schema.cascadeDelete()) {
      if (!schema.scopedCleanup()) {
        throw fail(name, "cascadeDelete", "cascadeDelete requires scopedCleanup");
      }
      if (subResource == null) {
        throw fail(
            name, "cascadeDelete", "cascadeDelete requires a sub-resource relationship to walk");
      }
    }
  }

  public static void validate(MatchLinkSchema schema) {
    String name = schema.relLabel();
    requireIdentifier(name, "relLabel", schema.relLabel());
    requireIdentifier(name, "sourceLabel", schema.sourceLabel());
    requireIdentifier(name, "targetLabel", schema.targetLabel());
    validateMatcher(name, "sourceMatcher", schema.sourceMatcher());
    validateMatcher(name, "targetMatcher", schema.targetMatcher());
    validateProperties(name, "properties", schema.properties());
    for (String required :
        new String[] {GraphProperties.SUB_RESOURCE_LABEL, GraphProperties.SUB_RESOURCE_ID}) {
      Binding binding =
          schema
              .properties()
              .get(required)
              .orElseThrow(
                  () ->
                      fail(
                          name,
                          "properties." + required,
                          "Match link properties must include '"
                              + required
                              + "' so that cleanup can be scoped"));
      if (!(binding instanceof Binding.FromKwargs)) {
        throw fail(
            name,
            "properties." + required,
            "'" + required + "' must be bound from kwargs, not from rows");
      }
    }
  }

  private static void validateRelationship(
      String schema, String field, RelationshipSchema relationship) {
    requireIdentifier(schema, field + ".targetLabel", relationship.targetLabel());
    requireIdentifier(schema, field + ".relLabel", relationship.relLabel());
    validateMatcher(schema, field + ".targetMatcher", relationship.targetMatcher());
    validateProperties(schema, field + ".properties", relationship.properties());
  }

  private static void validateSubResource(String schema, RelationshipSchema relationship) {
    String field = "subResourceRelationship";
    if (!RelationshipSchema.SUB_RESOURCE_REL_LABEL.equals(relationship.relLabel())) {
      throw fail(
          schema,
          field + ".relLabel",
          "Sub-resource relationships must use the '"
              + RelationshipSchema.SUB_RESOURCE_REL_LABEL
              + "' label, got '"
              + relationship.relLabel()
              + "'");
    }
    if (relationship.direction() != LinkDirection.INWARD) {
      throw fail(schema, field + ".direction", "Sub-resource relationships must be INWARD");
    }
    for (PropertyMap.PropertyMapping entry : relationship.targetMatcher()) {
      if (!(entry.binding() instanceof Binding.FromKwargs kwarg)
          || kwarg.matchMode() != MatchMode.EXACT) {
        throw fail(
            schema,
            field + ".targetMatcher." + entry.property(),
            "Sub-resource matchers must be exact matches on kwargs so that cleanup can be scoped");
      }
    }
  }

  private static void validateMatcher(String schema, String field, PropertyMap matcher) {
    if (matcher.isEmpty()) {
      throw fail(schema, field, "Matcher must declare at least one property");
    }
    for (PropertyMap.PropertyMapping entry : matcher) {
      requireIdentifier(schema, field, entry.property());
      requireKwargName(schema, field + "." + entry.property(), entry.binding());
    }
  }

  private static void validateProperties(String schema, String field, PropertyMap properties) {
    for (PropertyMap.PropertyMapping entry : properties) {
      String path = field + "." + entry.property();
      requireIdentifier(schema, field, entry.property());
      if (GraphProperties.RESERVED.contains(entry.property())) {
        throw fail(schema, path, "'" + entry.property() + "' is stamped automatically");
      }
      if (entry.binding() instanceof Binding.FromRowList) {
        throw fail(schema, path, "Row list bindings are only allowed inside matchers");
      }
      requireKwargName(schema, path, entry.binding());
    }
  }

  // kwarg names become query parameters
  private static void requireKwargName(String schema, String field, Binding binding) {
    if (binding instanceof Binding.FromKwargs kwarg) {
      requireIdentifier(schema, field, kwarg.name());
    }
  }

  private static void requireIdentifier(String schema, String field, String value) {
    if (!isIdentifier(value)) {
      throw fail(schema, field, "'" + value + "' is not a valid identifier");
    }
  }

  private static ConfigException fail(String schema, String field, String message) {
    return new ConfigException("Invalid schema '" + schema + "' at " + field + ": " + message)
        .withContext("schema", schema)
        .withContext("field", field);
  }
}
