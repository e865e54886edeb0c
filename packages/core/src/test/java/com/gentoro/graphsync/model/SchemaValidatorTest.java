package com.gentoro.graphsync.model;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphsync.TestSchemas;
import com.gentoro.graphsync.exception.ConfigException;
import com.gentoro.graphsync.exception.GraphSyncErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SchemaValidatorTest {

  private static NodeSchema.Builder widget() {
    return NodeSchema.builder("Widget").properties(PropertyMap.of("id", Binding.row("id")));
  }

  @Test
  @DisplayName("Well-formed schemas build with the documented defaults")
  void validSchemas() {
    NodeSchema schema = TestSchemas.TAGGED_WIDGET;
    assertTrue(schema.scopedCleanup());
    assertFalse(schema.cascadeDelete());
    assertEquals(3, schema.relationships().size());
    assertEquals(TestSchemas.WIDGET_ACCOUNT, schema.relationships().get(0));
    assertTrue(TestSchemas.PROJECT.cascadeDelete());
  }

  @Test
  @DisplayName("A node schema without an id property is rejected with schema and field context")
  void missingId() {
    ConfigException e =
        assertThrows(
            ConfigException.class,
            () ->
                NodeSchema.builder("Widget")
                    .properties(PropertyMap.of("name", Binding.row("name")))
                    .build());
    assertEquals(GraphSyncErrorCode.CONFIGURATION_ERROR, e.getCode());
    assertEquals("Widget", e.getContext().get("schema"));
    assertEquals("properties", e.getContext().get("field"));
  }

  @Test
  @DisplayName("Stamped properties cannot be bound by a schema")
  void reservedProperty() {
    ConfigException e =
        assertThrows(
            ConfigException.class,
            () ->
                NodeSchema.builder("Widget")
                    .properties(
                        PropertyMap.of("id", Binding.row("id"), "lastupdated", Binding.row("ts")))
                    .build());
    assertTrue(e.getMessage().contains("lastupdated"));
  }

  @Test
  @DisplayName("Row list bindings are only legal inside matchers")
  void rowListOutsideMatcher() {
    assertThrows(
        ConfigException.class,
        () ->
            NodeSchema.builder("Widget")
                .properties(PropertyMap.of("id", Binding.row("id"), "tags", Binding.rowList("t")))
                .build());
  }

  @Test
  @DisplayName("Labels must be plain identifiers")
  void invalidLabel() {
    assertThrows(
        ConfigException.class,
        () ->
            NodeSchema.builder("Bad-Label")
                .properties(PropertyMap.of("id", Binding.row("id")))
                .build());
    assertThrows(ConfigException.class, () -> widget().extraLabel("Also Bad").build());
  }

  @Test
  @DisplayName("Sub-resource relationships must be RESOURCE, INWARD and matched on kwargs")
  void subResourceShape() {
    PropertyMap byKwarg = PropertyMap.of("id", Binding.kwarg("ACCOUNT_ID"));
    assertThrows(
        ConfigException.class,
        () ->
            widget()
                .subResource(
                    new RelationshipSchema("Account", byKwarg, "OWNS", LinkDirection.INWARD, null))
                .build());
    assertThrows(
        ConfigException.class,
        () ->
            widget()
                .subResource(
                    new RelationshipSchema(
                        "Account", byKwarg, "RESOURCE", LinkDirection.OUTWARD, null))
                .build());
    ConfigException e =
        assertThrows(
            ConfigException.class,
            () ->
                widget()
                    .subResource(
                        RelationshipSchema.subResource(
                            "Account", PropertyMap.of("id", Binding.row("account_id"))))
                    .build());
    assertEquals("subResourceRelationship.targetMatcher.id", e.getContext().get("field"));
  }

  @Test
  @DisplayName("A sub-resource implies scoped cleanup")
  void subResourceRequiresScopedCleanup() {
    assertThrows(
        ConfigException.class,
        () -> widget().subResource(TestSchemas.WIDGET_ACCOUNT).scopedCleanup(false).build());
  }

  @Test
  @DisplayName("Cascade delete requires scoped cleanup and a sub-resource relationship")
  void cascadeRequiresScope() {
    ConfigException unscoped =
        assertThrows(
            ConfigException.class,
            () -> widget().scopedCleanup(false).cascadeDelete(true).build());
    assertEquals("cascadeDelete", unscoped.getContext().get("field"));
    assertThrows(ConfigException.class, () -> widget().cascadeDelete(true).build());
  }

  @Test
  @DisplayName("Matchers must not be empty")
  void emptyMatcher() {
    assertThrows(
        ConfigException.class,
        () ->
            widget()
                .relationship(
                    RelationshipSchema.of(
                        "Tag", PropertyMap.empty(), "TAGGED", LinkDirection.OUTWARD))
                .build());
  }

  @Test
  @DisplayName("Match links must carry kwarg-bound sub-resource properties")
  void matchLinkScopeProperties() {
    MatchLinkSchema.Builder base =
        MatchLinkSchema.builder("MEMBER_OF")
            .source("User", PropertyMap.of("id", Binding.row("user_id")))
            .target("Group", PropertyMap.of("id", Binding.row("group_id")));

    assertNotNull(base.build());
    assertThrows(ConfigException.class, () -> base.properties(PropertyMap.empty()).build());
    assertThrows(
        ConfigException.class,
        () ->
            base.properties(
                    PropertyMap.builder()
                        .put(
                            GraphProperties.SUB_RESOURCE_LABEL,
                            Binding.kwarg(GraphProperties.SUB_RESOURCE_LABEL))
                        .put(GraphProperties.SUB_RESOURCE_ID, Binding.row("account"))
                        .build())
                .build());
  }

  @Test
  @DisplayName("Match links need both endpoints")
  void matchLinkEndpoints() {
    assertThrows(
        ConfigException.class,
        () ->
            MatchLinkSchema.builder("MEMBER_OF")
                .target("Group", PropertyMap.of("id", Binding.row("group_id")))
                .build());
  }
}
