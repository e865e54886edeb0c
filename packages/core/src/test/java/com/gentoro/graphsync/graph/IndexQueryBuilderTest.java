package com.gentoro.graphsync.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphsync.TestSchemas;
import com.gentoro.graphsync.model.Binding;
import com.gentoro.graphsync.model.NodeSchema;
import com.gentoro.graphsync.model.PropertyMap;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IndexQueryBuilderTest {

  @Test
  @DisplayName("Node schemas constrain id, index lastupdated and every matcher key")
  void nodeIndexes() {
    Set<IndexDefinition> indexes = IndexQueryBuilder.indexes(TestSchemas.TAGGED_WIDGET);

    assertEquals(
        List.of(
            IndexDefinition.unique("Widget", "id"),
            IndexDefinition.node("Widget", "lastupdated"),
            IndexDefinition.unique("Account", "id"),
            IndexDefinition.unique("Tag", "id"),
            IndexDefinition.node("Person", "email")),
        List.copyOf(indexes));
  }

  @Test
  @DisplayName("Extra labels and flagged properties get their own indexes")
  void extraIndexes() {
    NodeSchema schema =
        NodeSchema.builder("Bucket")
            .properties(
                PropertyMap.of("id", Binding.row("id"), "arn", Binding.row("arn").withExtraIndex()))
            .extraLabel("CloudResource")
            .build();

    Set<IndexDefinition> indexes = IndexQueryBuilder.indexes(schema);
    assertTrue(indexes.contains(IndexDefinition.unique("Bucket", "id")));
    assertTrue(indexes.contains(IndexDefinition.node("CloudResource", "id")));
    assertTrue(indexes.contains(IndexDefinition.node("Bucket", "arn")));
    assertEquals(4, indexes.size());
  }

  @Test
  @DisplayName("An id flagged as extra index does not add a plain index next to its constraint")
  void extraIndexOnId() {
    NodeSchema schema =
        NodeSchema.builder("Bucket")
            .properties(PropertyMap.of("id", Binding.row("id").withExtraIndex()))
            .build();

    assertEquals(
        List.of(
            IndexDefinition.unique("Bucket", "id"), IndexDefinition.node("Bucket", "lastupdated")),
        List.copyOf(IndexQueryBuilder.indexes(schema)));
  }

  @Test
  @DisplayName("Match links index both endpoints and the scoped cleanup lookup")
  void matchLinkIndexes() {
    Set<IndexDefinition> indexes = IndexQueryBuilder.indexes(TestSchemas.MEMBER_OF);

    assertTrue(indexes.contains(IndexDefinition.unique("User", "id")));
    assertTrue(indexes.contains(IndexDefinition.unique("Group", "id")));
    assertTrue(
        indexes.contains(
            IndexDefinition.relationship(
                "MEMBER_OF", "lastupdated", "_sub_resource_label", "_sub_resource_id")));
  }

  @Test
  @DisplayName("Index statements are idempotent DDL")
  void toCypher() {
    assertEquals(
        "CREATE INDEX IF NOT EXISTS FOR (n:Widget) ON (n.id)",
        IndexQueryBuilder.toCypher(IndexDefinition.node("Widget", "id")));
    assertEquals(
        "CREATE CONSTRAINT IF NOT EXISTS FOR (n:Widget) REQUIRE n.id IS UNIQUE",
        IndexQueryBuilder.toCypher(IndexDefinition.unique("Widget", "id")));
    assertEquals(
        "CREATE INDEX IF NOT EXISTS FOR ()-[r:MEMBER_OF]-() ON (r.lastupdated, r._sub_resource_id)",
        IndexQueryBuilder.toCypher(
            IndexDefinition.relationship("MEMBER_OF", "lastupdated", "_sub_resource_id")));
  }
}
