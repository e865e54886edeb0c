package com.gentoro.graphsync.graph;

import com.gentoro.graphsync.model.Binding;
import com.gentoro.graphsync.model.GraphProperties;
import com.gentoro.graphsync.model.MatchLinkSchema;
import com.gentoro.graphsync.model.NodeSchema;
import com.gentoro.graphsync.model.PropertyMap;
import com.gentoro.graphsync.model.RelationshipSchema;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives the indexes a schema relies on and renders them as idempotent DDL.
 *
 * <p>{@code id} is the key every node schema merges on, so {@code id} on a node schema's label or
 * on a matcher's target label is a uniqueness constraint rather than a plain index. Without it two
 * transactions merging the same key concurrently can both create the node. Extra labels are shared
 * between node types and keep a plain {@code id} index.
 */
public final class IndexQueryBuilder {

  private IndexQueryBuilder() {}

  /**
   * Unique {@code id} and {@code lastupdated} on the node label, {@code id} on every extra label,
   * every relationship matcher key on its target label and every property flagged as extra index.
   */
  public static Set<IndexDefinition> indexes(NodeSchema schema) {
    Set<IndexDefinition> indexes = new LinkedHashSet<>();
    indexes.add(IndexDefinition.unique(schema.label(), GraphProperties.ID));
    indexes.add(IndexDefinition.node(schema.label(), GraphProperties.LASTUPDATED));
    for (String extra : schema.extraLabels()) {
      indexes.add(IndexDefinition.node(extra, GraphProperties.ID));
    }
    for (RelationshipSchema rel : schema.relationships()) {
      addMatcher(indexes, rel.targetLabel(), rel.targetMatcher());
    }
    for (PropertyMap.PropertyMapping entry : schema.properties()) {
      if (entry.binding() instanceof Binding.FromRow row
          && row.extraIndex()
          && !GraphProperties.ID.equals(entry.property())) {
        indexes.add(IndexDefinition.node(schema.label(), entry.property()));
      }
    }
    return indexes;
  }

  /** Both matchers plus the relationship index used by scoped match link cleanup. */
  public static Set<IndexDefinition> indexes(MatchLinkSchema schema) {
    Set<IndexDefinition> indexes = new LinkedHashSet<>();
    addMatcher(indexes, schema.sourceLabel(), schema.sourceMatcher());
    addMatcher(indexes, schema.targetLabel(), schema.targetMatcher());
    indexes.add(
        IndexDefinition.relationship(
            schema.relLabel(),
            GraphProperties.LASTUPDATED,
            GraphProperties.SUB_RESOURCE_LABEL,
            GraphProperties.SUB_RESOURCE_ID));
    return indexes;
  }

  private static void addMatcher(Set<IndexDefinition> indexes, String label, PropertyMap matcher) {
    for (PropertyMap.PropertyMapping entry : matcher) {
      indexes.add(
          GraphProperties.ID.equals(entry.property())
              ? IndexDefinition.unique(label, entry.property())
              : IndexDefinition.node(label, entry.property()));
    }
  }

  public static String toCypher(IndexDefinition index) {
    List<String> props = new ArrayList<>();
    if (index.kind() == IndexDefinition.Kind.UNIQUE) {
      return "CREATE CONSTRAINT IF NOT EXISTS FOR (n:"
          + index.label()
          + ") REQUIRE n."
          + index.properties().get(0)
          + " IS UNIQUE";
    }
    if (index.kind() == IndexDefinition.Kind.NODE) {
      for (String p : index.properties()) props.add("n." + p);
      return "CREATE INDEX IF NOT EXISTS FOR (n:"
          + index.label()
          + ") ON ("
          + String.join(", ", props)
          + ")";
    }
    for (String p : index.properties()) props.add("r." + p);
    return "CREATE INDEX IF NOT EXISTS FOR ()-[r:"
        + index.label()
        + "]-() ON ("
        + String.join(", ", props)
        + ")";
  }
}
