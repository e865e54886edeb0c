package com.gentoro.graphsync.graph;

import static com.gentoro.graphsync.graph.CypherText.INDENT;

import com.gentoro.graphsync.exception.ConfigException;
import com.gentoro.graphsync.model.Binding;
import com.gentoro.graphsync.model.GraphProperties;
import com.gentoro.graphsync.model.MatchLinkSchema;
import com.gentoro.graphsync.model.NodeSchema;
import com.gentoro.graphsync.model.PropertyMap;
import com.gentoro.graphsync.model.RelationshipSchema;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Compiles schemas into idempotent upsert statements. A statement unwinds the {@code $DictList}
 * parameter so that one execution writes a whole batch.
 *
 * <p>Node statements have the shape
 *
 * <pre>
 * UNWIND $DictList AS item
 * MERGE (i:Label {id: item.id})
 * ON CREATE SET i.firstseen = timestamp()
 * SET i.lastupdated = $UPDATE_TAG, ...
 * WITH i, item
 * CALL {
 *     WITH i, item
 *     OPTIONAL MATCH (j:Tenant {id: $TENANT_ID})
 *     WITH i, item, j WHERE j IS NOT NULL
 *     MERGE (i)&lt;-[r:RESOURCE]-(j)
 *     ...
 *   UNION
 *     ...
 * }
 * </pre>
 *
 * Each relationship is wired in its own branch of the unit subquery, so a missing target only
 * drops that one relationship and never the node.
 */
public final class IngestionQueryBuilder {

  private IngestionQueryBuilder() {}

  public static String nodeQuery(NodeSchema schema) {
    return nodeQuery(schema, null);
  }

  /**
   * @param selected relationships to wire, or null for all of them; an empty collection writes the
   *     nodes only
   * @throws ConfigException if a selected relationship is not declared on the schema
   */
  public static String nodeQuery(NodeSchema schema, Collection<RelationshipSchema> selected) {
    if (selected != null) {
      for (RelationshipSchema rel : selected) {
        if (!schema.hasRelationship(rel)) {
          throw new ConfigException(
                  "Relationship "
                      + rel.describe()
                      + " is not declared on node schema '"
                      + schema.label()
                      + "'")
              .withContext("schema", schema.label());
        }
      }
    }

    StringBuilder q = new StringBuilder();
    Binding id = schema.properties().get(GraphProperties.ID).orElseThrow();
    q.append("UNWIND $").append(QueryParameters.ROWS).append(" AS item\n");
    q.append("MERGE (i:")
        .append(schema.label())
        .append(" {")
        .append(GraphProperties.ID)
        .append(": ")
        .append(CypherText.value(id))
        .append("})\n");
    q.append("ON CREATE SET i.").append(GraphProperties.FIRSTSEEN).append(" = timestamp()\n");

    List<String> sets = stamps("i", schema.module());
    for (PropertyMap.PropertyMapping entry : schema.properties()) {
      if (GraphProperties.ID.equals(entry.property())) continue;
      sets.add("i." + entry.property() + " = " + CypherText.value(entry.binding()));
    }
    for (String extra : schema.extraLabels()) {
      sets.add("i:" + extra);
    }
    q.append("SET\n").append(INDENT).append(String.join(",\n" + INDENT, sets));

    List<String> branches = new ArrayList<>();
    RelationshipSchema subResource = schema.subResourceRelationship();
    if (subResource != null && (selected == null || selected.contains(subResource))) {
      branches.add(subResourceBranch(subResource, schema.module()));
    }
    int num = 0;
    for (RelationshipSchema rel : schema.otherRelationships()) {
      if (selected == null || selected.contains(rel)) {
        branches.add(relationshipBranch(rel, num, schema.module()));
      }
      num++;
    }
    if (!branches.isEmpty()) {
      q.append("\nWITH i, item\nCALL {\n")
          .append(String.join("\n  UNION\n", branches))
          .append("\n}");
    }
    return q.toString();
  }

  private static String subResourceBranch(RelationshipSchema rel, String module) {
    return INDENT
        + "WITH i, item\n"
        + INDENT
        + "OPTIONAL MATCH (j:"
        + rel.targetLabel()
        + " "
        + CypherText.inlineMap(rel.targetMatcher())
        + ")\n"
        + INDENT
        + "WITH i, item, j WHERE j IS NOT NULL\n"
        + mergeRelationship("i", "r", rel, "j", module);
  }

  private static String relationshipBranch(RelationshipSchema rel, int num, String module) {
    String node = "n" + num;
    String r = "r" + num;
    return INDENT
        + "WITH i, item\n"
        + INDENT
        + "OPTIONAL MATCH ("
        + node
        + ":"
        + rel.targetLabel()
        + ")\n"
        + INDENT
        + "WHERE "
        + CypherText.predicate(node, rel.targetMatcher())
        + "\n"
        + INDENT
        + "WITH i, item, "
        + node
        + " WHERE "
        + node
        + " IS NOT NULL\n"
        + mergeRelationship("i", r, rel, node, module);
  }

  private static String mergeRelationship(
      String from, String r, RelationshipSchema rel, String to, String module) {
    List<String> sets = stamps(r, module);
    for (PropertyMap.PropertyMapping entry : rel.properties()) {
      sets.add(r + "." + entry.property() + " = " + CypherText.value(entry.binding()));
    }
    return INDENT
        + "MERGE "
        + CypherText.link(from, r, rel.relLabel(), rel.direction(), to)
        + "\n"
        + INDENT
        + "ON CREATE SET "
        + r
        + "."
        + GraphProperties.FIRSTSEEN
        + " = timestamp()\n"
        + INDENT
        + "SET\n"
        + INDENT
        + INDENT
        + String.join(",\n" + INDENT + INDENT, sets);
  }

  /**
   * Match link statement: both endpoints are looked up with {@code MATCH}, so a row whose source or
   * target does not exist yields no relationship.
   */
  public static String matchLinkQuery(MatchLinkSchema schema) {
    List<String> sets = stamps("r", schema.module());
    for (PropertyMap.PropertyMapping entry : schema.properties()) {
      sets.add("r." + entry.property() + " = " + CypherText.value(entry.binding()));
    }
    return "UNWIND $"
        + QueryParameters.ROWS
        + " AS item\n"
        + "MATCH (from:"
        + schema.sourceLabel()
        + ")\n"
        + "WHERE "
        + CypherText.predicate("from", schema.sourceMatcher())
        + "\n"
        + "MATCH (to:"
        + schema.targetLabel()
        + ")\n"
        + "WHERE "
        + CypherText.predicate("to", schema.targetMatcher())
        + "\n"
        + "MERGE "
        + CypherText.link("from", "r", schema.relLabel(), schema.direction(), "to")
        + "\n"
        + "ON CREATE SET r."
        + GraphProperties.FIRSTSEEN
        + " = timestamp()\n"
        + "SET\n"
        + INDENT
        + String.join(",\n" + INDENT, sets);
  }

  private static List<String> stamps(String variable, String module) {
    List<String> sets = new ArrayList<>();
    sets.add(variable + "." + GraphProperties.LASTUPDATED + " = $" + QueryParameters.UPDATE_TAG);
    sets.add(
        variable
            + "."
            + GraphProperties.MODULE_NAME
            + " = "
            + CypherText.stringLiteral(CypherText.moduleName(module)));
    sets.add(
        variable
            + "."
            + GraphProperties.MODULE_VERSION
            + " = "
            + CypherText.stringLiteral(CypherText.moduleVersion()));
    return sets;
  }
}
