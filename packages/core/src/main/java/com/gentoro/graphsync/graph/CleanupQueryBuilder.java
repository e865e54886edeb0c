package com.gentoro.graphsync.graph;

import static com.gentoro.graphsync.graph.QueryParameters.LIMIT_SIZE;
import static com.gentoro.graphsync.graph.QueryParameters.UPDATE_TAG;

import com.gentoro.graphsync.exception.ConfigException;
import com.gentoro.graphsync.model.GraphProperties;
import com.gentoro.graphsync.model.LinkDirection;
import com.gentoro.graphsync.model.MatchLinkSchema;
import com.gentoro.graphsync.model.NodeSchema;
import com.gentoro.graphsync.model.RelationshipSchema;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles schemas into the statements that delete data a sync run did not touch. Every statement
 * deletes at most {@code $LIMIT_SIZE} items and is meant to be re-run until it changes nothing.
 *
 * <p>For a node schema the outcome depends on its cleanup mode:
 *
 * <ul>
 *   <li>sub-resource and scoped: stale nodes of the tenant, then stale sub-resource
 *       relationships, then stale other relationships of nodes in the tenant;
 *   <li>no sub-resource, scoped: stale other relationships only, nodes are kept;
 *   <li>unscoped: stale nodes everywhere, then stale other relationships everywhere.
 * </ul>
 *
 * A schema without any relationship yields no statements.
 */
public final class CleanupQueryBuilder {
  private static final String STALE = " <> $" + UPDATE_TAG;

  private CleanupQueryBuilder() {}

  public static List<String> nodeCleanupQueries(NodeSchema schema) {
    return nodeCleanupQueries(schema, schema.cascadeDelete());
  }

  /**
   * @param cascadeDelete also delete stale direct children of every deleted node
   * @throws ConfigException if cascading is requested for a schema without scoped cleanup
   */
  public static List<String> nodeCleanupQueries(NodeSchema schema, boolean cascadeDelete) {
    if (cascadeDelete && !schema.scopedCleanup()) {
      throw new ConfigException(
              "Invalid cleanup for '"
                  + schema.label()
                  + "': cascade delete requires scoped cleanup")
          .withContext("schema", schema.label());
    }
    RelationshipSchema subResource = schema.subResourceRelationship();
    if (cascadeDelete && subResource == null) {
      throw new ConfigException(
              "Invalid cleanup for '"
                  + schema.label()
                  + "': cascade delete requires a sub-resource relationship")
          .withContext("schema", schema.label());
    }
    List<String> queries = new ArrayList<>();
    if (subResource == null && schema.otherRelationships().isEmpty()) {
      return queries;
    }

    if (subResource != null) {
      String match = scopedMatch(schema, subResource);
      // nodes are found through their sub-resource relationship, so they go first
      queries.add(match + "\n" + deleteNodes(cascadeDelete ? subResource : null));
      queries.add(match + "\n" + deleteRelationships("s"));
      for (RelationshipSchema rel : schema.otherRelationships()) {
        queries.add(match + "\n" + relationshipMatch(rel) + "\n" + deleteRelationships("r"));
      }
      return queries;
    }

    String match = "MATCH (n:" + schema.label() + ")";
    if (!schema.scopedCleanup()) {
      queries.add(match + "\n" + deleteNodes(null));
    }
    for (RelationshipSchema rel : schema.otherRelationships()) {
      queries.add(match + "\n" + relationshipMatch(rel) + "\n" + deleteRelationships("r"));
    }
    return queries;
  }

  /** Stale relationships of a match link within one tenant. */
  public static String matchLinkCleanupQuery(MatchLinkSchema schema) {
    return "MATCH "
        + CypherText.link(
            "from:" + schema.sourceLabel(),
            "r",
            schema.relLabel(),
            schema.direction(),
            "to:" + schema.targetLabel())
        + "\n"
        + "WHERE r."
        + GraphProperties.LASTUPDATED
        + STALE
        + "\n"
        + "  AND r."
        + GraphProperties.SUB_RESOURCE_LABEL
        + " = $"
        + QueryParameters.SUB_RESOURCE_LABEL
        + "\n"
        + "  AND r."
        + GraphProperties.SUB_RESOURCE_ID
        + " = $"
        + QueryParameters.SUB_RESOURCE_ID
        + "\n"
        + "WITH r LIMIT $"
        + LIMIT_SIZE
        + "\n"
        + "DELETE r";
  }

  private static String scopedMatch(NodeSchema schema, RelationshipSchema subResource) {
    String tenant =
        ":" + subResource.targetLabel() + " " + CypherText.inlineMap(subResource.targetMatcher());
    return "MATCH "
        + CypherText.link(
            "n:" + schema.label(), "s", subResource.relLabel(), subResource.direction(), tenant);
  }

  private static String relationshipMatch(RelationshipSchema rel) {
    return "MATCH "
        + CypherText.link("n", "r", rel.relLabel(), rel.direction(), ":" + rel.targetLabel());
  }

  private static String deleteNodes(RelationshipSchema cascadeThrough) {
    StringBuilder q = new StringBuilder();
    q.append("WHERE n.").append(GraphProperties.LASTUPDATED).append(STALE).append("\n");
    q.append("WITH n LIMIT $").append(LIMIT_SIZE).append("\n");
    if (cascadeThrough != null) {
      // children hang off the node in the opposite direction of its own sub-resource link
      LinkDirection toChildren =
          cascadeThrough.direction() == LinkDirection.INWARD
              ? LinkDirection.OUTWARD
              : LinkDirection.INWARD;
      String childLink =
          toChildren == LinkDirection.OUTWARD
              ? "(n)-[:" + cascadeThrough.relLabel() + "]->(child)"
              : "(n)<-[:" + cascadeThrough.relLabel() + "]-(child)";
      q.append("CALL {\n")
          .append("    WITH n\n")
          .append("    OPTIONAL MATCH ")
          .append(childLink)
          .append("\n")
          .append("    WITH child WHERE child IS NOT NULL AND child.")
          .append(GraphProperties.LASTUPDATED)
          .append(STALE)
          .append("\n")
          .append("    DETACH DELETE child\n")
          .append("}\n");
    }
    q.append("DETACH DELETE n");
    return q.toString();
  }

  private static String deleteRelationships(String variable) {
    return "WHERE "
        + variable
        + "."
        + GraphProperties.LASTUPDATED
        + STALE
        + "\n"
        + "WITH "
        + variable
        + " LIMIT $"
        + LIMIT_SIZE
        + "\n"
        + "DELETE "
        + variable;
  }
}
