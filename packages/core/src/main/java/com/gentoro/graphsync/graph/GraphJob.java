package com.gentoro.graphsync.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.driver.WriteSummary;
import com.gentoro.graphsync.exception.ConfigException;
import com.gentoro.graphsync.exception.StoreException;
import com.gentoro.graphsync.model.Binding;
import com.gentoro.graphsync.model.MatchLinkSchema;
import com.gentoro.graphsync.model.NodeSchema;
import com.gentoro.graphsync.model.PropertyMap;
import com.gentoro.graphsync.model.RelationshipSchema;
import com.gentoro.graphsync.model.Scope;
import com.gentoro.graphsync.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named, ordered list of {@link GraphStatement}s: a cleanup derived from a schema or an analysis
 * pass read from JSON.
 *
 * <pre>
 * {
 *   "name": "cleanup stale widgets",
 *   "statements": [
 *     {"query": "...", "iterative": true, "iterationsize": 100}
 *   ]
 * }
 * </pre>
 */
public final class GraphJob {
  private static final org.slf4j.Logger log =
      com.gentoro.graphsync.logging.LoggingService.getLogger(GraphJob.class);

  private final String name;
  private final List<GraphStatement> statements;
  private final String shortName;

  @JsonCreator
  public GraphJob(
      @JsonProperty("name") String name,
      @JsonProperty("statements") List<GraphStatement> statements) {
    this(name, statements, null);
  }

  public GraphJob(String name, List<GraphStatement> statements, String shortName) {
    this.name = Objects.requireNonNull(name, "name");
    this.statements = statements == null ? List.of() : List.copyOf(statements);
    this.shortName = shortName;
  }

  /** Cleanup using the schema's own cascade setting. */
  public static GraphJob fromNodeSchema(
      NodeSchema schema, Map<String, Object> parameters, int iterationSize) {
    return fromNodeSchema(schema, parameters, iterationSize, schema.cascadeDelete());
  }

  /**
   * Cleanup job for a node schema.
   *
   * @param parameters must contain {@code UPDATE_TAG} and every kwarg the sub-resource matcher reads
   * @throws ConfigException for an unsafe cascade or a missing parameter, before any statement runs
   */
  public static GraphJob fromNodeSchema(
      NodeSchema schema,
      Map<String, Object> parameters,
      int iterationSize,
      boolean cascadeDelete) {
    List<String> queries = CleanupQueryBuilder.nodeCleanupQueries(schema, cascadeDelete);
    List<GraphStatement> statements = new ArrayList<>();
    for (String query : queries) {
      statements.add(new GraphStatement(query, parameters, true, iterationSize));
    }
    GraphJob job =
        new GraphJob(
            "Cleanup " + schema.label(), statements, schema.label().toLowerCase() + "_cleanup");
    job.requireParameters();
    return job;
  }

  /**
   * Cleanup of a node schema within a scope: the scope id is passed to the kwarg of the
   * sub-resource matcher.
   */
  public static GraphJob fromNodeSchema(
      NodeSchema schema, Scope scope, long updateTag, int iterationSize) {
    Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put(QueryParameters.UPDATE_TAG, updateTag);
    RelationshipSchema subResource = schema.subResourceRelationship();
    if (subResource != null) {
      if (scope == null) {
        throw new ConfigException("Cleanup of '" + schema.label() + "' needs a scope")
            .withContext("schema", schema.label());
      }
      if (!subResource.targetLabel().equals(scope.label())) {
        throw new ConfigException(
                "Scope "
                    + scope
                    + " does not match the sub-resource label '"
                    + subResource.targetLabel()
                    + "' of '"
                    + schema.label()
                    + "'")
            .withContext("schema", schema.label());
      }
      PropertyMap matcher = subResource.targetMatcher();
      if (matcher.size() != 1) {
        throw new ConfigException(
                "Cannot map a scope onto the "
                    + matcher.size()
                    + "-property sub-resource matcher of '"
                    + schema.label()
                    + "'; pass the parameters explicitly")
            .withContext("schema", schema.label());
      }
      Binding binding = matcher.entries().get(0).binding();
      parameters.put(binding.key(), scope.id());
    }
    return fromNodeSchema(schema, parameters, iterationSize);
  }

  public static GraphJob fromMatchLink(
      MatchLinkSchema schema, Scope scope, long updateTag, int iterationSize) {
    if (scope == null) {
      throw new ConfigException("Match link cleanup of '" + schema.relLabel() + "' needs a scope")
          .withContext("schema", schema.relLabel());
    }
    Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put(QueryParameters.UPDATE_TAG, updateTag);
    parameters.put(QueryParameters.SUB_RESOURCE_LABEL, scope.label());
    parameters.put(QueryParameters.SUB_RESOURCE_ID, scope.id());
    GraphStatement statement =
        new GraphStatement(
            CleanupQueryBuilder.matchLinkCleanupQuery(schema), parameters, true, iterationSize);
    return new GraphJob(
        "Cleanup " + schema.describe(),
        List.of(statement),
        schema.relLabel().toLowerCase() + "_matchlink_cleanup");
  }

  public static GraphJob fromJson(String json, String shortName) {
    try {
      GraphJob parsed = JacksonUtility.getJsonMapper().readValue(json, GraphJob.class);
      return new GraphJob(parsed.name, parsed.statements, shortName);
    } catch (JsonProcessingException e) {
      throw new ConfigException("Invalid graph job JSON: " + e.getOriginalMessage(), e);
    }
  }

  /** Load a job from a classpath resource; the short name is the file name without extension. */
  public static GraphJob fromJsonResource(String resource) {
    String path = resource.startsWith("/") ? resource.substring(1) : resource;
    try (InputStream in = GraphJob.class.getClassLoader().getResourceAsStream(path)) {
      if (in == null) {
        throw new ConfigException("Graph job resource not found: " + resource);
      }
      GraphJob parsed = JacksonUtility.getJsonMapper().readValue(in, GraphJob.class);
      return new GraphJob(parsed.name, parsed.statements, shortName(path));
    } catch (IOException e) {
      throw new ConfigException("Unable to read graph job " + resource + ": " + e.getMessage(), e);
    }
  }

  static String shortName(String path) {
    String file = path.substring(path.lastIndexOf('/') + 1);
    int dot = file.lastIndexOf('.');
    return dot > 0 ? file.substring(0, dot) : file;
  }

  public String toJson() {
    try {
      return JacksonUtility.getJsonMapper().writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new ConfigException("Unable to serialize graph job '" + name + "'", e);
    }
  }

  /** Copy with {@code parameters} merged into every statement. */
  public GraphJob withParameters(Map<String, Object> parameters) {
    List<GraphStatement> merged = new ArrayList<>();
    for (GraphStatement statement : statements) merged.add(statement.withParameters(parameters));
    return new GraphJob(name, merged, shortName);
  }

  /**
   * @throws ConfigException naming the parameters some statement references but nobody supplies
   */
  public void requireParameters() {
    Set<String> missing = new LinkedHashSet<>();
    for (GraphStatement statement : statements) missing.addAll(statement.missingParameters());
    if (!missing.isEmpty()) {
      throw new ConfigException("Job '" + name + "' is missing required parameters " + missing)
          .withContext("job", name);
    }
  }

  /** Run all statements in order and return their combined counters. */
  public WriteSummary run(GraphDriver driver) {
    requireParameters();
    log.info("Starting job '{}'", name);
    WriteSummary total = WriteSummary.EMPTY;
    int sequence = 1;
    for (GraphStatement statement : statements) {
      try {
        total = total.plus(statement.run(driver, name, sequence));
      } catch (StoreException e) {
        throw StoreException.wrap(
                "Statement #" + sequence + " of job '" + name + "' failed", e)
            .withContext("job", name)
            .withContext("statement", sequence);
      }
      sequence++;
    }
    log.info(
        "Finished job '{}': {} node(s) and {} relationship(s) deleted",
        name,
        total.nodesDeleted(),
        total.relationshipsDeleted());
    return total;
  }

  @JsonProperty("name")
  public String name() {
    return name;
  }

  @JsonProperty("statements")
  public List<GraphStatement> statements() {
    return statements;
  }

  @JsonIgnore
  public String shortName() {
    return shortName;
  }
}
