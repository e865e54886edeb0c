package com.gentoro.graphsync.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.driver.WriteSummary;
import com.gentoro.graphsync.exception.ConfigException;
import com.gentoro.graphsync.utility.CollectionUtility;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One Cypher statement of a {@link GraphJob}. An iterative statement receives {@code $LIMIT_SIZE}
 * and is executed again and again until an execution reports no updates.
 */
public final class GraphStatement {
  private static final org.slf4j.Logger log =
      com.gentoro.graphsync.logging.LoggingService.getLogger(GraphStatement.class);

  private final String query;
  private final Map<String, Object> parameters;
  private final boolean iterative;
  private final int iterationSize;

  @JsonCreator
  public GraphStatement(
      @JsonProperty("query") String query,
      @JsonProperty("parameters") Map<String, Object> parameters,
      @JsonProperty("iterative") boolean iterative,
      @JsonProperty("iterationsize") int iterationSize) {
    if (query == null || query.isBlank()) {
      throw new ConfigException("Graph statement has no query");
    }
    if (iterationSize < 0) {
      throw new ConfigException("iterationsize must not be negative, got " + iterationSize);
    }
    if (iterative && iterationSize == 0) {
      throw new ConfigException("Iterative statements need a positive iterationsize");
    }
    this.query = query;
    this.parameters =
        parameters == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    this.iterative = iterative;
    this.iterationSize = iterationSize;
  }

  public GraphStatement(String query) {
    this(query, null, false, 0);
  }

  @JsonProperty("query")
  public String query() {
    return query;
  }

  @JsonProperty("parameters")
  public Map<String, Object> parameters() {
    return parameters;
  }

  @JsonProperty("iterative")
  public boolean iterative() {
    return iterative;
  }

  @JsonProperty("iterationsize")
  public int iterationSize() {
    return iterationSize;
  }

  /** Parameters the query references that are neither set nor supplied automatically. */
  @JsonIgnore
  public Set<String> missingParameters() {
    Set<String> missing = CypherText.parameterNames(query);
    missing.remove(QueryParameters.LIMIT_SIZE);
    missing.removeAll(parameters.keySet());
    return missing;
  }

  /** Copy with {@code extra} merged over the current parameters. */
  public GraphStatement withParameters(Map<String, Object> extra) {
    return new GraphStatement(
        query, CollectionUtility.mergeMaps(parameters, extra), iterative, iterationSize);
  }

  WriteSummary run(GraphDriver driver, String jobName, int sequence) {
    Map<String, Object> params =
        CollectionUtility.mergeMaps(
            parameters, Map.of(QueryParameters.LIMIT_SIZE, (Object) iterationSize));
    if (!iterative) {
      log.debug("Running statement #{} of job '{}'", sequence, jobName);
      return driver.write(query, params);
    }
    WriteSummary total = WriteSummary.EMPTY;
    int iterations = 0;
    while (true) {
      WriteSummary summary = driver.write(query, params);
      iterations++;
      total = total.plus(summary);
      if (!summary.containsUpdates()) break;
    }
    log.debug(
        "Iterative statement #{} of job '{}' finished after {} run(s)",
        sequence,
        jobName,
        iterations);
    return total;
  }

  @Override
  public String toString() {
    return query;
  }
}
