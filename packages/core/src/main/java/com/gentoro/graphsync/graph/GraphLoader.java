package com.gentoro.graphsync.graph;

import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.driver.WriteSummary;
import com.gentoro.graphsync.exception.ConfigException;
import com.gentoro.graphsync.exception.StoreException;
import com.gentoro.graphsync.model.Binding;
import com.gentoro.graphsync.model.GraphProperties;
import com.gentoro.graphsync.model.MatchLinkSchema;
import com.gentoro.graphsync.model.NodeSchema;
import com.gentoro.graphsync.model.PropertyMap;
import com.gentoro.graphsync.model.RelationshipSchema;
import com.gentoro.graphsync.model.SchemaValidator;
import com.gentoro.graphsync.model.Scope;
import com.gentoro.graphsync.utility.CollectionUtility;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes rows into the graph according to a schema. A load call checks its input, ensures the
 * schema's indexes and then writes the rows in batches, each batch in one transaction.
 *
 * <p>The staleness tag is an explicit argument of every call. Instances are thread-safe and may
 * be shared by loads of different schemas or tenants.
 */
public class GraphLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.graphsync.logging.LoggingService.getLogger(GraphLoader.class);

  public static final int DEFAULT_BATCH_SIZE = 10_000;

  private record QueryKey(Object schema, Set<RelationshipSchema> selected) {}

  private final GraphDriver driver;
  private final IndexManager indexManager;
  private final int batchSize;
  private final Map<QueryKey, String> queries = new ConcurrentHashMap<>();

  public GraphLoader(GraphDriver driver) {
    this(driver, new IndexManager(driver), DEFAULT_BATCH_SIZE);
  }

  public GraphLoader(GraphDriver driver, IndexManager indexManager, int batchSize) {
    if (batchSize <= 0) {
      throw new ConfigException("sync.batchSize must be greater than 0, got " + batchSize);
    }
    this.driver = Objects.requireNonNull(driver, "driver");
    this.indexManager = Objects.requireNonNull(indexManager, "indexManager");
    this.batchSize = batchSize;
  }

  public WriteSummary load(
      NodeSchema schema,
      List<? extends Map<String, ?>> rows,
      long updateTag,
      Map<String, ?> kwargs) {
    return load(schema, rows, updateTag, kwargs, null);
  }

  /**
   * Upsert one node per row and wire the schema's relationships.
   *
   * @param selected relationships to wire, or null for all
   * @throws ConfigException if a kwarg is missing or a row list field holds a non-list; nothing
   *     has been written in that case
   * @throws StoreException if a batch fails; earlier batches stay committed
   */
  public WriteSummary load(
      NodeSchema schema,
      List<? extends Map<String, ?>> rows,
      long updateTag,
      Map<String, ?> kwargs,
      Collection<RelationshipSchema> selected) {
    Objects.requireNonNull(schema, "schema");
    if (rows == null || rows.isEmpty()) {
      log.debug("No {} rows to load", schema.label());
      return WriteSummary.EMPTY;
    }
    Map<String, Object> parameters = parameters(kwargs, updateTag);
    List<PropertyMap> matchers = new ArrayList<>();
    for (RelationshipSchema rel : schema.relationships()) matchers.add(rel.targetMatcher());
    BindingResolver.check(
        schema.label(), BindingResolver.kwargNames(schema), matchers, rows, parameters);

    String query =
        queries.computeIfAbsent(
            new QueryKey(schema, selected == null ? null : new LinkedHashSet<>(selected)),
            key -> {
              SchemaValidator.validate(schema);
              String compiled = IngestionQueryBuilder.nodeQuery(schema, selected);
              log.debug("Compiled ingestion query for {}:\n{}", schema.label(), compiled);
              return compiled;
            });

    indexManager.ensureIndexes(schema);
    WriteSummary summary = write(schema.label(), query, rows, parameters);
    log.info(
        "Loaded {} {} row(s): {} node(s) created, {} relationship(s) created",
        rows.size(),
        schema.label(),
        summary.nodesCreated(),
        summary.relationshipsCreated());
    long expected = summary.nodesCreated() * singleTargetRelationships(schema, selected);
    if (summary.relationshipsCreated() < expected) {
      log.info(
          "{} new {} node(s) got {} of at least {} relationship(s); relationships to targets that"
              + " do not exist yet were skipped",
          summary.nodesCreated(),
          schema.label(),
          summary.relationshipsCreated(),
          expected);
    }
    return summary;
  }

  // A new node gains one relationship per wired single-target relationship whose target exists.
  private static int singleTargetRelationships(
      NodeSchema schema, Collection<RelationshipSchema> selected) {
    int count = 0;
    for (RelationshipSchema rel : schema.relationships()) {
      if (selected != null && !selected.contains(rel)) continue;
      boolean fanOut = false;
      for (PropertyMap.PropertyMapping entry : rel.targetMatcher()) {
        if (entry.binding() instanceof Binding.FromRowList) fanOut = true;
      }
      if (!fanOut) count++;
    }
    return count;
  }

  /**
   * Connect existing nodes. Rows whose source or target cannot be found are skipped. The scope is
   * stamped on every relationship through the schema's sub-resource kwargs.
   */
  public WriteSummary loadMatchLinks(
      MatchLinkSchema schema,
      List<? extends Map<String, ?>> rows,
      long updateTag,
      Scope scope,
      Map<String, ?> kwargs) {
    Objects.requireNonNull(schema, "schema");
    if (scope == null) {
      throw new ConfigException("Match links '" + schema.relLabel() + "' need a scope")
          .withContext("schema", schema.relLabel());
    }
    if (rows == null || rows.isEmpty()) {
      log.debug("No {} match link rows to load", schema.relLabel());
      return WriteSummary.EMPTY;
    }
    Map<String, Object> parameters = parameters(kwargs, updateTag);
    putScope(schema, GraphProperties.SUB_RESOURCE_LABEL, scope.label(), parameters);
    putScope(schema, GraphProperties.SUB_RESOURCE_ID, scope.id(), parameters);
    BindingResolver.check(
        schema.relLabel(),
        BindingResolver.kwargNames(schema),
        List.of(schema.sourceMatcher(), schema.targetMatcher()),
        rows,
        parameters);

    String query =
        queries.computeIfAbsent(
            new QueryKey(schema, null),
            key -> {
              SchemaValidator.validate(schema);
              String compiled = IngestionQueryBuilder.matchLinkQuery(schema);
              log.debug("Compiled match link query for {}:\n{}", schema.describe(), compiled);
              return compiled;
            });

    indexManager.ensureIndexes(schema);
    WriteSummary summary = write(schema.relLabel(), query, rows, parameters);
    if (summary.relationshipsCreated() < rows.size()) {
      log.info(
          "{} of {} {} row(s) created a new relationship; the rest already existed or had no"
              + " matching endpoints",
          summary.relationshipsCreated(),
          rows.size(),
          schema.describe());
    }
    log.info("Loaded {} {} match link row(s) for {}", rows.size(), schema.relLabel(), scope);
    return summary;
  }

  private static void putScope(
      MatchLinkSchema schema, String property, Object value, Map<String, Object> parameters) {
    Binding binding = schema.properties().get(property).orElseThrow();
    parameters.put(binding.key(), value);
  }

  private static Map<String, Object> parameters(Map<String, ?> kwargs, long updateTag) {
    Map<String, Object> parameters = new LinkedHashMap<>();
    if (kwargs != null) parameters.putAll(kwargs);
    parameters.put(QueryParameters.UPDATE_TAG, updateTag);
    return parameters;
  }

  private WriteSummary write(
      String schemaName,
      String query,
      List<? extends Map<String, ?>> rows,
      Map<String, Object> parameters) {
    WriteSummary total = WriteSummary.EMPTY;
    List<? extends List<? extends Map<String, ?>>> batches =
        CollectionUtility.partition(rows, batchSize);
    int number = 1;
    for (List<? extends Map<String, ?>> batch : batches) {
      Map<String, Object> params =
          CollectionUtility.mergeMaps(
              parameters, Map.of(QueryParameters.ROWS, (Object) new ArrayList<>(batch)));
      try {
        WriteSummary summary = driver.write(query, params);
        log.debug("Batch {}/{} of {}: {}", number, batches.size(), schemaName, summary);
        total = total.plus(summary);
      } catch (StoreException e) {
        throw StoreException.wrap(
                "Failed to load batch " + number + "/" + batches.size() + " of " + schemaName, e)
            .withContext("schema", schemaName)
            .withContext("batch", number);
      }
      number++;
    }
    return total;
  }
}
