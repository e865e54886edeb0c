package com.gentoro.graphsync.graph;

import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.exception.StoreException;
import com.gentoro.graphsync.model.MatchLinkSchema;
import com.gentoro.graphsync.model.NodeSchema;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates the indexes and uniqueness constraints schemas rely on. Creation uses {@code IF NOT EXISTS}, and an index another
 * writer created concurrently is treated as success, so calls can be repeated freely. Indexes
 * ensured once are remembered and skipped afterwards.
 */
public class IndexManager {
  private static final org.slf4j.Logger log =
      com.gentoro.graphsync.logging.LoggingService.getLogger(IndexManager.class);

  static final String EQUIVALENT_SCHEMA_RULE = "EquivalentSchemaRuleAlreadyExists";

  private final GraphDriver driver;
  private final Set<IndexDefinition> ensured = ConcurrentHashMap.newKeySet();

  public IndexManager(GraphDriver driver) {
    this.driver = Objects.requireNonNull(driver, "driver");
  }

  public int ensureIndexes(NodeSchema schema) {
    return ensure(IndexQueryBuilder.indexes(schema));
  }

  public int ensureIndexes(MatchLinkSchema schema) {
    return ensure(IndexQueryBuilder.indexes(schema));
  }

  /** Indexes for a whole set of node schemas, e.g. every type a sync will load. */
  public int ensureIndexes(Collection<NodeSchema> schemas) {
    Set<IndexDefinition> all = new LinkedHashSet<>();
    for (NodeSchema schema : schemas) {
      all.addAll(IndexQueryBuilder.indexes(schema));
    }
    return ensure(all);
  }

  /**
   * @return the number of index statements sent to the store
   */
  public int ensure(Collection<IndexDefinition> indexes) {
    int executed = 0;
    for (IndexDefinition index : indexes) {
      if (ensured.contains(index)) continue;
      String cypher = IndexQueryBuilder.toCypher(index);
      try {
        driver.write(cypher, null);
        log.debug("Ensured index: {}", cypher);
      } catch (StoreException e) {
        if (!isEquivalentRule(e)) {
          throw StoreException.wrap("Unable to create index " + cypher, e)
              .withContext("index", index.label());
        }
        log.debug("Index already created by a concurrent writer: {}", cypher);
      }
      ensured.add(index);
      executed++;
    }
    return executed;
  }

  private static boolean isEquivalentRule(StoreException e) {
    String status = e.getStatusCode();
    if (status != null) return status.endsWith(EQUIVALENT_SCHEMA_RULE);
    return e.getMessage() != null && e.getMessage().contains(EQUIVALENT_SCHEMA_RULE);
  }
}
