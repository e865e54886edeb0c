package com.gentoro.graphsync.driver.neo4j;

import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.driver.WriteSummary;
import com.gentoro.graphsync.exception.ExceptionUtil;
import com.gentoro.graphsync.exception.GraphSyncException;
import com.gentoro.graphsync.exception.StateException;
import com.gentoro.graphsync.exception.StoreException;
import java.io.File;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.neo4j.configuration.GraphDatabaseSettings;
import org.neo4j.dbms.api.DatabaseManagementService;
import org.neo4j.dbms.api.DatabaseManagementServiceBuilder;
import org.neo4j.graphdb.Entity;
import org.neo4j.graphdb.GraphDatabaseService;
import org.neo4j.graphdb.QueryExecutionException;
import org.neo4j.graphdb.QueryStatistics;
import org.neo4j.graphdb.Result;
import org.neo4j.graphdb.Transaction;

/**
 * GraphDriver backed by an embedded Neo4j database. The database is either started and owned by
 * the driver (from {@code graph.neo4j.*} configuration) or supplied by the caller, in which case
 * {@link #shutdown()} leaves it running.
 */
public class Neo4jGraphDriver implements GraphDriver {
  private static final org.slf4j.Logger log =
      com.gentoro.graphsync.logging.LoggingService.getLogger(Neo4jGraphDriver.class);

  private final Configuration configuration;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private DatabaseManagementService managementService;
  private volatile GraphDatabaseService graphDb;
  private String database;

  public Neo4jGraphDriver(Configuration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  /** Use a database whose lifecycle is managed by the caller. */
  public Neo4jGraphDriver(GraphDatabaseService graphDb) {
    this.configuration = null;
    this.graphDb = Objects.requireNonNull(graphDb, "graphDb");
    this.database = graphDb.databaseName();
  }

  @Override
  public synchronized void initialize() {
    if (initialized.get()) return;
    if (configuration == null) {
      // caller-supplied database
      initialized.set(true);
      return;
    }
    log.trace("Initializing Neo4jGraphDriver");
    String root =
        configuration.getString("graph.neo4j.rootDir", new File("data/neo4j").getAbsolutePath());
    this.database = configuration.getString("graph.neo4j.database", "neo4j");
    File rootDir = Path.of(root, database).toFile();
    if (!rootDir.exists() && !rootDir.mkdirs()) {
      throw new StoreException(
          "Unable to create Neo4j root directory: " + rootDir, (Throwable) null);
    }

    log.info("Starting Neo4j database '{}' at {}", database, rootDir);
    managementService =
        new DatabaseManagementServiceBuilder(rootDir.toPath())
            .setConfig(GraphDatabaseSettings.initial_default_database, database)
            .build();
    try {
      graphDb = managementService.database(database);
    } catch (RuntimeException ex) {
      managementService.shutdown();
      managementService = null;
      throw new StoreException(
          "Failed to open/create Neo4j database '" + database + "' at " + rootDir, ex);
    }
    initialized.set(true);
    log.trace("Neo4jGraphDriver initialized");
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public WriteSummary write(String cypher, Map<String, Object> parameters) {
    GraphDatabaseService db = requireDatabase();
    try (Transaction tx = db.beginTx()) {
      QueryStatistics stats;
      try (Result result = tx.execute(cypher, parameters == null ? Map.of() : parameters)) {
        while (result.hasNext()) {
          result.next();
        }
        stats = result.getQueryStatistics();
      }
      tx.commit();
      return new WriteSummary(
          stats.getNodesCreated(),
          stats.getNodesDeleted(),
          stats.getRelationshipsCreated(),
          stats.getRelationshipsDeleted(),
          stats.getPropertiesSet(),
          stats.getLabelsAdded(),
          stats.getIndexesAdded());
    } catch (GraphSyncException e) {
      throw e;
    } catch (RuntimeException e) {
      throw translate(e);
    }
  }

  @Override
  public List<Map<String, Object>> read(String cypher, Map<String, Object> parameters) {
    GraphDatabaseService db = requireDatabase();
    try (Transaction tx = db.beginTx();
        Result result = tx.execute(cypher, parameters == null ? Map.of() : parameters)) {
      List<Map<String, Object>> out = new ArrayList<>();
      while (result.hasNext()) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : result.next().entrySet()) {
          // entities are only valid inside the transaction
          Object value = e.getValue();
          row.put(e.getKey(), value instanceof Entity entity ? entity.getAllProperties() : value);
        }
        out.add(row);
      }
      tx.commit();
      return out;
    } catch (GraphSyncException e) {
      throw e;
    } catch (RuntimeException e) {
      throw translate(e);
    }
  }

  private GraphDatabaseService requireDatabase() {
    if (!initialized.get() || graphDb == null) {
      throw new StateException("Neo4jGraphDriver has not been initialized");
    }
    return graphDb;
  }

  private static StoreException translate(RuntimeException e) {
    String status = null;
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof QueryExecutionException qe) {
        status = qe.getStatusCode();
        break;
      }
    }
    // kernel failures arrive wrapped; the innermost message names the cause
    Throwable root = ExceptionUtil.rootCause(e);
    String message = root.getMessage() == null ? e.getMessage() : root.getMessage();
    return new StoreException("Neo4j statement failed: " + message, status, e);
  }

  @Override
  public String getDriverName() {
    return "neo4j-embedded";
  }

  public String getDatabase() {
    return database;
  }

  @Override
  public synchronized void shutdown() {
    initialized.set(false);
    if (managementService != null) {
      log.info("Stopping Neo4j database '{}'", database);
      try {
        managementService.shutdown();
      } catch (RuntimeException e) {
        log.warn("Neo4j shutdown failed: {}", e.getMessage(), e);
      } finally {
        managementService = null;
        graphDb = null;
      }
    }
  }
}
