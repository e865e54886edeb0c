package com.gentoro.graphsync.driver.bolt;

import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.driver.WriteSummary;
import com.gentoro.graphsync.exception.ConfigException;
import com.gentoro.graphsync.exception.StateException;
import com.gentoro.graphsync.exception.StoreException;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Transaction;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.summary.SummaryCounters;
import org.neo4j.driver.types.Entity;

/**
 * GraphDriver for a remote Neo4j server reached over Bolt. Each call opens a session and one
 * explicit transaction; the driver's managed retries are not used so that a failed batch surfaces
 * to the caller once.
 */
public class BoltGraphDriver implements GraphDriver {
  private static final org.slf4j.Logger log =
      com.gentoro.graphsync.logging.LoggingService.getLogger(BoltGraphDriver.class);

  private final Configuration configuration;
  private final boolean ownsDriver;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private volatile Driver driver;
  private String database;

  public BoltGraphDriver(Configuration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.ownsDriver = true;
  }

  /** Use a driver whose lifecycle is managed by the caller. */
  public BoltGraphDriver(Driver driver, String database) {
    this.configuration = null;
    this.driver = Objects.requireNonNull(driver, "driver");
    this.database = database;
    this.ownsDriver = false;
  }

  @Override
  public synchronized void initialize() {
    if (initialized.get()) return;
    if (ownsDriver) {
      String uri = configuration.getString("graph.bolt.uri", "");
      if (uri == null || uri.isBlank()) {
        throw new ConfigException("graph.bolt.uri is required for the neo4j-bolt driver");
      }
      String username = configuration.getString("graph.bolt.username", "neo4j");
      String password = configuration.getString("graph.bolt.password", "");
      this.database = configuration.getString("graph.bolt.database", "");
      log.info("Connecting to Neo4j at {}", uri);
      driver = GraphDatabase.driver(uri, AuthTokens.basic(username, password));
    }
    try {
      driver.verifyConnectivity();
    } catch (Neo4jException e) {
      throw new StoreException("Unable to reach Neo4j server", e.code(), e);
    }
    initialized.set(true);
  }

  @Override
  public boolean isInitialized() {
    return initialized.get();
  }

  @Override
  public WriteSummary write(String cypher, Map<String, Object> parameters) {
    Driver d = requireDriver();
    try (Session session = d.session(sessionConfig());
        Transaction tx = session.beginTransaction()) {
      Result result = tx.run(cypher, parameters == null ? Map.of() : parameters);
      SummaryCounters counters = result.consume().counters();
      tx.commit();
      return new WriteSummary(
          counters.nodesCreated(),
          counters.nodesDeleted(),
          counters.relationshipsCreated(),
          counters.relationshipsDeleted(),
          counters.propertiesSet(),
          counters.labelsAdded(),
          counters.indexesAdded());
    } catch (Neo4jException e) {
      throw new StoreException("Neo4j statement failed: " + e.getMessage(), e.code(), e);
    }
  }

  @Override
  public List<Map<String, Object>> read(String cypher, Map<String, Object> parameters) {
    Driver d = requireDriver();
    try (Session session = d.session(sessionConfig());
        Transaction tx = session.beginTransaction()) {
      List<Map<String, Object>> rows =
          tx.run(cypher, parameters == null ? Map.of() : parameters)
              .list(BoltGraphDriver::toRow);
      tx.commit();
      return rows;
    } catch (Neo4jException e) {
      throw new StoreException("Neo4j query failed: " + e.getMessage(), e.code(), e);
    }
  }

  private static Map<String, Object> toRow(Record record) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : record.asMap().entrySet()) {
      Object value = e.getValue();
      row.put(e.getKey(), value instanceof Entity entity ? entity.asMap() : value);
    }
    return row;
  }

  private SessionConfig sessionConfig() {
    return database == null || database.isBlank()
        ? SessionConfig.defaultConfig()
        : SessionConfig.forDatabase(database);
  }

  private Driver requireDriver() {
    if (!initialized.get() || driver == null) {
      throw new StateException("BoltGraphDriver has not been initialized");
    }
    return driver;
  }

  @Override
  public String getDriverName() {
    return "neo4j-bolt";
  }

  @Override
  public synchronized void shutdown() {
    initialized.set(false);
    if (ownsDriver && driver != null) {
      try {
        driver.close();
      } catch (RuntimeException e) {
        log.warn("Neo4j driver close failed: {}", e.getMessage(), e);
      } finally {
        driver = null;
      }
    }
  }
}
