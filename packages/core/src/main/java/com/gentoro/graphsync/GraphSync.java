package com.gentoro.graphsync;

import com.gentoro.graphsync.config.ConfigurationProvider;
import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.driver.GraphDrivers;
import com.gentoro.graphsync.driver.WriteSummary;
import com.gentoro.graphsync.exception.StateException;
import com.gentoro.graphsync.graph.GraphJob;
import com.gentoro.graphsync.graph.GraphLoader;
import com.gentoro.graphsync.graph.IndexManager;
import com.gentoro.graphsync.logging.LoggingService;
import com.gentoro.graphsync.model.MatchLinkSchema;
import com.gentoro.graphsync.model.NodeSchema;
import com.gentoro.graphsync.model.Scope;
import com.gentoro.graphsync.sync.Sync;
import com.gentoro.graphsync.sync.SyncContext;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Entry point wiring configuration, logging, the graph driver, the loader and the index manager.
 *
 * <pre>
 * try (GraphSync graphSync = new GraphSync()) {
 *   graphSync.initialize();
 *   graphSync.run(sync, SyncContext.now());
 * }
 * </pre>
 */
public class GraphSync implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(GraphSync.class);

  private final Configuration configuration;
  private GraphDriver driver;
  private final boolean ownsDriver;
  private IndexManager indexManager;
  private GraphLoader loader;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  /** Configuration from the classpath {@code application.yaml} and system properties. */
  public GraphSync() {
    this((Path) null);
  }

  public GraphSync(Path configFile) {
    this.configuration = new ConfigurationProvider(configFile).config();
    this.ownsDriver = true;
  }

  /** Use a driver owned by the caller; {@link #shutdown()} leaves it open. */
  public GraphSync(Configuration configuration, GraphDriver driver) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.driver = Objects.requireNonNull(driver, "driver");
    this.ownsDriver = false;
  }

  public synchronized void initialize() {
    if (initialized.get()) return;
    LoggingService.applyConfiguration(configuration);
    if (driver == null) {
      driver = GraphDrivers.create(configuration);
    }
    driver.initialize();
    indexManager = new IndexManager(driver);
    loader =
        new GraphLoader(
            driver,
            indexManager,
            configuration.getInt("sync.batchSize", GraphLoader.DEFAULT_BATCH_SIZE));
    initialized.set(true);
    log.info("GraphSync initialized with driver '{}'", driver.getDriverName());
  }

  public Configuration configuration() {
    return configuration;
  }

  public GraphDriver driver() {
    requireInitialized();
    return driver;
  }

  public GraphLoader loader() {
    requireInitialized();
    return loader;
  }

  public IndexManager indexManager() {
    requireInitialized();
    return indexManager;
  }

  public int cleanupIterationSize() {
    return configuration.getInt("sync.cleanup.iterationSize", 100);
  }

  /** Delete stale data of a node type within a scope (null for root types). */
  public WriteSummary cleanup(NodeSchema schema, Scope scope, long updateTag) {
    requireInitialized();
    return GraphJob.fromNodeSchema(schema, scope, updateTag, cleanupIterationSize()).run(driver);
  }

  public WriteSummary cleanupMatchLinks(MatchLinkSchema schema, Scope scope, long updateTag) {
    requireInitialized();
    return GraphJob.fromMatchLink(schema, scope, updateTag, cleanupIterationSize()).run(driver);
  }

  public void run(Sync sync, SyncContext context) {
    requireInitialized();
    sync.run(driver, context);
  }

  private void requireInitialized() {
    if (!initialized.get()) {
      throw new StateException("GraphSync not initialized. Call initialize() first.");
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) return;
    initialized.set(false);
    if (ownsDriver && driver != null) {
      driver.close();
    }
  }

  @Override
  public void close() {
    shutdown();
  }
}
