package com.gentoro.graphsync.sync;

import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.exception.ExceptionUtil;
import com.gentoro.graphsync.exception.GraphSyncErrorCode;
import com.gentoro.graphsync.exception.GraphSyncException;
import com.gentoro.graphsync.graph.GraphJob;
import com.gentoro.graphsync.graph.IndexManager;
import com.gentoro.graphsync.model.NodeSchema;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered, named stages executed one after another against the same store and context. The run
 * stops at the first failing stage.
 */
public final class Sync {
  private static final org.slf4j.Logger log =
      com.gentoro.graphsync.logging.LoggingService.getLogger(Sync.class);

  private final String name;
  private final Map<String, SyncStage> stages;

  private Sync(String name, Map<String, SyncStage> stages) {
    this.name = name;
    this.stages = Collections.unmodifiableMap(new LinkedHashMap<>(stages));
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Stage running a JSON job from the classpath with the run's common job parameters. */
  public static SyncStage analysisStage(String resource) {
    return (driver, context) ->
        GraphJob.fromJsonResource(resource)
            .withParameters(context.commonJobParameters())
            .run(driver);
  }

  /** Stage creating the indexes of every listed schema before anything is loaded. */
  public static SyncStage indexStage(IndexManager indexManager, Collection<NodeSchema> schemas) {
    List<NodeSchema> universe = List.copyOf(schemas);
    return (driver, context) -> {
      int created = indexManager.ensureIndexes(universe);
      log.info("Ensured {} index(es) for {} schema(s)", created, universe.size());
    };
  }

  public String name() {
    return name;
  }

  public Set<String> stageNames() {
    return stages.keySet();
  }

  /**
   * @throws GraphSyncException of the failing stage, with the stage name added to its context
   */
  public void run(GraphDriver driver, SyncContext context) {
    Objects.requireNonNull(driver, "driver");
    Objects.requireNonNull(context, "context");
    log.info("Starting sync '{}' with update tag {}", name, context.updateTag());
    for (Map.Entry<String, SyncStage> entry : stages.entrySet()) {
      String stage = entry.getKey();
      log.info("Starting sync stage '{}'", stage);
      try {
        entry.getValue().run(driver, context);
      } catch (GraphSyncException e) {
        log.error("Sync stage '{}' failed: {}", stage, ExceptionUtil.toErrorDetails(e));
        log.debug("Stage '{}' failure trace: {}", stage, ExceptionUtil.formatCompactStackTrace(e));
        throw e.withContext("stage", stage);
      } catch (RuntimeException e) {
        log.error("Unhandled exception during sync stage '{}'", stage, e);
        throw new GraphSyncException(
                GraphSyncErrorCode.UNKNOWN, "Sync stage '" + stage + "' failed", e)
            .withContext("stage", stage);
      }
      log.info("Finishing sync stage '{}'", stage);
    }
    log.info("Finishing sync '{}' with update tag {}", name, context.updateTag());
  }

  public static final class Builder {
    private final String name;
    private final Map<String, SyncStage> stages = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder stage(String stageName, SyncStage stage) {
      Objects.requireNonNull(stage, "stage");
      if (stages.putIfAbsent(stageName, stage) != null) {
        throw new IllegalArgumentException("Duplicate sync stage '" + stageName + "'");
      }
      return this;
    }

    /**
     * Adds an analysis stage only if every stage it depends on is part of this sync; otherwise the
     * analysis would run on incomplete data and is left out.
     */
    public Builder analysis(String stageName, String resource, Set<String> dependsOn) {
      if (!stages.keySet().containsAll(dependsOn)) {
        log.info(
            "Not running analysis '{}': it needs stages {} but the sync only has {}",
            stageName,
            dependsOn,
            stages.keySet());
        return this;
      }
      return stage(stageName, analysisStage(resource));
    }

    public Sync build() {
      return new Sync(name, stages);
    }
  }
}
