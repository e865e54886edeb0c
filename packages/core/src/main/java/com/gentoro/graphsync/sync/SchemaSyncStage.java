package com.gentoro.graphsync.sync;

import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.graph.GraphJob;
import com.gentoro.graphsync.graph.GraphLoader;
import com.gentoro.graphsync.model.NodeSchema;
import com.gentoro.graphsync.model.PropertyMap;
import com.gentoro.graphsync.model.RelationshipSchema;
import com.gentoro.graphsync.model.Scope;
import com.gentoro.graphsync.utility.CollectionUtility;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sync of one node type: fetch rows, load them (indexes are ensured by the loader) and optionally
 * clean up what the run did not touch. With a scope, the scope id is also passed to the kwarg of
 * the sub-resource matcher unless the caller set it explicitly.
 */
public final class SchemaSyncStage implements SyncStage {
  private static final org.slf4j.Logger log =
      com.gentoro.graphsync.logging.LoggingService.getLogger(SchemaSyncStage.class);

  private final NodeSchema schema;
  private final GraphLoader loader;
  private final RowSource rows;
  private final Map<String, Object> kwargs;
  private final Scope scope;
  private final boolean cleanup;
  private final int iterationSize;
  private final boolean recordMetadata;

  private SchemaSyncStage(Builder b) {
    this.schema = b.schema;
    this.loader = b.loader;
    this.rows = b.rows;
    this.kwargs = new LinkedHashMap<>(b.kwargs);
    this.scope = b.scope;
    this.cleanup = b.cleanup;
    this.iterationSize = b.iterationSize;
    this.recordMetadata = b.recordMetadata;
  }

  public static Builder builder(NodeSchema schema, GraphLoader loader) {
    return new Builder(schema, loader);
  }

  @Override
  public void run(GraphDriver driver, SyncContext context) {
    Map<String, Object> callKwargs =
        CollectionUtility.mergeMaps(context.parameters(), scopeKwargs(), kwargs);
    loader.load(schema, rows.rows(context), context.updateTag(), callKwargs);

    if (cleanup) {
      GraphJob job =
          scope != null
              ? GraphJob.fromNodeSchema(schema, scope, context.updateTag(), iterationSize)
              : GraphJob.fromNodeSchema(
                  schema,
                  CollectionUtility.mergeMaps(callKwargs, context.commonJobParameters()),
                  iterationSize);
      job.run(driver);
    } else {
      log.debug("Cleanup of {} skipped", schema.label());
    }

    if (recordMetadata && scope != null) {
      SyncMetadata.merge(driver, scope.label(), scope.id(), schema.label(), context.updateTag());
    }
  }

  private Map<String, Object> scopeKwargs() {
    Map<String, Object> scoped = new LinkedHashMap<>();
    RelationshipSchema subResource = schema.subResourceRelationship();
    if (scope != null && subResource != null && subResource.targetMatcher().size() == 1) {
      PropertyMap.PropertyMapping entry = subResource.targetMatcher().entries().get(0);
      scoped.put(entry.binding().key(), scope.id());
    }
    return scoped;
  }

  public static final class Builder {
    private final NodeSchema schema;
    private final GraphLoader loader;
    private RowSource rows;
    private final Map<String, Object> kwargs = new LinkedHashMap<>();
    private Scope scope;
    private boolean cleanup;
    private int iterationSize = 100;
    private boolean recordMetadata;

    private Builder(NodeSchema schema, GraphLoader loader) {
      this.schema = Objects.requireNonNull(schema, "schema");
      this.loader = Objects.requireNonNull(loader, "loader");
    }

    public Builder rows(RowSource rows) {
      this.rows = rows;
      return this;
    }

    public Builder kwarg(String name, Object value) {
      this.kwargs.put(name, value);
      return this;
    }

    public Builder scope(Scope scope) {
      this.scope = scope;
      return this;
    }

    /** Run cleanup after loading, deleting at most {@code iterationSize} items per statement. */
    public Builder cleanup(int iterationSize) {
      this.cleanup = true;
      this.iterationSize = iterationSize;
      return this;
    }

    public Builder recordSyncMetadata() {
      this.recordMetadata = true;
      return this;
    }

    public SchemaSyncStage build() {
      Objects.requireNonNull(rows, "rows");
      return new SchemaSyncStage(this);
    }
  }
}
