package com.gentoro.graphsync.sync;

import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.graph.GraphJob;
import com.gentoro.graphsync.graph.GraphLoader;
import com.gentoro.graphsync.model.MatchLinkSchema;
import com.gentoro.graphsync.model.Scope;
import java.util.Objects;

/** Sync of one match link type within a scope, followed by its scoped cleanup. */
public final class MatchLinkSyncStage implements SyncStage {
  private final MatchLinkSchema schema;
  private final GraphLoader loader;
  private final RowSource rows;
  private final Scope scope;
  private final int iterationSize;

  public MatchLinkSyncStage(
      MatchLinkSchema schema, GraphLoader loader, RowSource rows, Scope scope, int iterationSize) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.rows = Objects.requireNonNull(rows, "rows");
    this.scope = Objects.requireNonNull(scope, "scope");
    this.iterationSize = iterationSize;
  }

  @Override
  public void run(GraphDriver driver, SyncContext context) {
    loader.loadMatchLinks(
        schema, rows.rows(context), context.updateTag(), scope, context.parameters());
    GraphJob.fromMatchLink(schema, scope, context.updateTag(), iterationSize).run(driver);
  }
}
