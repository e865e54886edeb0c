package com.gentoro.graphsync.sync;

import com.gentoro.graphsync.driver.GraphDriver;

/** One step of a {@link Sync}. */
@FunctionalInterface
public interface SyncStage {
  void run(GraphDriver driver, SyncContext context);
}
