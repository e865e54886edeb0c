package com.gentoro.graphsync.sync;

import java.util.List;
import java.util.Map;

/** Supplies the transformed rows of one entity type for a sync run. */
@FunctionalInterface
public interface RowSource {
  List<Map<String, Object>> rows(SyncContext context);
}
