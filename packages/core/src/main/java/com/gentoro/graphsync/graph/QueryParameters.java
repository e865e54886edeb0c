package com.gentoro.graphsync.graph;

/** Well-known query parameter names shared by load and cleanup statements. */
public final class QueryParameters {
  /** Staleness tag of the current sync run. */
  public static final String UPDATE_TAG = "UPDATE_TAG";

  /** Batch of rows a load statement unwinds. */
  public static final String ROWS = "DictList";

  /** Chunk size of iterative cleanup statements. */
  public static final String LIMIT_SIZE = "LIMIT_SIZE";

  /** Scope of a match link cleanup. */
  public static final String SUB_RESOURCE_LABEL = "sub_resource_label";

  public static final String SUB_RESOURCE_ID = "sub_resource_id";

  private QueryParameters() {}
}
