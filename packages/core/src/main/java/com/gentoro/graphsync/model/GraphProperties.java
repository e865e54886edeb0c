package com.gentoro.graphsync.model;

import java.util.Set;

/** Property names with a fixed meaning on every node and relationship written by a load. */
public final class GraphProperties {
  public static final String ID = "id";
  public static final String FIRSTSEEN = "firstseen";
  public static final String LASTUPDATED = "lastupdated";
  public static final String MODULE_NAME = "_module_name";
  public static final String MODULE_VERSION = "_module_version";

  /** Relationship properties that scope match link cleanup. */
  public static final String SUB_RESOURCE_LABEL = "_sub_resource_label";

  public static final String SUB_RESOURCE_ID = "_sub_resource_id";

  /** Stamped by the query synthesizer; schemas may not bind them. */
  public static final Set<String> RESERVED =
      Set.of(FIRSTSEEN, LASTUPDATED, MODULE_NAME, MODULE_VERSION);

  private GraphProperties() {}
}
