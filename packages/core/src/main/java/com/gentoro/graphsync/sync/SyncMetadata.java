package com.gentoro.graphsync.sync;

import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.graph.QueryParameters;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records that a node type was synced for a scope, as a {@code (:ModuleSyncMetadata:SyncMetadata)}
 * node keyed by {@code <groupType>_<groupId>_<syncedType>}.
 */
public final class SyncMetadata {
  public static final String LABEL = "ModuleSyncMetadata";

  private static final String QUERY =
      "MERGE (n:"
          + LABEL
          + " {id: $id})\n"
          + "ON CREATE SET n:SyncMetadata, n.firstseen = timestamp()\n"
          + "SET n.syncedtype = $syncedType,\n"
          + "    n.grouptype = $groupType,\n"
          + "    n.groupid = $groupId,\n"
          + "    n.lastupdated = $"
          + QueryParameters.UPDATE_TAG;

  private SyncMetadata() {}

  public static String id(String groupType, Object groupId, String syncedType) {
    return groupType + "_" + groupId + "_" + syncedType;
  }

  public static void merge(
      GraphDriver driver, String groupType, Object groupId, String syncedType, long updateTag) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("id", id(groupType, groupId, syncedType));
    params.put("syncedType", syncedType);
    params.put("groupType", groupType);
    params.put("groupId", String.valueOf(groupId));
    params.put(QueryParameters.UPDATE_TAG, updateTag);
    driver.write(QUERY, params);
  }
}
