package com.gentoro.graphsync.sync;

import com.gentoro.graphsync.graph.QueryParameters;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values shared by every stage of one sync run. The same update tag must reach every load and
 * every cleanup of the run.
 *
 * @param updateTag staleness tag of this run
 * @param parameters extra parameters handed to every job
 */
public record SyncContext(long updateTag, Map<String, Object> parameters) {

  public SyncContext {
    parameters =
        parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }

  /** New run tagged with the current epoch second. */
  public static SyncContext now() {
    return new SyncContext(Instant.now().getEpochSecond(), Map.of());
  }

  public static SyncContext of(long updateTag) {
    return new SyncContext(updateTag, Map.of());
  }

  public SyncContext withParameter(String name, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(parameters);
    copy.put(name, value);
    return new SyncContext(updateTag, copy);
  }

  /** {@code UPDATE_TAG} plus the extra parameters. */
  public Map<String, Object> commonJobParameters() {
    Map<String, Object> common = new LinkedHashMap<>(parameters);
    common.put(QueryParameters.UPDATE_TAG, updateTag);
    return common;
  }
}
