package com.gentoro.graphsync.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception for graphsync. Carries an error code and a small context map (schema
 * label, job name, field) that is rendered into logs and {@link ErrorDetails}.
 */
public class GraphSyncException extends RuntimeException {
  private final GraphSyncErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public GraphSyncException(GraphSyncErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public GraphSyncException(GraphSyncErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public GraphSyncErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry and return this exception for fluent rethrows. */
  public GraphSyncException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
