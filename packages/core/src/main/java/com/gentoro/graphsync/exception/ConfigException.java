package com.gentoro.graphsync.exception;

/**
 * Caller or schema-author mistake: a malformed schema, a kwarg the schema needs but the call did
 * not supply, an unsafe cleanup combination. Always raised before the store is touched.
 */
public class ConfigException extends GraphSyncException {
  public ConfigException(String message) {
    super(GraphSyncErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(GraphSyncErrorCode.CONFIGURATION_ERROR, message, cause);
  }

  @Override
  public ConfigException withContext(String key, Object value) {
    super.withContext(key, value);
    return this;
  }
}
