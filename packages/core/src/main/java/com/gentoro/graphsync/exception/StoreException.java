package com.gentoro.graphsync.exception;

/**
 * Failure reported by the graph store while running an upsert batch, an index creation or a
 * cleanup statement. The whole call is aborted; the orchestrator retries it in full.
 */
public class StoreException extends GraphSyncException {
  private final String statusCode;

  public StoreException(String message, Throwable cause) {
    this(message, null, cause);
  }

  public StoreException(String message, String statusCode, Throwable cause) {
    super(GraphSyncErrorCode.STORE_ERROR, message, cause);
    this.statusCode = statusCode;
  }

  /** Native status code of the store (e.g. {@code Neo.ClientError.Statement.SyntaxError}). */
  public String getStatusCode() {
    return statusCode;
  }

  /** Re-wrap with caller context while keeping the store's status code. */
  public static StoreException wrap(String message, StoreException cause) {
    return new StoreException(message + ": " + cause.getMessage(), cause.getStatusCode(), cause);
  }

  @Override
  public StoreException withContext(String key, Object value) {
    super.withContext(key, value);
    return this;
  }
}
