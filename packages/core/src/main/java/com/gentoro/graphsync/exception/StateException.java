package com.gentoro.graphsync.exception;

/** Component used outside of its lifecycle (not initialized, already shut down). */
public class StateException extends GraphSyncException {
  public StateException(String message) {
    super(GraphSyncErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(GraphSyncErrorCode.STATE_ERROR, message, cause);
  }
}
