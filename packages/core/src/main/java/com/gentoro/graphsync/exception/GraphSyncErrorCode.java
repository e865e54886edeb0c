package com.gentoro.graphsync.exception;

/** Stable error codes attached to every {@link GraphSyncException}. */
public enum GraphSyncErrorCode {
  /** Malformed schema, missing load/cleanup parameter or invalid settings. Never retried. */
  CONFIGURATION_ERROR,
  /** The backing graph store rejected or failed a write/read. Retry the whole call. */
  STORE_ERROR,
  /** A component was used before it was initialized or after it was shut down. */
  STATE_ERROR,
  UNKNOWN
}
