package com.gentoro.graphsync.driver;

import java.util.List;
import java.util.Map;

/**
 * Handle on the property-graph store that loads, index creation and cleanup jobs run against.
 *
 * <p>Every {@link #write} call runs in its own transaction: the statement either fully applies or
 * the call fails with a {@link com.gentoro.graphsync.exception.StoreException} and nothing is
 * committed. Implementations must be safe to use from several threads at once.
 *
 * <p>Implementations can target an embedded database or a remote server without leaking vendor
 * specifics to higher layers.
 */
public interface GraphDriver extends AutoCloseable {
  void initialize();

  boolean isInitialized();

  /**
   * Execute a Cypher statement in a write transaction and commit it.
   *
   * @return counters reported by the store for this statement
   */
  WriteSummary write(String cypher, Map<String, Object> parameters);

  /** Execute a Cypher statement in a read transaction and return all records. */
  List<Map<String, Object>> read(String cypher, Map<String, Object> parameters);

  /** Logical backend/driver name. */
  String getDriverName();

  void shutdown();

  @Override
  default void close() {
    shutdown();
  }
}
