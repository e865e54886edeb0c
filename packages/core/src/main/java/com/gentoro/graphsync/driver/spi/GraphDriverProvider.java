package com.gentoro.graphsync.driver.spi;

import com.gentoro.graphsync.driver.GraphDriver;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable GraphDriver backends.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.graphsync.driver.spi.GraphDriverProvider
 */
public interface GraphDriverProvider {
  /** Unique driver id used in configuration, e.g., "neo4j-embedded", "neo4j-bolt". */
  String id();

  /** Whether the provider can operate in the current runtime (e.g., dependencies present). */
  default boolean isAvailable(Configuration configuration) {
    return true;
  }

  /** Create a new, not yet initialized GraphDriver from the {@code graph.*} configuration. */
  GraphDriver create(Configuration configuration);
}
