package com.gentoro.graphsync.driver;

import com.gentoro.graphsync.driver.spi.GraphDriverProvider;
import com.gentoro.graphsync.exception.ConfigException;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Resolves the {@code graph.driver} setting to a provider discovered through ServiceLoader. */
public final class GraphDrivers {
  private static final org.slf4j.Logger log =
      com.gentoro.graphsync.logging.LoggingService.getLogger(GraphDrivers.class);

  public static final String DEFAULT_DRIVER = "neo4j-embedded";

  private GraphDrivers() {}

  public static List<GraphDriverProvider> providers() {
    List<GraphDriverProvider> providers = new ArrayList<>();
    ServiceLoader.load(GraphDriverProvider.class).forEach(providers::add);
    return providers;
  }

  /** Create (but do not initialize) the configured driver. */
  public static GraphDriver create(Configuration configuration) {
    String desired = configuration.getString("graph.driver", DEFAULT_DRIVER);
    List<String> known = new ArrayList<>();
    for (GraphDriverProvider provider : providers()) {
      known.add(provider.id());
      if (!provider.id().equalsIgnoreCase(desired)) continue;
      if (!provider.isAvailable(configuration)) {
        throw new ConfigException(
            "Graph driver '" + desired + "' is not available with the current configuration");
      }
      log.debug("Using graph driver '{}' ({})", provider.id(), provider.getClass().getName());
      return provider.create(configuration);
    }
    throw new ConfigException("Unknown graph driver '" + desired + "', available: " + known);
  }
}
