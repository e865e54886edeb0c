package com.gentoro.graphsync.driver.providers;

import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.driver.bolt.BoltGraphDriver;
import com.gentoro.graphsync.driver.spi.GraphDriverProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for a remote Neo4j server reached over Bolt. */
public class Neo4jBoltGraphDriverProvider implements GraphDriverProvider {
  public static final String ID = "neo4j-bolt";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public boolean isAvailable(Configuration configuration) {
    String uri = configuration.getString("graph.bolt.uri", "");
    return uri != null && !uri.isBlank();
  }

  @Override
  public GraphDriver create(Configuration configuration) {
    return new BoltGraphDriver(configuration);
  }
}
