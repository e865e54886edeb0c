package com.gentoro.graphsync.driver.providers;

import com.gentoro.graphsync.driver.GraphDriver;
import com.gentoro.graphsync.driver.neo4j.Neo4jGraphDriver;
import com.gentoro.graphsync.driver.spi.GraphDriverProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the embedded Neo4j GraphDriver. */
public class Neo4jEmbeddedGraphDriverProvider implements GraphDriverProvider {
  public static final String ID = "neo4j-embedded";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public GraphDriver create(Configuration configuration) {
    return new Neo4jGraphDriver(configuration);
  }
}
