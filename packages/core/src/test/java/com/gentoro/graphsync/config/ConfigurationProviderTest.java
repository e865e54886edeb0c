package com.gentoro.graphsync.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphsync.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {
  @TempDir Path tempDir;

  private static Path testResource() throws Exception {
    ClassLoader loader = ConfigurationProviderTest.class.getClassLoader();
    return Path.of(loader.getResource("application-test.yaml").toURI());
  }

  @Test
  @DisplayName("Defaults come from the classpath application.yaml")
  void classpathDefaults() {
    Configuration config = new ConfigurationProvider().config();

    assertEquals("neo4j-embedded", config.getString("graph.driver"));
    assertEquals(10000, config.getInt("sync.batchSize"));
    assertEquals(100, config.getInt("sync.cleanup.iterationSize"));
  }

  @Test
  @DisplayName("An explicit YAML file replaces the classpath defaults")
  void explicitFile() throws Exception {
    Configuration config = new ConfigurationProvider(testResource()).config();

    assertEquals("neo4j-bolt", config.getString("graph.driver"));
    assertEquals("bolt://localhost:7687", config.getString("graph.bolt.uri"));
    assertEquals(2, config.getInt("sync.batchSize"));
    // dotted YAML keys are escaped by the expression engine
    assertEquals("DEBUG", config.getString("logging.level.com..gentoro..graphsync..graph"));
  }

  @Test
  @DisplayName("System properties override the YAML values")
  void systemPropertiesWin() throws Exception {
    System.setProperty("sync.batchSize", "7");
    try {
      Configuration config = new ConfigurationProvider(testResource()).config();
      assertEquals(7, config.getInt("sync.batchSize"));
    } finally {
      System.clearProperty("sync.batchSize");
    }
  }

  @Test
  @DisplayName("Missing or malformed files are configuration errors")
  void invalidFiles() throws Exception {
    assertThrows(
        ConfigException.class, () -> new ConfigurationProvider(tempDir.resolve("missing.yaml")));

    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "graph: [unclosed\n");
    assertThrows(ConfigException.class, () -> new ConfigurationProvider(broken));
  }
}
