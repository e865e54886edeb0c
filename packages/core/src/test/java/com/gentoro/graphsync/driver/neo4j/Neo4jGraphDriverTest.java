package com.gentoro.graphsync.driver.neo4j;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphsync.driver.WriteSummary;
import com.gentoro.graphsync.exception.StateException;
import com.gentoro.graphsync.exception.StoreException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class Neo4jGraphDriverTest {
  @TempDir Path tempDir;

  private Neo4jGraphDriver driver;

  @BeforeEach
  void setUp() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("graph.neo4j.rootDir", tempDir.toString());
    config.setProperty("graph.neo4j.database", "neo4j");
    driver = new Neo4jGraphDriver(config);
  }

  @AfterEach
  void tearDown() {
    driver.shutdown();
  }

  @Test
  @DisplayName("The driver starts its own database and reports write counters")
  void writeAndRead() {
    driver.initialize();
    assertTrue(driver.isInitialized());
    assertEquals("neo4j", driver.getDatabase());
    assertTrue(tempDir.resolve("neo4j").toFile().isDirectory());

    WriteSummary summary =
        driver.write("CREATE (:Widget {id: $id, name: 'first'})", Map.of("id", "w1"));
    assertEquals(1, summary.nodesCreated());
    assertEquals(1, summary.labelsAdded());
    assertEquals(2, summary.propertiesSet());
    assertTrue(summary.containsUpdates());

    List<Map<String, Object>> rows = driver.read("MATCH (w:Widget) RETURN w", null);
    assertEquals(List.of(Map.of("w", Map.of("id", "w1", "name", "first"))), rows);
  }

  @Test
  @DisplayName("Statement failures carry the Neo4j status code")
  void syntaxError() {
    driver.initialize();

    StoreException e = assertThrows(StoreException.class, () -> driver.write("MATCH (", null));
    assertEquals("Neo.ClientError.Statement.SyntaxError", e.getStatusCode());
  }

  @Test
  @DisplayName("Constraint violations report the store's own reason")
  void constraintViolation() {
    driver.initialize();
    driver.write("CREATE CONSTRAINT IF NOT EXISTS FOR (n:Widget) REQUIRE n.id IS UNIQUE", null);
    driver.write("CREATE (:Widget {id: 'w1'})", null);

    StoreException e =
        assertThrows(StoreException.class, () -> driver.write("CREATE (:Widget {id: 'w1'})", null));
    assertEquals("Neo.ClientError.Schema.ConstraintValidationFailed", e.getStatusCode());
    assertTrue(e.getMessage().contains("already exists"), e.getMessage());
    assertEquals(1L, driver.read("MATCH (w:Widget) RETURN count(w) AS c", null).get(0).get("c"));
  }

  @Test
  @DisplayName("The driver cannot be used before initialize or after shutdown")
  void lifecycle() {
    assertThrows(StateException.class, () -> driver.read("RETURN 1", null));
    driver.initialize();
    driver.shutdown();
    assertFalse(driver.isInitialized());
    assertThrows(StateException.class, () -> driver.write("RETURN 1", null));
  }
}
