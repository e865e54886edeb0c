package com.gentoro.graphsync.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphsync.EmbeddedNeo4jTestBase;
import com.gentoro.graphsync.TestSchemas;
import com.gentoro.graphsync.driver.WriteSummary;
import com.gentoro.graphsync.model.Scope;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GraphLoaderIntegrationTest extends EmbeddedNeo4jTestBase {
  private GraphLoader loader;

  @BeforeEach
  void setUp() {
    loader = new GraphLoader(driver);
    exec("CREATE (:Account {id: 'a1'}), (:Account {id: 'a2'})");
  }

  private static Map<String, Object> widget(String id, String name) {
    return Map.of("id", id, "name", name);
  }

  @Test
  @DisplayName("Widgets are created under their account with provenance stamps")
  void loadUnderAccount() {
    WriteSummary summary =
        loader.load(
            TestSchemas.WIDGET,
            List.of(widget("w1", "first"), widget("w2", "second")),
            1L,
            Map.of("ACCOUNT_ID", "a1"));

    assertEquals(2, summary.nodesCreated());
    assertEquals(2, summary.relationshipsCreated());
    assertEquals(
        2, count("MATCH (:Account {id: 'a1'})-[:RESOURCE]->(w:Widget) RETURN count(w) AS c"));
    Map<String, Object> w1 =
        single(
            "MATCH (w:Widget {id: 'w1'}) RETURN w.name AS name, w.lastupdated AS lastupdated,"
                + " w._module_name AS module");
    assertEquals("first", w1.get("name"));
    assertEquals(1L, w1.get("lastupdated"));
    assertEquals("graphsync:test", w1.get("module"));
  }

  @Test
  @DisplayName("Reloading the same rows is idempotent and keeps firstseen")
  void idempotent() {
    List<Map<String, Object>> rows = List.of(widget("w1", "first"));
    loader.load(TestSchemas.WIDGET, rows, 1L, Map.of("ACCOUNT_ID", "a1"));
    Object firstSeen = single("MATCH (w:Widget {id: 'w1'}) RETURN w.firstseen AS f").get("f");

    WriteSummary again = loader.load(TestSchemas.WIDGET, rows, 2L, Map.of("ACCOUNT_ID", "a1"));

    assertEquals(0, again.nodesCreated());
    assertEquals(0, again.relationshipsCreated());
    assertEquals(1, count("MATCH (w:Widget) RETURN count(w) AS c"));
    assertEquals(1, count("MATCH ()-[r:RESOURCE]->() RETURN count(r) AS c"));
    Map<String, Object> w1 =
        single("MATCH (w:Widget {id: 'w1'}) RETURN w.firstseen AS f, w.lastupdated AS t");
    assertEquals(firstSeen, w1.get("f"));
    assertEquals(2L, w1.get("t"));
  }

  @Test
  @DisplayName("A missing sub-resource only drops the relationship")
  void missingAccount() {
    loader.load(
        TestSchemas.WIDGET, List.of(widget("w1", "first")), 1L, Map.of("ACCOUNT_ID", "a9"));

    assertEquals(1, count("MATCH (w:Widget {id: 'w1'}) RETURN count(w) AS c"));
    assertEquals(0, count("MATCH ()-[r:RESOURCE]->() RETURN count(r) AS c"));
  }

  @Test
  @DisplayName("Row lists fan out to every existing target and case-insensitive matches link")
  void fanOutAndIgnoreCase() {
    exec(
        "CREATE (:Tag {id: 't1'}), (:Tag {id: 't2'}),"
            + " (:Person {email: 'Alice@Example.com'})");
    Map<String, Object> row =
        Map.of(
            "id", "w1",
            "name", "first",
            "tag_ids", List.of("t1", "t2", "t3"),
            "owner_email", "alice@example.com");

    loader.load(TestSchemas.TAGGED_WIDGET, List.of(row), 1L, Map.of("ACCOUNT_ID", "a1"));

    assertEquals(2, count("MATCH (:Widget {id: 'w1'})-[r:TAGGED]->(:Tag) RETURN count(r) AS c"));
    assertEquals(1, count("MATCH (:Person)-[r:OWNS]->(:Widget {id: 'w1'}) RETURN count(r) AS c"));
    assertEquals(
        1, count("MATCH (:Account {id: 'a1'})-[r:RESOURCE]->(:Widget) RETURN count(r) AS c"));
  }

  @Test
  @DisplayName("Rows without a row list field still load the node")
  void absentRowList() {
    loader.load(
        TestSchemas.TAGGED_WIDGET,
        List.of(widget("w1", "first")),
        1L,
        Map.of("ACCOUNT_ID", "a1"));

    assertEquals(1, count("MATCH (w:Widget) RETURN count(w) AS c"));
    assertEquals(0, count("MATCH ()-[r:TAGGED]->() RETURN count(r) AS c"));
  }

  @Test
  @DisplayName("Match links connect existing nodes and skip rows with a missing endpoint")
  void matchLinks() {
    exec("CREATE (:User {id: 'u1'}), (:User {id: 'u2'}), (:Group {id: 'g1'})");

    loader.loadMatchLinks(
        TestSchemas.MEMBER_OF,
        List.of(
            Map.of("user_id", "u1", "group_id", "g1"),
            Map.of("user_id", "u3", "group_id", "g1"),
            Map.of("user_id", "u2", "group_id", "g9")),
        1L,
        new Scope("Account", "a1"),
        Map.of());

    assertEquals(1, count("MATCH ()-[r:MEMBER_OF]->() RETURN count(r) AS c"));
    assertEquals(0, count("MATCH (n) WHERE n.id IN ['u3', 'g9'] RETURN count(n) AS c"));
    Map<String, Object> link =
        single(
            "MATCH (:User {id: 'u1'})-[r:MEMBER_OF]->(:Group {id: 'g1'})"
                + " RETURN r._sub_resource_label AS label, r._sub_resource_id AS id");
    assertEquals("Account", link.get("label"));
    assertEquals("a1", link.get("id"));
  }

  @Test
  @DisplayName("Loads for different tenants can run in parallel on one loader")
  void concurrentTenants() throws Exception {
    new IndexManager(driver).ensureIndexes(TestSchemas.WIDGET);
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      List<Future<WriteSummary>> futures = new ArrayList<>();
      for (String account : List.of("a1", "a2")) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
          rows.add(widget(account + "-w" + i, "widget " + i));
        }
        futures.add(
            executor.submit(
                () -> loader.load(TestSchemas.WIDGET, rows, 1L, Map.of("ACCOUNT_ID", account))));
      }
      for (Future<WriteSummary> future : futures) {
        assertEquals(20, future.get(60, TimeUnit.SECONDS).nodesCreated());
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(
        20, count("MATCH (:Account {id: 'a1'})-[:RESOURCE]->(w:Widget) RETURN count(w) AS c"));
    assertEquals(
        20, count("MATCH (:Account {id: 'a2'})-[:RESOURCE]->(w:Widget) RETURN count(w) AS c"));
  }

  @Test
  @DisplayName("Concurrent loads of the same key merge into a single node")
  void concurrentSameKey() throws Exception {
    new IndexManager(driver).ensureIndexes(TestSchemas.WIDGET);
    int threads = 8;
    int rounds = 10;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      for (int round = 0; round < rounds; round++) {
        List<Map<String, Object>> rows = List.of(widget("shared-" + round, "shared"));
        CountDownLatch start = new CountDownLatch(1);
        List<Future<WriteSummary>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
          futures.add(
              executor.submit(
                  () -> {
                    start.await();
                    return loader.load(TestSchemas.WIDGET, rows, 1L, Map.of("ACCOUNT_ID", "a1"));
                  }));
        }
        start.countDown();
        long created = 0;
        for (Future<WriteSummary> future : futures) {
          created += future.get(60, TimeUnit.SECONDS).nodesCreated();
        }
        assertEquals(1, created, "round " + round);
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(rounds, count("MATCH (w:Widget) RETURN count(w) AS c"));
    assertEquals(
        rounds,
        count("MATCH (:Account {id: 'a1'})-[r:RESOURCE]->(:Widget) RETURN count(r) AS c"));
  }
}
