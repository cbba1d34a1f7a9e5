package io.intellixity.polystore.persistence.adapter;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import de.bwaldvogel.mongo.MongoServer;
import de.bwaldvogel.mongo.backend.memory.MemoryBackend;
import io.intellixity.polystore.persistence.config.PersistenceSettings;
import io.intellixity.polystore.persistence.exec.AggregateResult;
import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.exec.DocumentStore;
import io.intellixity.polystore.persistence.jdbc.JdbcHandle;
import io.intellixity.polystore.persistence.jdbc.JooqRelationalOperations;
import io.intellixity.polystore.persistence.mongo.MongoDocumentOperations;
import io.intellixity.polystore.persistence.mongo.MongoHandle;
import io.intellixity.polystore.persistence.query.DocumentQuery;
import io.intellixity.polystore.persistence.query.Filter;
import io.intellixity.polystore.persistence.query.Page;
import io.intellixity.polystore.persistence.query.SortField;
import org.h2.jdbcx.JdbcDataSource;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class DialectAdapterEndToEndTest {
  private MongoServer server;
  private MongoClient client;
  private DialectAdapter adapter;

  @AfterEach
  void tearDown() {
    if (adapter != null) adapter.disconnect();
    if (client != null) client.close();
    if (server != null) server.shutdownNow();
  }

  @Test
  void mongo_createGetUpdateDeleteCount() {
    adapter = mongo();
    lifecycle(adapter);
  }

  @Test
  void jdbc_createGetUpdateDeleteCount() {
    adapter = jdbc();
    lifecycle(adapter);
  }

  @Test
  void mongo_getMany_honorsEverySortKey() {
    adapter = mongo();
    seed(adapter);

    List<Map<String, Object>> docs = adapter.getMany("users", Filter.empty(),
        List.of(SortField.asc("team"), SortField.desc("name")), Page.ALL);

    assertEquals(List.of("b", "a", "c"), names(docs));
  }

  @Test
  void jdbc_getMany_filtersSortsAndPages() {
    adapter = jdbc();
    seed(adapter);

    DocumentQuery q = new DocumentQuery(Filter.builder().in("team", List.of("x")).build(),
        List.of(SortField.desc("name")), Page.of(1, 1));

    assertEquals(List.of("a"), names(adapter.getMany("users", q)));
    assertEquals(2, adapter.count("users", Map.of("team", "x")));
  }

  @Test
  void jdbc_results_carryCanonicalId() {
    adapter = jdbc();
    Object id = adapter.create("users", Map.of("name", "Ann", "team", "x"));

    Map<String, Object> doc = adapter.getMany("users", Filter.empty()).get(0);

    assertEquals(id, doc.get("_id"));
    assertEquals(id, doc.get("id"));
    assertNotNull(doc.get("created_at"));
  }

  @Test
  void mongo_aggregate_runsPipeline() {
    adapter = mongo();
    seed(adapter);

    AggregateResult r = adapter.aggregate("users", List.of(Map.of("$match", Map.of("team", "y"))));

    assertTrue(r.supported());
    assertEquals(List.of("c"), names(r.documents()));
  }

  @Test
  void jdbc_aggregate_isNotSupported_withoutRaising() {
    adapter = jdbc();
    seed(adapter);

    AggregateResult r = assertDoesNotThrow(() -> adapter.aggregate("users", List.of(Map.of("$match", Map.of()))));

    assertFalse(r.supported());
    assertTrue(r.documents().isEmpty());
  }

  @Test
  void mongo_disconnect_leavesClientUsable() {
    adapter = mongo();
    adapter.disconnect();

    assertEquals(0, client.getDatabase("app").getCollection("users").countDocuments());
  }

  private static void lifecycle(DocumentStore store) {
    Object id = store.create("users", Map.of("name", "Ann", "team", "x"));
    assertNotNull(id);

    Map<String, Object> created = store.get("users", Map.of("_id", id)).orElseThrow();
    assertEquals("Ann", created.get("name"));
    assertEquals(id, created.get("_id"));

    assertTrue(store.update("users", Map.of("_id", id), Map.of("$set", Map.of("name", "Ann2"))));
    assertEquals("Ann2", store.get("users", Map.of("_id", id)).orElseThrow().get("name"));

    assertTrue(store.delete("users", Map.of("_id", id)));
    assertTrue(store.get("users", Map.of("_id", id)).isEmpty());
    assertEquals(0, store.count("users"));
    assertFalse(store.delete("users", Map.of("_id", id)));
  }

  private static void seed(DocumentStore store) {
    store.create("users", Map.of("name", "a", "team", "x"));
    store.create("users", Map.of("name", "b", "team", "x"));
    store.create("users", Map.of("name", "c", "team", "y"));
  }

  private static List<Object> names(List<Map<String, Object>> docs) {
    return docs.stream().map(d -> d.get("name")).toList();
  }

  private DialectAdapter mongo() {
    server = new MongoServer(new MemoryBackend());
    String cs = server.bindAndGetConnectionString();
    client = MongoClients.create(cs);
    PersistenceSettings settings = PersistenceSettings.builder(Backend.MONGO).mongoUrl(cs).mongoDatabase("app").build();

    DialectAdapter a = new DialectAdapter(settings,
        (b, s) -> new MongoHandle("mongo-test", client, s.mongoDatabase()),
        (b, h) -> new MongoDocumentOperations((MongoHandle) h, Clock.systemUTC()));
    a.connect();
    return a;
  }

  private static DialectAdapter jdbc() {
    String url = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL(url);
    DSL.using(ds, SQLDialect.H2).execute(
        "create table \"users\" (\"id\" bigint auto_increment primary key, \"name\" varchar(255), "
            + "\"team\" varchar(32), \"created_at\" timestamp with time zone, \"updated_at\" timestamp with time zone)");
    PersistenceSettings settings = PersistenceSettings.builder(Backend.JDBC).jdbcUrl(url).build();

    DialectAdapter a = new DialectAdapter(settings,
        (b, s) -> new JdbcHandle("jdbc-test", ds, s.jdbcSchema()),
        (b, h) -> new JooqRelationalOperations((JdbcHandle) h, SQLDialect.H2));
    a.connect();
    return a;
  }
}
