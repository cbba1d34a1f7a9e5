package io.intellixity.polystore.persistence.adapter;

import io.intellixity.polystore.persistence.config.PersistenceSettings;
import io.intellixity.polystore.persistence.exceptions.ConfigurationException;
import io.intellixity.polystore.persistence.exceptions.TranslationAmbiguityException;
import io.intellixity.polystore.persistence.exec.AggregateResult;
import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.query.Filter;
import io.intellixity.polystore.persistence.query.Page;
import io.intellixity.polystore.persistence.query.SortField;
import io.intellixity.polystore.persistence.spi.DocumentOperations;
import io.intellixity.polystore.persistence.translate.ColumnPredicate;
import io.intellixity.polystore.persistence.translate.OrderBy;
import io.intellixity.polystore.persistence.translate.RowWindow;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class DialectAdapterTest {
  private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private static final PersistenceSettings JDBC = PersistenceSettings.builder(Backend.JDBC)
      .jdbcUrl("jdbc:h2:mem:unused").build();
  private static final PersistenceSettings MONGO = PersistenceSettings.builder(Backend.MONGO)
      .mongoUrl("mongodb://localhost").mongoDatabase("app").build();

  private final RecordingRelationalOperations rel = new RecordingRelationalOperations();

  private DialectAdapter relational(TestHandles.Owned handle) {
    return new DialectAdapter(JDBC, (b, s) -> handle, (b, h) -> rel, CLOCK);
  }

  private DialectAdapter connectedRelational() {
    DialectAdapter a = relational(new TestHandles.Owned(Backend.JDBC));
    a.connect();
    return a;
  }

  // ---------- lifecycle ----------

  @Test
  void operations_beforeConnect_areIllegal() {
    DialectAdapter a = relational(new TestHandles.Owned(Backend.JDBC));
    assertEquals(DialectAdapter.State.UNINITIALIZED, a.state());
    assertThrows(IllegalStateException.class, () -> a.count("users"));
  }

  @Test
  void connect_pingsRelationalBackend_once() {
    DialectAdapter a = relational(new TestHandles.Owned(Backend.JDBC));
    a.connect();
    a.connect();

    assertEquals(DialectAdapter.State.CONNECTED, a.state());
    assertEquals(1, rel.pings);
  }

  @Test
  void connect_afterDisconnect_isIllegal() {
    DialectAdapter a = connectedRelational();
    a.disconnect();
    assertThrows(IllegalStateException.class, a::connect);
    assertThrows(IllegalStateException.class, () -> a.count("users"));
  }

  @Test
  void disconnect_closesOwnedHandle_once() {
    TestHandles.Owned h = new TestHandles.Owned(Backend.JDBC);
    DialectAdapter a = relational(h);
    a.connect();

    a.disconnect();
    a.disconnect();

    assertEquals(1, h.closes);
    assertEquals(DialectAdapter.State.DISCONNECTED, a.state());
  }

  @Test
  void disconnect_leavesExternallyManagedHandleOpen() {
    TestHandles.Shared h = new TestHandles.Shared(Backend.MONGO);
    DocumentOperations ops = new NoopDocumentOperations();
    DialectAdapter a = new DialectAdapter(MONGO, (b, s) -> h, (b, x) -> ops, CLOCK);
    a.connect();

    assertDoesNotThrow(a::disconnect);
    assertEquals(DialectAdapter.State.DISCONNECTED, a.state());
  }

  @Test
  void connect_missingSettings_isConfigurationError() {
    PersistenceSettings noUrl = PersistenceSettings.builder(Backend.MONGO).mongoDatabase("app").build();
    DialectAdapter a = new DialectAdapter(noUrl, (b, s) -> fail("resolver must not be called"), (b, h) -> rel, CLOCK);

    assertThrows(ConfigurationException.class, a::connect);
    assertEquals(DialectAdapter.State.UNINITIALIZED, a.state());
  }

  @Test
  void connect_operationsOfWrongKind_isConfigurationError_andReleasesHandle() {
    TestHandles.Owned h = new TestHandles.Owned(Backend.JDBC);
    DialectAdapter a = new DialectAdapter(JDBC, (b, s) -> h, (b, x) -> new NoopDocumentOperations(), CLOCK);

    assertThrows(ConfigurationException.class, a::connect);
    assertEquals(1, h.closes);
  }

  @Test
  void connect_handleForOtherBackend_isConfigurationError() {
    DialectAdapter a = new DialectAdapter(JDBC, (b, s) -> new TestHandles.Shared(Backend.MONGO), (b, h) -> rel, CLOCK);
    assertThrows(ConfigurationException.class, a::connect);
  }

  @Test
  void connect_ownedHandleForOtherBackend_isReleased() {
    TestHandles.Owned h = new TestHandles.Owned(Backend.MONGO);
    DialectAdapter a = new DialectAdapter(JDBC, (b, s) -> h, (b, x) -> rel, CLOCK);

    assertThrows(ConfigurationException.class, a::connect);
    assertEquals(1, h.closes);
    assertEquals(0, rel.pings);
    assertEquals(DialectAdapter.State.UNINITIALIZED, a.state());
  }

  @Test
  void connect_failedPing_propagates_andReleasesHandle() {
    rel.pingFailure = new IllegalStateException("down");
    TestHandles.Owned h = new TestHandles.Owned(Backend.JDBC);
    DialectAdapter a = relational(h);

    assertThrows(IllegalStateException.class, a::connect);
    assertEquals(1, h.closes);
    assertFalse(a.isConnected());
  }

  // ---------- relational route ----------

  @Test
  void relational_filter_isMappedAndTranslatedInOrder() {
    DialectAdapter a = connectedRelational();

    a.getMany("users", Map.of("_id", Map.of("$in", List.of(1, 2))), null, null, 0);

    assertEquals(List.of(new ColumnPredicate.Member("id", List.of(1, 2))), rel.wheres.get(0));
  }

  @Test
  void relational_skipWithoutLimit_readsDefaultWindow() {
    DialectAdapter a = connectedRelational();

    a.getMany("users", Filter.empty(), List.of(SortField.desc("_id"), SortField.asc("name")), Page.skip(10));

    assertEquals(new RowWindow(10, 1000), rel.lastWindow);
    assertEquals(new OrderBy("id", true), rel.lastOrder);
  }

  @Test
  void relational_get_readsOneRow_andAddsCanonicalId() {
    rel.rows = List.of(Map.of("id", 7L, "name", "Ann"));
    DialectAdapter a = connectedRelational();

    Optional<Map<String, Object>> doc = a.get("users", Map.of("_id", 7L));

    assertEquals(RowWindow.first(1), rel.lastWindow);
    assertEquals(7L, doc.orElseThrow().get("_id"));
    assertEquals("Ann", doc.orElseThrow().get("name"));
  }

  @Test
  void relational_update_unwrapsSet_andStampsUpdatedAt() {
    DialectAdapter a = connectedRelational();

    assertTrue(a.update("users", Map.of("_id", 7), Map.of("$set", Map.of("name", "X"))));

    assertEquals(Map.of("name", "X", "updated_at", NOW.atOffset(ZoneOffset.UTC)), rel.updates.get(0));
    assertEquals(List.of(new ColumnPredicate.Equal("id", 7)), rel.wheres.get(0));
  }

  @Test
  void relational_update_noMatch_isFalse() {
    rel.affected = 0;
    assertFalse(connectedRelational().update("users", Map.of("_id", 7), Map.of("name", "X")));
  }

  @Test
  void relational_create_stampsBothTimestamps_andMapsId() {
    DialectAdapter a = connectedRelational();

    assertEquals(42L, a.create("users", Map.of("_id", 5, "name", "Ann")));

    Map<String, Object> row = rel.inserted.get(0);
    assertEquals(5, row.get("id"));
    assertFalse(row.containsKey("_id"));
    assertEquals(NOW.atOffset(ZoneOffset.UTC), row.get("created_at"));
    assertEquals(NOW.atOffset(ZoneOffset.UTC), row.get("updated_at"));
  }

  @Test
  void relational_aggregate_degradesToNotSupported() {
    DialectAdapter a = connectedRelational();

    AggregateResult r = a.aggregate("users", List.of(Map.of("$match", Map.of("name", "Ann"))));

    assertFalse(r.supported());
    assertEquals(List.of(), r.documents());
    assertInstanceOf(AggregateResult.NotSupported.class, r);
  }

  @Test
  void unknownOperator_isRejectedBeforeDispatch() {
    DialectAdapter a = connectedRelational();

    assertThrows(TranslationAmbiguityException.class, () -> a.count("users", Map.of("age", Map.of("$gt", 3))));
    assertTrue(rel.wheres.isEmpty());
  }

  @Test
  void conflictingIdentifiers_areRejected() {
    DialectAdapter a = connectedRelational();
    assertThrows(TranslationAmbiguityException.class, () -> a.delete("users", Map.of("_id", 1, "id", 2)));
  }
}
