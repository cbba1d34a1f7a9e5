package io.intellixity.polystore.examples.service;

import de.bwaldvogel.mongo.MongoServer;
import de.bwaldvogel.mongo.backend.memory.MemoryBackend;
import io.intellixity.polystore.persistence.adapter.DialectAdapter;
import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.query.DocumentQuery;
import io.intellixity.polystore.persistence.query.Filter;
import io.intellixity.polystore.persistence.query.Page;
import io.intellixity.polystore.persistence.query.SortField;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
final class UserServiceTest {
  private static MongoServer server;

  @Autowired
  private UserService users;

  @Autowired
  private DialectAdapter adapter;

  @DynamicPropertySource
  static void mongo(DynamicPropertyRegistry registry) {
    server = new MongoServer(new MemoryBackend());
    String cs = server.bindAndGetConnectionString();
    registry.add("polystore.backend", () -> "mongodb");
    registry.add("polystore.mongo.url", () -> cs);
    registry.add("polystore.mongo.database", () -> "examples");
  }

  @AfterAll
  static void stop() {
    server.shutdownNow();
  }

  @Test
  void context_connectsAdapterToSelectedBackend() {
    assertTrue(adapter.isConnected());
    assertEquals(Backend.MONGO, adapter.backend());
  }

  @Test
  void registerRenameRemove() {
    Object id = users.register("Ann", "ann@example.com");

    assertEquals("Ann", users.find(id).orElseThrow().get("name"));
    assertTrue(users.rename(id, "Ann2"));
    assertEquals("Ann2", users.findByEmail("ann@example.com").orElseThrow().get("name"));
    assertTrue(users.remove(id));
    assertTrue(users.find(id).isEmpty());
  }

  @Test
  void search_byQuery() {
    users.register("zed", "z@example.com");
    users.register("amy", "a@example.com");

    List<Map<String, Object>> found = users.search(new DocumentQuery(
        Filter.builder().in("email", List.of("z@example.com", "a@example.com")).build(),
        List.of(SortField.asc("name")),
        Page.limit(1)));

    assertEquals(1, found.size());
    assertEquals("amy", found.get(0).get("name"));
  }
}
